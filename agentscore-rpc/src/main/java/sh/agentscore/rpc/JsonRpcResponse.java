// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc;

import static sh.agentscore.rpc.internal.RpcUtils.MAPPER;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * JSON-RPC 2.0 response envelope. Exactly one of {@code result} and {@code error} is
 * meaningful; a null {@code result} without an error is a legitimate "not found".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        @Nullable Object result,
        @Nullable JsonRpcError error,
        String id) {

    public boolean hasError() {
        return error != null;
    }

    public @Nullable String resultAsString() {
        return result != null ? result.toString() : null;
    }

    @SuppressWarnings("unchecked")
    public @Nullable Map<String, Object> resultAsMap() {
        if (result == null) {
            return null;
        }
        if (result instanceof Map<?, ?>) {
            return (Map<String, Object>) result;
        }
        return MAPPER.convertValue(result, new TypeReference<Map<String, Object>>() {});
    }
}
