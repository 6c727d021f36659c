// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * JSON-RPC 2.0 error object.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcError(int code, String message, @Nullable Object data) {}
