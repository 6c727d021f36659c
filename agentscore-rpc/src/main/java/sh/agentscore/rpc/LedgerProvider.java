// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc;

import java.util.List;
import sh.agentscore.core.error.RpcException;

/**
 * Raw JSON-RPC transport to a chain node.
 *
 * <p>Implementations throw {@link RpcException} both for transport failures and for
 * error objects returned by the node, so a returned response never carries an error.
 */
public interface LedgerProvider extends AutoCloseable {

    /**
     * Sends one request and waits for its response.
     *
     * @param method the JSON-RPC method, e.g. {@code eth_getLogs}
     * @param params positional parameters, serialized with Jackson
     * @return the successful response
     * @throws RpcException on transport failure or a JSON-RPC error
     */
    JsonRpcResponse send(String method, List<?> params) throws RpcException;

    static LedgerProvider http(final String url) {
        return HttpLedgerProvider.builder(url).build();
    }

    @Override
    default void close() {
        // nothing to release by default
    }
}
