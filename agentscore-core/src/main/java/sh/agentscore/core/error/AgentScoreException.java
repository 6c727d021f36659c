// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.error;

/**
 * Root of the chain-facing exception hierarchy.
 *
 * <pre>
 * AgentScoreException
 * ├── {@link AbiDecodingException} - malformed event data or call results
 * ├── {@link AbiEncodingException} - values that cannot be encoded as calldata
 * ├── {@link RpcException} - JSON-RPC communication failures
 * └── {@link TxnException} - signing and submission failures
 * </pre>
 */
public sealed class AgentScoreException extends RuntimeException
        permits AbiDecodingException, AbiEncodingException, RpcException, TxnException {

    public AgentScoreException(final String message) {
        super(message);
    }

    public AgentScoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
