// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.error;

import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC request failed, either with an error object from the node or in transport.
 *
 * <p>Codes follow JSON-RPC: {@code -32700} parse error, {@code -32600..-32603} protocol
 * errors, {@code -32000..-32099} server errors. Transport failures use {@code -32000}
 * (network) and {@code -32001} (non-2xx HTTP status).
 */
public final class RpcException extends AgentScoreException {
    private final int code;
    private final @Nullable String data;
    private final @Nullable Long requestId;

    public RpcException(
            final int code,
            final String message,
            final @Nullable String data,
            final @Nullable Long requestId,
            final @Nullable Throwable cause) {
        super(augmentMessage(message, requestId), cause);
        this.code = code;
        this.data = data;
        this.requestId = requestId;
    }

    public RpcException(final int code, final String message, final @Nullable String data, final @Nullable Long requestId) {
        this(code, message, data, requestId, null);
    }

    public int code() {
        return code;
    }

    public @Nullable String data() {
        return data;
    }

    public @Nullable Long requestId() {
        return requestId;
    }

    /** Whether the node refused an {@code eth_getLogs} range as too wide. */
    public boolean isBlockRangeTooLarge() {
        return contains(getMessage(), "block range") || contains(data, "block range");
    }

    @Override
    public String toString() {
        return "RpcException{code=" + code + ", message=" + getMessage() + ", data=" + data
                + ", requestId=" + requestId + "}";
    }

    private static boolean contains(final @Nullable String text, final String needle) {
        return text != null && text.toLowerCase().contains(needle);
    }

    private static String augmentMessage(final String message, final @Nullable Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }
        return "[requestId=" + requestId + "] " + message;
    }
}
