// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core;

import java.util.Locale;

/**
 * Single-line formats for {@link DebugLogger} output.
 *
 * <pre>
 * [RPC] method=eth_getLogs id=7 duration=12.3ms
 * [RPC-ERROR] method=eth_call code=-32000 message=execution reverted duration=4.0ms
 * [TX-SEND] to=0x1234...5678 nonce=4 gasLimit=110000 hash=0xabcd...ef01
 * [TX-RECEIPT] hash=0xabcd...ef01 block=19000000 status=SUCCESS
 * </pre>
 */
public final class LogFormatter {
    private static final int HASH_PREFIX_LENGTH = 6;
    private static final int HASH_SUFFIX_LENGTH = 4;

    private LogFormatter() {
    }

    public static String formatRpc(final String method, final long id, final long durationNanos) {
        return "[RPC] method=" + method + " id=" + id + " duration=" + formatDuration(durationNanos);
    }

    public static String formatRpcError(
            final String method, final int code, final String message, final long durationNanos) {
        return "[RPC-ERROR] method=" + method + " code=" + code + " message=" + message
                + " duration=" + formatDuration(durationNanos);
    }

    public static String formatTxSend(final String to, final long nonce, final long gasLimit, final String hash) {
        return "[TX-SEND] to=" + shorten(to) + " nonce=" + nonce + " gasLimit=" + gasLimit + " hash=" + shorten(hash);
    }

    public static String formatTxReceipt(final String hash, final long block, final boolean success) {
        return "[TX-RECEIPT] hash=" + shorten(hash) + " block=" + block + " status=" + (success ? "SUCCESS" : "REVERTED");
    }

    /** {@code 0x1234567890abcdef} becomes {@code 0x1234...cdef}. */
    public static String shorten(final String hex) {
        if (hex == null || hex.length() <= HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH) {
            return hex;
        }
        return hex.substring(0, HASH_PREFIX_LENGTH) + "..." + hex.substring(hex.length() - HASH_SUFFIX_LENGTH);
    }

    static String formatDuration(final long nanos) {
        final double millis = nanos / 1_000_000.0;
        if (millis < 1000) {
            return String.format(Locale.ROOT, "%.1fms", millis);
        }
        return String.format(Locale.ROOT, "%.1fs", millis / 1000);
    }
}
