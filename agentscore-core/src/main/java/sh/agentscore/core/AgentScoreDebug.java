// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core;

/**
 * Process-wide switches for verbose RPC and transaction tracing.
 *
 * <p>Flags are volatile; the combined check in {@link #isEnabled()} is best effort.
 */
public final class AgentScoreDebug {
    private static volatile boolean rpcLogging = false;
    private static volatile boolean txLogging = false;

    private AgentScoreDebug() {
    }

    public static boolean isEnabled() {
        return rpcLogging || txLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        txLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setTxLogging(final boolean enabled) {
        txLogging = enabled;
    }

    public static boolean isTxLoggingEnabled() {
        return txLogging;
    }
}
