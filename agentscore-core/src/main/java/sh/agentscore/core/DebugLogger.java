// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opt-in trace output for raw RPC traffic and transaction submission.
 *
 * <p>Everything is passed through {@link LogSanitizer} before it reaches SLF4J under the
 * {@code sh.agentscore.debug} logger.
 */
public final class DebugLogger {
    private static final Logger LOG = LoggerFactory.getLogger("sh.agentscore.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (!AgentScoreDebug.isRpcLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logTx(final String message, final Object... args) {
        if (!AgentScoreDebug.isTxLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
