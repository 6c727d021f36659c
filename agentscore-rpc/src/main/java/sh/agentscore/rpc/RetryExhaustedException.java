// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc;

import org.jspecify.annotations.Nullable;
import sh.agentscore.core.error.RpcException;

/**
 * Every attempt of a retried call failed with a transient error.
 *
 * <p>The cause is the last failure; earlier ones are attached as suppressed exceptions
 * in the order they happened.
 */
public final class RetryExhaustedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int attemptCount;
    private final long totalRetryDurationMs;

    public RetryExhaustedException(
            final int attemptCount,
            final long totalRetryDurationMs,
            final Throwable cause) {
        super(String.format("All %d retry attempts exhausted (total: %dms)", attemptCount, totalRetryDurationMs), cause);
        this.attemptCount = attemptCount;
        this.totalRetryDurationMs = totalRetryDurationMs;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public long getTotalRetryDurationMs() {
        return totalRetryDurationMs;
    }

    public @Nullable String getRpcErrorData() {
        if (getCause() instanceof RpcException rpc) {
            return rpc.data();
        }
        return null;
    }

    public int getRpcErrorCode() {
        if (getCause() instanceof RpcException rpc) {
            return rpc.code();
        }
        return 0;
    }
}
