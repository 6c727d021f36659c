// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import sh.agentscore.core.error.RpcException;

/**
 * Retries RPC calls that fail transiently, with exponential backoff and jitter.
 *
 * <p>Retried: rate limiting, timeouts, connection resets, missing headers, overloaded or
 * 5xx upstreams, and any failure caused by an {@link IOException}. Not retried: revert
 * data, insufficient funds, and every other JSON-RPC error. An interrupt during backoff
 * ends the loop and rethrows the last failure.
 */
final class RpcRetry {

    private static final RpcRetryConfig DEFAULT_CONFIG = RpcRetryConfig.defaults();

    private RpcRetry() {
    }

    static <T> T run(final Supplier<T> supplier, final int maxAttempts) {
        return run(supplier, maxAttempts, DEFAULT_CONFIG);
    }

    /**
     * Runs {@code supplier} up to {@code maxAttempts} times.
     *
     * @throws RpcException             the first non-retryable failure
     * @throws RetryExhaustedException  if every attempt failed transiently
     * @throws IllegalArgumentException if {@code maxAttempts < 1}
     */
    static <T> T run(final Supplier<T> supplier, final int maxAttempts, final RpcRetryConfig config) {
        Objects.requireNonNull(supplier, "supplier");
        Objects.requireNonNull(config, "config");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }

        final List<Throwable> failedAttempts = new ArrayList<>();
        final long startTime = System.currentTimeMillis();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return supplier.get();
            } catch (RpcException e) {
                failedAttempts.add(e);
                if (!isRetryableRpcError(e)) {
                    throw e;
                }
            } catch (RuntimeException e) {
                if (unwrapIo(e) == null) {
                    throw e;
                }
                failedAttempts.add(e);
            }
            if (attempt == maxAttempts) {
                break;
            }

            try {
                Thread.sleep(backoff(attempt, config));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                final Throwable last = failedAttempts.get(failedAttempts.size() - 1);
                final RuntimeException toThrow = last instanceof RuntimeException re
                        ? re
                        : new RpcException(-32000, "Interrupted while retrying", null, null, last);
                toThrow.addSuppressed(e);
                throw toThrow;
            }
        }
        throw exhausted(failedAttempts, startTime);
    }

    static boolean isRetryableRpcError(final @Nullable RpcException e) {
        if (e == null || e.getMessage() == null) {
            return false;
        }
        if (isLikelyRevert(e.data())) {
            return false;
        }
        if (e.getCause() instanceof IOException) {
            return true;
        }
        final String message = e.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("insufficient funds")) {
            return false;
        }
        return message.contains("header not found")
                || message.contains("timeout")
                || message.contains("timed out")
                || message.contains("connection reset")
                || message.contains("temporary unavailable")
                || message.contains("try again")
                // rate limiting
                || message.contains("rate limit")
                || message.contains("too many requests")
                || message.contains("429")
                // upstream trouble
                || message.contains(": 502")
                || message.contains(": 503")
                || message.contains(": 504")
                || message.contains("internal error")
                || message.contains("server busy")
                || message.contains("overloaded");
    }

    private static RetryExhaustedException exhausted(final List<Throwable> failedAttempts, final long startTime) {
        final long totalDuration = System.currentTimeMillis() - startTime;
        final Throwable lastFailure = failedAttempts.get(failedAttempts.size() - 1);
        final RetryExhaustedException exhausted =
                new RetryExhaustedException(failedAttempts.size(), totalDuration, lastFailure);
        for (int i = 0; i < failedAttempts.size() - 1; i++) {
            exhausted.addSuppressed(failedAttempts.get(i));
        }
        return exhausted;
    }

    static long backoff(final int attempt, final RpcRetryConfig config) {
        final long delay = config.backoffBaseMs() * (1L << Math.min(attempt - 1, 30));
        final long cappedDelay = Math.min(delay, config.backoffMaxMs());
        final double jitter = ThreadLocalRandom.current().nextDouble(config.jitterMin(), config.jitterMax());
        return cappedDelay + (long) (cappedDelay * jitter);
    }

    private static boolean isLikelyRevert(final @Nullable String data) {
        return data != null && data.startsWith("0x") && data.length() > 10;
    }

    private static @Nullable IOException unwrapIo(final RuntimeException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof IOException io) {
                return io;
            }
            current = current.getCause();
        }
        return null;
    }
}
