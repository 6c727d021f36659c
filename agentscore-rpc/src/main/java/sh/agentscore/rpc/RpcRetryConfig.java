// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc;

/**
 * Backoff timing for retried RPC calls.
 *
 * <p>The delay before attempt {@code n + 1} is {@code min(base * 2^(n-1), max)} plus a
 * random jitter fraction drawn from {@code [jitterMin, jitterMax)}.
 *
 * @param backoffBaseMs delay after the first failure, in milliseconds
 * @param backoffMaxMs  cap on the exponential delay, in milliseconds
 * @param jitterMin     lower bound of the jitter fraction
 * @param jitterMax     upper bound of the jitter fraction
 */
public record RpcRetryConfig(
        long backoffBaseMs,
        long backoffMaxMs,
        double jitterMin,
        double jitterMax) {

    public static final long DEFAULT_BACKOFF_BASE_MS = 200;
    public static final long DEFAULT_BACKOFF_MAX_MS = 5000;
    public static final double DEFAULT_JITTER_MIN = 0.10;
    public static final double DEFAULT_JITTER_MAX = 0.25;

    public RpcRetryConfig {
        if (backoffBaseMs <= 0) {
            throw new IllegalArgumentException("backoffBaseMs must be > 0, got: " + backoffBaseMs);
        }
        if (backoffMaxMs < backoffBaseMs) {
            throw new IllegalArgumentException(
                    "backoffMaxMs must be >= backoffBaseMs, got: " + backoffMaxMs + " < " + backoffBaseMs);
        }
        if (jitterMin < 0) {
            throw new IllegalArgumentException("jitterMin must be >= 0, got: " + jitterMin);
        }
        if (jitterMax <= jitterMin) {
            throw new IllegalArgumentException(
                    "jitterMax must be > jitterMin, got: " + jitterMax + " <= " + jitterMin);
        }
    }

    public static RpcRetryConfig defaults() {
        return new RpcRetryConfig(
                DEFAULT_BACKOFF_BASE_MS, DEFAULT_BACKOFF_MAX_MS, DEFAULT_JITTER_MIN, DEFAULT_JITTER_MAX);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long backoffBaseMs = DEFAULT_BACKOFF_BASE_MS;
        private long backoffMaxMs = DEFAULT_BACKOFF_MAX_MS;
        private double jitterMin = DEFAULT_JITTER_MIN;
        private double jitterMax = DEFAULT_JITTER_MAX;

        private Builder() {}

        public Builder backoffBaseMs(final long backoffBaseMs) {
            this.backoffBaseMs = backoffBaseMs;
            return this;
        }

        public Builder backoffMaxMs(final long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
            return this;
        }

        public Builder jitterMin(final double jitterMin) {
            this.jitterMin = jitterMin;
            return this;
        }

        public Builder jitterMax(final double jitterMax) {
            this.jitterMax = jitterMax;
            return this;
        }

        public RpcRetryConfig build() {
            return new RpcRetryConfig(backoffBaseMs, backoffMaxMs, jitterMin, jitterMax);
        }
    }
}
