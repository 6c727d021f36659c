// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.oracle;

import java.time.Duration;
import java.util.Objects;
import sh.agentscore.pipeline.config.PipelineConfig;

/**
 * Publication tuning.
 *
 * @param batchSize           scores per transaction
 * @param minScoreChange      smallest movement from the on-chain value worth publishing
 * @param confirmationTimeout bound on each receipt wait
 * @param batchDelay          pause between batch submissions
 */
public record OracleSettings(int batchSize, double minScoreChange, Duration confirmationTimeout, Duration batchDelay) {

    /** Candidates fetched per cycle, as a multiple of the batch size. */
    static final int CANDIDATE_FACTOR = 10;

    public OracleSettings {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        if (minScoreChange < 0.0 || Double.isNaN(minScoreChange)) {
            throw new IllegalArgumentException("minScoreChange must be non-negative, got " + minScoreChange);
        }
        Objects.requireNonNull(confirmationTimeout, "confirmationTimeout");
        Objects.requireNonNull(batchDelay, "batchDelay");
        if (confirmationTimeout.isNegative() || confirmationTimeout.isZero()) {
            throw new IllegalArgumentException("confirmationTimeout must be positive");
        }
        if (batchDelay.isNegative()) {
            throw new IllegalArgumentException("batchDelay must not be negative");
        }
    }

    public static OracleSettings defaults() {
        return new OracleSettings(
                PipelineConfig.DEFAULT_ORACLE_BATCH_SIZE,
                PipelineConfig.DEFAULT_MIN_SCORE_CHANGE,
                PipelineConfig.DEFAULT_CONFIRMATION_TIMEOUT,
                PipelineConfig.DEFAULT_BATCH_DELAY);
    }

    public static OracleSettings from(final PipelineConfig config) {
        return new OracleSettings(
                config.oracleBatchSize(),
                config.minScoreChange(),
                config.confirmationTimeout(),
                config.batchDelay());
    }

    int candidateLimit() {
        return batchSize * CANDIDATE_FACTOR;
    }
}
