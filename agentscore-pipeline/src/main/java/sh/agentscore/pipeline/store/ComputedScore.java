// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.store;

import java.time.Instant;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Cached trust score of one agent.
 *
 * @param agentId        rated agent
 * @param overallScore   decayed mean on the 0-100 scale, two decimals
 * @param feedbackCount  non-revoked feedback entries
 * @param positiveCount  entries with a positive value
 * @param negativeCount  entries with a negative value
 * @param categoryScores per-tag breakdown
 * @param computedAt     reference time of the computation
 * @param pushedToChain  whether this exact score has been published
 * @param pushedAt       time of publication
 */
public record ComputedScore(
        String agentId,
        double overallScore,
        int feedbackCount,
        int positiveCount,
        int negativeCount,
        CategoryScores categoryScores,
        Instant computedAt,
        boolean pushedToChain,
        @Nullable Instant pushedAt) {

    public ComputedScore {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(categoryScores, "categoryScores");
        Objects.requireNonNull(computedAt, "computedAt");
        if (overallScore < 0.0 || overallScore > 100.0 || Double.isNaN(overallScore)) {
            throw new IllegalArgumentException("overallScore must be within 0-100, got " + overallScore);
        }
    }
}
