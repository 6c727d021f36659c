// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.agentscore.pipeline.store.CategoryScore;
import sh.agentscore.pipeline.store.CategoryScores;
import sh.agentscore.pipeline.store.ComputedScore;
import sh.agentscore.pipeline.store.DomainStore;
import sh.agentscore.pipeline.store.Feedback;

/**
 * Turns an agent's feedback into a time-decayed trust score.
 *
 * <p>Each value is scaled by its decimals, clamped to {@code [-100, 100]} and mapped onto
 * {@code [0, 100]} as {@code (v + 100) / 2}. The overall score and each {@code tag1}
 * category score are weighted means under {@link TimeDecay}, rounded half-up to two
 * decimals. Revoked feedback is ignored entirely.
 *
 * <p>Weights are {@code 2^(-age / halfLife)}, with age measured from the feedback's
 * block time to the reference time. When the weights of a group sum to zero, which
 * happens once every entry is old enough for its weight to underflow, the group scores
 * a neutral 50 while its feedback count is still reported.
 *
 * <p>Any {@code uint8} decimals value is accepted. Values whose magnitude exceeds 100
 * after scaling are clamped, so very large raw values cannot dominate a mean.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * ScoreAggregator aggregator = new ScoreAggregator(store, new TimeDecay(90.0), Clock.systemUTC());
 * Optional<ComputedScore> preview = aggregator.computeScore("42", Instant.now());
 * RecomputeSummary summary = aggregator.computeAllScores();
 * }</pre>
 *
 * @see TimeDecay
 * @see ScoreRefresher
 * @since 0.1.0
 */
public final class ScoreAggregator {
    private static final Logger log = LoggerFactory.getLogger(ScoreAggregator.class);

    static final double NEUTRAL_SCORE = 50.0;
    private static final BigDecimal MAX_MAGNITUDE = BigDecimal.valueOf(100);

    private final DomainStore store;
    private final TimeDecay decay;
    private final Clock clock;

    public ScoreAggregator(final DomainStore store, final TimeDecay decay, final Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.decay = Objects.requireNonNull(decay, "decay");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Scores one agent as of {@code referenceTime} without persisting anything.
     *
     * @return the score, or empty when the agent has no non-revoked feedback
     */
    public Optional<ComputedScore> computeScore(final String agentId, final Instant referenceTime) {
        final List<Feedback> feedback = store.activeFeedback(agentId);
        if (feedback.isEmpty()) {
            return Optional.empty();
        }

        final Accumulator overall = new Accumulator();
        final Map<String, Accumulator> categories = new LinkedHashMap<>();
        int positive = 0;
        int negative = 0;
        for (Feedback f : feedback) {
            final double normalized = normalize(f.decimalValue());
            final double weight = decay.weight(f.timestamp(), referenceTime);
            overall.add(normalized, weight);
            final String category = f.tag1();
            if (category != null && !category.isBlank()) {
                categories.computeIfAbsent(category, k -> new Accumulator()).add(normalized, weight);
            }
            if (f.value().signum() > 0) {
                positive++;
            } else if (f.value().signum() < 0) {
                negative++;
            }
        }

        final Map<String, CategoryScore> byCategory = new LinkedHashMap<>();
        for (Map.Entry<String, Accumulator> entry : categories.entrySet()) {
            final Accumulator acc = entry.getValue();
            byCategory.put(entry.getKey(), new CategoryScore(round2(acc.mean()), acc.count));
        }

        return Optional.of(new ComputedScore(
                agentId,
                round2(overall.mean()),
                feedback.size(),
                positive,
                negative,
                new CategoryScores(byCategory),
                referenceTime,
                false,
                null));
    }

    /**
     * Scores one agent now and stores the result, replacing any cached score.
     *
     * <p>An agent whose feedback has all been revoked loses its cached score.
     */
    public ScoreOutcome computeAndSave(final String agentId) {
        try {
            final Optional<ComputedScore> score = computeScore(agentId, clock.instant());
            if (score.isEmpty()) {
                final boolean removed = store.deleteScore(agentId);
                if (removed) {
                    log.info("Removed stale score for agent {}: no active feedback", agentId);
                }
                return new ScoreOutcome.NoFeedback(agentId, removed);
            }
            store.saveScore(score.get());
            log.debug("Saved score for agent {}: {}", agentId, score.get().overallScore());
            return new ScoreOutcome.Computed(agentId, score.get());
        } catch (RuntimeException e) {
            log.warn("Failed to compute score for agent {}", agentId, e);
            return new ScoreOutcome.Failed(agentId, e);
        }
    }

    /**
     * Recomputes every agent with active feedback. One agent's failure never stops the
     * pass.
     */
    public RecomputeSummary computeAllScores() {
        final List<String> subjects = store.subjectsWithActiveFeedback();
        final List<ScoreOutcome> outcomes = new ArrayList<>(subjects.size());
        for (String subject : subjects) {
            outcomes.add(computeAndSave(subject));
        }
        final RecomputeSummary summary = new RecomputeSummary(outcomes);
        log.info("Recomputed {} scores ({} failed)", summary.computed(), summary.failed());
        return summary;
    }

    /** Maps a decimal feedback value onto {@code [0, 100]}. */
    static double normalize(final BigDecimal value) {
        final BigDecimal clamped = value.max(MAX_MAGNITUDE.negate()).min(MAX_MAGNITUDE);
        return (clamped.doubleValue() + 100.0) / 2.0;
    }

    static double round2(final double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static final class Accumulator {
        private double weightedSum;
        private double weightSum;
        private int count;

        void add(final double score, final double weight) {
            weightedSum += score * weight;
            weightSum += weight;
            count++;
        }

        double mean() {
            if (weightSum <= 0.0) {
                return NEUTRAL_SCORE;
            }
            return Math.min(100.0, Math.max(0.0, weightedSum / weightSum));
        }
    }
}
