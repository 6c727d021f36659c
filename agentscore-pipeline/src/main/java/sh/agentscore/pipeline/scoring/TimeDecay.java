// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.scoring;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential half-life weighting: {@code weight = 2^(-ageDays / halfLifeDays)}.
 *
 * <p>Weights lie in {@code (0, 1]}. An age of zero weighs 1 and an age of one half-life
 * weighs 0.5. Negative ages (feedback stamped after the reference time) count as zero.
 */
public final class TimeDecay {
    private static final double SECONDS_PER_DAY = 86_400.0;

    private final double halfLifeDays;

    public TimeDecay(final double halfLifeDays) {
        this.halfLifeDays = requireHalfLife(halfLifeDays);
    }

    public double halfLifeDays() {
        return halfLifeDays;
    }

    public double weight(final double ageDays) {
        return weight(ageDays, halfLifeDays);
    }

    /** Weight of feedback stamped {@code feedbackTime}, seen from {@code reference}. */
    public double weight(final Instant feedbackTime, final Instant reference) {
        final Duration age = Duration.between(feedbackTime, reference);
        final double ageDays = (age.getSeconds() + age.getNano() / 1_000_000_000.0) / SECONDS_PER_DAY;
        return weight(ageDays);
    }

    /** Age in days at which the weight drops to {@code minWeight}. */
    public double effectiveWindow(final double minWeight) {
        return effectiveWindow(minWeight, halfLifeDays);
    }

    public static double weight(final double ageDays, final double halfLifeDays) {
        requireHalfLife(halfLifeDays);
        if (Double.isNaN(ageDays)) {
            throw new IllegalArgumentException("ageDays is NaN");
        }
        final double age = Math.max(0.0, ageDays);
        return Math.pow(2.0, -age / halfLifeDays);
    }

    public static double effectiveWindow(final double minWeight, final double halfLifeDays) {
        requireHalfLife(halfLifeDays);
        if (!(minWeight > 0.0) || minWeight > 1.0) {
            throw new IllegalArgumentException("minWeight must be in (0, 1], got " + minWeight);
        }
        return -halfLifeDays * (Math.log(minWeight) / Math.log(2.0));
    }

    private static double requireHalfLife(final double halfLifeDays) {
        if (!(halfLifeDays > 0.0) || Double.isInfinite(halfLifeDays)) {
            throw new IllegalArgumentException("halfLifeDays must be positive, got " + halfLifeDays);
        }
        return halfLifeDays;
    }
}
