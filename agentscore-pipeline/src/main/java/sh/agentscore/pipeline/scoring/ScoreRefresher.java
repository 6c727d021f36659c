// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.scoring;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recomputes every cached score on a fixed interval, without publishing anything.
 *
 * <p>This keeps the leaderboard and score lookups current when no oracle contract is
 * configured. When publication is enabled the publication cycle recomputes scores
 * itself and this loop is not needed.
 *
 * <p>A failed pass is logged and the schedule continues. {@link #stop()} may be called
 * from any thread and interrupts the wait between passes.
 */
public final class ScoreRefresher {
    private static final Logger log = LoggerFactory.getLogger(ScoreRefresher.class);

    private final ScoreAggregator aggregator;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile boolean running;

    public ScoreRefresher(final ScoreAggregator aggregator) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    }

    /**
     * Recomputes every score once.
     *
     * @return per-agent outcomes of the pass
     */
    public RecomputeSummary refresh() {
        final RecomputeSummary summary = aggregator.computeAllScores();
        log.info("Score refresh: {} computed, {} without feedback, {} failed",
                summary.computed(), summary.skipped(), summary.failed());
        return summary;
    }

    /**
     * Runs {@link #refresh()} every {@code interval} until {@link #stop()}.
     *
     * @param interval time from the start of one pass to the start of the next
     * @throws IllegalArgumentException if {@code interval} is not positive
     */
    public void runDaemon(final Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (stopSignal.getCount() == 0) {
            return;
        }
        running = true;
        log.info("Score refresher started; interval {}", interval);
        while (running && !Thread.currentThread().isInterrupted()) {
            final long started = System.nanoTime();
            try {
                refresh();
            } catch (RuntimeException e) {
                log.error("Score refresh failed", e);
            }
            final long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            if (await(Math.max(0L, interval.toMillis() - elapsedMs))) {
                break;
            }
        }
        running = false;
        log.info("Score refresher stopped");
    }

    public void stop() {
        running = false;
        stopSignal.countDown();
    }

    public boolean isRunning() {
        return running;
    }

    private boolean await(final long millis) {
        try {
            return stopSignal.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
