// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.oracle;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.agentscore.core.model.TransactionReceipt;
import sh.agentscore.core.types.Hash;
import sh.agentscore.pipeline.scoring.RecomputeSummary;
import sh.agentscore.pipeline.scoring.ScoreAggregator;
import sh.agentscore.pipeline.store.ComputedScore;
import sh.agentscore.pipeline.store.DomainStore;

/**
 * Publishes changed scores to the oracle contract.
 *
 * <p>A cycle recomputes every score, takes a window of up to {@code 10 * batchSize}
 * unpushed scores, keeps those that are new to the oracle or have moved by at least
 * {@code minScoreChange}, and submits them in batches. A batch is marked pushed only
 * after a success receipt; reverted, timed-out or unsubmittable batches stay unpushed
 * and are reconsidered next cycle.
 *
 * <p>The candidate window rotates: each cycle resumes after the last agent id the
 * previous cycle examined and wraps around to the lowest id, so every unpushed score is
 * examined within {@code ceil(unpushed / window)} cycles even when the scores at the
 * front of the order never move.
 *
 * <p>Cycles are not reentrant. {@link #runDaemon(Duration)} drives them from one thread;
 * {@link #stop()} may be called from any thread.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * OracleUpdater updater = new OracleUpdater(
 *         aggregator, store, new ScoreOracle(ledger, oracleContract),
 *         OracleSettings.defaults(), Clock.systemUTC());
 * CycleReport report = updater.runCycle();        // one cycle, or
 * updater.runDaemon(Duration.ofMinutes(15));      // until stop()
 * }</pre>
 *
 * @see OracleSettings
 * @see ScoreOracle
 * @since 0.1.0
 */
public final class OracleUpdater {
    private static final Logger log = LoggerFactory.getLogger(OracleUpdater.class);

    private final ScoreAggregator aggregator;
    private final DomainStore store;
    private final ScoreOracle oracle;
    private final OracleSettings settings;
    private final Clock clock;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile boolean running;
    private @Nullable String cursor;

    public OracleUpdater(
            final ScoreAggregator aggregator,
            final DomainStore store,
            final ScoreOracle oracle,
            final OracleSettings settings,
            final Clock clock) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.store = Objects.requireNonNull(store, "store");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs one publication cycle.
     *
     * @return number of scores confirmed on chain
     */
    public int runUpdateCycle() {
        return runCycle().pushed();
    }

    /**
     * Runs one publication cycle and reports what it did.
     *
     * <p>Batch failures are recorded in the report rather than thrown; the affected
     * scores stay unpushed. Store failures during the recompute or the candidate read
     * propagate.
     *
     * @return counts for the recompute, the candidate window and every batch attempted
     * @throws sh.agentscore.pipeline.store.StoreException if the store cannot be read
     */
    public CycleReport runCycle() {
        final RecomputeSummary recomputed = aggregator.computeAllScores();
        final List<ComputedScore> candidates = nextCandidates();
        final List<ComputedScore> queue = new ArrayList<>();
        for (ComputedScore candidate : candidates) {
            if (shouldPublish(candidate)) {
                queue.add(candidate);
            }
        }
        log.info("Publication cycle: {} recomputed, {} candidates, {} to publish",
                recomputed.computed(), candidates.size(), queue.size());

        final List<BatchResult> batches = new ArrayList<>();
        for (int start = 0; start < queue.size(); start += settings.batchSize()) {
            if (start > 0 && pause()) {
                log.info("Stop requested; {} scores left for the next cycle", queue.size() - start);
                break;
            }
            final List<ComputedScore> batch = queue.subList(start, Math.min(start + settings.batchSize(), queue.size()));
            batches.add(publish(batch));
        }

        final CycleReport report = new CycleReport(recomputed.computed(), candidates.size(), queue.size(), batches);
        log.info("Publication cycle done: {} pushed, {}/{} batches confirmed",
                report.pushed(), report.batchesConfirmed(), batches.size());
        return report;
    }

    /**
     * Runs a cycle every {@code interval} until {@link #stop()}. A failed cycle is logged
     * and the schedule continues.
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
        log.info("Oracle updater started; interval {}", interval);
        while (running && !Thread.currentThread().isInterrupted()) {
            final long started = System.nanoTime();
            try {
                runCycle();
            } catch (RuntimeException e) {
                log.error("Publication cycle failed", e);
            }
            final long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            if (await(Math.max(0L, interval.toMillis() - elapsedMs))) {
                break;
            }
        }
        running = false;
        log.info("Oracle updater stopped");
    }

    public void stop() {
        running = false;
        stopSignal.countDown();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * The next window of unpushed scores, resuming after the previous cycle's last id and
     * wrapping to the start when the end of the order is reached.
     */
    private List<ComputedScore> nextCandidates() {
        final int limit = settings.candidateLimit();
        final String resumeAfter = cursor;
        final List<ComputedScore> window = new ArrayList<>(store.unpushedScores(resumeAfter, limit));
        if (window.size() < limit && resumeAfter != null) {
            final Set<String> seen = new HashSet<>();
            for (ComputedScore score : window) {
                seen.add(score.agentId());
            }
            for (ComputedScore score : store.unpushedScores(null, limit - window.size())) {
                if (seen.add(score.agentId())) {
                    window.add(score);
                }
            }
        }
        cursor = window.size() < limit ? null : window.get(window.size() - 1).agentId();
        return window;
    }

    /** New to the oracle, unreadable, or moved by at least {@code minScoreChange}. */
    boolean shouldPublish(final ComputedScore score) {
        final Optional<OnChainScore> onChain;
        try {
            onChain = oracle.getScore(score.agentId());
        } catch (RuntimeException e) {
            log.warn("Could not read on-chain score for agent {}; publishing anyway: {}",
                    score.agentId(), e.getMessage());
            return true;
        }
        if (onChain.isEmpty()) {
            return true;
        }
        final BigDecimal change = BigDecimal.valueOf(score.overallScore()).subtract(onChain.get().score()).abs();
        final boolean publish = change.compareTo(BigDecimal.valueOf(settings.minScoreChange())) >= 0;
        if (!publish) {
            log.debug("Agent {} moved {} since last publication; below threshold", score.agentId(), change);
        }
        return publish;
    }

    private BatchResult publish(final List<ComputedScore> batch) {
        final List<String> ids = new ArrayList<>(batch.size());
        final List<Double> values = new ArrayList<>(batch.size());
        for (ComputedScore score : batch) {
            ids.add(score.agentId());
            values.add(score.overallScore());
        }

        final Hash txHash;
        try {
            txHash = oracle.submitBatch(ids, values);
        } catch (RuntimeException e) {
            log.warn("Failed to submit batch of {} scores", ids.size(), e);
            return new BatchResult(ids, BatchResult.Status.SUBMIT_FAILED, null, e);
        }
        log.info("Submitted batch of {} scores: {}", ids.size(), txHash);

        final Optional<TransactionReceipt> receipt;
        try {
            receipt = oracle.awaitReceipt(txHash, settings.confirmationTimeout());
        } catch (RuntimeException e) {
            log.warn("Failed waiting for receipt of {}", txHash, e);
            return new BatchResult(ids, BatchResult.Status.TIMED_OUT, txHash, e);
        }
        if (receipt.isEmpty()) {
            log.warn("No receipt for {} within {}; scores stay unpushed", txHash, settings.confirmationTimeout());
            return new BatchResult(ids, BatchResult.Status.TIMED_OUT, txHash, null);
        }
        if (!receipt.get().status()) {
            log.warn("Batch {} reverted in block {}; scores stay unpushed", txHash, receipt.get().blockNumber());
            return new BatchResult(ids, BatchResult.Status.REVERTED, txHash, null);
        }
        final int marked = store.markPushed(ids, clock.instant());
        log.info("Batch {} confirmed in block {}; {} scores marked pushed", txHash, receipt.get().blockNumber(), marked);
        return new BatchResult(ids, BatchResult.Status.CONFIRMED, txHash, null);
    }

    /** Sleeps for the batch delay; true if stop was requested meanwhile. */
    private boolean pause() {
        return await(settings.batchDelay().toMillis());
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
