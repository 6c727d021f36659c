// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.ingest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.agentscore.core.error.AbiDecodingException;
import sh.agentscore.core.model.LogEntry;
import sh.agentscore.pipeline.PipelineExecutors;
import sh.agentscore.pipeline.store.DomainStore;
import sh.agentscore.pipeline.store.WriteOutcome;
import sh.agentscore.rpc.LedgerClient;

/**
 * Follows the registries block range by block range and applies their events to the
 * {@link DomainStore}.
 *
 * <p>Each iteration reads the chain height {@code H} and the checkpoint {@code c}; when
 * {@code c < H} it processes {@code (c, min(c + batchSize, H)]}. Every mapper fetches,
 * maps and applies its logs on its own worker thread, in block and log-index order.
 * The checkpoint moves to the range's upper bound only after every mapper has finished
 * the whole range, so a crash or a failure replays the range; replay is harmless because
 * every mutation is idempotent.
 *
 * <p>Logs flagged {@code removed} by the node are skipped. Reorgs are otherwise not
 * handled.
 *
 * <p>Mappers stamp agent and feedback rows with block times from {@link BlockTimes},
 * so a replayed range rewrites exactly the values the first pass wrote.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * BlockTimes times = new BlockTimes(ledger);
 * List<EventMapper> mappers = List.of(
 *         new IdentityEventMapper(identityRegistry, times),
 *         new ReputationEventMapper(reputationRegistry, times));
 * try (IngestionLoop loop = new IngestionLoop(ledger, store, mappers, 0L, 1_000, Duration.ofSeconds(12))) {
 *     RangeResult result = loop.runOnce();   // one range, or
 *     loop.run();                            // follow the chain until stop()
 * }
 * }</pre>
 *
 * @see EventMapper
 * @see RangeResult
 * @since 0.1.0
 */
public final class IngestionLoop implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestionLoop.class);

    private final LedgerClient ledger;
    private final DomainStore store;
    private final List<EventMapper> mappers;
    private final long startBlock;
    private final int batchSize;
    private final Duration pollInterval;
    private final ExecutorService executor;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile boolean running;

    /**
     * @param startBlock   first block to index when no checkpoint is stored
     * @param batchSize    maximum blocks per range
     * @param pollInterval sleep between iterations when idle or after a failure
     */
    public IngestionLoop(
            final LedgerClient ledger,
            final DomainStore store,
            final List<EventMapper> mappers,
            final long startBlock,
            final int batchSize,
            final Duration pollInterval) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.store = Objects.requireNonNull(store, "store");
        this.mappers = List.copyOf(mappers);
        if (this.mappers.isEmpty()) {
            throw new IllegalArgumentException("at least one mapper is required");
        }
        if (startBlock < 0) {
            throw new IllegalArgumentException("startBlock must be non-negative, got " + startBlock);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must not be negative");
        }
        this.startBlock = startBlock;
        this.batchSize = batchSize;
        this.pollInterval = pollInterval;
        this.executor = PipelineExecutors.newBlockingExecutor("ingest", this.mappers.size());
    }

    /**
     * Runs until {@link #stop()} is called or the thread is interrupted. Failed ranges
     * are logged and retried after the poll interval.
     */
    public void run() {
        if (stopSignal.getCount() == 0) {
            return;
        }
        running = true;
        log.info("Ingestion started from checkpoint {}", checkpoint());
        while (running && !Thread.currentThread().isInterrupted()) {
            final RangeResult result = runOnce();
            if (result instanceof RangeResult.Indexed) {
                continue;
            }
            try {
                if (stopSignal.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        running = false;
        log.info("Ingestion stopped at checkpoint {}", checkpoint());
    }

    /** Performs exactly one iteration. Never throws for RPC or store failures. */
    public RangeResult runOnce() {
        final long checkpoint = checkpoint();
        final long height;
        try {
            height = ledger.currentHeight();
        } catch (RuntimeException e) {
            log.warn("Failed to read chain height; checkpoint stays at {}", checkpoint, e);
            return new RangeResult.Failed(checkpoint + 1, -1, e);
        }
        if (checkpoint >= height) {
            log.debug("Up to date at block {} (head {})", checkpoint, height);
            return new RangeResult.Idle(checkpoint, height);
        }
        final long from = checkpoint + 1;
        final long to = Math.min(checkpoint + batchSize, height);
        return processRange(from, to);
    }

    /** Requests shutdown; the current range is finished or abandoned without a checkpoint. */
    public void stop() {
        running = false;
        stopSignal.countDown();
    }

    public boolean isRunning() {
        return running;
    }

    /** Last fully indexed block, {@code startBlock - 1} before the first range. */
    public long checkpoint() {
        return store.lastIndexedBlock().orElse(startBlock - 1);
    }

    /** {@code height - checkpoint}, never negative. */
    public long blocksBehind() {
        return Math.max(0, ledger.currentHeight() - checkpoint());
    }

    @Override
    public void close() {
        stop();
        executor.shutdownNow();
    }

    private RangeResult processRange(final long from, final long to) {
        final List<Future<Tally>> futures = new ArrayList<>(mappers.size());
        for (EventMapper mapper : mappers) {
            futures.add(executor.submit(() -> apply(mapper, from, to)));
        }

        final Tally total = new Tally();
        Throwable failure = null;
        for (Future<Tally> future : futures) {
            try {
                total.merge(future.get());
            } catch (ExecutionException e) {
                // every mapper finishes before the range can be retried
                if (failure == null) {
                    failure = e.getCause() != null ? e.getCause() : e;
                } else {
                    failure.addSuppressed(e.getCause() != null ? e.getCause() : e);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(futures);
                log.info("Interrupted while indexing blocks {}-{}; checkpoint not advanced", from, to);
                return new RangeResult.Failed(from, to, e);
            }
        }
        if (failure != null) {
            log.warn("Failed to index blocks {}-{}; will retry", from, to, failure);
            return new RangeResult.Failed(from, to, failure);
        }

        try {
            store.saveCheckpoint(to);
        } catch (RuntimeException e) {
            log.warn("Failed to save checkpoint {}; range {}-{} will be replayed", to, from, to, e);
            return new RangeResult.Failed(from, to, e);
        }
        final RangeResult.Indexed result = new RangeResult.Indexed(from, to, total.outcomes, total.skipped);
        log.info("Indexed blocks {}-{}: {} events applied {}, {} skipped",
                from, to, result.applied(), result.outcomes(), result.skipped());
        return result;
    }

    private Tally apply(final EventMapper mapper, final long from, final long to) {
        final List<LogEntry> logs = ledger.getLogs(mapper.filter(from, to));
        final Tally tally = new Tally();
        for (LogEntry entry : logs) {
            if (entry.removed()) {
                log.warn("Skipping removed log {}#{} in block {}",
                        entry.transactionHash(), entry.logIndex(), entry.blockNumber());
                tally.skipped++;
                continue;
            }
            final Optional<DomainMutation> mutation;
            try {
                mutation = mapper.map(entry);
            } catch (AbiDecodingException e) {
                log.warn("Skipping malformed {} log {}#{}: {}",
                        mapper.name(), entry.transactionHash(), entry.logIndex(), e.getMessage());
                tally.skipped++;
                continue;
            }
            if (mutation.isEmpty()) {
                tally.skipped++;
                continue;
            }
            final WriteOutcome outcome = mutation.get().applyTo(store);
            if (outcome == WriteOutcome.MISSING) {
                log.warn("{} targets a missing row (block {}, tx {})",
                        mutation.get().getClass().getSimpleName(), entry.blockNumber(), entry.transactionHash());
            } else if (outcome == WriteOutcome.DUPLICATE) {
                log.debug("{} already applied (block {}, tx {})",
                        mutation.get().getClass().getSimpleName(), entry.blockNumber(), entry.transactionHash());
            }
            tally.record(outcome);
        }
        log.debug("{} mapper applied {} logs for blocks {}-{}", mapper.name(), logs.size(), from, to);
        return tally;
    }

    private static void cancelAll(final List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    private static final class Tally {
        private final Map<WriteOutcome, Integer> outcomes = new EnumMap<>(WriteOutcome.class);
        private int skipped;

        void record(final WriteOutcome outcome) {
            outcomes.merge(outcome, 1, Integer::sum);
        }

        void merge(final Tally other) {
            other.outcomes.forEach((k, v) -> outcomes.merge(k, v, Integer::sum));
            skipped += other.skipped;
        }
    }
}
