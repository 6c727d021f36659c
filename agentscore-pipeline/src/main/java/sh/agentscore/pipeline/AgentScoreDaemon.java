// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.agentscore.core.crypto.PrivateKeySigner;
import sh.agentscore.pipeline.config.ConfigurationException;
import sh.agentscore.pipeline.config.PipelineConfig;
import sh.agentscore.pipeline.ingest.BlockTimes;
import sh.agentscore.pipeline.ingest.EventMapper;
import sh.agentscore.pipeline.ingest.IdentityEventMapper;
import sh.agentscore.pipeline.ingest.IngestionLoop;
import sh.agentscore.pipeline.ingest.ReputationEventMapper;
import sh.agentscore.pipeline.oracle.OracleSettings;
import sh.agentscore.pipeline.oracle.OracleUpdater;
import sh.agentscore.pipeline.oracle.ScoreOracle;
import sh.agentscore.pipeline.scoring.RecomputeSummary;
import sh.agentscore.pipeline.scoring.ScoreAggregator;
import sh.agentscore.pipeline.scoring.ScoreRefresher;
import sh.agentscore.pipeline.scoring.TimeDecay;
import sh.agentscore.pipeline.store.DomainStore;
import sh.agentscore.pipeline.store.JdbcDomainStore;
import sh.agentscore.rpc.HttpLedgerProvider;
import sh.agentscore.rpc.JsonRpcLedgerClient;
import sh.agentscore.rpc.LedgerClient;
import sh.agentscore.rpc.LedgerProvider;

/**
 * Wires the store, the ledger client, the ingestion loop and a scoring loop, and runs
 * them until shutdown.
 *
 * <p>The scoring loop is the publication daemon when an oracle contract is configured.
 * Without one, a {@link ScoreRefresher} recomputes scores on the same interval so the
 * store's leaderboard and score lookups stay current.
 *
 * <pre>{@code
 * RPC_URL=https://... DATABASE_URL=jdbc:h2:./data/trust_scores \
 *     java -cp ... sh.agentscore.pipeline.AgentScoreDaemon
 *
 * # recompute every score once and exit
 * DATABASE_URL=jdbc:h2:./data/trust_scores \
 *     java -cp ... sh.agentscore.pipeline.AgentScoreDaemon compute-scores
 * }</pre>
 */
public final class AgentScoreDaemon implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AgentScoreDaemon.class);

    /** Command-line argument that recomputes every score once and exits. */
    static final String COMPUTE_SCORES = "compute-scores";

    private final PipelineConfig config;
    private final LedgerProvider provider;
    private final DomainStore store;
    private final IngestionLoop ingestion;
    private final ScoreAggregator aggregator;
    private final @Nullable OracleUpdater oracleUpdater;
    private final @Nullable ScoreRefresher scoreRefresher;
    private final ExecutorService loops;
    private final CountDownLatch closed = new CountDownLatch(1);

    AgentScoreDaemon(
            final PipelineConfig config,
            final LedgerProvider provider,
            final LedgerClient ledger,
            final DomainStore store,
            final Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.store = Objects.requireNonNull(store, "store");

        final BlockTimes blockTimes = new BlockTimes(ledger);
        final List<EventMapper> mappers = new ArrayList<>(2);
        mappers.add(new IdentityEventMapper(config.identityRegistry(), blockTimes));
        mappers.add(new ReputationEventMapper(config.reputationRegistry(), blockTimes));
        this.ingestion = new IngestionLoop(
                ledger, store, mappers, config.startBlock(), config.indexerBatchSize(), config.pollInterval());

        this.aggregator = new ScoreAggregator(store, new TimeDecay(config.decayHalfLifeDays()), clock);
        if (config.publicationEnabled()) {
            this.scoreRefresher = null;
            this.oracleUpdater = new OracleUpdater(
                    aggregator,
                    store,
                    new ScoreOracle(ledger, Objects.requireNonNull(config.oracleContract())),
                    OracleSettings.from(config),
                    clock);
        } else {
            this.oracleUpdater = null;
            this.scoreRefresher = new ScoreRefresher(aggregator);
        }
        this.loops = Executors.newFixedThreadPool(2, PipelineExecutors.threadFactory("loop"));
    }

    /** Builds every component from {@code config}. */
    public static AgentScoreDaemon create(final PipelineConfig config) {
        final LedgerProvider provider = HttpLedgerProvider.builder(config.rpcUrl()).build();
        final JsonRpcLedgerClient.Builder client = JsonRpcLedgerClient.builder(provider).chainId(config.chainId());
        final String key = config.oracleOwnerKey();
        if (config.publicationEnabled() && key != null) {
            client.signer(new PrivateKeySigner(key));
        }
        return new AgentScoreDaemon(config, provider, client.build(), JdbcDomainStore.open(config.databaseUrl()),
                Clock.systemUTC());
    }

    /** Starts the loops on background threads. */
    public void start() {
        log.info("Starting AgentScore pipeline: {}", config);
        loops.submit(ingestion::run);
        if (oracleUpdater != null) {
            loops.submit(() -> oracleUpdater.runDaemon(config.oracleUpdateInterval()));
        } else if (scoreRefresher != null) {
            log.info("Oracle publication disabled: {} not set; scores are computed locally only",
                    PipelineConfig.ORACLE_CONTRACT);
            loops.submit(() -> scoreRefresher.runDaemon(config.oracleUpdateInterval()));
        }
    }

    /**
     * Recomputes every score once on the calling thread, without indexing or publishing.
     *
     * @return per-agent outcomes of the pass
     */
    public RecomputeSummary computeScores() {
        final RecomputeSummary summary = aggregator.computeAllScores();
        log.info("Computed {} scores ({} without feedback, {} failed)",
                summary.computed(), summary.skipped(), summary.failed());
        return summary;
    }

    IngestionLoop ingestion() {
        return ingestion;
    }

    @Nullable OracleUpdater oracleUpdater() {
        return oracleUpdater;
    }

    @Nullable ScoreRefresher scoreRefresher() {
        return scoreRefresher;
    }

    /** Stops both loops, waits briefly for them, and releases the store and transport. */
    @Override
    public void close() {
        log.info("Shutting down AgentScore pipeline");
        ingestion.stop();
        if (oracleUpdater != null) {
            oracleUpdater.stop();
        }
        if (scoreRefresher != null) {
            scoreRefresher.stop();
        }
        loops.shutdown();
        try {
            if (!loops.awaitTermination(10, TimeUnit.SECONDS)) {
                loops.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            loops.shutdownNow();
        }
        ingestion.close();
        store.close();
        try {
            provider.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close ledger provider", e);
        }
        closed.countDown();
    }

    /** Blocks until {@link #close()} has finished. */
    public void awaitShutdown() throws InterruptedException {
        closed.await();
    }

    public static void main(final String[] args) throws InterruptedException {
        final PipelineConfig config;
        try {
            config = PipelineConfig.fromEnvironment(System.getenv());
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        final AgentScoreDaemon daemon = create(config);
        if (args.length > 0 && COMPUTE_SCORES.equals(args[0])) {
            try (daemon) {
                daemon.computeScores();
            }
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(daemon::close, "agentscore-shutdown"));
        daemon.start();
        daemon.awaitShutdown();
    }
}
