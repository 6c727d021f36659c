// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.agentscore.core.crypto.PrivateKey;
import sh.agentscore.core.erc8004.Erc8004Addresses;
import sh.agentscore.core.types.Address;

/**
 * Settings for the indexer, the score aggregator and the oracle publisher.
 *
 * <p>Publication is enabled exactly when {@link #oracleContract()} is set, in which case
 * {@link #oracleOwnerKey()} is required. The key is excluded from {@link #toString()}.
 *
 * @param rpcUrl                 JSON-RPC endpoint
 * @param chainId                chain id used when signing
 * @param identityRegistry       Identity Registry address
 * @param reputationRegistry     Reputation Registry address
 * @param databaseUrl            JDBC URL of the domain store
 * @param startBlock             first block indexed when no checkpoint exists
 * @param pollInterval           indexer sleep when caught up or after a failed range
 * @param indexerBatchSize       blocks per indexed range
 * @param decayHalfLifeDays      feedback half-life in days
 * @param oracleContract         TrustScoreOracle address, or null to disable publication
 * @param oracleOwnerKey         hex private key of the oracle owner
 * @param oracleBatchSize        scores per {@code updateScoreBatch} transaction
 * @param minScoreChange         smallest score movement worth publishing
 * @param oracleUpdateInterval   time between publication cycles, or between local score
 *                               recomputes when publication is disabled
 * @param confirmationTimeout    bound on each receipt wait
 * @param batchDelay             pause between batch submissions
 */
public record PipelineConfig(
        String rpcUrl,
        long chainId,
        Address identityRegistry,
        Address reputationRegistry,
        String databaseUrl,
        long startBlock,
        Duration pollInterval,
        int indexerBatchSize,
        double decayHalfLifeDays,
        @Nullable Address oracleContract,
        @Nullable String oracleOwnerKey,
        int oracleBatchSize,
        double minScoreChange,
        Duration oracleUpdateInterval,
        Duration confirmationTimeout,
        Duration batchDelay) {

    public static final String RPC_URL = "RPC_URL";
    public static final String CHAIN_ID = "CHAIN_ID";
    public static final String IDENTITY_REGISTRY = "IDENTITY_REGISTRY";
    public static final String REPUTATION_REGISTRY = "REPUTATION_REGISTRY";
    public static final String DATABASE_URL = "DATABASE_URL";
    public static final String INDEXER_START_BLOCK = "INDEXER_START_BLOCK";
    public static final String INDEXER_POLL_INTERVAL = "INDEXER_POLL_INTERVAL";
    public static final String INDEXER_BATCH_SIZE = "INDEXER_BATCH_SIZE";
    public static final String DECAY_HALF_LIFE_DAYS = "DECAY_HALF_LIFE_DAYS";
    public static final String ORACLE_CONTRACT = "ORACLE_CONTRACT";
    public static final String ORACLE_OWNER_KEY = "ORACLE_OWNER_KEY";
    public static final String ORACLE_BATCH_SIZE = "ORACLE_BATCH_SIZE";
    public static final String ORACLE_MIN_SCORE_CHANGE = "ORACLE_MIN_SCORE_CHANGE";
    public static final String ORACLE_UPDATE_INTERVAL_HOURS = "ORACLE_UPDATE_INTERVAL_HOURS";
    public static final String ORACLE_CONFIRMATION_TIMEOUT = "ORACLE_CONFIRMATION_TIMEOUT";
    public static final String ORACLE_BATCH_DELAY = "ORACLE_BATCH_DELAY";

    public static final String DEFAULT_RPC_URL = "https://eth.llamarpc.com";
    public static final String DEFAULT_DATABASE_URL = "jdbc:h2:./data/trust_scores";
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(12);
    public static final int DEFAULT_INDEXER_BATCH_SIZE = 1000;
    public static final double DEFAULT_HALF_LIFE_DAYS = 90.0;
    public static final int DEFAULT_ORACLE_BATCH_SIZE = 50;
    public static final double DEFAULT_MIN_SCORE_CHANGE = 1.0;
    public static final Duration DEFAULT_UPDATE_INTERVAL = Duration.ofHours(6);
    public static final Duration DEFAULT_CONFIRMATION_TIMEOUT = Duration.ofSeconds(120);
    public static final Duration DEFAULT_BATCH_DELAY = Duration.ofSeconds(2);

    public PipelineConfig {
        requireText(RPC_URL, rpcUrl);
        requireText(DATABASE_URL, databaseUrl);
        if (chainId <= 0) {
            throw new ConfigurationException(CHAIN_ID, "must be positive, got " + chainId);
        }
        if (identityRegistry == null) {
            throw new ConfigurationException(IDENTITY_REGISTRY, "is required");
        }
        if (reputationRegistry == null) {
            throw new ConfigurationException(REPUTATION_REGISTRY, "is required");
        }
        if (startBlock < 0) {
            throw new ConfigurationException(INDEXER_START_BLOCK, "cannot be negative, got " + startBlock);
        }
        requirePositive(INDEXER_POLL_INTERVAL, pollInterval);
        if (indexerBatchSize <= 0) {
            throw new ConfigurationException(INDEXER_BATCH_SIZE, "must be positive, got " + indexerBatchSize);
        }
        if (!(decayHalfLifeDays > 0) || Double.isInfinite(decayHalfLifeDays)) {
            throw new ConfigurationException(DECAY_HALF_LIFE_DAYS, "must be positive, got " + decayHalfLifeDays);
        }
        if (oracleContract != null) {
            if (oracleOwnerKey == null || oracleOwnerKey.isBlank()) {
                throw new ConfigurationException(ORACLE_OWNER_KEY, "is required when " + ORACLE_CONTRACT + " is set");
            }
            try {
                PrivateKey.fromHex(oracleOwnerKey).destroy();
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(ORACLE_OWNER_KEY, "is not a valid secp256k1 key", e);
            }
        }
        if (oracleBatchSize <= 0) {
            throw new ConfigurationException(ORACLE_BATCH_SIZE, "must be positive, got " + oracleBatchSize);
        }
        if (minScoreChange < 0 || Double.isNaN(minScoreChange)) {
            throw new ConfigurationException(ORACLE_MIN_SCORE_CHANGE, "cannot be negative, got " + minScoreChange);
        }
        requirePositive(ORACLE_UPDATE_INTERVAL_HOURS, oracleUpdateInterval);
        requirePositive(ORACLE_CONFIRMATION_TIMEOUT, confirmationTimeout);
        if (batchDelay == null || batchDelay.isNegative()) {
            throw new ConfigurationException(ORACLE_BATCH_DELAY, "cannot be negative");
        }
    }

    public boolean publicationEnabled() {
        return oracleContract != null;
    }

    /**
     * Reads settings from environment-style keys, falling back to defaults.
     *
     * @throws ConfigurationException if a value cannot be parsed or fails validation
     */
    public static PipelineConfig fromEnvironment(final Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        final Builder builder = builder();
        final String rpcUrl = value(env, RPC_URL);
        if (rpcUrl != null) {
            builder.rpcUrl(rpcUrl);
        }
        final String databaseUrl = value(env, DATABASE_URL);
        if (databaseUrl != null) {
            builder.databaseUrl(databaseUrl);
        }
        final String identity = value(env, IDENTITY_REGISTRY);
        if (identity != null) {
            builder.identityRegistry(parseAddress(IDENTITY_REGISTRY, identity));
        }
        final String reputation = value(env, REPUTATION_REGISTRY);
        if (reputation != null) {
            builder.reputationRegistry(parseAddress(REPUTATION_REGISTRY, reputation));
        }
        final String oracle = value(env, ORACLE_CONTRACT);
        if (oracle != null) {
            builder.oracleContract(parseAddress(ORACLE_CONTRACT, oracle));
        }
        builder.oracleOwnerKey(value(env, ORACLE_OWNER_KEY));

        final Long chainId = parseLong(env, CHAIN_ID);
        if (chainId != null) {
            builder.chainId(chainId);
        }
        final Long startBlock = parseLong(env, INDEXER_START_BLOCK);
        if (startBlock != null) {
            builder.startBlock(startBlock);
        }
        final Double pollSeconds = parseDouble(env, INDEXER_POLL_INTERVAL);
        if (pollSeconds != null) {
            builder.pollInterval(seconds(pollSeconds));
        }
        final Long indexerBatch = parseLong(env, INDEXER_BATCH_SIZE);
        if (indexerBatch != null) {
            builder.indexerBatchSize(toInt(INDEXER_BATCH_SIZE, indexerBatch));
        }
        final Double halfLife = parseDouble(env, DECAY_HALF_LIFE_DAYS);
        if (halfLife != null) {
            builder.decayHalfLifeDays(halfLife);
        }
        final Long oracleBatch = parseLong(env, ORACLE_BATCH_SIZE);
        if (oracleBatch != null) {
            builder.oracleBatchSize(toInt(ORACLE_BATCH_SIZE, oracleBatch));
        }
        final Double minChange = parseDouble(env, ORACLE_MIN_SCORE_CHANGE);
        if (minChange != null) {
            builder.minScoreChange(minChange);
        }
        final Double intervalHours = parseDouble(env, ORACLE_UPDATE_INTERVAL_HOURS);
        if (intervalHours != null) {
            builder.oracleUpdateInterval(seconds(intervalHours * 3600.0));
        }
        final Double confirmSeconds = parseDouble(env, ORACLE_CONFIRMATION_TIMEOUT);
        if (confirmSeconds != null) {
            builder.confirmationTimeout(seconds(confirmSeconds));
        }
        final Double delaySeconds = parseDouble(env, ORACLE_BATCH_DELAY);
        if (delaySeconds != null) {
            builder.batchDelay(seconds(delaySeconds));
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "PipelineConfig{rpcUrl=" + rpcUrl
                + ", chainId=" + chainId
                + ", identityRegistry=" + identityRegistry
                + ", reputationRegistry=" + reputationRegistry
                + ", databaseUrl=" + databaseUrl
                + ", startBlock=" + startBlock
                + ", pollInterval=" + pollInterval
                + ", indexerBatchSize=" + indexerBatchSize
                + ", decayHalfLifeDays=" + decayHalfLifeDays
                + ", oracleContract=" + oracleContract
                + ", oracleOwnerKey=" + (oracleOwnerKey == null ? "null" : "***")
                + ", oracleBatchSize=" + oracleBatchSize
                + ", minScoreChange=" + minScoreChange
                + ", oracleUpdateInterval=" + oracleUpdateInterval
                + ", confirmationTimeout=" + confirmationTimeout
                + ", batchDelay=" + batchDelay
                + "}";
    }

    private static void requireText(final String key, final @Nullable String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(key, "is required");
        }
    }

    private static void requirePositive(final String key, final @Nullable Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(key, "must be positive, got " + value);
        }
    }

    private static @Nullable String value(final Map<String, String> env, final String key) {
        final String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim();
    }

    private static Address parseAddress(final String key, final String raw) {
        try {
            return new Address(raw);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(key, "is not a 20-byte hex address: " + raw, e);
        }
    }

    private static @Nullable Long parseLong(final Map<String, String> env, final String key) {
        final String raw = value(env, key);
        if (raw == null) {
            return null;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, "is not an integer: " + raw, e);
        }
    }

    private static @Nullable Double parseDouble(final Map<String, String> env, final String key) {
        final String raw = value(env, key);
        if (raw == null) {
            return null;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, "is not a number: " + raw, e);
        }
    }

    private static int toInt(final String key, final long value) {
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new ConfigurationException(key, "is out of range: " + value);
        }
        return (int) value;
    }

    private static Duration seconds(final double seconds) {
        return Duration.ofMillis(Math.round(seconds * 1000.0));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String rpcUrl = DEFAULT_RPC_URL;
        private long chainId = 1L;
        private Address identityRegistry = Erc8004Addresses.MAINNET_IDENTITY;
        private Address reputationRegistry = Erc8004Addresses.MAINNET_REPUTATION;
        private String databaseUrl = DEFAULT_DATABASE_URL;
        private long startBlock = 0L;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private int indexerBatchSize = DEFAULT_INDEXER_BATCH_SIZE;
        private double decayHalfLifeDays = DEFAULT_HALF_LIFE_DAYS;
        private @Nullable Address oracleContract;
        private @Nullable String oracleOwnerKey;
        private int oracleBatchSize = DEFAULT_ORACLE_BATCH_SIZE;
        private double minScoreChange = DEFAULT_MIN_SCORE_CHANGE;
        private Duration oracleUpdateInterval = DEFAULT_UPDATE_INTERVAL;
        private Duration confirmationTimeout = DEFAULT_CONFIRMATION_TIMEOUT;
        private Duration batchDelay = DEFAULT_BATCH_DELAY;

        private Builder() {}

        public Builder rpcUrl(final String rpcUrl) {
            this.rpcUrl = rpcUrl;
            return this;
        }

        public Builder chainId(final long chainId) {
            this.chainId = chainId;
            return this;
        }

        public Builder identityRegistry(final Address identityRegistry) {
            this.identityRegistry = identityRegistry;
            return this;
        }

        public Builder reputationRegistry(final Address reputationRegistry) {
            this.reputationRegistry = reputationRegistry;
            return this;
        }

        public Builder databaseUrl(final String databaseUrl) {
            this.databaseUrl = databaseUrl;
            return this;
        }

        public Builder startBlock(final long startBlock) {
            this.startBlock = startBlock;
            return this;
        }

        public Builder pollInterval(final Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder indexerBatchSize(final int indexerBatchSize) {
            this.indexerBatchSize = indexerBatchSize;
            return this;
        }

        public Builder decayHalfLifeDays(final double decayHalfLifeDays) {
            this.decayHalfLifeDays = decayHalfLifeDays;
            return this;
        }

        public Builder oracleContract(final @Nullable Address oracleContract) {
            this.oracleContract = oracleContract;
            return this;
        }

        public Builder oracleOwnerKey(final @Nullable String oracleOwnerKey) {
            this.oracleOwnerKey = oracleOwnerKey;
            return this;
        }

        public Builder oracleBatchSize(final int oracleBatchSize) {
            this.oracleBatchSize = oracleBatchSize;
            return this;
        }

        public Builder minScoreChange(final double minScoreChange) {
            this.minScoreChange = minScoreChange;
            return this;
        }

        public Builder oracleUpdateInterval(final Duration oracleUpdateInterval) {
            this.oracleUpdateInterval = oracleUpdateInterval;
            return this;
        }

        public Builder confirmationTimeout(final Duration confirmationTimeout) {
            this.confirmationTimeout = confirmationTimeout;
            return this;
        }

        public Builder batchDelay(final Duration batchDelay) {
            this.batchDelay = batchDelay;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(
                    rpcUrl,
                    chainId,
                    identityRegistry,
                    reputationRegistry,
                    databaseUrl,
                    startBlock,
                    pollInterval,
                    indexerBatchSize,
                    decayHalfLifeDays,
                    oracleContract,
                    oracleOwnerKey,
                    oracleBatchSize,
                    minScoreChange,
                    oracleUpdateInterval,
                    confirmationTimeout,
                    batchDelay);
        }
    }
}
