// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.oracle;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import sh.agentscore.core.abi.AbiDecoder;
import sh.agentscore.core.abi.AbiEncoder;
import sh.agentscore.core.abi.AbiType;
import sh.agentscore.core.abi.Bytes32;
import sh.agentscore.core.abi.UInt;
import sh.agentscore.core.abi.WordArray;
import sh.agentscore.core.erc8004.AgentId;
import sh.agentscore.core.model.TransactionReceipt;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;
import sh.agentscore.core.types.HexData;
import sh.agentscore.rpc.LedgerClient;

/**
 * Binding for the trust score oracle contract.
 *
 * <pre>
 * function getScoreView(bytes32 agentId) view returns (uint256 score, uint256 lastUpdated, bool exists)
 * function updateScoreBatch(bytes32[] agentIds, uint256[] newScores)
 * </pre>
 *
 * <p>Agent ids are the 32-byte big-endian encoding of the integer token id. Scores are
 * stored multiplied by 100 and truncated.
 */
public final class ScoreOracle {
    static final String GET_SCORE_VIEW = "getScoreView(bytes32)";
    static final String UPDATE_SCORE_BATCH = "updateScoreBatch(bytes32[],uint256[])";
    static final long BASE_GAS = 50_000L;
    static final long GAS_PER_SCORE = 30_000L;

    private final LedgerClient ledger;
    private final Address contract;

    public ScoreOracle(final LedgerClient ledger, final Address contract) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.contract = Objects.requireNonNull(contract, "contract");
    }

    public Address contract() {
        return contract;
    }

    /**
     * Reads the published score of an agent.
     *
     * @return the score, or empty if the oracle has none
     * @throws sh.agentscore.core.error.AbiDecodingException if the return data is short
     */
    public Optional<OnChainScore> getScore(final String agentId) {
        final byte[] calldata = AbiEncoder.encodeFunction(GET_SCORE_VIEW, List.of(agentKey(agentId)));
        final byte[] result = ledger.callView(contract, HexData.fromBytes(calldata)).toBytes();
        if (!AbiDecoder.bool(result, 2)) {
            return Optional.empty();
        }
        final BigInteger lastUpdated = AbiDecoder.uint(result, 1);
        return Optional.of(new OnChainScore(
                AbiDecoder.uint(result, 0), Instant.ofEpochSecond(lastUpdated.longValueExact())));
    }

    /**
     * Submits one {@code updateScoreBatch} transaction.
     *
     * @param agentIds decimal agent ids
     * @param scores   scores on the 0-100 scale, same order as {@code agentIds}
     * @return the transaction hash
     */
    public Hash submitBatch(final List<String> agentIds, final List<Double> scores) {
        if (agentIds.size() != scores.size()) {
            throw new IllegalArgumentException(
                    "agentIds and scores differ in length: " + agentIds.size() + " vs " + scores.size());
        }
        if (agentIds.isEmpty()) {
            throw new IllegalArgumentException("batch is empty");
        }
        final List<AbiType> keys = new ArrayList<>(agentIds.size());
        final List<AbiType> values = new ArrayList<>(scores.size());
        for (int i = 0; i < agentIds.size(); i++) {
            keys.add(agentKey(agentIds.get(i)));
            values.add(UInt.uint256(toChainValue(scores.get(i))));
        }
        final byte[] calldata = AbiEncoder.encodeFunction(UPDATE_SCORE_BATCH,
                List.of(new WordArray("bytes32", keys), new WordArray("uint256", values)));
        return ledger.submitTransaction(contract, HexData.fromBytes(calldata), gasLimit(agentIds.size()));
    }

    public Optional<TransactionReceipt> awaitReceipt(final Hash txHash, final Duration timeout) {
        return ledger.waitForReceipt(txHash, timeout);
    }

    /** {@code floor(score * 100)}. */
    public static BigInteger toChainValue(final double score) {
        if (score < 0.0 || score > 100.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be within 0-100, got " + score);
        }
        return BigDecimal.valueOf(score).movePointRight(2).setScale(0, RoundingMode.FLOOR).toBigIntegerExact();
    }

    /** The oracle key of an agent: its token id as a big-endian {@code bytes32}. */
    public static Bytes32 agentKey(final String agentId) {
        return Bytes32.fromUnsigned(AgentId.parse(agentId).value());
    }

    static long gasLimit(final int batchSize) {
        return BASE_GAS + GAS_PER_SCORE * batchSize;
    }
}
