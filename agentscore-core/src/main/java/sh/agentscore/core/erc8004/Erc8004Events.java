// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.erc8004;

import java.util.List;
import org.jspecify.annotations.Nullable;
import sh.agentscore.core.abi.AbiDecoder;
import sh.agentscore.core.crypto.Keccak256;
import sh.agentscore.core.error.AbiDecodingException;
import sh.agentscore.core.model.LogEntry;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;

/**
 * Event signatures, topic hashes and decoders for the Identity and Reputation
 * registries.
 *
 * <p>Decoders check topic 0 and the topic count, then read indexed arguments from the
 * topics and the rest from the data section. Malformed logs raise
 * {@link AbiDecodingException}.
 */
public final class Erc8004Events {

    public static final String REGISTERED_SIGNATURE = "Registered(uint256,string,address)";
    public static final String URI_UPDATED_SIGNATURE = "URIUpdated(uint256,string,address)";
    public static final String AGENT_URI_UPDATED_SIGNATURE = "AgentURIUpdated(uint256,string)";
    public static final String METADATA_SET_SIGNATURE = "MetadataSet(uint256,string,string,bytes)";
    public static final String NEW_FEEDBACK_SIGNATURE =
            "NewFeedback(uint256,address,uint64,int128,uint8,string,string,string,string,string,bytes32)";
    public static final String FEEDBACK_REVOKED_SIGNATURE = "FeedbackRevoked(uint256,address,uint64)";

    public static final Hash REGISTERED = topicOf(REGISTERED_SIGNATURE);
    public static final Hash URI_UPDATED = topicOf(URI_UPDATED_SIGNATURE);
    public static final Hash AGENT_URI_UPDATED = topicOf(AGENT_URI_UPDATED_SIGNATURE);
    public static final Hash METADATA_SET = topicOf(METADATA_SET_SIGNATURE);
    public static final Hash NEW_FEEDBACK = topicOf(NEW_FEEDBACK_SIGNATURE);
    public static final Hash FEEDBACK_REVOKED = topicOf(FEEDBACK_REVOKED_SIGNATURE);

    /** Topic 0 values emitted by the Identity Registry that the indexer follows. */
    public static final List<Hash> IDENTITY_TOPICS = List.of(REGISTERED, URI_UPDATED, AGENT_URI_UPDATED, METADATA_SET);

    /** Topic 0 values emitted by the Reputation Registry that the indexer follows. */
    public static final List<Hash> REPUTATION_TOPICS = List.of(NEW_FEEDBACK, FEEDBACK_REVOKED);

    private Erc8004Events() {}

    /** Keccak-256 of a canonical event signature. */
    public static Hash topicOf(final String signature) {
        return Hash.fromBytes(Keccak256.hashUtf8(signature));
    }

    /**
     * Decodes any followed registry event.
     *
     * @param log the raw log
     * @return the event, or null if topic 0 is not a followed event
     * @throws AbiDecodingException if topic 0 matches but the payload is malformed
     */
    public static @Nullable Erc8004Event decode(final LogEntry log) {
        final Hash topic0 = log.topic0();
        if (topic0 == null) {
            return null;
        }
        if (topic0.equals(REGISTERED)) {
            return decodeRegistered(log);
        }
        if (topic0.equals(URI_UPDATED) || topic0.equals(AGENT_URI_UPDATED)) {
            return decodeUriUpdated(log);
        }
        if (topic0.equals(METADATA_SET)) {
            return decodeMetadataSet(log);
        }
        if (topic0.equals(NEW_FEEDBACK)) {
            return decodeNewFeedback(log);
        }
        if (topic0.equals(FEEDBACK_REVOKED)) {
            return decodeFeedbackRevoked(log);
        }
        return null;
    }

    public static AgentRegistered decodeRegistered(final LogEntry log) {
        requireTopics(log, REGISTERED, 3);
        final byte[] data = log.data().toBytes();
        return guarded(log, () -> new AgentRegistered(
                agentId(log), AbiDecoder.string(data, 0), Address.fromWord(log.topics().get(2).toBytes())));
    }

    public static AgentUriUpdated decodeUriUpdated(final LogEntry log) {
        final Hash topic0 = log.topic0();
        final boolean legacy = AGENT_URI_UPDATED.equals(topic0);
        requireTopics(log, legacy ? AGENT_URI_UPDATED : URI_UPDATED, legacy ? 2 : 3);
        final byte[] data = log.data().toBytes();
        return guarded(log, () -> new AgentUriUpdated(
                agentId(log),
                AbiDecoder.string(data, 0),
                legacy ? null : Address.fromWord(log.topics().get(2).toBytes())));
    }

    public static MetadataSet decodeMetadataSet(final LogEntry log) {
        requireTopics(log, METADATA_SET, 3);
        final byte[] data = log.data().toBytes();
        return guarded(log, () -> new MetadataSet(
                agentId(log), AbiDecoder.string(data, 0), AbiDecoder.bytes(data, 1)));
    }

    public static FeedbackSubmitted decodeNewFeedback(final LogEntry log) {
        requireTopics(log, NEW_FEEDBACK, 4);
        final byte[] data = log.data().toBytes();
        return guarded(log, () -> new FeedbackSubmitted(
                agentId(log),
                Address.fromWord(log.topics().get(2).toBytes()),
                AbiDecoder.uint(data, 0),
                new FeedbackValue(AbiDecoder.int256(data, 1), AbiDecoder.uint(data, 2).intValueExact()),
                AbiDecoder.string(data, 3),
                AbiDecoder.string(data, 4),
                AbiDecoder.string(data, 5),
                AbiDecoder.string(data, 6),
                Hash.fromBytes(AbiDecoder.word(data, 7))));
    }

    public static FeedbackRevoked decodeFeedbackRevoked(final LogEntry log) {
        requireTopics(log, FEEDBACK_REVOKED, 4);
        return guarded(log, () -> new FeedbackRevoked(
                agentId(log),
                Address.fromWord(log.topics().get(2).toBytes()),
                AbiDecoder.topicUint(log.topics().get(3).toBytes())));
    }

    private static AgentId agentId(final LogEntry log) {
        return new AgentId(AbiDecoder.topicUint(log.topics().get(1).toBytes()));
    }

    private static void requireTopics(final LogEntry log, final Hash expected, final int count) {
        if (!expected.equals(log.topic0())) {
            throw new AbiDecodingException("log " + log.transactionHash() + "#" + log.logIndex()
                    + " is not the expected event " + expected);
        }
        if (log.topics().size() != count) {
            throw new AbiDecodingException("log " + log.transactionHash() + "#" + log.logIndex()
                    + " has " + log.topics().size() + " topics, expected " + count);
        }
    }

    private static <T> T guarded(final LogEntry log, final Decoding<T> decoding) {
        try {
            return decoding.run();
        } catch (ArithmeticException | IllegalArgumentException e) {
            throw new AbiDecodingException(
                    "malformed event data in " + log.transactionHash() + "#" + log.logIndex(), e);
        }
    }

    @FunctionalInterface
    private interface Decoding<T> {
        T run();
    }
}
