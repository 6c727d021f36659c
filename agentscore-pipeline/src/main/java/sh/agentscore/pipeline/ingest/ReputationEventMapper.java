// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.ingest;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.agentscore.core.erc8004.Erc8004Event;
import sh.agentscore.core.erc8004.Erc8004Events;
import sh.agentscore.core.erc8004.FeedbackRevoked;
import sh.agentscore.core.erc8004.FeedbackSubmitted;
import sh.agentscore.core.model.LogEntry;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;
import sh.agentscore.pipeline.store.Feedback;
import sh.agentscore.rpc.LedgerClient;

/**
 * Reputation Registry events: {@code NewFeedback} and {@code FeedbackRevoked}.
 *
 * <p>Feedback is stamped with its block time, looked up through {@link BlockTimes}.
 */
public final class ReputationEventMapper implements EventMapper {
    private static final Logger log = LoggerFactory.getLogger(ReputationEventMapper.class);

    private final Address registry;
    private final BlockTimes blockTimes;

    public ReputationEventMapper(final Address registry, final LedgerClient ledger) {
        this(registry, new BlockTimes(ledger));
    }

    public ReputationEventMapper(final Address registry, final BlockTimes blockTimes) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.blockTimes = Objects.requireNonNull(blockTimes, "blockTimes");
    }

    @Override
    public String name() {
        return "reputation";
    }

    @Override
    public Address contract() {
        return registry;
    }

    @Override
    public List<Hash> topics() {
        return Erc8004Events.REPUTATION_TOPICS;
    }

    @Override
    public Optional<DomainMutation> map(final LogEntry entry) {
        final Erc8004Event event = Erc8004Events.decode(entry);
        if (event instanceof FeedbackSubmitted submitted) {
            final String id = submitted.feedbackId().toString();
            log.debug("Feedback {} value={} decimals={} block={}", id,
                    submitted.value().value(), submitted.value().decimals(), entry.blockNumber());
            return Optional.of(new DomainMutation.RecordFeedback(new Feedback(
                    id,
                    submitted.agentId().toString(),
                    submitted.client(),
                    submitted.tag1(),
                    submitted.tag2(),
                    submitted.endpoint(),
                    submitted.value().value(),
                    submitted.value().decimals(),
                    submitted.feedbackURI(),
                    false,
                    entry.blockNumber(),
                    entry.transactionHash(),
                    blockTimes.of(entry.blockNumber()))));
        }
        if (event instanceof FeedbackRevoked revoked) {
            log.debug("Feedback {} revoked block={}", revoked.feedbackId(), entry.blockNumber());
            return Optional.of(new DomainMutation.RevokeFeedback(revoked.feedbackId().toString()));
        }
        return Optional.empty();
    }
}
