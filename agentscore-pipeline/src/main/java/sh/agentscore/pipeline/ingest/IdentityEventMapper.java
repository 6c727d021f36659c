// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.ingest;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.agentscore.core.erc8004.AgentRegistered;
import sh.agentscore.core.erc8004.AgentUriUpdated;
import sh.agentscore.core.erc8004.Erc8004Event;
import sh.agentscore.core.erc8004.Erc8004Events;
import sh.agentscore.core.erc8004.MetadataSet;
import sh.agentscore.core.model.LogEntry;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;
import sh.agentscore.pipeline.store.Agent;
import sh.agentscore.rpc.LedgerClient;

/**
 * Identity Registry events: {@code Registered}, {@code URIUpdated} (and the older
 * {@code AgentURIUpdated}) and {@code MetadataSet}.
 *
 * <p>Agent times come from the event's block: {@code createdAt} and {@code updatedAt}
 * of a registration are its block time, and URI or metadata changes advance
 * {@code updatedAt} to theirs. Mapping the same log twice yields equal mutations.
 */
public final class IdentityEventMapper implements EventMapper {
    private static final Logger log = LoggerFactory.getLogger(IdentityEventMapper.class);

    private final Address registry;
    private final BlockTimes blockTimes;

    public IdentityEventMapper(final Address registry, final LedgerClient ledger) {
        this(registry, new BlockTimes(ledger));
    }

    public IdentityEventMapper(final Address registry, final BlockTimes blockTimes) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.blockTimes = Objects.requireNonNull(blockTimes, "blockTimes");
    }

    @Override
    public String name() {
        return "identity";
    }

    @Override
    public Address contract() {
        return registry;
    }

    @Override
    public List<Hash> topics() {
        return Erc8004Events.IDENTITY_TOPICS;
    }

    @Override
    public Optional<DomainMutation> map(final LogEntry entry) {
        final Erc8004Event event = Erc8004Events.decode(entry);
        if (event instanceof AgentRegistered registered) {
            final Instant at = blockTimes.of(entry.blockNumber());
            log.debug("Registered agent {} owner={} block={}",
                    registered.agentId(), registered.owner(), entry.blockNumber());
            return Optional.of(new DomainMutation.RegisterAgent(new Agent(
                    registered.agentId().toString(),
                    registered.owner(),
                    registered.agentURI(),
                    entry.blockNumber(),
                    entry.transactionHash(),
                    at,
                    at)));
        }
        if (event instanceof AgentUriUpdated updated) {
            log.debug("URI updated for agent {} block={}", updated.agentId(), entry.blockNumber());
            return Optional.of(new DomainMutation.UpdateAgentUri(updated.agentId().toString(), updated.newURI(),
                    blockTimes.of(entry.blockNumber())));
        }
        if (event instanceof MetadataSet metadata) {
            log.debug("Metadata '{}' set for agent {}", metadata.metadataKey(), metadata.agentId());
            return Optional.of(new DomainMutation.TouchAgent(metadata.agentId().toString(),
                    blockTimes.of(entry.blockNumber())));
        }
        return Optional.empty();
    }
}
