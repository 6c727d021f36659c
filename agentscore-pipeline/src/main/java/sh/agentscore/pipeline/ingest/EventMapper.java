// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.ingest;

import java.util.List;
import java.util.Optional;
import sh.agentscore.core.model.LogEntry;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;
import sh.agentscore.rpc.LogFilter;

/**
 * Maps raw logs of one registry contract to domain mutations.
 *
 * <p>Mapping must be deterministic: the same log always yields the same mutation, with
 * times taken from the log's block rather than from a clock. Combined with the store's
 * idempotent writes this makes replaying a block range harmless.
 *
 * <p>Implementations are called from one ingestion worker thread at a time, but
 * different mappers run concurrently.
 *
 * @see IdentityEventMapper
 * @see ReputationEventMapper
 * @see IngestionLoop
 */
public interface EventMapper {

    /** Short name used in logs and thread names. */
    String name();

    /** The contract whose logs this mapper consumes. */
    Address contract();

    /** Topic 0 values this mapper understands. */
    List<Hash> topics();

    /**
     * Maps one log.
     *
     * @return the mutation, or empty when the log is not an event this mapper follows
     * @throws sh.agentscore.core.error.AbiDecodingException if the payload is malformed
     */
    Optional<DomainMutation> map(LogEntry log);

    /** The {@code eth_getLogs} filter for a block range. */
    default LogFilter filter(final long fromBlock, final long toBlock) {
        return LogFilter.of(fromBlock, toBlock, contract(), topics());
    }
}
