// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.model;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;
import sh.agentscore.core.types.HexData;

/**
 * A contract event log as returned by {@code eth_getLogs}.
 *
 * @param address         the emitting contract
 * @param data            non-indexed event arguments
 * @param topics          topic 0 (event signature hash) followed by indexed arguments
 * @param blockNumber     the containing block
 * @param blockHash       the containing block hash, null for pending logs
 * @param transactionHash the emitting transaction
 * @param logIndex        position within the block
 * @param removed         true when the log was dropped by a reorganization
 */
public record LogEntry(
        Address address,
        HexData data,
        List<Hash> topics,
        long blockNumber,
        @Nullable Hash blockHash,
        Hash transactionHash,
        long logIndex,
        boolean removed) {

    public LogEntry {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(topics, "topics cannot be null");
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        topics = List.copyOf(topics);
    }

    /** The event signature hash, if the log is not anonymous. */
    public @Nullable Hash topic0() {
        return topics.isEmpty() ? null : topics.get(0);
    }
}
