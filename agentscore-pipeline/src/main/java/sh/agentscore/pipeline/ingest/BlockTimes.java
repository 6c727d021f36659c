// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.ingest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import sh.agentscore.rpc.LedgerClient;

/**
 * Block timestamps, looked up once per block and kept in a bounded LRU cache.
 *
 * <p>Mappers stamp every row they derive from an event with the time of the event's
 * block, never with the wall clock, so replaying a range writes exactly the values the
 * first pass wrote. One instance may be shared by all mappers of a loop; lookups are
 * thread-safe. Two threads missing the same block may both call the ledger, and
 * both then store the same value.
 */
public final class BlockTimes {

    /** Most recently used blocks kept in memory. */
    public static final int DEFAULT_CAPACITY = 4096;

    private final LedgerClient ledger;
    private final Map<Long, Instant> cache;

    public BlockTimes(final LedgerClient ledger) {
        this(ledger, DEFAULT_CAPACITY);
    }

    /**
     * @param ledger   source of block timestamps
     * @param capacity maximum number of cached blocks
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public BlockTimes(final LedgerClient ledger, final int capacity) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.cache = new LinkedHashMap<>(Math.min(capacity, 256), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(final Map.Entry<Long, Instant> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * Time of the given block.
     *
     * @param blockNumber the block
     * @return the block timestamp
     * @throws sh.agentscore.core.error.RpcException if the lookup fails
     */
    public Instant of(final long blockNumber) {
        synchronized (cache) {
            final Instant cached = cache.get(blockNumber);
            if (cached != null) {
                return cached;
            }
        }
        final Instant fetched = Instant.ofEpochSecond(ledger.getBlockTimestamp(blockNumber));
        synchronized (cache) {
            cache.put(blockNumber, fetched);
        }
        return fetched;
    }
}
