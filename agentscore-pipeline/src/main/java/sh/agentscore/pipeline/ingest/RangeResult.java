// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.ingest;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import sh.agentscore.pipeline.store.WriteOutcome;

/**
 * What one iteration of the {@link IngestionLoop} did.
 */
public sealed interface RangeResult permits RangeResult.Idle, RangeResult.Indexed, RangeResult.Failed {

    /** The checkpoint had caught up with the chain head; nothing was fetched. */
    record Idle(long checkpoint, long height) implements RangeResult {}

    /**
     * The range {@code [fromBlock, toBlock]} was applied and the checkpoint advanced to
     * {@code toBlock}.
     *
     * @param outcomes events applied, per outcome
     * @param skipped  logs that were removed by a reorg, malformed or not followed
     */
    record Indexed(long fromBlock, long toBlock, Map<WriteOutcome, Integer> outcomes, int skipped)
            implements RangeResult {

        public Indexed {
            final Map<WriteOutcome, Integer> copy = new EnumMap<>(WriteOutcome.class);
            copy.putAll(outcomes);
            outcomes = Collections.unmodifiableMap(copy);
        }

        public int count(final WriteOutcome outcome) {
            return outcomes.getOrDefault(outcome, 0);
        }

        public int applied() {
            int n = 0;
            for (int c : outcomes.values()) {
                n += c;
            }
            return n;
        }
    }

    /** The range failed; the checkpoint was left untouched. */
    record Failed(long fromBlock, long toBlock, Throwable error) implements RangeResult {}
}
