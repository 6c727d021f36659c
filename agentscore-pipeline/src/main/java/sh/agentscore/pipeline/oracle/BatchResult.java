// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.oracle;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.agentscore.core.types.Hash;

/**
 * Outcome of one {@code updateScoreBatch} submission.
 *
 * @param agentIds agents in the batch
 * @param status   how the submission ended
 * @param txHash   the transaction, null if submission failed
 * @param error    the failure, if any
 */
public record BatchResult(List<String> agentIds, Status status, @Nullable Hash txHash, @Nullable Throwable error) {

    public enum Status {
        /** Mined with a success receipt; the scores were marked pushed. */
        CONFIRMED,
        /** Mined but reverted. */
        REVERTED,
        /** No receipt within the confirmation timeout. */
        TIMED_OUT,
        /** Signing or broadcasting failed. */
        SUBMIT_FAILED
    }

    public BatchResult {
        agentIds = List.copyOf(agentIds);
        Objects.requireNonNull(status, "status");
    }

    public boolean confirmed() {
        return status == Status.CONFIRMED;
    }

    public int size() {
        return agentIds.size();
    }
}
