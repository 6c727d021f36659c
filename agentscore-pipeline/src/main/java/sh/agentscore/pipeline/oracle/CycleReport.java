// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.oracle;

import java.util.List;

/**
 * Summary of one publication cycle.
 *
 * @param recomputed scores recomputed at the start of the cycle
 * @param candidates unpushed scores considered
 * @param enqueued   candidates that differed enough from the chain to publish
 * @param batches    one entry per submitted batch
 */
public record CycleReport(int recomputed, int candidates, int enqueued, List<BatchResult> batches) {

    public CycleReport {
        batches = List.copyOf(batches);
    }

    public int batchesSubmitted() {
        int n = 0;
        for (BatchResult batch : batches) {
            if (batch.status() != BatchResult.Status.SUBMIT_FAILED) {
                n++;
            }
        }
        return n;
    }

    public int batchesConfirmed() {
        int n = 0;
        for (BatchResult batch : batches) {
            if (batch.confirmed()) {
                n++;
            }
        }
        return n;
    }

    public int batchesFailed() {
        return batches.size() - batchesConfirmed();
    }

    /** Scores confirmed on chain and marked pushed. */
    public int pushed() {
        int n = 0;
        for (BatchResult batch : batches) {
            if (batch.confirmed()) {
                n += batch.size();
            }
        }
        return n;
    }
}
