// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.scoring;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one full recomputation pass.
 *
 * @param outcomes one entry per agent, in processing order
 */
public record RecomputeSummary(List<ScoreOutcome> outcomes) {

    public RecomputeSummary {
        outcomes = List.copyOf(outcomes);
    }

    public int computed() {
        return count(ScoreOutcome.Computed.class);
    }

    public int skipped() {
        return count(ScoreOutcome.NoFeedback.class);
    }

    public int failed() {
        return count(ScoreOutcome.Failed.class);
    }

    public List<ScoreOutcome.Failed> failures() {
        final List<ScoreOutcome.Failed> failures = new ArrayList<>();
        for (ScoreOutcome outcome : outcomes) {
            if (outcome instanceof ScoreOutcome.Failed failed) {
                failures.add(failed);
            }
        }
        return failures;
    }

    private int count(final Class<? extends ScoreOutcome> type) {
        int n = 0;
        for (ScoreOutcome outcome : outcomes) {
            if (type.isInstance(outcome)) {
                n++;
            }
        }
        return n;
    }
}
