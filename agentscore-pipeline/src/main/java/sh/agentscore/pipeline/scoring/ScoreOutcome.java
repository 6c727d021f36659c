// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.scoring;

import sh.agentscore.pipeline.store.ComputedScore;

/**
 * Result of recomputing one agent's score.
 */
public sealed interface ScoreOutcome permits ScoreOutcome.Computed, ScoreOutcome.NoFeedback, ScoreOutcome.Failed {

    String agentId();

    /** A score was computed and stored. */
    record Computed(String agentId, ComputedScore score) implements ScoreOutcome {}

    /**
     * The agent has no non-revoked feedback.
     *
     * @param staleScoreRemoved whether a previously cached score was deleted
     */
    record NoFeedback(String agentId, boolean staleScoreRemoved) implements ScoreOutcome {}

    /** Computing or storing failed; other agents are unaffected. */
    record Failed(String agentId, Exception error) implements ScoreOutcome {}
}
