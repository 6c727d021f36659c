// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.store;

import java.util.OptionalLong;

/**
 * Row counts and indexing progress.
 *
 * @param agents           registered agents
 * @param activeFeedback   non-revoked feedback entries
 * @param ratedAgents      agents with at least one non-revoked entry
 * @param scores           cached scores
 * @param lastIndexedBlock checkpoint, empty before the first range completes
 */
public record IndexStats(long agents, long activeFeedback, long ratedAgents, long scores, OptionalLong lastIndexedBlock) {}
