// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.store;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import org.jspecify.annotations.Nullable;
import sh.agentscore.core.types.Address;

/**
 * Read-only view of the domain store, for query front ends.
 *
 * <p>Every method reads committed state only. Lists are ordered deterministically so
 * that {@code limit}/{@code offset} paging is stable while nothing is written; a write
 * between two pages may shift rows across the page boundary.
 *
 * <p>Agent ids are decimal strings of the on-chain {@code uint256} token id. Lookups
 * compare them as strings, so callers pass the canonical form produced by
 * {@link sh.agentscore.core.erc8004.AgentId#toString()}.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * DomainStoreReader reader = store;
 * for (ComputedScore score : reader.leaderboard(10, 0)) {
 *     reader.findAgent(score.agentId())
 *             .ifPresent(agent -> System.out.println(agent.id() + " " + score.overallScore()));
 * }
 * }</pre>
 *
 * @see DomainStore
 * @since 0.1.0
 */
public interface DomainStoreReader {

    /**
     * @param agentId canonical decimal agent id
     * @return the agent, or empty if no {@code Registered} event has been indexed for it
     */
    Optional<Agent> findAgent(String agentId);

    /**
     * Agents, newest first.
     *
     * @param owner  restrict to this owner, or null for all
     * @param limit  page size
     * @param offset rows to skip
     */
    List<Agent> listAgents(@Nullable Address owner, int limit, int offset);

    /** Number of agents {@link #listAgents} would page through for {@code owner}. */
    long countAgents(@Nullable Address owner);

    /** Feedback for one agent, newest block time first. */
    List<Feedback> listFeedback(String subject, boolean includeRevoked, int limit);

    /**
     * Cached score of one agent.
     *
     * <p>Scores are written by the aggregator, not by ingestion, so an agent that has
     * feedback may still have no score until the next recompute.
     *
     * @param agentId canonical decimal agent id
     * @return the last computed score, or empty if none has been computed
     */
    Optional<ComputedScore> findScore(String agentId);

    /** Cached scores, highest first; ties by feedback count, then agent id. */
    List<ComputedScore> leaderboard(int limit, int offset);

    long countScores();

    /**
     * @return the last block whose events are fully applied, or empty before the first
     *         range has been indexed
     */
    OptionalLong lastIndexedBlock();

    /** Row counts and the checkpoint, read in one pass. */
    IndexStats stats();
}
