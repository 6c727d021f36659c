// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.store;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Persistent agents, feedback, cached scores and the indexing checkpoint.
 *
 * <p>Every mutating call runs in its own transaction. Event writes report what happened
 * as a {@link WriteOutcome}, so replaying an event is never an error. Database failures
 * surface as {@link StoreException}.
 *
 * <p>Event writes are idempotent: applying the same event twice leaves every row as the
 * first application left it. Agent and feedback times come from the event's block, and
 * {@code updatedAt} only ever moves forward.
 *
 * <p>Cached scores carry a {@code pushedToChain} flag. {@link #saveScore} clears it,
 * {@link #markPushed} sets it, and {@link #unpushedScores(String, int)} pages through the
 * rows that still need publishing.
 *
 * @see JdbcDomainStore
 * @since 0.1.0
 */
public interface DomainStore extends DomainStoreReader, AutoCloseable {

    /**
     * Inserts the agent, or for a known id refreshes its URI and {@code updatedAt} only.
     *
     * <p>A refresh replaces the URI only when {@code agent.updatedAt()} is not older than
     * the stored {@code updatedAt}, and never moves {@code updatedAt} backwards, so
     * replaying an event with the same times leaves the row unchanged.
     *
     * @return {@link WriteOutcome#INSERTED} or {@link WriteOutcome#UPDATED}
     */
    WriteOutcome registerAgent(Agent agent);

    /**
     * Replaces the agent URI, unless the stored row was last updated after {@code at}.
     *
     * @return {@link WriteOutcome#UPDATED} or {@link WriteOutcome#MISSING}
     */
    WriteOutcome updateAgentUri(String agentId, String metadataUri, Instant at);

    /**
     * Advances {@code updatedAt}.
     *
     * @return {@link WriteOutcome#UPDATED} or {@link WriteOutcome#MISSING}
     */
    WriteOutcome touchAgent(String agentId, Instant at);

    /**
     * Inserts new feedback. Feedback ids are write-once.
     *
     * @return {@link WriteOutcome#INSERTED}, or {@link WriteOutcome#DUPLICATE} for a known id
     */
    WriteOutcome insertFeedback(Feedback feedback);

    /**
     * Marks feedback revoked.
     *
     * @return {@link WriteOutcome#UPDATED}, {@link WriteOutcome#DUPLICATE} if already revoked,
     *         or {@link WriteOutcome#MISSING}
     */
    WriteOutcome revokeFeedback(String feedbackId);

    /** Non-revoked feedback for one agent. */
    List<Feedback> activeFeedback(String subject);

    /** Distinct subjects with at least one non-revoked entry, in id order. */
    List<String> subjectsWithActiveFeedback();

    /** Replaces the cached score, which is stored as not yet published. */
    void saveScore(ComputedScore score);

    /** Removes the cached score, returning whether one existed. */
    boolean deleteScore(String agentId);

    /** Unpublished scores in agent id order, at most {@code limit}. */
    default List<ComputedScore> unpushedScores(int limit) {
        return unpushedScores(null, limit);
    }

    /**
     * Unpublished scores whose agent id sorts after {@code afterAgentId}, in agent id order.
     *
     * <p>Ids compare as strings, the order the store keeps them in. Passing the last id
     * of one page returns the next page; {@code null} starts from the beginning.
     *
     * @param afterAgentId exclusive lower bound, or {@code null}
     * @param limit        maximum number of rows
     * @return at most {@code limit} scores
     */
    List<ComputedScore> unpushedScores(@Nullable String afterAgentId, int limit);

    /**
     * Marks the given scores published. Ids without a cached score are ignored.
     *
     * @param agentIds agents whose scores were confirmed on chain
     * @param at       publication time, stored as {@code pushedAt}
     * @return the number of rows marked
     */
    int markPushed(Collection<String> agentIds, Instant at);

    /**
     * Persists the checkpoint. A value below the stored one is ignored.
     *
     * @return true if the stored checkpoint changed
     */
    boolean saveCheckpoint(long block);

    @Override
    void close();
}
