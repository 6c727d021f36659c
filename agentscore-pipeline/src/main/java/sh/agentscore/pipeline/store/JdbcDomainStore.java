// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.store;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcConnectionPool;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;

/**
 * {@link DomainStore} over JDBC, written against H2.
 *
 * <p>The schema is created from {@code schema.sql} on construction. Each write runs in
 * its own transaction on a pooled connection, so one instance can be shared by the
 * indexer, the aggregator and the publisher.
 */
public final class JdbcDomainStore implements DomainStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcDomainStore.class);

    static final String CHECKPOINT_KEY = "last_block";
    private static final String UNIQUE_VIOLATION = "23505";

    /** {@code updated_at} never moves backwards; binds the candidate time twice. */
    private static final String ADVANCE_UPDATED_AT =
            "updated_at = CASE WHEN updated_at < ? THEN CAST(? AS TIMESTAMP WITH TIME ZONE) ELSE updated_at END";

    private static final String AGENT_COLUMNS =
            "id, owner, metadata_uri, block_number, tx_hash, created_at, updated_at";
    private static final String FEEDBACK_COLUMNS =
            "id, subject, author, tag1, tag2, tag3, raw_value, value_decimals, comment_uri, revoked, "
                    + "block_number, tx_hash, block_time";
    private static final String SCORE_COLUMNS =
            "agent_id, overall_score, feedback_count, positive_count, negative_count, category_scores, "
                    + "computed_at, pushed_to_chain, pushed_at";

    private final DataSource dataSource;
    private final @Nullable JdbcConnectionPool ownedPool;

    public JdbcDomainStore(final DataSource dataSource) {
        this(dataSource, null);
    }

    private JdbcDomainStore(final DataSource dataSource, final @Nullable JdbcConnectionPool ownedPool) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.ownedPool = ownedPool;
        initSchema();
    }

    /**
     * Opens a pooled H2 store at {@code jdbcUrl}; {@link #close()} disposes the pool.
     */
    public static JdbcDomainStore open(final String jdbcUrl) {
        final JdbcConnectionPool pool = JdbcConnectionPool.create(jdbcUrl, "sa", "");
        try {
            return new JdbcDomainStore(pool, pool);
        } catch (RuntimeException e) {
            pool.dispose();
            throw e;
        }
    }

    private void initSchema() {
        final String script;
        try (InputStream in = JdbcDomainStore.class.getResourceAsStream("schema.sql")) {
            if (in == null) {
                throw new IllegalStateException("schema.sql not found on the classpath");
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("Unable to read schema.sql", e);
        }
        inTransaction("create schema", c -> {
            try (Statement st = c.createStatement()) {
                for (String sql : script.split(";")) {
                    if (!sql.isBlank()) {
                        st.execute(sql);
                    }
                }
            }
            return null;
        });
        log.debug("Domain schema ready");
    }

    // ---------------------------------------------------------------- agents

    @Override
    public WriteOutcome registerAgent(final Agent agent) {
        Objects.requireNonNull(agent, "agent");
        return inTransaction("register agent " + agent.id(), c -> {
            if (refreshAgent(c, agent.id(), agent.metadataUri(), agent.updatedAt())) {
                return WriteOutcome.UPDATED;
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO agents (" + AGENT_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                ps.setString(1, agent.id());
                ps.setString(2, agent.owner().value());
                ps.setString(3, agent.metadataUri());
                ps.setLong(4, agent.registrationBlock());
                ps.setString(5, agent.registrationTx().value());
                ps.setObject(6, ts(agent.createdAt()));
                ps.setObject(7, ts(agent.updatedAt()));
                ps.executeUpdate();
                return WriteOutcome.INSERTED;
            } catch (SQLException e) {
                if (!UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    throw e;
                }
                refreshAgent(c, agent.id(), agent.metadataUri(), agent.updatedAt());
                return WriteOutcome.UPDATED;
            }
        });
    }

    private static boolean refreshAgent(
            final Connection c, final String id, final @Nullable String uri, final Instant at) throws SQLException {
        // an older event never overwrites the URI written by a newer one
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE agents SET metadata_uri = CASE WHEN updated_at <= ? THEN CAST(? AS VARCHAR) ELSE metadata_uri END, "
                        + ADVANCE_UPDATED_AT + " WHERE id = ?")) {
            ps.setObject(1, ts(at));
            ps.setString(2, uri);
            ps.setObject(3, ts(at));
            ps.setObject(4, ts(at));
            ps.setString(5, id);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public WriteOutcome updateAgentUri(final String agentId, final String metadataUri, final Instant at) {
        return inTransaction("update agent uri " + agentId,
                c -> refreshAgent(c, agentId, metadataUri, at) ? WriteOutcome.UPDATED : WriteOutcome.MISSING);
    }

    @Override
    public WriteOutcome touchAgent(final String agentId, final Instant at) {
        return inTransaction("touch agent " + agentId, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE agents SET " + ADVANCE_UPDATED_AT + " WHERE id = ?")) {
                ps.setObject(1, ts(at));
                ps.setObject(2, ts(at));
                ps.setString(3, agentId);
                return ps.executeUpdate() > 0 ? WriteOutcome.UPDATED : WriteOutcome.MISSING;
            }
        });
    }

    @Override
    public Optional<Agent> findAgent(final String agentId) {
        return query("find agent " + agentId, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + AGENT_COLUMNS + " FROM agents WHERE id = ?")) {
                ps.setString(1, agentId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(readAgent(rs)) : Optional.<Agent>empty();
                }
            }
        });
    }

    @Override
    public List<Agent> listAgents(final @Nullable Address owner, final int limit, final int offset) {
        requirePage(limit, offset);
        final String where = owner == null ? "" : " WHERE LOWER(owner) = ?";
        return query("list agents", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + AGENT_COLUMNS + " FROM agents" + where
                            + " ORDER BY created_at DESC, block_number DESC, id DESC LIMIT ? OFFSET ?")) {
                int i = 1;
                if (owner != null) {
                    ps.setString(i++, owner.value());
                }
                ps.setInt(i++, limit);
                ps.setInt(i, offset);
                try (ResultSet rs = ps.executeQuery()) {
                    final List<Agent> agents = new ArrayList<>();
                    while (rs.next()) {
                        agents.add(readAgent(rs));
                    }
                    return agents;
                }
            }
        });
    }

    @Override
    public long countAgents(final @Nullable Address owner) {
        if (owner == null) {
            return count("SELECT COUNT(*) FROM agents", null);
        }
        return count("SELECT COUNT(*) FROM agents WHERE LOWER(owner) = ?", owner.value());
    }

    private static Agent readAgent(final ResultSet rs) throws SQLException {
        return new Agent(
                rs.getString("id"),
                new Address(rs.getString("owner")),
                rs.getString("metadata_uri"),
                rs.getLong("block_number"),
                new Hash(rs.getString("tx_hash")),
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }

    // -------------------------------------------------------------- feedback

    @Override
    public WriteOutcome insertFeedback(final Feedback feedback) {
        Objects.requireNonNull(feedback, "feedback");
        return inTransaction("insert feedback " + feedback.id(), c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO feedback (" + FEEDBACK_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                ps.setString(1, feedback.id());
                ps.setString(2, feedback.subject());
                ps.setString(3, feedback.author().value());
                ps.setString(4, feedback.tag1());
                ps.setString(5, feedback.tag2());
                ps.setString(6, feedback.tag3());
                ps.setBigDecimal(7, new BigDecimal(feedback.value()));
                ps.setInt(8, feedback.valueDecimals());
                ps.setString(9, feedback.comment());
                ps.setBoolean(10, feedback.revoked());
                ps.setLong(11, feedback.blockNumber());
                ps.setString(12, feedback.txHash().value());
                ps.setObject(13, ts(feedback.timestamp()));
                ps.executeUpdate();
                return WriteOutcome.INSERTED;
            } catch (SQLException e) {
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    return WriteOutcome.DUPLICATE;
                }
                throw e;
            }
        });
    }

    @Override
    public WriteOutcome revokeFeedback(final String feedbackId) {
        return inTransaction("revoke feedback " + feedbackId, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE feedback SET revoked = TRUE WHERE id = ? AND revoked = FALSE")) {
                ps.setString(1, feedbackId);
                if (ps.executeUpdate() > 0) {
                    return WriteOutcome.UPDATED;
                }
            }
            try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM feedback WHERE id = ?")) {
                ps.setString(1, feedbackId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? WriteOutcome.DUPLICATE : WriteOutcome.MISSING;
                }
            }
        });
    }

    @Override
    public List<Feedback> activeFeedback(final String subject) {
        return query("load feedback for " + subject, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + FEEDBACK_COLUMNS + " FROM feedback WHERE subject = ? AND revoked = FALSE"
                            + " ORDER BY block_number, id")) {
                ps.setString(1, subject);
                return readFeedback(ps);
            }
        });
    }

    @Override
    public List<Feedback> listFeedback(final String subject, final boolean includeRevoked, final int limit) {
        requirePage(limit, 0);
        final String revokedFilter = includeRevoked ? "" : " AND revoked = FALSE";
        return query("list feedback for " + subject, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + FEEDBACK_COLUMNS + " FROM feedback WHERE subject = ?" + revokedFilter
                            + " ORDER BY block_time DESC, block_number DESC, id LIMIT ?")) {
                ps.setString(1, subject);
                ps.setInt(2, limit);
                return readFeedback(ps);
            }
        });
    }

    @Override
    public List<String> subjectsWithActiveFeedback() {
        return query("list rated agents", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT DISTINCT subject FROM feedback WHERE revoked = FALSE ORDER BY subject");
                    ResultSet rs = ps.executeQuery()) {
                final List<String> subjects = new ArrayList<>();
                while (rs.next()) {
                    subjects.add(rs.getString(1));
                }
                return subjects;
            }
        });
    }

    private static List<Feedback> readFeedback(final PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            final List<Feedback> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(new Feedback(
                        rs.getString("id"),
                        rs.getString("subject"),
                        new Address(rs.getString("author")),
                        rs.getString("tag1"),
                        rs.getString("tag2"),
                        rs.getString("tag3"),
                        rs.getBigDecimal("raw_value").toBigIntegerExact(),
                        rs.getInt("value_decimals"),
                        rs.getString("comment_uri"),
                        rs.getBoolean("revoked"),
                        rs.getLong("block_number"),
                        new Hash(rs.getString("tx_hash")),
                        instant(rs, "block_time")));
            }
            return rows;
        }
    }

    // ---------------------------------------------------------------- scores

    @Override
    public void saveScore(final ComputedScore score) {
        Objects.requireNonNull(score, "score");
        inTransaction("save score " + score.agentId(), c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "MERGE INTO computed_scores (" + SCORE_COLUMNS + ") KEY (agent_id)"
                            + " VALUES (?, ?, ?, ?, ?, ?, ?, FALSE, NULL)")) {
                ps.setString(1, score.agentId());
                ps.setDouble(2, score.overallScore());
                ps.setInt(3, score.feedbackCount());
                ps.setInt(4, score.positiveCount());
                ps.setInt(5, score.negativeCount());
                ps.setString(6, score.categoryScores().toJson());
                ps.setObject(7, ts(score.computedAt()));
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public boolean deleteScore(final String agentId) {
        return inTransaction("delete score " + agentId, c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM computed_scores WHERE agent_id = ?")) {
                ps.setString(1, agentId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public Optional<ComputedScore> findScore(final String agentId) {
        return query("find score " + agentId, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + SCORE_COLUMNS + " FROM computed_scores WHERE agent_id = ?")) {
                ps.setString(1, agentId);
                final List<ComputedScore> rows = readScores(ps);
                return rows.isEmpty() ? Optional.<ComputedScore>empty() : Optional.of(rows.get(0));
            }
        });
    }

    @Override
    public List<ComputedScore> leaderboard(final int limit, final int offset) {
        requirePage(limit, offset);
        return query("leaderboard", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + SCORE_COLUMNS + " FROM computed_scores"
                            + " ORDER BY overall_score DESC, feedback_count DESC, agent_id LIMIT ? OFFSET ?")) {
                ps.setInt(1, limit);
                ps.setInt(2, offset);
                return readScores(ps);
            }
        });
    }

    @Override
    public long countScores() {
        return count("SELECT COUNT(*) FROM computed_scores", null);
    }

    @Override
    public List<ComputedScore> unpushedScores(final @Nullable String afterAgentId, final int limit) {
        requirePage(limit, 0);
        final String after = afterAgentId == null ? "" : " AND agent_id > ?";
        return query("load unpushed scores", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + SCORE_COLUMNS + " FROM computed_scores WHERE pushed_to_chain = FALSE" + after
                            + " ORDER BY agent_id LIMIT ?")) {
                int i = 1;
                if (afterAgentId != null) {
                    ps.setString(i++, afterAgentId);
                }
                ps.setInt(i, limit);
                return readScores(ps);
            }
        });
    }

    @Override
    public int markPushed(final Collection<String> agentIds, final Instant at) {
        if (agentIds.isEmpty()) {
            return 0;
        }
        return inTransaction("mark pushed", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE computed_scores SET pushed_to_chain = TRUE, pushed_at = ? WHERE agent_id = ?")) {
                for (String agentId : agentIds) {
                    ps.setObject(1, ts(at));
                    ps.setString(2, agentId);
                    ps.addBatch();
                }
                int marked = 0;
                for (int updated : ps.executeBatch()) {
                    marked += Math.max(updated, 0);
                }
                return marked;
            }
        });
    }

    private static List<ComputedScore> readScores(final PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            final List<ComputedScore> rows = new ArrayList<>();
            while (rs.next()) {
                final OffsetDateTime pushedAt = rs.getObject("pushed_at", OffsetDateTime.class);
                rows.add(new ComputedScore(
                        rs.getString("agent_id"),
                        rs.getDouble("overall_score"),
                        rs.getInt("feedback_count"),
                        rs.getInt("positive_count"),
                        rs.getInt("negative_count"),
                        CategoryScores.fromJson(rs.getString("category_scores")),
                        instant(rs, "computed_at"),
                        rs.getBoolean("pushed_to_chain"),
                        pushedAt == null ? null : pushedAt.toInstant()));
            }
            return rows;
        }
    }

    // ------------------------------------------------------------ checkpoint

    @Override
    public OptionalLong lastIndexedBlock() {
        return query("read checkpoint", JdbcDomainStore::readCheckpoint);
    }

    @Override
    public boolean saveCheckpoint(final long block) {
        if (block < 0) {
            throw new IllegalArgumentException("checkpoint cannot be negative: " + block);
        }
        return inTransaction("save checkpoint " + block, c -> {
            final OptionalLong current;
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT state_value FROM indexer_state WHERE state_key = ? FOR UPDATE")) {
                ps.setString(1, CHECKPOINT_KEY);
                try (ResultSet rs = ps.executeQuery()) {
                    current = rs.next() ? OptionalLong.of(Long.parseLong(rs.getString(1))) : OptionalLong.empty();
                }
            }
            if (current.isPresent() && current.getAsLong() >= block) {
                if (current.getAsLong() > block) {
                    log.warn("Ignoring checkpoint {} below stored checkpoint {}", block, current.getAsLong());
                }
                return false;
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "MERGE INTO indexer_state (state_key, state_value, updated_at) KEY (state_key)"
                            + " VALUES (?, ?, CURRENT_TIMESTAMP)")) {
                ps.setString(1, CHECKPOINT_KEY);
                ps.setString(2, Long.toString(block));
                ps.executeUpdate();
            }
            return true;
        });
    }

    private static OptionalLong readCheckpoint(final Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT state_value FROM indexer_state WHERE state_key = ?")) {
            ps.setString(1, CHECKPOINT_KEY);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? OptionalLong.of(Long.parseLong(rs.getString(1))) : OptionalLong.empty();
            }
        }
    }

    // ----------------------------------------------------------------- stats

    @Override
    public IndexStats stats() {
        return query("collect stats", c -> new IndexStats(
                scalar(c, "SELECT COUNT(*) FROM agents"),
                scalar(c, "SELECT COUNT(*) FROM feedback WHERE revoked = FALSE"),
                scalar(c, "SELECT COUNT(DISTINCT subject) FROM feedback WHERE revoked = FALSE"),
                scalar(c, "SELECT COUNT(*) FROM computed_scores"),
                readCheckpoint(c)));
    }

    @Override
    public void close() {
        if (ownedPool != null) {
            ownedPool.dispose();
        }
    }

    // --------------------------------------------------------------- helpers

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    private <T> T inTransaction(final String operation, final SqlWork<T> work) {
        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            try {
                final T result = work.apply(c);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    c.rollback();
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to " + operation, e);
        }
    }

    private <T> T query(final String operation, final SqlWork<T> work) {
        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(true);
            return work.apply(c);
        } catch (SQLException e) {
            throw new StoreException("Failed to " + operation, e);
        }
    }

    private long count(final String sql, final @Nullable String param) {
        return query("count", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                if (param != null) {
                    ps.setString(1, param);
                }
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    return rs.getLong(1);
                }
            }
        });
    }

    private static long scalar(final Connection c, final String sql) throws SQLException {
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static void requirePage(final int limit, final int offset) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset cannot be negative, got " + offset);
        }
    }

    private static OffsetDateTime ts(final Instant instant) {
        return OffsetDateTime.ofInstant(instant.truncatedTo(ChronoUnit.MICROS), ZoneOffset.UTC);
    }

    private static Instant instant(final ResultSet rs, final String column) throws SQLException {
        return rs.getObject(column, OffsetDateTime.class).toInstant();
    }
}
