// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.store;

import static org.junit.jupiter.api.Assertions.*;
import static sh.agentscore.pipeline.PipelineFixtures.*;

import java.math.BigInteger;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.agentscore.core.types.Address;

class JdbcDomainStoreTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private JdbcDomainStore store;

    @BeforeEach
    void setUp() {
        store = memoryStore();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void registerInsertsThenRefreshes() {
        assertEquals(WriteOutcome.INSERTED, store.registerAgent(agent("7", T0)));

        Agent replay = new Agent("7", CLIENT, "ipfs://new", 999L, TX, T0.plusSeconds(60), T0.plusSeconds(60));
        assertEquals(WriteOutcome.UPDATED, store.registerAgent(replay));

        Agent stored = store.findAgent("7").orElseThrow();
        assertEquals(OWNER, stored.owner(), "registration fields are immutable");
        assertEquals(100L, stored.registrationBlock());
        assertEquals(T0, stored.createdAt());
        assertEquals("ipfs://new", stored.metadataUri());
        assertEquals(T0.plusSeconds(60), stored.updatedAt());
    }

    @Test
    @DisplayName("updatedAt never moves backwards")
    void updatedAtIsMonotonic() {
        store.registerAgent(agent("1", T0));

        assertEquals(WriteOutcome.UPDATED, store.updateAgentUri("1", "https://later", T0.plusSeconds(120)));
        assertEquals(WriteOutcome.UPDATED, store.touchAgent("1", T0.plusSeconds(30)));

        Agent stored = store.findAgent("1").orElseThrow();
        assertEquals("https://later", stored.metadataUri());
        assertEquals(T0.plusSeconds(120), stored.updatedAt());
    }

    @Test
    @DisplayName("an older event never overwrites a newer URI")
    void olderUriUpdateIsIgnored() {
        store.registerAgent(agent("1", T0));
        store.updateAgentUri("1", "https://newer", T0.plusSeconds(120));

        assertEquals(WriteOutcome.UPDATED, store.updateAgentUri("1", "https://older", T0.plusSeconds(60)));
        assertEquals(WriteOutcome.UPDATED, store.registerAgent(agent("1", T0)));

        Agent stored = store.findAgent("1").orElseThrow();
        assertEquals("https://newer", stored.metadataUri());
        assertEquals(T0.plusSeconds(120), stored.updatedAt());
    }

    @Test
    void updatesOfUnknownAgentsReportMissing() {
        assertEquals(WriteOutcome.MISSING, store.updateAgentUri("404", "x", T0));
        assertEquals(WriteOutcome.MISSING, store.touchAgent("404", T0));
        assertTrue(store.findAgent("404").isEmpty());
    }

    @Test
    void listsAgentsNewestFirstWithOwnerFilter() {
        store.registerAgent(agent("1", T0));
        store.registerAgent(agent("2", T0.plusSeconds(10)));
        store.registerAgent(new Agent("3", CLIENT, null, 101L, TX, T0.plusSeconds(20), T0.plusSeconds(20)));

        List<Agent> all = store.listAgents(null, 10, 0);
        assertEquals(List.of("3", "2", "1"), all.stream().map(Agent::id).toList());

        Address mixedCase = new Address("0x00000000000000000000000000000000000000AA");
        assertEquals(List.of("2", "1"), store.listAgents(mixedCase, 10, 0).stream().map(Agent::id).toList());
        assertEquals(List.of("1"), store.listAgents(OWNER, 1, 1).stream().map(Agent::id).toList());
        assertEquals(3, store.countAgents(null));
        assertEquals(2, store.countAgents(OWNER));
        assertThrows(IllegalArgumentException.class, () -> store.listAgents(null, 0, 0));
    }

    @Test
    void feedbackIsWriteOnce() {
        Feedback f = feedback("5", 1, 80, 0, "support", T0);

        assertEquals(WriteOutcome.INSERTED, store.insertFeedback(f));
        assertEquals(WriteOutcome.DUPLICATE, store.insertFeedback(f));
        assertEquals(1, store.listFeedback("5", true, 10).size());
    }

    @Test
    void feedbackRoundTripsLargeValuesAndNullTags() {
        BigInteger int128Min = BigInteger.ONE.shiftLeft(127).negate();
        Feedback f = new Feedback("9-" + CLIENT.value() + "-0", "9", CLIENT, "", null, "https://api", int128Min, 18,
                "ipfs://doc", false, 5L, TX, T0);
        store.insertFeedback(f);

        Feedback stored = store.activeFeedback("9").get(0);
        assertEquals(int128Min, stored.value());
        assertEquals(18, stored.valueDecimals());
        assertNull(stored.tag1());
        assertEquals("https://api", stored.tag3());
        assertEquals("ipfs://doc", stored.comment());
        assertEquals(T0, stored.timestamp());
    }

    @Test
    void revocationIsOneWay() {
        Feedback f = feedback("5", 1, 80, 0, "support", T0);
        store.insertFeedback(f);

        assertEquals(WriteOutcome.UPDATED, store.revokeFeedback(f.id()));
        assertEquals(WriteOutcome.DUPLICATE, store.revokeFeedback(f.id()));
        assertEquals(WriteOutcome.MISSING, store.revokeFeedback("5-" + CLIENT.value() + "-99"));

        assertTrue(store.activeFeedback("5").isEmpty());
        assertTrue(store.listFeedback("5", false, 10).isEmpty());
        assertTrue(store.listFeedback("5", true, 10).get(0).revoked());
        assertTrue(store.subjectsWithActiveFeedback().isEmpty());
    }

    @Test
    void listFeedbackIsNewestFirst() {
        store.insertFeedback(feedback("5", 1, 10, 0, "a", T0));
        store.insertFeedback(feedback("5", 2, 20, 0, "b", T0.plusSeconds(5)));
        store.insertFeedback(feedback("6", 3, 30, 0, "c", T0.plusSeconds(9)));

        List<Feedback> rows = store.listFeedback("5", false, 10);
        assertEquals(List.of("b", "a"), rows.stream().map(Feedback::tag1).toList());
        assertEquals(List.of("5", "6"), store.subjectsWithActiveFeedback());
    }

    @Test
    void scoresAreReplacedAndResetToUnpushed() {
        CategoryScores categories = new CategoryScores(Map.of("support", new CategoryScore(90.0, 1)));
        store.saveScore(new ComputedScore("5", 90.0, 1, 1, 0, categories, T0, false, null));
        assertEquals(1, store.markPushed(List.of("5"), T0.plusSeconds(1)));

        ComputedScore pushed = store.findScore("5").orElseThrow();
        assertTrue(pushed.pushedToChain());
        assertEquals(T0.plusSeconds(1), pushed.pushedAt());
        assertTrue(store.unpushedScores(10).isEmpty());

        store.saveScore(new ComputedScore("5", 75.5, 2, 1, 1, categories, T0.plusSeconds(2), false, null));
        ComputedScore replaced = store.findScore("5").orElseThrow();
        assertEquals(75.5, replaced.overallScore());
        assertFalse(replaced.pushedToChain());
        assertNull(replaced.pushedAt());
        assertEquals(categories, replaced.categoryScores());
        assertEquals(List.of("5"), store.unpushedScores(10).stream().map(ComputedScore::agentId).toList());
    }

    @Test
    void unpushedScoresPageAfterAnAgentId() {
        for (String id : List.of("1", "2", "10", "3")) {
            store.saveScore(new ComputedScore(id, 50.0, 1, 1, 0, CategoryScores.EMPTY, T0, false, null));
        }
        store.markPushed(List.of("2"), T0);

        assertEquals(List.of("1", "10"), store.unpushedScores(null, 2).stream().map(ComputedScore::agentId).toList());
        assertEquals(List.of("3"), store.unpushedScores("10", 2).stream().map(ComputedScore::agentId).toList());
        assertTrue(store.unpushedScores("3", 2).isEmpty());
    }

    @Test
    void leaderboardOrdersByScoreThenFeedbackCount() {
        store.saveScore(new ComputedScore("1", 60.0, 3, 3, 0, CategoryScores.EMPTY, T0, false, null));
        store.saveScore(new ComputedScore("2", 80.0, 1, 1, 0, CategoryScores.EMPTY, T0, false, null));
        store.saveScore(new ComputedScore("3", 60.0, 5, 5, 0, CategoryScores.EMPTY, T0, false, null));

        assertEquals(List.of("2", "3", "1"), store.leaderboard(10, 0).stream().map(ComputedScore::agentId).toList());
        assertEquals(List.of("3"), store.leaderboard(1, 1).stream().map(ComputedScore::agentId).toList());
        assertEquals(3, store.countScores());
        assertTrue(store.deleteScore("3"));
        assertFalse(store.deleteScore("3"));
    }

    @Test
    @DisplayName("checkpoint never moves backwards")
    void checkpointIsMonotonic() {
        assertEquals(OptionalLong.empty(), store.lastIndexedBlock());

        assertTrue(store.saveCheckpoint(100));
        assertTrue(store.saveCheckpoint(250));
        assertFalse(store.saveCheckpoint(200));
        assertFalse(store.saveCheckpoint(250));

        assertEquals(OptionalLong.of(250), store.lastIndexedBlock());
        assertThrows(IllegalArgumentException.class, () -> store.saveCheckpoint(-1));
    }

    @Test
    void statsCountActiveRows() {
        store.registerAgent(agent("1", T0));
        store.insertFeedback(feedback("1", 1, 10, 0, "a", T0));
        store.insertFeedback(feedback("1", 2, 10, 0, "a", T0));
        store.insertFeedback(feedback("2", 3, 10, 0, "a", T0));
        store.revokeFeedback(feedback("2", 3, 10, 0, "a", T0).id());
        store.saveCheckpoint(42);

        IndexStats stats = store.stats();
        assertEquals(1, stats.agents());
        assertEquals(2, stats.activeFeedback());
        assertEquals(1, stats.ratedAgents());
        assertEquals(0, stats.scores());
        assertEquals(OptionalLong.of(42), stats.lastIndexedBlock());
    }

    @Test
    void timestampsKeepMicrosecondPrecision() {
        Instant precise = T0.plusNanos(123_456_789);
        store.registerAgent(agent("1", precise));

        assertEquals(precise.truncatedTo(ChronoUnit.MICROS), store.findAgent("1").orElseThrow().createdAt());
    }

    @Test
    void schemaCreationIsIdempotent() {
        String url = "jdbc:h2:mem:" + java.util.UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        try (JdbcDomainStore first = JdbcDomainStore.open(url)) {
            first.registerAgent(agent("1", T0));
            try (JdbcDomainStore second = JdbcDomainStore.open(url)) {
                assertTrue(second.findAgent("1").isPresent());
            }
        }
    }
}
