// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.scoring;

import static org.junit.jupiter.api.Assertions.*;
import static sh.agentscore.pipeline.PipelineFixtures.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sh.agentscore.pipeline.store.CategoryScore;
import sh.agentscore.pipeline.store.ComputedScore;
import sh.agentscore.pipeline.store.Feedback;
import sh.agentscore.pipeline.store.JdbcDomainStore;

class ScoreAggregatorTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private JdbcDomainStore store;
    private ScoreAggregator aggregator;

    @BeforeEach
    void setUp() {
        store = memoryStore();
        aggregator = new ScoreAggregator(store, new TimeDecay(90.0), Clock.fixed(T0, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void normalizesOntoZeroToHundred() {
        assertEquals(100.0, ScoreAggregator.normalize(BigDecimal.valueOf(100)));
        assertEquals(0.0, ScoreAggregator.normalize(BigDecimal.valueOf(-100)));
        assertEquals(50.0, ScoreAggregator.normalize(BigDecimal.ZERO));
        assertEquals(100.0, ScoreAggregator.normalize(BigDecimal.valueOf(500)));
        assertEquals(0.0, ScoreAggregator.normalize(BigDecimal.valueOf(-1000)));
        assertEquals(60.0, ScoreAggregator.normalize(new BigDecimal(BigInteger.valueOf(2000), 2)));
    }

    @Test
    void noFeedbackMeansNoScore() {
        assertTrue(aggregator.computeScore("1", T0).isEmpty());
    }

    @Test
    void singleFeedbackScenario() {
        store.insertFeedback(feedback("1", 1, 80, 0, "support", T0));

        ComputedScore score = aggregator.computeScore("1", T0).orElseThrow();

        assertEquals(90.0, score.overallScore());
        assertEquals(new CategoryScore(90.0, 1), score.categoryScores().get("support").orElseThrow());
        assertEquals(1, score.feedbackCount());
        assertEquals(1, score.positiveCount());
        assertEquals(0, score.negativeCount());
        assertEquals(T0, score.computedAt());
        assertFalse(score.pushedToChain());
    }

    @Test
    void vanishingWeightsFallBackToNeutral() {
        Instant ancient = T0.minus(Duration.ofDays(20_000));
        store.insertFeedback(feedback("1", 1, 100, 0, "support", ancient));
        store.insertFeedback(feedback("1", 2, -40, 0, "speed", ancient));
        ScoreAggregator shortMemory = new ScoreAggregator(store, new TimeDecay(1.0), Clock.fixed(T0, ZoneOffset.UTC));
        assertEquals(0.0, new TimeDecay(1.0).weight(ancient, T0), "weight underflows");

        ComputedScore score = shortMemory.computeScore("1", T0).orElseThrow();

        assertEquals(50.0, score.overallScore());
        assertEquals(new CategoryScore(50.0, 1), score.categoryScores().get("support").orElseThrow());
        assertEquals(2, score.feedbackCount());
        assertEquals(1, score.positiveCount());
        assertEquals(1, score.negativeCount());
    }

    @Test
    void decimalsBeyondEighteenAreStoredAndScored() {
        store.insertFeedback(feedback("1", 1, 4_000, 30, "support", T0));

        assertEquals(30, store.activeFeedback("1").get(0).valueDecimals());
        assertEquals(50.0, aggregator.computeScore("1", T0).orElseThrow().overallScore());
    }

    @Test
    void singleSampleIsUnaffectedByAge() {
        store.insertFeedback(feedback("1", 1, 80, 0, "support", T0));

        ComputedScore later = aggregator.computeScore("1", T0.plus(Duration.ofDays(90))).orElseThrow();

        assertEquals(90.0, later.overallScore());
    }

    @Test
    void olderSamplesWeighLess() {
        Instant now = T0.plus(Duration.ofDays(90));
        store.insertFeedback(feedback("1", 1, -100, 0, "quality", T0));
        store.insertFeedback(feedback("1", 2, 100, 0, "quality", now));

        ComputedScore score = aggregator.computeScore("1", now).orElseThrow();

        // weights 0.5 and 1.0 over normalized 0 and 100
        assertEquals(66.67, score.overallScore());
        assertTrue(score.overallScore() > 50.0);
        assertEquals(1, score.positiveCount());
        assertEquals(1, score.negativeCount());
    }

    @Test
    void decimalsScaleValues() {
        store.insertFeedback(feedback("1", 1, 8550, 2, "", T0));

        ComputedScore score = aggregator.computeScore("1", T0).orElseThrow();

        assertEquals(92.75, score.overallScore());
        assertTrue(score.categoryScores().isEmpty());
    }

    @Test
    void categoriesAreScoredSeparately() {
        store.insertFeedback(feedback("1", 1, 100, 0, "support", T0));
        store.insertFeedback(feedback("1", 2, 0, 0, "support", T0));
        store.insertFeedback(feedback("1", 3, -100, 0, "latency", T0));

        ComputedScore score = aggregator.computeScore("1", T0).orElseThrow();

        assertEquals(new CategoryScore(75.0, 2), score.categoryScores().get("support").orElseThrow());
        assertEquals(new CategoryScore(0.0, 1), score.categoryScores().get("latency").orElseThrow());
        assertEquals(50.0, score.overallScore());
        assertEquals(3, score.feedbackCount());
        assertEquals(1, score.positiveCount());
        assertEquals(1, score.negativeCount());
    }

    @Test
    void revokedFeedbackIsExcluded() {
        Feedback bad = feedback("1", 1, -100, 0, "support", T0);
        store.insertFeedback(bad);
        store.insertFeedback(feedback("1", 2, 100, 0, "support", T0));
        store.revokeFeedback(bad.id());

        ComputedScore score = aggregator.computeScore("1", T0).orElseThrow();

        assertEquals(100.0, score.overallScore());
        assertEquals(1, score.feedbackCount());
        assertEquals(0, score.negativeCount());
    }

    @Test
    void computeAndSavePersistsAndClearsStaleScores() {
        Feedback only = feedback("1", 1, 80, 0, "support", T0);
        store.insertFeedback(only);

        ScoreOutcome.Computed computed = assertInstanceOf(ScoreOutcome.Computed.class, aggregator.computeAndSave("1"));
        assertEquals(90.0, store.findScore("1").orElseThrow().overallScore());
        assertEquals(computed.score(), store.findScore("1").orElseThrow());

        store.revokeFeedback(only.id());
        ScoreOutcome.NoFeedback none = assertInstanceOf(ScoreOutcome.NoFeedback.class, aggregator.computeAndSave("1"));
        assertTrue(none.staleScoreRemoved());
        assertTrue(store.findScore("1").isEmpty());
    }

    @Test
    void computeAllScoresCoversEverySubject() {
        store.insertFeedback(feedback("1", 1, 80, 0, "support", T0));
        store.insertFeedback(feedback("2", 2, -20, 0, "support", T0));
        store.insertFeedback(feedback("3", 3, 10, 0, "support", T0));

        RecomputeSummary summary = aggregator.computeAllScores();

        assertEquals(3, summary.computed());
        assertEquals(0, summary.failed());
        assertEquals(List.of("1", "3", "2"),
                store.leaderboard(10, 0).stream().map(ComputedScore::agentId).toList());
    }

    @Test
    void summaryCountsOutcomes() {
        RecomputeSummary summary = new RecomputeSummary(List.of(
                new ScoreOutcome.NoFeedback("1", false),
                new ScoreOutcome.Failed("2", new IllegalStateException("boom"))));

        assertEquals(0, summary.computed());
        assertEquals(1, summary.skipped());
        assertEquals(1, summary.failed());
        assertEquals("2", summary.failures().get(0).agentId());
    }
}
