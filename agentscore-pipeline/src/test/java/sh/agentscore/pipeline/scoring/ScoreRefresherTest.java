// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.scoring;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;
import static sh.agentscore.pipeline.PipelineFixtures.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import sh.agentscore.pipeline.store.DomainStore;
import sh.agentscore.pipeline.store.JdbcDomainStore;
import sh.agentscore.pipeline.store.StoreException;

class ScoreRefresherTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(T0, ZoneOffset.UTC);

    @Test
    void refreshStoresEveryScore() {
        try (JdbcDomainStore store = memoryStore()) {
            store.insertFeedback(feedback("1", 1, 80, 0, "support", T0));
            store.insertFeedback(feedback("2", 1, 0, 0, "support", T0));
            ScoreRefresher refresher = new ScoreRefresher(new ScoreAggregator(store, new TimeDecay(90.0), CLOCK));

            RecomputeSummary summary = refresher.refresh();

            assertEquals(2, summary.computed());
            assertEquals(90.0, store.findScore("1").orElseThrow().overallScore());
            assertEquals(50.0, store.findScore("2").orElseThrow().overallScore());
            assertFalse(store.findScore("1").orElseThrow().pushedToChain());
        }
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void daemonSurvivesFailedPassesAndStops() throws Exception {
        DomainStore broken = mock(DomainStore.class);
        when(broken.subjectsWithActiveFeedback()).thenThrow(new StoreException("database is gone", new IllegalStateException()));
        ScoreRefresher refresher = new ScoreRefresher(new ScoreAggregator(broken, new TimeDecay(90.0), CLOCK));

        CompletableFuture<Void> daemon = CompletableFuture.runAsync(() -> refresher.runDaemon(Duration.ofMillis(20)));
        verify(broken, timeout(5_000).atLeast(2)).subjectsWithActiveFeedback();
        refresher.stop();
        daemon.get(5, TimeUnit.SECONDS);

        assertFalse(refresher.isRunning());
    }

    @Test
    void stoppedRefresherDoesNotStart() {
        DomainStore store = mock(DomainStore.class);
        ScoreRefresher refresher = new ScoreRefresher(new ScoreAggregator(store, new TimeDecay(90.0), CLOCK));
        refresher.stop();

        refresher.runDaemon(Duration.ofMillis(20));

        verifyNoInteractions(store);
        assertThrows(IllegalArgumentException.class, () -> refresher.runDaemon(Duration.ZERO));
    }
}
