// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.ingest;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;
import static sh.agentscore.pipeline.PipelineFixtures.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import sh.agentscore.core.error.RpcException;
import sh.agentscore.core.model.LogEntry;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.HexData;
import sh.agentscore.pipeline.store.Agent;
import sh.agentscore.pipeline.store.JdbcDomainStore;
import sh.agentscore.pipeline.store.WriteOutcome;
import sh.agentscore.rpc.LedgerClient;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class IngestionLoopTest {

    @Mock
    private LedgerClient ledger;

    private JdbcDomainStore store;
    private IngestionLoop loop;

    @BeforeEach
    void setUp() {
        store = memoryStore();
        when(ledger.getBlockTimestamp(anyLong())).thenReturn(1_700_000_000L);
        loop = newLoop();
    }

    @AfterEach
    void tearDown() {
        loop.close();
        store.close();
    }

    private IngestionLoop newLoop() {
        return new IngestionLoop(ledger, store,
                List.of(new IdentityEventMapper(IDENTITY, ledger), new ReputationEventMapper(REPUTATION, ledger)),
                100, 50, Duration.ofMillis(10));
    }

    private void logsFor(Address contract, List<LogEntry> logs) {
        when(ledger.getLogs(argThat(f -> f != null && f.addresses().contains(contract)))).thenReturn(logs);
    }

    @Test
    void firstRangeStartsAtStartBlock() {
        when(ledger.currentHeight()).thenReturn(1_000L);
        logsFor(IDENTITY, List.of());
        logsFor(REPUTATION, List.of());

        RangeResult.Indexed result = assertInstanceOf(RangeResult.Indexed.class, loop.runOnce());

        assertEquals(100L, result.fromBlock());
        assertEquals(149L, result.toBlock());
        assertEquals(OptionalLong.of(149L), store.lastIndexedBlock());
        assertEquals(851L, loop.blocksBehind());
        verify(ledger).getLogs(argThat(f -> f.addresses().contains(IDENTITY)
                && f.fromBlock() == 100L && f.toBlock() == 149L));
    }

    @Test
    void rangeIsCappedAtChainHeadAndThenIdles() {
        when(ledger.currentHeight()).thenReturn(120L);
        logsFor(IDENTITY, List.of());
        logsFor(REPUTATION, List.of());

        RangeResult.Indexed first = assertInstanceOf(RangeResult.Indexed.class, loop.runOnce());
        RangeResult second = loop.runOnce();

        assertEquals(120L, first.toBlock());
        assertEquals(new RangeResult.Idle(120L, 120L), second);
        assertEquals(0L, loop.blocksBehind());
    }

    @Test
    void appliesEventsFromBothRegistries() {
        when(ledger.currentHeight()).thenReturn(200L);
        logsFor(IDENTITY, List.of(registeredLog(110, 42, "ipfs://a"), uriUpdatedLog(111, 42, "ipfs://b")));
        logsFor(REPUTATION, List.of(
                newFeedbackLog(120, 42, 1, 80, 0, "support"),
                newFeedbackLog(121, 42, 2, 60, 0, "support"),
                revokedLog(130, 42, 2)));

        RangeResult.Indexed result = assertInstanceOf(RangeResult.Indexed.class, loop.runOnce());

        assertEquals(3, result.count(WriteOutcome.INSERTED));
        assertEquals(2, result.count(WriteOutcome.UPDATED));
        assertEquals(5, result.applied());
        assertEquals("ipfs://b", store.findAgent("42").orElseThrow().metadataUri());
        assertEquals(1, store.activeFeedback("42").size());
        assertEquals(2, store.listFeedback("42", true, 10).size());
    }

    @Test
    @DisplayName("a failed mapper leaves the checkpoint in place and the range is replayed")
    void failedRangeDoesNotAdvanceCheckpoint() {
        when(ledger.currentHeight()).thenReturn(149L);
        logsFor(IDENTITY, List.of(registeredLog(110, 42, "ipfs://a")));
        when(ledger.getLogs(argThat(f -> f != null && f.addresses().contains(REPUTATION))))
                .thenThrow(new RpcException(-32000, "connection reset", null, null, null))
                .thenReturn(List.of(newFeedbackLog(120, 42, 1, 80, 0, "support")));

        RangeResult.Failed failed = assertInstanceOf(RangeResult.Failed.class, loop.runOnce());
        assertEquals(100L, failed.fromBlock());
        assertEquals(149L, failed.toBlock());
        assertInstanceOf(RpcException.class, failed.error());
        assertEquals(OptionalLong.empty(), store.lastIndexedBlock());
        assertEquals(1, store.countAgents(null), "identity events of the failed range were applied");

        RangeResult.Indexed retried = assertInstanceOf(RangeResult.Indexed.class, loop.runOnce());
        assertEquals(100L, retried.fromBlock());
        assertEquals(1, retried.count(WriteOutcome.UPDATED), "re-registration refreshes the existing agent");
        assertEquals(1, retried.count(WriteOutcome.INSERTED));
        assertEquals(OptionalLong.of(149L), store.lastIndexedBlock());
        assertEquals(1, store.countAgents(null));
    }

    @Test
    @DisplayName("identity events replayed after a failed range leave the agent row unchanged")
    void replayedIdentityEventsLeaveAgentUnchanged() {
        when(ledger.getBlockTimestamp(110L)).thenReturn(1_700_000_000L);
        when(ledger.getBlockTimestamp(111L)).thenReturn(1_700_000_012L);
        when(ledger.currentHeight()).thenReturn(149L);
        logsFor(IDENTITY, List.of(registeredLog(110, 42, "ipfs://a"), uriUpdatedLog(111, 42, "https://b")));
        when(ledger.getLogs(argThat(f -> f != null && f.addresses().contains(REPUTATION))))
                .thenThrow(new RpcException(-32000, "connection reset", null, null, null))
                .thenReturn(List.of());

        assertInstanceOf(RangeResult.Failed.class, loop.runOnce());
        Agent first = store.findAgent("42").orElseThrow();
        assertEquals("https://b", first.metadataUri());
        assertEquals(Instant.ofEpochSecond(1_700_000_000L), first.createdAt());
        assertEquals(Instant.ofEpochSecond(1_700_000_012L), first.updatedAt());

        assertInstanceOf(RangeResult.Indexed.class, loop.runOnce());
        assertEquals(first, store.findAgent("42").orElseThrow());
    }

    @Test
    void applyingTheSameEventsTwiceChangesNothing() {
        List<LogEntry> logs = List.of(newFeedbackLog(120, 42, 1, 80, 0, "support"), revokedLog(130, 42, 1));
        ReputationEventMapper mapper = new ReputationEventMapper(REPUTATION, ledger);

        for (LogEntry entry : logs) {
            mapper.map(entry).orElseThrow().applyTo(store);
        }
        for (LogEntry entry : logs) {
            assertEquals(WriteOutcome.DUPLICATE, mapper.map(entry).orElseThrow().applyTo(store));
        }

        assertEquals(1, store.listFeedback("42", true, 10).size());
        assertTrue(store.activeFeedback("42").isEmpty());
    }

    @Test
    void removedAndMalformedLogsAreSkipped() {
        LogEntry good = newFeedbackLog(120, 42, 1, 80, 0, "support");
        LogEntry removed = new LogEntry(good.address(), good.data(), good.topics(), good.blockNumber(), null,
                good.transactionHash(), good.logIndex(), true);
        LogEntry malformed = new LogEntry(good.address(), HexData.EMPTY, good.topics(), 121L, null,
                good.transactionHash(), 7L, false);
        when(ledger.currentHeight()).thenReturn(149L);
        logsFor(IDENTITY, List.of());
        logsFor(REPUTATION, List.of(removed, malformed));

        RangeResult.Indexed result = assertInstanceOf(RangeResult.Indexed.class, loop.runOnce());

        assertEquals(2, result.skipped());
        assertEquals(0, result.applied());
        assertTrue(store.listFeedback("42", true, 10).isEmpty());
        assertEquals(OptionalLong.of(149L), store.lastIndexedBlock());
    }

    @Test
    void revokeOfUnknownFeedbackIsReportedMissing() {
        when(ledger.currentHeight()).thenReturn(149L);
        logsFor(IDENTITY, List.of(uriUpdatedLog(105, 9, "https://x")));
        logsFor(REPUTATION, List.of(revokedLog(130, 42, 1)));

        RangeResult.Indexed result = assertInstanceOf(RangeResult.Indexed.class, loop.runOnce());

        assertEquals(2, result.count(WriteOutcome.MISSING));
        assertEquals(OptionalLong.of(149L), store.lastIndexedBlock());
    }

    @Test
    void heightFailureIsReportedNotThrown() {
        when(ledger.currentHeight()).thenThrow(new RpcException(-32000, "timeout", null, null, null));

        RangeResult.Failed failed = assertInstanceOf(RangeResult.Failed.class, loop.runOnce());

        assertEquals(100L, failed.fromBlock());
        assertEquals(-1L, failed.toBlock());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void runCatchesUpAndStops() throws Exception {
        when(ledger.currentHeight()).thenReturn(299L);
        logsFor(IDENTITY, List.of());
        logsFor(REPUTATION, List.of());

        CompletableFuture<Void> running = CompletableFuture.runAsync(loop::run);
        while (store.lastIndexedBlock().orElse(0L) < 299L) {
            Thread.sleep(5);
        }
        loop.stop();
        running.get(5, TimeUnit.SECONDS);

        assertFalse(loop.isRunning());
        assertEquals(OptionalLong.of(299L), store.lastIndexedBlock());
    }

    @Test
    void rejectsInvalidSettings() {
        List<EventMapper> mappers = List.of(new IdentityEventMapper(IDENTITY, ledger));
        assertThrows(IllegalArgumentException.class,
                () -> new IngestionLoop(ledger, store, List.of(), 0, 10, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new IngestionLoop(ledger, store, mappers, -1, 10, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new IngestionLoop(ledger, store, mappers, 0, 0, Duration.ZERO));
    }
}
