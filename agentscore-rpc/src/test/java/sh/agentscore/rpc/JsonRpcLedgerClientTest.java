// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigInteger;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sh.agentscore.core.crypto.Signer;
import sh.agentscore.core.error.RpcException;
import sh.agentscore.core.error.TxnException;
import sh.agentscore.core.model.LogEntry;
import sh.agentscore.core.model.TransactionReceipt;
import sh.agentscore.core.tx.Eip1559Transaction;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;
import sh.agentscore.core.types.HexData;

@ExtendWith(MockitoExtension.class)
class JsonRpcLedgerClientTest {

    private static final Address CONTRACT = new Address("0x" + "a".repeat(40));
    private static final Address SENDER = new Address("0x" + "b".repeat(40));
    private static final String TX_HASH = "0x" + "c".repeat(64);
    private static final String BLOCK_HASH = "0x" + "d".repeat(64);
    private static final Hash TOPIC = new Hash("0x" + "e".repeat(64));
    private static final RpcRetryConfig FAST = RpcRetryConfig.builder().backoffBaseMs(1).backoffMaxMs(2).build();

    @Mock
    private LedgerProvider provider;

    @Mock
    private Signer signer;

    private JsonRpcLedgerClient client;

    @BeforeEach
    void setUp() {
        client = JsonRpcLedgerClient.builder(provider)
                .signer(signer)
                .chainId(11155111L)
                .retryConfig(FAST)
                .receiptPollInterval(Duration.ofMillis(1))
                .build();
    }

    @Test
    void currentHeightDecodesQuantity() {
        when(provider.send(eq("eth_blockNumber"), any())).thenReturn(ok("0x1b4"));

        assertEquals(436L, client.currentHeight());
    }

    @Test
    void currentHeightRetriesRateLimiting() {
        when(provider.send(eq("eth_blockNumber"), any()))
                .thenThrow(new RpcException(429, "Too Many Requests", null, 1L))
                .thenReturn(ok("0x2"));

        assertEquals(2L, client.currentHeight());
        verify(provider, times(2)).send(eq("eth_blockNumber"), any());
    }

    @Test
    void getLogsSendsFilterAndSortsByPosition() {
        when(provider.send(eq("eth_getLogs"), any())).thenReturn(ok(List.of(rawLog(12, 3), rawLog(10, 7), rawLog(12, 1))));

        List<LogEntry> logs = client.getLogs(LogFilter.of(10, 12, CONTRACT, List.of(TOPIC)));

        assertEquals(3, logs.size());
        assertEquals(10L, logs.get(0).blockNumber());
        assertEquals(1L, logs.get(1).logIndex());
        assertEquals(3L, logs.get(2).logIndex());
        verify(provider).send(eq("eth_getLogs"), argThat(params -> {
            @SuppressWarnings("unchecked")
            Map<String, Object> filter = (Map<String, Object>) params.get(0);
            return "0xa".equals(filter.get("fromBlock"))
                    && "0xc".equals(filter.get("toBlock"))
                    && CONTRACT.value().equals(filter.get("address"))
                    && List.of(List.of(TOPIC.value())).equals(filter.get("topics"));
        }));
    }

    @Test
    void getLogsSplitsRangeTheNodeRejects() {
        when(provider.send(eq("eth_getLogs"), any())).thenAnswer(invocation -> {
            @SuppressWarnings("unchecked")
            Map<String, Object> filter = (Map<String, Object>) ((List<?>) invocation.getArgument(1)).get(0);
            if ("0x0".equals(filter.get("fromBlock")) && "0x3".equals(filter.get("toBlock"))) {
                throw new RpcException(-32005, "block range is too large", null, 1L);
            }
            long from = Long.decode((String) filter.get("fromBlock"));
            return ok(List.of(rawLog(from, 0)));
        });

        List<LogEntry> logs = client.getLogs(LogFilter.of(0, 3, CONTRACT, List.of(TOPIC)));

        assertEquals(2, logs.size());
        assertEquals(0L, logs.get(0).blockNumber());
        assertEquals(2L, logs.get(1).blockNumber());
    }

    @Test
    void getBlockTimestampReadsHeader() {
        when(provider.send(eq("eth_getBlockByNumber"), eq(List.of("0x64", Boolean.FALSE))))
                .thenReturn(ok(Map.of("number", "0x64", "timestamp", "0x65f0a000")));

        assertEquals(0x65f0a000L, client.getBlockTimestamp(100));
    }

    @Test
    void getBlockTimestampFailsForUnknownBlock() {
        when(provider.send(eq("eth_getBlockByNumber"), any())).thenReturn(ok(null));

        assertThrows(RpcException.class, () -> client.getBlockTimestamp(100));
    }

    @Test
    void callViewPostsToLatestBlock() {
        when(provider.send(eq("eth_call"), any())).thenReturn(ok("0x" + "0".repeat(63) + "1"));

        HexData result = client.callView(CONTRACT, new HexData("0x12345678"));

        assertEquals(32, result.byteLength());
        verify(provider).send(eq("eth_call"), argThat(params ->
                params.size() == 2
                        && "latest".equals(params.get(1))
                        && ((Map<?, ?>) params.get(0)).get("to").equals(CONTRACT.value())
                        && ((Map<?, ?>) params.get(0)).get("data").equals("0x12345678")));
    }

    @Test
    void submitTransactionBuildsEip1559CallWithDoubledGasPrice() {
        when(signer.address()).thenReturn(SENDER);
        when(provider.send(eq("eth_getTransactionCount"), eq(List.of(SENDER.value(), "pending"))))
                .thenReturn(ok("0x7"));
        when(provider.send(eq("eth_gasPrice"), any())).thenReturn(ok("0x3b9aca00"));
        when(signer.signTransaction(any())).thenReturn(new HexData("0x02c0"));
        when(provider.send(eq("eth_sendRawTransaction"), eq(List.of("0x02c0")))).thenReturn(ok(TX_HASH));

        Hash hash = client.submitTransaction(CONTRACT, new HexData("0xabcd"), 80_000L);

        assertEquals(TX_HASH, hash.value());
        ArgumentCaptor<Eip1559Transaction> captor = ArgumentCaptor.forClass(Eip1559Transaction.class);
        verify(signer).signTransaction(captor.capture());
        Eip1559Transaction tx = captor.getValue();
        assertEquals(11155111L, tx.chainId());
        assertEquals(7L, tx.nonce());
        assertEquals(BigInteger.valueOf(2_000_000_000L), tx.maxFeePerGas());
        assertEquals(JsonRpcLedgerClient.PRIORITY_FEE, tx.maxPriorityFeePerGas());
        assertEquals(80_000L, tx.gasLimit());
        assertEquals(CONTRACT, tx.to());
        assertEquals(BigInteger.ZERO, tx.value());
    }

    @Test
    void priorityFeeNeverExceedsFeeCap() {
        when(signer.address()).thenReturn(SENDER);
        when(provider.send(eq("eth_getTransactionCount"), any())).thenReturn(ok("0x0"));
        when(provider.send(eq("eth_gasPrice"), any())).thenReturn(ok("0x3e8"));
        when(signer.signTransaction(any())).thenReturn(new HexData("0x02c0"));
        when(provider.send(eq("eth_sendRawTransaction"), any())).thenReturn(ok(TX_HASH));

        client.submitTransaction(CONTRACT, HexData.EMPTY, 50_000L);

        ArgumentCaptor<Eip1559Transaction> captor = ArgumentCaptor.forClass(Eip1559Transaction.class);
        verify(signer).signTransaction(captor.capture());
        assertEquals(BigInteger.valueOf(2000), captor.getValue().maxFeePerGas());
        assertEquals(BigInteger.valueOf(2000), captor.getValue().maxPriorityFeePerGas());
    }

    @Test
    void rawSendIsAttemptedOnceAndRejectionsBecomeTxnException() {
        when(signer.address()).thenReturn(SENDER);
        when(provider.send(eq("eth_getTransactionCount"), any())).thenReturn(ok("0x1"));
        when(provider.send(eq("eth_gasPrice"), any())).thenReturn(ok("0x1"));
        when(signer.signTransaction(any())).thenReturn(new HexData("0x02c0"));
        when(provider.send(eq("eth_sendRawTransaction"), any()))
                .thenThrow(new RpcException(-32000, "nonce too low", null, 9L));

        TxnException ex = assertThrows(
                TxnException.class, () -> client.submitTransaction(CONTRACT, HexData.EMPTY, 50_000L));

        assertTrue(ex.isNonceTooLow());
        verify(provider, times(1)).send(eq("eth_sendRawTransaction"), any());
    }

    @Test
    void submitWithoutSignerIsRejected() {
        JsonRpcLedgerClient readOnly = JsonRpcLedgerClient.builder(provider).build();

        assertThrows(IllegalStateException.class, () -> readOnly.submitTransaction(CONTRACT, HexData.EMPTY, 50_000L));
        verify(provider, never()).send(any(), any());
    }

    @Test
    void waitForReceiptPollsUntilMined() {
        when(provider.send(eq("eth_getTransactionReceipt"), eq(List.of(TX_HASH))))
                .thenReturn(ok(null))
                .thenReturn(ok(null))
                .thenReturn(ok(rawReceipt("0x1")));

        Optional<TransactionReceipt> receipt = client.waitForReceipt(new Hash(TX_HASH), Duration.ofSeconds(5));

        assertTrue(receipt.isPresent());
        assertTrue(receipt.get().status());
        assertEquals(0x20L, receipt.get().blockNumber());
        assertEquals(21000L, receipt.get().gasUsed());
        verify(provider, times(3)).send(eq("eth_getTransactionReceipt"), any());
    }

    @Test
    void waitForReceiptReportsRevertedStatus() {
        when(provider.send(eq("eth_getTransactionReceipt"), any())).thenReturn(ok(rawReceipt("0x0")));

        Optional<TransactionReceipt> receipt = client.waitForReceipt(new Hash(TX_HASH), Duration.ofSeconds(1));

        assertTrue(receipt.isPresent());
        assertFalse(receipt.get().status());
    }

    @Test
    void waitForReceiptTimesOut() {
        when(provider.send(eq("eth_getTransactionReceipt"), any())).thenReturn(ok(null));

        Optional<TransactionReceipt> receipt = client.waitForReceipt(new Hash(TX_HASH), Duration.ofMillis(30));

        assertTrue(receipt.isEmpty());
    }

    private static JsonRpcResponse ok(final Object result) {
        return new JsonRpcResponse("2.0", result, null, "1");
    }

    private static Map<String, Object> rawLog(final long block, final long index) {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("address", CONTRACT.value());
        log.put("data", "0x");
        log.put("topics", List.of(TOPIC.value()));
        log.put("blockNumber", "0x" + Long.toHexString(block));
        log.put("blockHash", BLOCK_HASH);
        log.put("transactionHash", TX_HASH);
        log.put("logIndex", "0x" + Long.toHexString(index));
        log.put("removed", false);
        return log;
    }

    private static Map<String, Object> rawReceipt(final String status) {
        Map<String, Object> receipt = new LinkedHashMap<>();
        receipt.put("transactionHash", TX_HASH);
        receipt.put("blockHash", BLOCK_HASH);
        receipt.put("blockNumber", "0x20");
        receipt.put("from", SENDER.value());
        receipt.put("to", CONTRACT.value());
        receipt.put("status", status);
        receipt.put("gasUsed", "0x5208");
        return receipt;
    }
}
