// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.agentscore.core.DebugLogger;
import sh.agentscore.core.LogFormatter;
import sh.agentscore.core.crypto.Signer;
import sh.agentscore.core.error.RpcException;
import sh.agentscore.core.error.TxnException;
import sh.agentscore.core.model.LogEntry;
import sh.agentscore.core.model.TransactionReceipt;
import sh.agentscore.core.tx.Eip1559Transaction;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;
import sh.agentscore.core.types.HexData;
import sh.agentscore.rpc.internal.LogParser;
import sh.agentscore.rpc.internal.RpcUtils;

/**
 * {@link LedgerClient} over a {@link LedgerProvider}.
 *
 * <p>Reads are retried through {@link RpcRetry}. A log query the node rejects as too wide
 * is split in half and retried recursively. Transactions are EIP-1559 calls with
 * {@code maxFeePerGas = 2 * eth_gasPrice}, a 1 gwei tip and the pending nonce; the raw
 * send is attempted once, so a broadcast is never duplicated by the retry layer.
 */
public final class JsonRpcLedgerClient implements LedgerClient {
    private static final Logger log = LoggerFactory.getLogger(JsonRpcLedgerClient.class);

    static final BigInteger PRIORITY_FEE = BigInteger.valueOf(1_000_000_000L);
    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);
    private static final long MAX_POLL_INTERVAL_MS = 10_000L;

    private final LedgerProvider provider;
    private final @Nullable Signer signer;
    private final long chainId;
    private final int maxAttempts;
    private final RpcRetryConfig retryConfig;
    private final Duration receiptPollInterval;

    private JsonRpcLedgerClient(final Builder builder) {
        this.provider = builder.provider;
        this.signer = builder.signer;
        this.chainId = builder.chainId;
        this.maxAttempts = builder.maxAttempts;
        this.retryConfig = builder.retryConfig;
        this.receiptPollInterval = builder.receiptPollInterval;
    }

    public static Builder builder(final LedgerProvider provider) {
        return new Builder(provider);
    }

    @Override
    public long currentHeight() {
        final JsonRpcResponse response = call("eth_blockNumber", List.of());
        return RpcUtils.decodeHexLong(response.result(), "blockNumber");
    }

    @Override
    public List<LogEntry> getLogs(final LogFilter filter) {
        Objects.requireNonNull(filter, "filter");
        final List<LogEntry> logs;
        try {
            final JsonRpcResponse response = call("eth_getLogs", List.of(filter.toRequestParam()));
            logs = new ArrayList<>(LogParser.parseLogs(response.result()));
        } catch (RpcException e) {
            if (!e.isBlockRangeTooLarge() || filter.fromBlock() == filter.toBlock()) {
                throw e;
            }
            final long mid = filter.fromBlock() + (filter.toBlock() - filter.fromBlock()) / 2;
            log.debug("Splitting log query {}-{} at {}: {}", filter.fromBlock(), filter.toBlock(), mid, e.getMessage());
            final List<LogEntry> merged = new ArrayList<>(getLogs(filter.withRange(filter.fromBlock(), mid)));
            merged.addAll(getLogs(filter.withRange(mid + 1, filter.toBlock())));
            return merged;
        }
        logs.sort(Comparator.comparingLong(LogEntry::blockNumber).thenComparingLong(LogEntry::logIndex));
        return logs;
    }

    @Override
    public long getBlockTimestamp(final long blockNumber) {
        final JsonRpcResponse response =
                call("eth_getBlockByNumber", List.of(RpcUtils.toHexBlock(blockNumber), Boolean.FALSE));
        final Map<String, Object> block = response.resultAsMap();
        if (block == null) {
            throw new RpcException(-32001, "Block not found: " + blockNumber, null, null);
        }
        return RpcUtils.decodeHexLong(block.get("timestamp"), "timestamp");
    }

    @Override
    public HexData callView(final Address contract, final HexData callData) {
        final Map<String, Object> tx = new LinkedHashMap<>();
        tx.put("to", contract.value());
        tx.put("data", callData.value());
        final JsonRpcResponse response = call("eth_call", List.of(tx, "latest"));
        final String result = response.resultAsString();
        return result == null ? HexData.EMPTY : new HexData(result);
    }

    @Override
    public Hash submitTransaction(final Address to, final HexData callData, final long gasLimit) {
        if (signer == null) {
            throw new IllegalStateException("No signer configured; transactions cannot be submitted");
        }
        final Address from = signer.address();
        final long nonce = RpcUtils.decodeHexLong(
                call("eth_getTransactionCount", List.of(from.value(), "pending")).result(), "nonce");
        final BigInteger gasPrice = RpcUtils.decodeHexBigInteger(call("eth_gasPrice", List.of()).resultAsString());
        final BigInteger maxFee = gasPrice.shiftLeft(1);
        final BigInteger priorityFee = PRIORITY_FEE.min(maxFee);

        final Eip1559Transaction tx = new Eip1559Transaction(
                chainId, nonce, priorityFee, maxFee, gasLimit, to, BigInteger.ZERO, callData);
        final HexData raw = signer.signTransaction(tx);

        final JsonRpcResponse response;
        try {
            response = RpcRetry.run(
                    () -> provider.send("eth_sendRawTransaction", List.of(raw.value())), 1, retryConfig);
        } catch (RpcException e) {
            throw asTxnException(e);
        }
        final String hash = response.resultAsString();
        if (hash == null) {
            throw new TxnException("eth_sendRawTransaction returned no transaction hash");
        }
        DebugLogger.logTx(LogFormatter.formatTxSend(to.value(), nonce, gasLimit, hash));
        log.debug("Submitted tx {} (nonce={}, gasLimit={}, maxFee={})", hash, nonce, gasLimit, maxFee);
        return new Hash(hash);
    }

    @Override
    public Optional<TransactionReceipt> waitForReceipt(final Hash txHash, final Duration timeout) {
        final long deadline = System.nanoTime() + timeout.toNanos();
        long pollMs = Math.max(1L, receiptPollInterval.toMillis());
        while (true) {
            final Optional<TransactionReceipt> receipt = fetchReceipt(txHash);
            if (receipt.isPresent()) {
                DebugLogger.logTx(LogFormatter.formatTxReceipt(
                        txHash.value(), receipt.get().blockNumber(), receipt.get().status()));
                return receipt;
            }
            final long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMs <= 0) {
                return Optional.empty();
            }
            try {
                Thread.sleep(Math.min(pollMs, remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RpcException(-32000, "Interrupted while waiting for receipt " + txHash, null, null, e);
            }
            pollMs = Math.min(pollMs * 2, MAX_POLL_INTERVAL_MS);
        }
    }

    Optional<TransactionReceipt> fetchReceipt(final Hash txHash) {
        final Map<String, Object> map = call("eth_getTransactionReceipt", List.of(txHash.value())).resultAsMap();
        if (map == null) {
            return Optional.empty();
        }
        final String to = RpcUtils.stringValue(map.get("to"));
        return Optional.of(new TransactionReceipt(
                new Hash(String.valueOf(map.get("transactionHash"))),
                new Hash(String.valueOf(map.get("blockHash"))),
                RpcUtils.decodeHexLong(map.get("blockNumber"), "blockNumber"),
                new Address(String.valueOf(map.get("from"))),
                to != null ? new Address(to) : null,
                "0x1".equals(RpcUtils.stringValue(map.get("status"))),
                RpcUtils.decodeHexLong(map.get("gasUsed"), "gasUsed")));
    }

    private JsonRpcResponse call(final String method, final List<?> params) {
        final Supplier<JsonRpcResponse> request = () -> provider.send(method, params);
        return RpcRetry.run(request, maxAttempts, retryConfig);
    }

    private static TxnException asTxnException(final RpcException e) {
        final String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("nonce too low")) {
            return new TxnException("nonce too low: " + e.getMessage(), e);
        }
        return new TxnException("Transaction rejected: " + e.getMessage(), e);
    }

    public static final class Builder {
        private final LedgerProvider provider;
        private @Nullable Signer signer;
        private long chainId = 1L;
        private int maxAttempts = 3;
        private RpcRetryConfig retryConfig = RpcRetryConfig.defaults();
        private Duration receiptPollInterval = DEFAULT_POLL_INTERVAL;

        private Builder(final LedgerProvider provider) {
            this.provider = Objects.requireNonNull(provider, "provider");
        }

        public Builder signer(final @Nullable Signer signer) {
            this.signer = signer;
            return this;
        }

        public Builder chainId(final long chainId) {
            if (chainId <= 0) {
                throw new IllegalArgumentException("chainId must be positive: " + chainId);
            }
            this.chainId = chainId;
            return this;
        }

        public Builder maxAttempts(final int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryConfig(final RpcRetryConfig retryConfig) {
            this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig");
            return this;
        }

        public Builder receiptPollInterval(final Duration receiptPollInterval) {
            this.receiptPollInterval = Objects.requireNonNull(receiptPollInterval, "receiptPollInterval");
            return this;
        }

        public JsonRpcLedgerClient build() {
            return new JsonRpcLedgerClient(this);
        }
    }
}
