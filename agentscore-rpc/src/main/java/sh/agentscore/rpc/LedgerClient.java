// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import sh.agentscore.core.model.LogEntry;
import sh.agentscore.core.model.TransactionReceipt;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;
import sh.agentscore.core.types.HexData;

/**
 * The slice of chain access the indexer and the oracle publisher need.
 *
 * <p>Implementations report failures as unchecked exceptions: {@code RpcException} for
 * errors from the node, {@link RetryExhaustedException} when transient failures outlast
 * the retry budget, and {@code TxnException} for rejected submissions.
 */
public interface LedgerClient {

    /** Latest block number. */
    long currentHeight();

    /** Logs matching {@code filter}, ordered by block number then log index. */
    List<LogEntry> getLogs(LogFilter filter);

    /** Timestamp of the block, in seconds since the epoch. */
    long getBlockTimestamp(long blockNumber);

    /**
     * Executes a read-only call against the latest block.
     *
     * @return the raw return data
     */
    HexData callView(Address contract, HexData callData);

    /**
     * Signs and broadcasts a contract call from the configured account.
     *
     * @return the transaction hash
     * @throws IllegalStateException if the client was built without a signer
     */
    Hash submitTransaction(Address to, HexData callData, long gasLimit);

    /**
     * Polls for the receipt until it appears or {@code timeout} elapses.
     *
     * @return the receipt, or empty on timeout
     */
    Optional<TransactionReceipt> waitForReceipt(Hash txHash, Duration timeout);
}
