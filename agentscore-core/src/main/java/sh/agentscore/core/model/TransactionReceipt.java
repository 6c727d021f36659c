// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.model;

import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;

/**
 * Receipt of a mined transaction.
 *
 * @param transactionHash the transaction
 * @param blockHash       the including block
 * @param blockNumber     the including block number
 * @param from            the sender
 * @param to              the recipient, null for contract creation
 * @param status          true when execution succeeded, false when it reverted
 * @param gasUsed         gas consumed by this transaction
 */
public record TransactionReceipt(
        Hash transactionHash,
        Hash blockHash,
        long blockNumber,
        Address from,
        @Nullable Address to,
        boolean status,
        long gasUsed) {

    public TransactionReceipt {
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        Objects.requireNonNull(blockHash, "blockHash cannot be null");
        Objects.requireNonNull(from, "from cannot be null");
    }
}
