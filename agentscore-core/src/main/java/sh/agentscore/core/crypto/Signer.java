// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.crypto;

import sh.agentscore.core.tx.Eip1559Transaction;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.HexData;

/**
 * Holds the account that publishes oracle updates.
 */
public interface Signer {

    Address address();

    /**
     * Signs {@code tx} and returns the raw envelope for {@code eth_sendRawTransaction}.
     */
    HexData signTransaction(Eip1559Transaction tx);
}
