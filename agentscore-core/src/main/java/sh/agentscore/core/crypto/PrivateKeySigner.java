// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.crypto;

import java.util.Objects;
import sh.agentscore.core.tx.Eip1559Transaction;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.HexData;

/**
 * {@link Signer} backed by an in-memory secp256k1 key.
 */
public final class PrivateKeySigner implements Signer {

    private final PrivateKey privateKey;
    private final Address address;

    public PrivateKeySigner(final String privateKeyHex) {
        this(PrivateKey.fromHex(privateKeyHex));
    }

    public PrivateKeySigner(final PrivateKey privateKey) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
        this.address = privateKey.toAddress();
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public HexData signTransaction(final Eip1559Transaction tx) {
        Objects.requireNonNull(tx, "tx");
        final Signature signature = privateKey.sign(tx.signingHash());
        return HexData.fromBytes(tx.encodeAsEnvelope(signature));
    }

    @Override
    public String toString() {
        return "PrivateKeySigner[" + address + "]";
    }
}
