// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.tx;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import sh.agentscore.core.crypto.Keccak256;
import sh.agentscore.core.crypto.Signature;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.HexData;
import sh.agentscore.primitives.rlp.Rlp;
import sh.agentscore.primitives.rlp.RlpItem;
import sh.agentscore.primitives.rlp.RlpList;
import sh.agentscore.primitives.rlp.RlpString;

/**
 * EIP-1559 (type {@code 0x02}) contract call with an empty access list.
 *
 * <pre>
 * preimage: 0x02 || RLP([chainId, nonce, maxPriorityFeePerGas, maxFeePerGas, gasLimit, to, value, data, []])
 * envelope: 0x02 || RLP([chainId, nonce, maxPriorityFeePerGas, maxFeePerGas, gasLimit, to, value, data, [], yParity, r, s])
 * </pre>
 *
 * @param chainId              the chain ID
 * @param nonce                the sender nonce
 * @param maxPriorityFeePerGas tip in wei
 * @param maxFeePerGas         fee cap in wei
 * @param gasLimit             gas limit
 * @param to                   the called contract
 * @param value                wei transferred
 * @param data                 calldata
 */
public record Eip1559Transaction(
        long chainId,
        long nonce,
        BigInteger maxPriorityFeePerGas,
        BigInteger maxFeePerGas,
        long gasLimit,
        Address to,
        BigInteger value,
        HexData data) {

    private static final byte TYPE = (byte) 0x02;

    public Eip1559Transaction {
        if (chainId <= 0) {
            throw new IllegalArgumentException("Chain ID must be positive");
        }
        if (nonce < 0) {
            throw new IllegalArgumentException("Nonce cannot be negative");
        }
        Objects.requireNonNull(maxPriorityFeePerGas, "maxPriorityFeePerGas cannot be null");
        Objects.requireNonNull(maxFeePerGas, "maxFeePerGas cannot be null");
        if (maxPriorityFeePerGas.compareTo(maxFeePerGas) > 0) {
            throw new IllegalArgumentException("maxPriorityFeePerGas cannot exceed maxFeePerGas");
        }
        if (gasLimit <= 0) {
            throw new IllegalArgumentException("gasLimit must be positive");
        }
        Objects.requireNonNull(to, "to cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
    }

    /** Bytes whose Keccak-256 hash is signed. */
    public byte[] encodeForSigning() {
        return typed(Rlp.encodeList(payload()));
    }

    /** Hash of {@link #encodeForSigning()}. */
    public byte[] signingHash() {
        return Keccak256.hash(encodeForSigning());
    }

    /**
     * Signed envelope, ready for {@code eth_sendRawTransaction}.
     *
     * @param signature signature over {@link #signingHash()}
     * @return the raw transaction
     */
    public byte[] encodeAsEnvelope(final Signature signature) {
        Objects.requireNonNull(signature, "signature is required");
        final List<RlpItem> items = payload();
        items.add(RlpString.of(signature.v()));
        items.add(RlpString.of(signature.rValue()));
        items.add(RlpString.of(signature.sValue()));
        return typed(Rlp.encodeList(items));
    }

    private List<RlpItem> payload() {
        final List<RlpItem> items = new ArrayList<>(12);
        items.add(RlpString.of(chainId));
        items.add(RlpString.of(nonce));
        items.add(RlpString.of(maxPriorityFeePerGas));
        items.add(RlpString.of(maxFeePerGas));
        items.add(RlpString.of(gasLimit));
        items.add(RlpString.of(to.toBytes()));
        items.add(RlpString.of(value));
        items.add(RlpString.of(data.toBytes()));
        items.add(RlpList.of());
        return items;
    }

    private static byte[] typed(final byte[] rlp) {
        final byte[] result = new byte[rlp.length + 1];
        result[0] = TYPE;
        System.arraycopy(rlp, 0, result, 1, rlp.length);
        return result;
    }
}
