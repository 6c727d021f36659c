// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;
import javax.security.auth.Destroyable;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import sh.agentscore.core.types.Address;
import sh.agentscore.primitives.Hex;

/**
 * secp256k1 private key used to sign oracle update transactions.
 *
 * <p>Signing is deterministic (RFC 6979, HMAC-SHA256 nonce) and low-s normalized.
 * The recovery parity is taken directly from the ephemeral point, so no public key
 * recovery is needed to build a typed transaction envelope.
 *
 * <p>Call {@link #destroy()} once the key is no longer needed; further use then fails
 * with {@link IllegalStateException}.
 */
public final class PrivateKey implements Destroyable {
    private static final int PRIVATE_KEY_SIZE = 32;
    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());
    private static final BigInteger HALF_CURVE_ORDER = CURVE.getN().shiftRight(1);
    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private volatile BigInteger privateKeyValue;
    private volatile ECPoint publicKey;
    private volatile boolean destroyed;

    private PrivateKey(final byte[] keyBytes) {
        if (keyBytes.length != PRIVATE_KEY_SIZE) {
            throw new IllegalArgumentException("Private key must be " + PRIVATE_KEY_SIZE + " bytes, got " + keyBytes.length);
        }
        try {
            final BigInteger value = new BigInteger(1, keyBytes);
            if (value.signum() == 0) {
                throw new IllegalArgumentException("Private key cannot be zero");
            }
            if (value.compareTo(CURVE.getN()) >= 0) {
                throw new IllegalArgumentException("Private key must be less than curve order");
            }
            this.privateKeyValue = value;
            this.publicKey = MULTIPLIER.multiply(CURVE.getG(), value);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * @param hexString hex-encoded key, with or without {@code 0x}
     * @return the key
     * @throws IllegalArgumentException if the hex is malformed or the key is out of range
     */
    public static PrivateKey fromHex(final String hexString) {
        Objects.requireNonNull(hexString, "hex string cannot be null");
        return new PrivateKey(Hex.decode(hexString.trim()));
    }

    /**
     * Address of this key: the last 20 bytes of the Keccak-256 hash of the
     * uncompressed public key without its {@code 0x04} prefix.
     */
    public Address toAddress() {
        final ECPoint pubKey;
        synchronized (this) {
            checkNotDestroyed();
            pubKey = publicKey;
        }
        final byte[] encoded = pubKey.getEncoded(false);
        final byte[] hash = Keccak256.hash(Arrays.copyOfRange(encoded, 1, encoded.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    /**
     * Signs a 32-byte message hash.
     *
     * @param messageHash the hash to sign
     * @return the signature with y-parity {@code v}
     */
    public Signature sign(final byte[] messageHash) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes, got " + messageHash.length);
        }
        final BigInteger d;
        synchronized (this) {
            checkNotDestroyed();
            d = privateKeyValue;
        }

        final BigInteger n = CURVE.getN();
        final HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(n, d, messageHash);
        final BigInteger z = new BigInteger(1, messageHash);

        while (true) {
            final BigInteger k = kCalculator.nextK();
            final ECPoint p = MULTIPLIER.multiply(CURVE.getG(), k).normalize();
            final BigInteger r = p.getAffineXCoord().toBigInteger().mod(n);
            if (r.signum() == 0) {
                continue;
            }
            BigInteger s = k.modInverse(n).multiply(z.add(r.multiply(d))).mod(n);
            if (s.signum() == 0) {
                continue;
            }
            int v = p.getAffineYCoord().toBigInteger().testBit(0) ? 1 : 0;
            // (r, n - s) signs with -R, whose y has the opposite parity
            if (s.compareTo(HALF_CURVE_ORDER) > 0) {
                s = n.subtract(s);
                v ^= 1;
            }
            return new Signature(toBytes32(r), toBytes32(s), v);
        }
    }

    @Override
    public synchronized void destroy() {
        privateKeyValue = null;
        publicKey = null;
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return destroyed ? "PrivateKey[destroyed]" : "PrivateKey[***]";
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
    }

    private static byte[] toBytes32(final BigInteger value) {
        final byte[] bytes = value.toByteArray();
        if (bytes.length == 32) {
            return bytes;
        }
        final byte[] result = new byte[32];
        if (bytes.length < 32) {
            System.arraycopy(bytes, 0, result, 32 - bytes.length, bytes.length);
        } else {
            System.arraycopy(bytes, bytes.length - 32, result, 0, 32);
        }
        return result;
    }
}
