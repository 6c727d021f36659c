// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * secp256k1 ECDSA signature.
 *
 * <p>{@code v} is the y-parity of the ephemeral point (0 or 1), which is what typed
 * (EIP-2718) transaction envelopes carry.
 *
 * @param r first 32 bytes
 * @param s second 32 bytes, low-s normalized
 * @param v y-parity
 */
public record Signature(byte[] r, byte[] s, int v) {

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");
        if (r.length != 32) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != 32) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }
        if (v != 0 && v != 1) {
            throw new IllegalArgumentException("v must be a y-parity of 0 or 1, got " + v);
        }
        r = Arrays.copyOf(r, 32);
        s = Arrays.copyOf(s, 32);
    }

    @Override
    public byte[] r() {
        return Arrays.copyOf(r, r.length);
    }

    @Override
    public byte[] s() {
        return Arrays.copyOf(s, s.length);
    }

    public BigInteger rValue() {
        return new BigInteger(1, r);
    }

    public BigInteger sValue() {
        return new BigInteger(1, s);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Signature other)) {
            return false;
        }
        return Arrays.equals(r, other.r) && Arrays.equals(s, other.s) && v == other.v;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(r), Arrays.hashCode(s), v);
    }

    @Override
    public String toString() {
        return "Signature[v=" + v + "]";
    }
}
