// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.abi;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;
import sh.agentscore.core.error.AbiEncodingException;
import sh.agentscore.primitives.Hex;

/**
 * Solidity {@code bytes32}.
 */
public record Bytes32(byte[] value) implements AbiType {

    public Bytes32 {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.length != 32) {
            throw new AbiEncodingException("bytes32 requires exactly 32 bytes, got " + value.length);
        }
        value = Arrays.copyOf(value, 32);
    }

    /**
     * Big-endian, left-padded encoding of a non-negative integer.
     *
     * @param value the integer, at most 256 bits
     * @return the word
     */
    public static Bytes32 fromUnsigned(final BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0 || value.bitLength() > 256) {
            throw new AbiEncodingException("value does not fit in bytes32: " + value);
        }
        final byte[] raw = value.toByteArray();
        final int start = raw.length > 32 ? raw.length - 32 : 0;
        return new Bytes32(Hex.padLeft(Arrays.copyOfRange(raw, start, raw.length), 32));
    }

    @Override
    public byte[] value() {
        return Arrays.copyOf(value, value.length);
    }

    @Override
    public String typeName() {
        return "bytes32";
    }

    @Override
    public boolean isDynamic() {
        return false;
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof Bytes32 other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "Bytes32[" + Hex.encode(value) + "]";
    }
}
