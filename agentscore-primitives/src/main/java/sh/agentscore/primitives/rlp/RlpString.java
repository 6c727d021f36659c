// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.primitives.rlp;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;
import sh.agentscore.primitives.Hex;

/**
 * RLP byte string.
 *
 * <p>Numeric factories produce the minimal unsigned big-endian form, so zero encodes
 * as the empty string ({@code 0x80}).
 */
public final class RlpString implements RlpItem {
    private static final byte[] EMPTY = new byte[0];

    private final byte[] bytes;

    private RlpString(final byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wraps a copy of {@code bytes}.
     *
     * @param bytes the raw value
     * @return the RLP string
     */
    public static RlpString of(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return new RlpString(Arrays.copyOf(bytes, bytes.length));
    }

    /**
     * Wraps the bytes of a hex string, with or without {@code 0x} prefix.
     *
     * @param hex the hex string
     * @return the RLP string
     */
    public static RlpString of(final String hex) {
        return new RlpString(Hex.decode(hex));
    }

    /**
     * Encodes a non-negative long as a minimal big-endian scalar.
     *
     * @param value the value
     * @return the RLP string
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpString of(final long value) {
        if (value < 0) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative");
        }
        if (value == 0) {
            return new RlpString(EMPTY);
        }
        final int size = (64 - Long.numberOfLeadingZeros(value) + 7) >>> 3;
        final byte[] result = new byte[size];
        long tmp = value;
        for (int i = size - 1; i >= 0; i--) {
            result[i] = (byte) tmp;
            tmp >>>= 8;
        }
        return new RlpString(result);
    }

    /**
     * Encodes a non-negative {@link BigInteger} as a minimal big-endian scalar.
     *
     * @param value the value
     * @return the RLP string
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpString of(final BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative");
        }
        if (value.signum() == 0) {
            return new RlpString(EMPTY);
        }
        final byte[] raw = value.toByteArray();
        return new RlpString(raw[0] == 0 ? Arrays.copyOfRange(raw, 1, raw.length) : raw);
    }

    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public byte[] encode() {
        return Rlp.encodeString(bytes);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RlpString other)) {
            return false;
        }
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RlpString[" + Hex.encode(bytes) + "]";
    }
}
