// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.abi;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import sh.agentscore.core.error.AbiDecodingException;

/**
 * Reads ABI-encoded tuples word by word.
 *
 * <p>Positions are head slot indices: slot {@code i} is the 32-byte word at byte
 * offset {@code 32 * i}. Dynamic values ({@code string}, {@code bytes}) are read by
 * following the offset stored in their head slot.
 */
public final class AbiDecoder {
    private static final int WORD = 32;
    private static final BigInteger TWO_256 = BigInteger.ONE.shiftLeft(256);
    private static final BigInteger INT_256_MAX = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);

    private AbiDecoder() {
    }

    /** The raw word in head slot {@code slot}. */
    public static byte[] word(final byte[] data, final int slot) {
        final int offset = slot * WORD;
        requireRange(data, offset, WORD);
        return Arrays.copyOfRange(data, offset, offset + WORD);
    }

    public static BigInteger uint(final byte[] data, final int slot) {
        return new BigInteger(1, word(data, slot));
    }

    /** Two's complement interpretation of the word, as emitted for {@code intN} values. */
    public static BigInteger int256(final byte[] data, final int slot) {
        final BigInteger raw = uint(data, slot);
        return raw.compareTo(INT_256_MAX) > 0 ? raw.subtract(TWO_256) : raw;
    }

    public static boolean bool(final byte[] data, final int slot) {
        return uint(data, slot).signum() != 0;
    }

    /** UTF-8 string whose offset is stored in head slot {@code slot}. */
    public static String string(final byte[] data, final int slot) {
        return new String(bytes(data, slot), StandardCharsets.UTF_8);
    }

    /** Dynamic {@code bytes} whose offset is stored in head slot {@code slot}. */
    public static byte[] bytes(final byte[] data, final int slot) {
        final int offset = toIndex(uint(data, slot), "offset");
        requireRange(data, offset, WORD);
        final int length = toIndex(new BigInteger(1, Arrays.copyOfRange(data, offset, offset + WORD)), "length");
        final int start = offset + WORD;
        requireRange(data, start, length);
        return Arrays.copyOfRange(data, start, start + length);
    }

    /** Unsigned integer held in an indexed event topic. */
    public static BigInteger topicUint(final byte[] topic) {
        if (topic.length != WORD) {
            throw new AbiDecodingException("topic must be 32 bytes, got " + topic.length);
        }
        return new BigInteger(1, topic);
    }

    private static int toIndex(final BigInteger value, final String what) {
        if (value.bitLength() > 31) {
            throw new AbiDecodingException("ABI " + what + " out of range: " + value);
        }
        return value.intValue();
    }

    private static void requireRange(final byte[] data, final int offset, final int length) {
        if (offset < 0 || length < 0 || (long) offset + length > data.length) {
            throw new AbiDecodingException(
                    "ABI data too short: need " + ((long) offset + length) + " bytes, have " + data.length);
        }
    }
}
