// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.types;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import sh.agentscore.primitives.Hex;

/**
 * 20-byte account or contract address.
 *
 * <p>The value must be {@code 0x} followed by 40 hex characters and is stored in
 * lowercase, so two addresses that differ only in checksum casing are equal.
 */
public record Address(@JsonValue String value) {
    private static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address("0x" + Hex.encodeNoPrefix(bytes));
    }

    /**
     * Extracts an address from a 32-byte ABI word or indexed topic (the low 20 bytes).
     *
     * @param word the 32-byte word
     * @return the address
     */
    public static Address fromWord(final byte[] word) {
        if (word == null || word.length != 32) {
            throw new IllegalArgumentException("ABI word must be exactly 32 bytes");
        }
        final byte[] tail = new byte[BYTE_LENGTH];
        System.arraycopy(word, 32 - BYTE_LENGTH, tail, 0, BYTE_LENGTH);
        return fromBytes(tail);
    }

    @Override
    public String toString() {
        return value;
    }
}
