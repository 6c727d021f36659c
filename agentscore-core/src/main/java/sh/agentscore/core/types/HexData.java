// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.types;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import sh.agentscore.primitives.Hex;

/**
 * Arbitrary-length {@code 0x}-prefixed byte data: calldata, event data, call results.
 */
public record HexData(@JsonValue String value) {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    public static final HexData EMPTY = new HexData("0x");

    public HexData {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public static HexData fromBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new HexData(Hex.encode(bytes));
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    /** Number of bytes represented. */
    public int byteLength() {
        return (value.length() - 2) / 2;
    }

    @Override
    public String toString() {
        return value;
    }
}
