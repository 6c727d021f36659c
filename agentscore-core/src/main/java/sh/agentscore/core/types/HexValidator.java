// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for {@code 0x}-prefixed hex strings of a fixed byte length.
 */
public final class HexValidator {
    private HexValidator() {}

    /**
     * Pattern matching {@code 0x} followed by exactly {@code byteLength * 2} hex characters.
     *
     * @param byteLength the byte length
     * @return the compiled pattern
     */
    public static Pattern fixedLength(int byteLength) {
        return Pattern.compile("^0x[0-9a-fA-F]{" + (byteLength * 2) + "}$");
    }
}
