// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.abi;

import java.math.BigInteger;
import java.util.Objects;
import sh.agentscore.core.error.AbiEncodingException;

/**
 * Solidity unsigned integer ({@code uint8} to {@code uint256}).
 *
 * @param width the bit width, a multiple of 8 between 8 and 256
 * @param value the non-negative value
 */
public record UInt(int width, BigInteger value) implements AbiType {

    public UInt {
        if (width % 8 != 0 || width < 8 || width > 256) {
            throw new IllegalArgumentException("Invalid uint width: " + width);
        }
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new AbiEncodingException("uint cannot be negative: " + value);
        }
        if (value.bitLength() > width) {
            throw new AbiEncodingException("value " + value + " too large for uint" + width);
        }
    }

    public static UInt uint256(final BigInteger value) {
        return new UInt(256, value);
    }

    public static UInt uint256(final long value) {
        return new UInt(256, BigInteger.valueOf(value));
    }

    @Override
    public String typeName() {
        return "uint" + width;
    }

    @Override
    public boolean isDynamic() {
        return false;
    }
}
