// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.abi;

import java.math.BigInteger;
import java.util.Objects;
import sh.agentscore.core.error.AbiEncodingException;

/**
 * Solidity signed integer ({@code int8} to {@code int256}), encoded as a
 * sign-extended two's complement word.
 */
public record Int(int width, BigInteger value) implements AbiType {

    public Int {
        if (width % 8 != 0 || width < 8 || width > 256) {
            throw new IllegalArgumentException("Invalid int width: " + width);
        }
        Objects.requireNonNull(value, "value cannot be null");
        if (value.bitLength() > width - 1) {
            throw new AbiEncodingException("value " + value + " out of range for int" + width);
        }
    }

    @Override
    public String typeName() {
        return "int" + width;
    }

    @Override
    public boolean isDynamic() {
        return false;
    }
}
