// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.abi;

import java.util.Arrays;
import java.util.Objects;

/**
 * Solidity {@code bytes}.
 */
public record DynamicBytes(byte[] value) implements AbiType {

    public DynamicBytes {
        Objects.requireNonNull(value, "value cannot be null");
        value = Arrays.copyOf(value, value.length);
    }

    @Override
    public byte[] value() {
        return Arrays.copyOf(value, value.length);
    }

    @Override
    public String typeName() {
        return "bytes";
    }

    @Override
    public boolean isDynamic() {
        return true;
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof DynamicBytes other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }
}
