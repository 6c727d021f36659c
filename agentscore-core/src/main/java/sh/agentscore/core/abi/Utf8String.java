// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.abi;

import java.util.Objects;

/**
 * Solidity {@code string}.
 */
public record Utf8String(String value) implements AbiType {

    public Utf8String {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    public boolean isDynamic() {
        return true;
    }
}
