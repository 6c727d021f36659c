// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.abi;

import java.util.List;
import java.util.Objects;

/**
 * Dynamic array ({@code T[]}) of a static element type.
 *
 * @param elementType the Solidity element type name, e.g. {@code bytes32}
 * @param elements    the elements, all of {@code elementType}
 */
public record WordArray(String elementType, List<AbiType> elements) implements AbiType {

    public WordArray {
        Objects.requireNonNull(elementType, "elementType");
        Objects.requireNonNull(elements, "elements");
        elements = List.copyOf(elements);
        for (AbiType element : elements) {
            if (element.isDynamic() || !element.typeName().equals(elementType)) {
                throw new IllegalArgumentException(
                        "array of " + elementType + " cannot hold " + element.typeName());
            }
        }
    }

    @Override
    public String typeName() {
        return elementType + "[]";
    }

    @Override
    public boolean isDynamic() {
        return true;
    }
}
