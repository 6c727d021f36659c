// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.abi;

/**
 * A value that can be ABI encoded.
 *
 * <p>Static types ({@link UInt}, {@link Int}, {@link Bytes32}) occupy one 32-byte head
 * word. Dynamic types ({@link Utf8String}, {@link DynamicBytes}, {@link WordArray}) are
 * written to the tail and referenced by an offset word in the head.
 */
public sealed interface AbiType permits UInt, Int, Bytes32, Utf8String, DynamicBytes, WordArray {

    /** Canonical Solidity type name, as used in function and event signatures. */
    String typeName();

    boolean isDynamic();
}
