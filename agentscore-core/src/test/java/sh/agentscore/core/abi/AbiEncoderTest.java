// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.abi;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;
import sh.agentscore.core.error.AbiEncodingException;
import sh.agentscore.primitives.Hex;

class AbiEncoderTest {

    @Test
    void selectorMatchesKnownValue() {
        assertEquals("0xa9059cbb", Hex.encode(AbiEncoder.functionSelector("transfer(address,uint256)")));
    }

    @Test
    void encodesDynamicArraysBehindOffsets() {
        // Given two parallel arrays of one element each
        List<AbiType> args = List.of(
                new WordArray("bytes32", List.of(Bytes32.fromUnsigned(BigInteger.valueOf(7)))),
                new WordArray("uint256", List.of(UInt.uint256(9050))));

        // When
        byte[] encoded = AbiEncoder.encode(args);

        // Then: two offsets, then length + element for each array
        assertEquals(6 * 32, encoded.length);
        assertEquals(BigInteger.valueOf(64), AbiDecoder.uint(encoded, 0));
        assertEquals(BigInteger.valueOf(128), AbiDecoder.uint(encoded, 1));
        assertEquals(BigInteger.ONE, AbiDecoder.uint(encoded, 2));
        assertEquals(BigInteger.valueOf(7), AbiDecoder.uint(encoded, 3));
        assertEquals(BigInteger.ONE, AbiDecoder.uint(encoded, 4));
        assertEquals(BigInteger.valueOf(9050), AbiDecoder.uint(encoded, 5));
    }

    @Test
    void encodesFunctionCallWithSelectorPrefix() {
        byte[] call = AbiEncoder.encodeFunction(
                "updateScore(bytes32,uint256)",
                List.of(Bytes32.fromUnsigned(BigInteger.ONE), UInt.uint256(100)));

        assertEquals(4 + 64, call.length);
        assertEquals(Hex.encode(AbiEncoder.functionSelector("updateScore(bytes32,uint256)")),
                Hex.encode(java.util.Arrays.copyOf(call, 4)));
    }

    @Test
    void negativeIntsAreSignExtended() {
        byte[] encoded = AbiEncoder.encode(List.of(new Int(128, BigInteger.valueOf(-5))));

        assertEquals(BigInteger.valueOf(-5), AbiDecoder.int256(encoded, 0));
        assertEquals((byte) 0xFF, encoded[0]);
    }

    @Test
    void stringsAndBytesRoundTripThroughDecoder() {
        byte[] encoded = AbiEncoder.encode(List.of(
                UInt.uint256(3), new Utf8String("customer-support"), new DynamicBytes(new byte[] {1, 2, 3})));

        assertEquals(BigInteger.valueOf(3), AbiDecoder.uint(encoded, 0));
        assertEquals("customer-support", AbiDecoder.string(encoded, 1));
        assertArrayEquals(new byte[] {1, 2, 3}, AbiDecoder.bytes(encoded, 2));
    }

    @Test
    void rejectsValuesOutsideTheirType() {
        assertThrows(AbiEncodingException.class, () -> UInt.uint256(-1));
        assertThrows(AbiEncodingException.class, () -> new UInt(8, BigInteger.valueOf(256)));
        assertThrows(AbiEncodingException.class, () -> new Int(8, BigInteger.valueOf(128)));
        assertThrows(IllegalArgumentException.class,
                () -> new WordArray("bytes32", List.of(UInt.uint256(1))));
    }
}
