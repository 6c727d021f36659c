// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.primitives.rlp;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.agentscore.primitives.Hex;

class RlpTest {
    @Test
    @DisplayName("String encoding vectors from the Ethereum RLP documentation")
    void stringVectors() {
        assertEquals("80", Hex.encodeNoPrefix(RlpString.of(new byte[] {}).encode()));
        assertEquals("83646f67", Hex.encodeNoPrefix(RlpString.of("dog".getBytes(StandardCharsets.US_ASCII)).encode()));
        assertEquals("00", Hex.encodeNoPrefix(RlpString.of(new byte[] {0x00}).encode()));
        assertEquals("0f", Hex.encodeNoPrefix(RlpString.of(new byte[] {0x0f}).encode()));
        assertEquals("820400", Hex.encodeNoPrefix(RlpString.of(1024L).encode()));
        assertEquals("8180", Hex.encodeNoPrefix(RlpString.of(128L).encode()));
    }

    @Test
    @DisplayName("List encoding vectors from the Ethereum RLP documentation")
    void listVectors() {
        assertEquals("c0", Hex.encodeNoPrefix(RlpList.of().encode()));
        RlpList animals = RlpList.of(
                RlpString.of("cat".getBytes(StandardCharsets.US_ASCII)),
                RlpString.of("dog".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("c88363617483646f67", Hex.encodeNoPrefix(animals.encode()));
        assertEquals("c1c0", Hex.encodeNoPrefix(RlpList.of(RlpList.of()).encode()));
    }

    @Test
    void zeroEncodesAsEmptyString() {
        assertEquals(RlpString.of(0L), RlpString.of(BigInteger.ZERO));
        assertEquals("80", Hex.encodeNoPrefix(RlpString.of(BigInteger.ZERO).encode()));
    }

    @Test
    void bigIntegerDropsSignByte() {
        // 0xff has a leading 0x00 sign byte in two's complement
        assertEquals("81ff", Hex.encodeNoPrefix(RlpString.of(BigInteger.valueOf(255)).encode()));
        assertThrows(IllegalArgumentException.class, () -> RlpString.of(BigInteger.ONE.negate()));
        assertThrows(IllegalArgumentException.class, () -> RlpString.of(-1L));
    }

    @Test
    void longStringAndListHeaders() {
        byte[] longString = new byte[60];
        Arrays.fill(longString, (byte) 0x01);
        byte[] encodedString = RlpString.of(longString).encode();
        assertEquals((byte) 0xB8, encodedString[0]);
        assertEquals((byte) 0x3C, encodedString[1]);
        assertEquals(62, encodedString.length);

        List<RlpItem> manyItems = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            manyItems.add(RlpString.of((long) i));
        }
        byte[] encodedList = RlpList.of(manyItems).encode();
        assertEquals((byte) 0xF8, encodedList[0]);
        assertEquals((byte) 0x3C, encodedList[1]);
        assertEquals(62, encodedList.length);
    }

    @Test
    void twoByteLengthPrefix() {
        byte[] payload = new byte[1024];
        byte[] encoded = Rlp.encodeString(payload);
        assertEquals((byte) 0xB9, encoded[0]);
        assertEquals((byte) 0x04, encoded[1]);
        assertEquals((byte) 0x00, encoded[2]);
        assertEquals(1027, encoded.length);
    }
}
