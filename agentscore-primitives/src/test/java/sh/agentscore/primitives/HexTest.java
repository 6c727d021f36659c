// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HexTest {
    @Test
    @DisplayName("Encoding empty and single bytes")
    void encodeBasic() {
        assertEquals("0x", Hex.encode(new byte[] {}));
        assertEquals("0x00", Hex.encode(new byte[] {0x00}));
        assertEquals("0xff", Hex.encode(new byte[] {(byte) 0xFF}));
        assertEquals("0123abcd", Hex.encodeNoPrefix(new byte[] {0x01, 0x23, (byte) 0xAB, (byte) 0xCD}));
    }

    @Test
    void decodeAcceptsMixedCaseAndMissingPrefix() {
        byte[] expected = new byte[] {0x0A, (byte) 0xBC, (byte) 0xDE, (byte) 0xF0};
        assertArrayEquals(expected, Hex.decode("0x0AbCdEf0"));
        assertArrayEquals(expected, Hex.decode("0X0aBcDeF0"));
        assertArrayEquals(expected, Hex.decode("0aBcDeF0"));
        assertArrayEquals(new byte[] {}, Hex.decode("0x"));
    }

    @Test
    void prefixHelpers() {
        assertEquals("1234", Hex.cleanPrefix("0x1234"));
        assertEquals("1234", Hex.cleanPrefix("1234"));
        assertTrue(Hex.hasPrefix("0Xff"));
        assertFalse(Hex.hasPrefix(""));
        assertFalse(Hex.hasPrefix(null));
    }

    @Test
    void decodeRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0x1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xz1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.cleanPrefix(null));
    }

    @Test
    void padLeftFillsWithZeros() {
        assertArrayEquals(new byte[] {0, 0, 0, 7}, Hex.padLeft(new byte[] {7}, 4));
        assertArrayEquals(new byte[] {1, 2}, Hex.padLeft(new byte[] {1, 2}, 2));
        assertThrows(IllegalArgumentException.class, () -> Hex.padLeft(new byte[3], 2));
    }
}
