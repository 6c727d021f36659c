// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.abi;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import sh.agentscore.core.error.AbiDecodingException;
import sh.agentscore.primitives.Hex;

class AbiDecoderTest {

    @Test
    void decodesScoreViewTuple() {
        // (uint256 score = 7250, uint256 lastUpdated = 1700000000, bool exists = true)
        byte[] data = Hex.decode("0x"
                + "0000000000000000000000000000000000000000000000000000000000001c52"
                + "000000000000000000000000000000000000000000000000000000006553f100"
                + "0000000000000000000000000000000000000000000000000000000000000001");

        assertEquals(BigInteger.valueOf(7250), AbiDecoder.uint(data, 0));
        assertEquals(BigInteger.valueOf(1_700_000_000L), AbiDecoder.uint(data, 1));
        assertTrue(AbiDecoder.bool(data, 2));
    }

    @Test
    void int256InterpretsTwosComplement() {
        byte[] minusOne = new byte[32];
        java.util.Arrays.fill(minusOne, (byte) 0xFF);

        assertEquals(BigInteger.ONE.negate(), AbiDecoder.int256(minusOne, 0));
    }

    @Test
    void truncatedDataFails() {
        assertThrows(AbiDecodingException.class, () -> AbiDecoder.uint(new byte[31], 0));
        assertThrows(AbiDecodingException.class, () -> AbiDecoder.uint(new byte[32], 1));
    }

    @Test
    void offsetPastEndFails() {
        byte[] data = new byte[32];
        data[31] = 64;

        assertThrows(AbiDecodingException.class, () -> AbiDecoder.string(data, 0));
    }
}
