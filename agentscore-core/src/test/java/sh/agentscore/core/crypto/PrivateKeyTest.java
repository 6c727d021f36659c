// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import sh.agentscore.core.types.Address;

class PrivateKeyTest {
    private static final String KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    private static final BigInteger HALF_ORDER = new BigInteger(
            "7fffffffffffffffffffffffffffffff5d576e7357a4501ddfe92f46681b20a0", 16);

    @Test
    void derivesAddress() {
        assertEquals(new Address("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23"), PrivateKey.fromHex(KEY).toAddress());
        assertEquals(
                new Address("0x7e5f4552091a69125d5dfcb7b8c2659029395bdf"),
                PrivateKey.fromHex("0x0000000000000000000000000000000000000000000000000000000000000001").toAddress());
    }

    @Test
    void signingIsDeterministicAndLowS() {
        PrivateKey key = PrivateKey.fromHex(KEY);
        byte[] hash = Keccak256.hashUtf8("oracle update");

        Signature first = key.sign(hash);
        Signature second = key.sign(hash);

        assertEquals(first, second);
        assertTrue(first.sValue().compareTo(HALF_ORDER) <= 0);
        assertTrue(first.v() == 0 || first.v() == 1);
    }

    @Test
    void rejectsOutOfRangeKeys() {
        assertThrows(IllegalArgumentException.class,
                () -> PrivateKey.fromHex("0x0000000000000000000000000000000000000000000000000000000000000000"));
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromHex("0x1234"));
        assertThrows(IllegalArgumentException.class,
                () -> PrivateKey.fromHex("0xfffffffffffffffffffffffffffffffebaaedce6af48a03bbfd25e8cd0364141"));
    }

    @Test
    void destroyedKeyCannotSign() {
        PrivateKey key = PrivateKey.fromHex(KEY);
        key.destroy();

        assertTrue(key.isDestroyed());
        assertThrows(IllegalStateException.class, () -> key.sign(new byte[32]));
        assertFalse(key.toString().contains("4c0883"));
    }
}
