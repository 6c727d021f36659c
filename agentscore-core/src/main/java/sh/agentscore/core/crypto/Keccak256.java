// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.bouncycastle.jcajce.provider.digest.Keccak;

/**
 * Keccak-256 (the pre-standard SHA-3 variant used by Ethereum).
 *
 * <p>Digest instances are cached per thread.
 */
public final class Keccak256 {
    private static final ThreadLocal<Keccak.Digest256> DIGEST = ThreadLocal.withInitial(Keccak.Digest256::new);

    private Keccak256() {
        // Utility class
    }

    /**
     * @param input the data to hash
     * @return 32-byte hash
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Hashes the concatenation of {@code inputs}.
     *
     * @param inputs the data arrays to hash
     * @return 32-byte hash
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        for (byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input);
        }
        return digest.digest();
    }

    /** Hashes the UTF-8 bytes of {@code text}, as used for event and function signatures. */
    public static byte[] hashUtf8(final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return hash(text.getBytes(StandardCharsets.UTF_8));
    }
}
