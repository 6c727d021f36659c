// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.abi;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import sh.agentscore.core.crypto.Keccak256;
import sh.agentscore.primitives.Hex;

/**
 * Encodes function calls according to the Solidity contract ABI.
 *
 * <pre>{@code
 * byte[] data = AbiEncoder.encodeFunction(
 *         "getScoreView(bytes32)", List.of(Bytes32.fromUnsigned(BigInteger.valueOf(7))));
 * }</pre>
 */
public final class AbiEncoder {
    private static final int WORD = 32;

    private AbiEncoder() {
    }

    /**
     * First four bytes of the Keccak-256 hash of {@code signature}.
     *
     * @param signature canonical signature, e.g. {@code updateScore(bytes32,uint256)}
     * @return the selector
     */
    public static byte[] functionSelector(final String signature) {
        return Arrays.copyOf(Keccak256.hashUtf8(signature), 4);
    }

    /**
     * Encodes arguments as a tuple (head words followed by dynamic tails).
     *
     * @param args the arguments
     * @return the encoded tuple
     */
    public static byte[] encode(final List<AbiType> args) {
        Objects.requireNonNull(args, "args");
        final ByteArrayOutputStream head = new ByteArrayOutputStream();
        final ByteArrayOutputStream tail = new ByteArrayOutputStream();
        final int headSize = args.size() * WORD;
        for (AbiType arg : args) {
            if (arg.isDynamic()) {
                head.writeBytes(uintWord(BigInteger.valueOf(headSize + tail.size())));
                tail.writeBytes(encodeDynamic(arg));
            } else {
                head.writeBytes(encodeStatic(arg));
            }
        }
        head.writeBytes(tail.toByteArray());
        return head.toByteArray();
    }

    /**
     * Selector followed by the encoded arguments.
     *
     * @param signature canonical signature
     * @param args      the arguments, matching the signature's parameter types
     * @return calldata
     */
    public static byte[] encodeFunction(final String signature, final List<AbiType> args) {
        final byte[] selector = functionSelector(signature);
        final byte[] body = encode(args);
        final byte[] result = new byte[selector.length + body.length];
        System.arraycopy(selector, 0, result, 0, selector.length);
        System.arraycopy(body, 0, result, selector.length, body.length);
        return result;
    }

    private static byte[] encodeStatic(final AbiType arg) {
        if (arg instanceof UInt uint) {
            return uintWord(uint.value());
        }
        if (arg instanceof Int signed) {
            return signedWord(signed.value());
        }
        if (arg instanceof Bytes32 bytes) {
            return bytes.value();
        }
        throw new IllegalArgumentException("not a static type: " + arg.typeName());
    }

    private static byte[] encodeDynamic(final AbiType arg) {
        if (arg instanceof Utf8String string) {
            return lengthPrefixed(string.value().getBytes(StandardCharsets.UTF_8));
        }
        if (arg instanceof DynamicBytes bytes) {
            return lengthPrefixed(bytes.value());
        }
        if (arg instanceof WordArray array) {
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            out.writeBytes(uintWord(BigInteger.valueOf(array.elements().size())));
            for (AbiType element : array.elements()) {
                out.writeBytes(encodeStatic(element));
            }
            return out.toByteArray();
        }
        throw new IllegalArgumentException("unsupported dynamic type: " + arg.typeName());
    }

    private static byte[] lengthPrefixed(final byte[] payload) {
        final int padded = (payload.length + WORD - 1) / WORD * WORD;
        final byte[] out = new byte[WORD + padded];
        System.arraycopy(uintWord(BigInteger.valueOf(payload.length)), 0, out, 0, WORD);
        System.arraycopy(payload, 0, out, WORD, payload.length);
        return out;
    }

    private static byte[] signedWord(final BigInteger value) {
        if (value.signum() >= 0) {
            return uintWord(value);
        }
        final byte[] raw = value.toByteArray();
        final byte[] word = new byte[WORD];
        Arrays.fill(word, (byte) 0xFF);
        System.arraycopy(raw, 0, word, WORD - raw.length, raw.length);
        return word;
    }

    private static byte[] uintWord(final BigInteger value) {
        final byte[] raw = value.toByteArray();
        final int start = raw.length > WORD ? raw.length - WORD : 0;
        return Hex.padLeft(Arrays.copyOfRange(raw, start, raw.length), WORD);
    }
}
