// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.primitives.rlp;

import java.util.List;
import java.util.Objects;

/**
 * Recursive Length Prefix encoder, used to serialize signed transactions.
 *
 * @see <a href="https://ethereum.org/en/developers/docs/data-structures-and-encoding/rlp/">RLP</a>
 */
public final class Rlp {
    private static final int SHORT_LIMIT = 55;

    private Rlp() {
        // Utility class
    }

    public static byte[] encode(final RlpItem item) {
        Objects.requireNonNull(item, "item cannot be null");
        return item.encode();
    }

    /**
     * Encodes a byte string.
     *
     * @param bytes the raw bytes
     * @return encoded bytes
     */
    public static byte[] encodeString(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length == 1 && (bytes[0] & 0xFF) <= 0x7F) {
            return new byte[] {bytes[0]};
        }
        return withHeader(0x80, bytes);
    }

    /**
     * Encodes a list of items.
     *
     * @param items the items
     * @return encoded bytes
     */
    public static byte[] encodeList(final List<RlpItem> items) {
        Objects.requireNonNull(items, "items cannot be null");
        final byte[][] encodedItems = new byte[items.size()][];
        int payloadSize = 0;
        for (int i = 0; i < encodedItems.length; i++) {
            final RlpItem item = items.get(i);
            Objects.requireNonNull(item, "items cannot contain null values");
            encodedItems[i] = item.encode();
            payloadSize += encodedItems[i].length;
        }

        final byte[] payload = new byte[payloadSize];
        int offset = 0;
        for (final byte[] encoded : encodedItems) {
            System.arraycopy(encoded, 0, payload, offset, encoded.length);
            offset += encoded.length;
        }
        return withHeader(0xC0, payload);
    }

    private static byte[] withHeader(final int base, final byte[] payload) {
        final int length = payload.length;
        if (length <= SHORT_LIMIT) {
            final byte[] result = new byte[1 + length];
            result[0] = (byte) (base + length);
            System.arraycopy(payload, 0, result, 1, length);
            return result;
        }

        final int lengthSize = lengthSize(length);
        final byte[] result = new byte[1 + lengthSize + length];
        result[0] = (byte) (base + SHORT_LIMIT + lengthSize);
        for (int i = 0; i < lengthSize; i++) {
            result[lengthSize - i] = (byte) (length >>> (8 * i));
        }
        System.arraycopy(payload, 0, result, 1 + lengthSize, length);
        return result;
    }

    private static int lengthSize(final int value) {
        if (value < 0x100) {
            return 1;
        }
        if (value < 0x10000) {
            return 2;
        }
        if (value < 0x1000000) {
            return 3;
        }
        return 4;
    }
}
