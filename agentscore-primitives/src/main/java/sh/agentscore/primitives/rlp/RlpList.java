// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.primitives.rlp;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * RLP list of items.
 */
public record RlpList(List<RlpItem> items) implements RlpItem {

    public RlpList {
        Objects.requireNonNull(items, "items cannot be null");
        for (final RlpItem item : items) {
            if (item == null) {
                throw new IllegalArgumentException("items cannot contain null values");
            }
        }
        items = List.copyOf(items);
    }

    public static RlpList of(final RlpItem... items) {
        return new RlpList(Arrays.asList(items));
    }

    public static RlpList of(final List<RlpItem> items) {
        return new RlpList(items);
    }

    @Override
    public byte[] encode() {
        return Rlp.encodeList(items);
    }
}
