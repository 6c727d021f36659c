// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;
import sh.agentscore.rpc.internal.RpcUtils;

/**
 * Inclusive block range plus contract and topic0 constraints for {@code eth_getLogs}.
 *
 * @param fromBlock first block, inclusive
 * @param toBlock   last block, inclusive
 * @param addresses emitting contracts; empty matches any
 * @param topic0    accepted event signatures; empty matches any
 */
public record LogFilter(long fromBlock, long toBlock, List<Address> addresses, List<Hash> topic0) {

    public LogFilter {
        if (fromBlock < 0) {
            throw new IllegalArgumentException("fromBlock cannot be negative: " + fromBlock);
        }
        if (toBlock < fromBlock) {
            throw new IllegalArgumentException("toBlock " + toBlock + " precedes fromBlock " + fromBlock);
        }
        addresses = List.copyOf(Objects.requireNonNull(addresses, "addresses"));
        topic0 = List.copyOf(Objects.requireNonNull(topic0, "topic0"));
    }

    public static LogFilter of(final long fromBlock, final long toBlock, final Address address, final List<Hash> topic0) {
        return new LogFilter(fromBlock, toBlock, List.of(address), topic0);
    }

    /** Same constraints over a different block range. */
    public LogFilter withRange(final long from, final long to) {
        return new LogFilter(from, to, addresses, topic0);
    }

    /** The JSON object passed as the single {@code eth_getLogs} parameter. */
    public Map<String, Object> toRequestParam() {
        final Map<String, Object> param = new LinkedHashMap<>();
        param.put("fromBlock", RpcUtils.toHexBlock(fromBlock));
        param.put("toBlock", RpcUtils.toHexBlock(toBlock));
        if (!addresses.isEmpty()) {
            final List<String> values = new ArrayList<>(addresses.size());
            for (Address address : addresses) {
                values.add(address.value());
            }
            param.put("address", values.size() == 1 ? values.get(0) : values);
        }
        if (!topic0.isEmpty()) {
            final List<String> values = new ArrayList<>(topic0.size());
            for (Hash topic : topic0) {
                values.add(topic.value());
            }
            param.put("topics", List.of(values));
        }
        return param;
    }
}
