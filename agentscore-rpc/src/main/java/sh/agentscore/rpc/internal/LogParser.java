// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc.internal;

import static sh.agentscore.rpc.internal.RpcUtils.MAPPER;

import com.fasterxml.jackson.core.type.TypeReference;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import sh.agentscore.core.error.AbiDecodingException;
import sh.agentscore.core.model.LogEntry;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;
import sh.agentscore.core.types.HexData;

/**
 * Converts the {@code eth_getLogs} result into {@link LogEntry} values.
 *
 * <p>Block number and log index are required, since ingestion orders and keys events
 * by them.
 */
public final class LogParser {

    private LogParser() {
        // Utility class
    }

    public static List<LogEntry> parseLogs(final @Nullable Object value) {
        if (value == null) {
            return List.of();
        }
        final List<Map<String, Object>> rawLogs = MAPPER.convertValue(
                value, new TypeReference<List<Map<String, Object>>>() {});
        final List<LogEntry> logs = new ArrayList<>(rawLogs.size());
        for (Map<String, Object> map : rawLogs) {
            logs.add(parseLog(map));
        }
        return List.copyOf(logs);
    }

    public static LogEntry parseLog(final Map<String, Object> map) {
        final @Nullable String address = RpcUtils.stringValue(map.get("address"));
        final @Nullable String data = RpcUtils.stringValue(map.get("data"));
        final @Nullable String blockHash = RpcUtils.stringValue(map.get("blockHash"));
        final @Nullable String txHash = RpcUtils.stringValue(map.get("transactionHash"));
        if (address == null || txHash == null) {
            throw new AbiDecodingException("Log entry missing address or transactionHash: " + map);
        }
        if (map.get("blockNumber") == null || map.get("logIndex") == null) {
            throw new AbiDecodingException("Log entry missing blockNumber or logIndex: " + map);
        }

        final @Nullable List<String> topicsHex = MAPPER.convertValue(
                map.get("topics"), new TypeReference<List<String>>() {});
        final List<Hash> topics = new ArrayList<>();
        if (topicsHex != null) {
            for (String topic : topicsHex) {
                topics.add(new Hash(topic));
            }
        }

        return new LogEntry(
                new Address(address),
                data != null ? new HexData(data) : HexData.EMPTY,
                topics,
                RpcUtils.decodeHexLong(map.get("blockNumber"), "blockNumber"),
                blockHash != null ? new Hash(blockHash) : null,
                new Hash(txHash),
                RpcUtils.decodeHexLong(map.get("logIndex"), "logIndex"),
                Boolean.TRUE.equals(map.get("removed")));
    }
}
