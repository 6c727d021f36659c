// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigInteger;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import sh.agentscore.core.error.RpcException;

/**
 * Shared Jackson mapper and quantity helpers for the JSON-RPC layer.
 */
public final class RpcUtils {
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private RpcUtils() {
        // Utility class
    }

    /**
     * Flattens the {@code data} member of a JSON-RPC error to a string, preferring the
     * first nested hex string (revert data) when the node wraps it in an object or array.
     */
    public static @Nullable String extractErrorData(final @Nullable Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String s) {
            return s;
        }
        if (dataValue instanceof Map<?, ?> map) {
            return firstNested(map.values(), dataValue);
        }
        if (dataValue instanceof Iterable<?> iterable) {
            return firstNested(iterable, dataValue);
        }
        return dataValue.toString();
    }

    private static String firstNested(final Iterable<?> values, final Object fallback) {
        for (Object value : values) {
            final String nested = extractErrorData(value);
            if (nested != null && nested.startsWith("0x")) {
                return nested;
            }
        }
        return fallback.toString();
    }

    public static @Nullable String stringValue(final @Nullable Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Decodes a hex quantity such as {@code 0x1b4}.
     *
     * @throws RpcException if the value is missing or not hex
     */
    public static long decodeHexLong(final @Nullable Object value, final String field) {
        if (value == null) {
            throw new RpcException(-32602, "Missing quantity field: " + field, null, null);
        }
        final String hex = value.toString();
        final String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseLong(normalized, 16);
        } catch (NumberFormatException e) {
            throw new RpcException(-32602, "Invalid quantity for " + field + ": " + hex, null, null, e);
        }
    }

    public static BigInteger decodeHexBigInteger(final @Nullable String hex) {
        if (hex == null || hex.isEmpty()) {
            return BigInteger.ZERO;
        }
        final String normalized = hex.startsWith("0x") ? hex.substring(2) : hex;
        if (normalized.isEmpty()) {
            return BigInteger.ZERO;
        }
        return new BigInteger(normalized, 16);
    }

    public static String toQuantityHex(final BigInteger value) {
        return "0x" + value.toString(16);
    }

    public static String toHexBlock(final long block) {
        return "0x" + Long.toHexString(block);
    }
}
