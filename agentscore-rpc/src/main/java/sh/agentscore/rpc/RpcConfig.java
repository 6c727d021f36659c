// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Transport settings for {@link HttpLedgerProvider}.
 *
 * @param url            the JSON-RPC endpoint
 * @param connectTimeout TCP connect timeout
 * @param readTimeout    per-request timeout
 * @param headers        extra HTTP headers, e.g. an API key
 */
public record RpcConfig(
        String url,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers) {

    private static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_READ = Duration.ofSeconds(30);

    public RpcConfig {
        Objects.requireNonNull(url, "url");
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static RpcConfig withDefaults(final String url) {
        return new RpcConfig(url, DEFAULT_CONNECT, DEFAULT_READ, Map.of());
    }
}
