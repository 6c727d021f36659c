// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import sh.agentscore.core.DebugLogger;
import sh.agentscore.core.LogFormatter;
import sh.agentscore.core.error.RpcException;
import sh.agentscore.rpc.internal.RpcUtils;

/**
 * {@link LedgerProvider} over HTTP POST using {@link java.net.http.HttpClient}.
 *
 * <p>Request ids are sequential per provider. Non-2xx statuses fail with code
 * {@value #HTTP_ERROR_CODE}, I/O failures with {@value #NETWORK_ERROR_CODE} and
 * unparseable bodies with {@value #PARSE_ERROR_CODE}.
 */
public final class HttpLedgerProvider implements LedgerProvider {
    static final int NETWORK_ERROR_CODE = -32000;
    static final int HTTP_ERROR_CODE = -32001;
    static final int PARSE_ERROR_CODE = -32700;

    private final RpcConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = RpcUtils.MAPPER;
    private final AtomicLong ids = new AtomicLong(1L);

    private HttpLedgerProvider(final RpcConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    @Override
    public JsonRpcResponse send(final String method, final List<?> params) throws RpcException {
        final List<?> safeParams = params == null ? List.of() : params;
        final long requestId = ids.getAndIncrement();
        final JsonRpcRequest request = new JsonRpcRequest("2.0", method, safeParams, String.valueOf(requestId));
        final String payload = serialize(request, requestId);
        DebugLogger.logRpc("[RPC-REQUEST] %s", payload);

        final long start = System.nanoTime();
        final HttpResponse<String> response = execute(buildRequest(payload), requestId);
        final long durationNanos = System.nanoTime() - start;

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(
                    method, response.statusCode(), "HTTP " + response.statusCode(), durationNanos));
            throw new RpcException(
                    HTTP_ERROR_CODE,
                    "HTTP error for method " + method + ": " + response.statusCode(),
                    response.body(),
                    requestId,
                    null);
        }

        final JsonRpcResponse rpcResponse = parseResponse(method, response.body(), requestId);
        if (rpcResponse.hasError()) {
            final JsonRpcError err = rpcResponse.error();
            DebugLogger.logRpc(LogFormatter.formatRpcError(method, err.code(), err.message(), durationNanos));
            throw new RpcException(err.code(), err.message(), RpcUtils.extractErrorData(err.data()), requestId);
        }
        DebugLogger.logRpc(LogFormatter.formatRpc(method, requestId, durationNanos));
        return rpcResponse;
    }

    private String serialize(final JsonRpcRequest request, final long requestId) {
        try {
            return mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new RpcException(
                    PARSE_ERROR_CODE, "Unable to serialize JSON-RPC request for " + request.method(), null, requestId, e);
        }
    }

    private HttpRequest buildRequest(final String payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.url()))
                .header("Content-Type", "application/json")
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload));
        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    private HttpResponse<String> execute(final HttpRequest request, final long requestId) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException(NETWORK_ERROR_CODE, "Interrupted during JSON-RPC call", null, requestId, e);
        } catch (IOException e) {
            throw new RpcException(NETWORK_ERROR_CODE, "Network error during JSON-RPC call", null, requestId, e);
        }
    }

    private JsonRpcResponse parseResponse(final String method, final String body, final long requestId) {
        try {
            return mapper.readValue(body, JsonRpcResponse.class);
        } catch (JsonProcessingException e) {
            throw new RpcException(
                    PARSE_ERROR_CODE, "Unable to parse JSON-RPC response for method " + method, body, requestId, e);
        }
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public HttpLedgerProvider build() {
            return new HttpLedgerProvider(new RpcConfig(url, connectTimeout, readTimeout, headers));
        }
    }
}
