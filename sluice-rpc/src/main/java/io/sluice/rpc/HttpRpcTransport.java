// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc;

import static io.sluice.rpc.internal.RpcUtils.MAPPER;

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

import com.fasterxml.jackson.core.JsonProcessingException;

import io.sluice.core.DebugLogger;
import io.sluice.core.LogFormatter;
import io.sluice.core.error.RpcException;
import io.sluice.rpc.internal.RpcUtils;

/**
 * JSON-RPC 2.0 transport over HTTP(S) using the JDK {@link HttpClient}.
 *
 * <p>
 * Failures are reported as {@link RpcException} in a shape the scheduler's
 * failure classifier understands:
 * <ul>
 * <li>non-2xx status: {@link RpcException#httpStatus()} is set</li>
 * <li>JSON-RPC error object: {@link RpcException#code()} is the node's code</li>
 * <li>I/O failure: the {@link IOException} is the cause</li>
 * </ul>
 */
public final class HttpRpcTransport implements RpcTransport {

    private final RpcConfig config;
    private final HttpClient httpClient;
    private final AtomicLong ids = new AtomicLong(1L);

    private HttpRpcTransport(final RpcConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public RpcConfig config() {
        return config;
    }

    @Override
    public JsonRpcResponse send(final String method, final List<?> params) throws RpcException {
        final List<?> safeParams = params == null ? List.of() : params;
        final long requestId = ids.getAndIncrement();
        final JsonRpcRequest request = new JsonRpcRequest("2.0", method, safeParams, requestId);

        final String payload = serialize(request, requestId);
        final HttpRequest httpRequest = buildRequest(payload);
        DebugLogger.logRpc("[RPC-SEND] url=%s payload=%s", config.url(), payload);

        final long start = System.nanoTime();
        final HttpResponse<String> response = execute(httpRequest, method, requestId);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            DebugLogger.logRpc(
                    LogFormatter.formatRpcError(method, response.statusCode(),
                            "HTTP " + response.statusCode(), durationMicros));
            throw RpcException.httpStatus(response.statusCode(), method, response.body(), requestId);
        }

        final JsonRpcResponse rpcResponse = parseResponse(method, response.body(), requestId);
        if (rpcResponse.hasError()) {
            final JsonRpcError err = rpcResponse.error();
            DebugLogger.logRpc(
                    LogFormatter.formatRpcError(method, err.code(), err.message(), durationMicros));
            throw new RpcException(err.code(), err.message(), RpcUtils.extractErrorData(err.data()), requestId);
        }

        DebugLogger.logRpc(LogFormatter.formatRpc(method, durationMicros));
        return rpcResponse;
    }

    private String serialize(final JsonRpcRequest request, final long requestId) throws RpcException {
        try {
            return MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new RpcException(
                    RpcException.PARSE_ERROR,
                    "Unable to serialize JSON-RPC request for " + request.method(),
                    null,
                    null,
                    requestId,
                    e);
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

    private HttpResponse<String> execute(final HttpRequest request, final String method, final long requestId)
            throws RpcException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException(
                    RpcException.NETWORK_ERROR, "Interrupted during JSON-RPC call " + method, null, null, requestId, e);
        } catch (IOException e) {
            throw new RpcException(
                    RpcException.NETWORK_ERROR, "Network error during JSON-RPC call " + method, null, null, requestId, e);
        }
    }

    private JsonRpcResponse parseResponse(final String method, final String body, final long requestId)
            throws RpcException {
        try {
            return MAPPER.readValue(body, JsonRpcResponse.class);
        } catch (JsonProcessingException e) {
            throw new RpcException(
                    RpcException.PARSE_ERROR,
                    "Unable to parse JSON-RPC response for method " + method,
                    body,
                    null,
                    requestId,
                    e);
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

        public HttpRpcTransport build() {
            return new HttpRpcTransport(new RpcConfig(url, connectTimeout, readTimeout, new LinkedHashMap<>(headers)));
        }
    }
}
