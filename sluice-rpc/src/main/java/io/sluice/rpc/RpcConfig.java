// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings for {@link HttpRpcTransport}.
 *
 * @param url            the JSON-RPC endpoint
 * @param connectTimeout TCP connect timeout (defaults to 10s)
 * @param readTimeout    per-request timeout (defaults to 30s)
 * @param headers        extra HTTP headers sent with every request
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
}
