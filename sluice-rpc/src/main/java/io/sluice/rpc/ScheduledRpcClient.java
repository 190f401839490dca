// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sluice.core.error.RpcException;
import io.sluice.rpc.scheduler.AsyncOperation;
import io.sluice.rpc.scheduler.RequestScheduler;

/**
 * JSON-RPC client whose every call goes through a shared
 * {@link RequestScheduler}.
 *
 * <p>
 * Each method submits a blocking {@link RpcTransport#send} to the I/O executor
 * as one scheduled operation, so rate limiting, retries and stats apply to
 * every call.
 *
 * <pre>{@code
 * ScheduledRpcClient rpc = sluice.rpc();
 * long lamports = rpc.getBalance("9xQeWvG816bUx9EPjHmaT23yvVM2ZWbrrpZb9PusVFin").join();
 * }</pre>
 */
public final class ScheduledRpcClient {

    private static final Logger log = LoggerFactory.getLogger(ScheduledRpcClient.class);

    public static final String DEFAULT_SERVICE_ID = "rpc";

    private final RpcTransport transport;
    private final RequestScheduler scheduler;
    private final Executor ioExecutor;
    private final String serviceId;

    public ScheduledRpcClient(
            final RpcTransport transport,
            final RequestScheduler scheduler,
            final Executor ioExecutor,
            final String serviceId) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
        this.serviceId = Objects.requireNonNull(serviceId, "serviceId");
    }

    /**
     * Returns the balance of {@code address} in lamports.
     */
    public CompletableFuture<Long> getBalance(final String address) {
        Objects.requireNonNull(address, "address");
        return call("getBalance", List.of(address), "getBalance " + address)
                .thenApply(response -> {
                    final Map<String, Object> result = response.resultAsMap();
                    if (result == null || !(result.get("value") instanceof Number)) {
                        throw new RpcException(RpcException.PARSE_ERROR,
                                "getBalance returned no numeric value for " + address);
                    }
                    return ((Number) result.get("value")).longValue();
                });
    }

    public CompletableFuture<NodeVersion> getVersion() {
        return call("getVersion", List.of(), "getVersion")
                .thenApply(response -> {
                    final Map<String, Object> result = response.resultAsMap();
                    if (result == null) {
                        throw new RpcException(RpcException.PARSE_ERROR, "getVersion returned null");
                    }
                    return NodeVersion.fromResult(result);
                });
    }

    /**
     * Fetches a confirmed transaction.
     *
     * @param signature the transaction signature
     * @return the raw result, or empty when the node does not know the transaction
     */
    public CompletableFuture<Optional<Map<String, Object>>> getTransaction(final String signature) {
        Objects.requireNonNull(signature, "signature");
        final Map<String, Object> options = new LinkedHashMap<>();
        options.put("commitment", "confirmed");
        options.put("maxSupportedTransactionVersion", 0);
        return call("getTransaction", List.of(signature, options), "getTransaction " + signature)
                .thenApply(response -> Optional.ofNullable(response.resultAsMap()));
    }

    /**
     * Checks that the node answers {@code getVersion}.
     *
     * @return a future that completes with {@code false} instead of failing
     */
    public CompletableFuture<Boolean> testConnection() {
        return getVersion().handle((version, error) -> {
            if (error != null) {
                log.warn("Connection test failed: {}", error.getMessage(), error);
                return false;
            }
            log.info("Connection test succeeded: solana-core {}", version.solanaCore());
            return true;
        });
    }

    private CompletableFuture<JsonRpcResponse> call(
            final String method, final List<?> params, final String description) {
        return scheduler.submit(
                AsyncOperation.blocking(() -> transport.send(method, params), ioExecutor),
                description,
                serviceId);
    }
}
