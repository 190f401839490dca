// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc;

import java.util.List;

import io.sluice.core.error.RpcException;

/**
 * Low-level abstraction for sending JSON-RPC requests to a blockchain node.
 *
 * <p>
 * Implementations handle serialization, the wire transport and response
 * parsing. They do <em>not</em> retry or throttle: callers route calls through
 * a {@link io.sluice.rpc.scheduler.RequestScheduler} for that, usually via
 * {@link ScheduledRpcClient}.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe.
 *
 * @see HttpRpcTransport
 */
public interface RpcTransport extends AutoCloseable {

    /**
     * Sends a JSON-RPC request and blocks until the response arrives.
     *
     * @param method the JSON-RPC method name (e.g. {@code "getBalance"})
     * @param params the list of parameters
     * @return the JSON-RPC response, never carrying an error
     * @throws RpcException if the request fails or the node returns an error
     */
    JsonRpcResponse send(String method, List<?> params) throws RpcException;

    /**
     * Creates a default HTTP transport.
     *
     * @param url the JSON-RPC endpoint URL
     * @return a new transport
     */
    static RpcTransport http(final String url) {
        return HttpRpcTransport.builder(url).build();
    }

    /**
     * Closes this transport and releases any associated resources.
     * The default implementation does nothing.
     */
    @Override
    default void close() {
    }
}
