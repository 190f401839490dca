// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc;

import static io.sluice.rpc.internal.RpcUtils.MAPPER;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;

import org.jspecify.annotations.Nullable;

/**
 * Represents a JSON-RPC 2.0 response from a node.
 * <p>
 * Holds either a successful result or an error. Use {@link #hasError()} to
 * check which is present.
 *
 * @param jsonrpc the JSON-RPC version (always "2.0")
 * @param result  the result object if successful, or {@code null}
 * @param error   the error object if failed, or {@code null}
 * @param id      the request ID that this response corresponds to
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        @Nullable Object result,
        @Nullable JsonRpcError error,
        @Nullable String id) {

    public boolean hasError() {
        return error != null;
    }

    /**
     * Returns the result as a Map, for object results such as
     * {@code getBalance} or {@code getTransaction}.
     *
     * @return the result as a map, or {@code null} if result is null
     * @throws IllegalArgumentException if the result cannot be converted to a map
     */
    @SuppressWarnings("unchecked")
    public @Nullable Map<String, Object> resultAsMap() {
        if (result == null) {
            return null;
        }
        if (result instanceof Map<?, ?>) {
            return (Map<String, Object>) result;
        }
        return MAPPER.convertValue(result, new TypeReference<Map<String, Object>>() {});
    }
}
