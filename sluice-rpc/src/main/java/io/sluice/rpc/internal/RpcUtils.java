// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.internal;

import java.lang.reflect.Array;
import java.util.Map;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.jspecify.annotations.Nullable;

/**
 * Internal helpers shared by the RPC layer: the JSON mapper and error data
 * extraction.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper instance. Unknown response fields are
     * ignored because nodes add fields between releases.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private RpcUtils() {
    }

    /**
     * Flattens JSON-RPC error data to a string.
     *
     * <p>
     * Strings are returned as-is. Maps, iterables and arrays are searched for the
     * first nested string. Anything else falls back to {@code toString()}.
     *
     * @param dataValue the {@code error.data} value from a response
     * @return the extracted data, or {@code null} if there was none
     */
    public static @Nullable String extractErrorData(final @Nullable Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String s) {
            return s;
        }
        if (dataValue instanceof Map<?, ?> map) {
            return extractFromIterable(map.values(), dataValue);
        }
        if (dataValue instanceof Iterable<?> iterable) {
            return extractFromIterable(iterable, dataValue);
        }
        if (dataValue.getClass().isArray()) {
            final int length = Array.getLength(dataValue);
            for (int i = 0; i < length; i++) {
                final String nested = extractErrorData(Array.get(dataValue, i));
                if (nested != null) {
                    return nested;
                }
            }
            return dataValue.toString();
        }
        return dataValue.toString();
    }

    private static String extractFromIterable(final Iterable<?> iterable, final Object fallback) {
        for (Object value : iterable) {
            if (value instanceof String s) {
                return s;
            }
            if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
                final String nested = extractErrorData(value);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return fallback.toString();
    }
}
