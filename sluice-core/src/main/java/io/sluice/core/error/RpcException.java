// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.core.error;

import java.util.Locale;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a JSON-RPC request to a blockchain node fails.
 *
 * <p>
 * Failures come from three places, and this exception records which one:
 * <ul>
 * <li><strong>HTTP layer</strong>: the gateway answered with a non-2xx status.
 * {@link #httpStatus()} holds the status (429 for throttling, 5xx for server
 * trouble) and {@link #code()} is {@link #HTTP_ERROR}.</li>
 * <li><strong>JSON-RPC layer</strong>: the node answered with an error object.
 * {@link #code()} holds the JSON-RPC error code.</li>
 * <li><strong>Network</strong>: the call never completed. The cause is the
 * underlying {@link java.io.IOException} and {@link #code()} is
 * {@link #NETWORK_ERROR}.</li>
 * </ul>
 *
 * <p>
 * <strong>Common JSON-RPC Error Codes:</strong>
 * <ul>
 * <li><strong>-32700</strong>: Parse error (invalid JSON)</li>
 * <li><strong>-32602</strong>: Invalid method parameters</li>
 * <li><strong>-32603</strong>: Internal JSON-RPC error</li>
 * <li><strong>-32005</strong>: Node is behind / request limit exceeded</li>
 * </ul>
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      Error Specification</a>
 */
public final class RpcException extends SluiceException {

    /** Code used when the HTTP layer rejected the request. */
    public static final int HTTP_ERROR = -32001;

    /** Code used when the request failed before a response arrived. */
    public static final int NETWORK_ERROR = -32000;

    /** Code used when a payload could not be serialized or parsed. */
    public static final int PARSE_ERROR = -32700;

    private final int code;
    private final @Nullable String data;
    private final @Nullable Integer httpStatus;
    private final @Nullable Long requestId;

    public RpcException(
            final int code,
            final String message,
            final @Nullable String data,
            final @Nullable Integer httpStatus,
            final @Nullable Long requestId,
            final @Nullable Throwable cause) {
        super(augmentMessage(message, requestId), cause);
        this.code = code;
        this.data = data;
        this.httpStatus = httpStatus;
        this.requestId = requestId;
    }

    public RpcException(final int code, final String message, final @Nullable String data, final @Nullable Long requestId) {
        this(code, message, data, null, requestId, null);
    }

    public RpcException(final int code, final String message) {
        this(code, message, null, null, null, null);
    }

    /**
     * Creates an exception for a non-2xx HTTP response.
     *
     * @param status    the HTTP status code
     * @param method    the JSON-RPC method that was called
     * @param body      the response body, kept as error data
     * @param requestId the JSON-RPC request id
     * @return a new exception with {@link #httpStatus()} set
     */
    public static RpcException httpStatus(
            final int status, final String method, final @Nullable String body, final @Nullable Long requestId) {
        return new RpcException(
                HTTP_ERROR, "HTTP error for method " + method + ": " + status, body, status, requestId, null);
    }

    public int code() {
        return code;
    }

    public @Nullable String data() {
        return data;
    }

    public @Nullable Integer httpStatus() {
        return httpStatus;
    }

    public @Nullable Long requestId() {
        return requestId;
    }

    /**
     * Returns whether the node or gateway signalled throttling.
     */
    public boolean isRateLimited() {
        if ((httpStatus != null && httpStatus == 429) || code == 429 || code == -32005) {
            return true;
        }
        final String msg = getMessage();
        return msg != null && msg.toLowerCase(Locale.ROOT).contains("too many requests");
    }

    /**
     * Returns whether the HTTP layer reported a server-side (5xx) failure.
     */
    public boolean isServerError() {
        return httpStatus != null && httpStatus >= 500;
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + ", httpStatus="
                + httpStatus
                + ", requestId="
                + requestId
                + "}";
    }

    private static String augmentMessage(final String message, final @Nullable Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }

        return "[requestId=" + requestId + "] " + message;
    }
}
