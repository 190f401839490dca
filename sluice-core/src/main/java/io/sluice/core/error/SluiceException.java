// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.core.error;

/**
 * Base runtime exception for all Sluice failures.
 *
 * <p>
 * This sealed class forms the root of Sluice's exception hierarchy, so callers
 * can catch every library-specific error with a single clause while the
 * scheduler can still tell the cases apart.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * SluiceException
 * ├── {@link RpcException} - JSON-RPC transport failures (HTTP status, node error, I/O)
 * └── {@link DecodeException} - payload decoding failures (never retried)
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * reader.fetchUserData(txId).exceptionally(error -> {
 *     Throwable cause = error instanceof CompletionException ? error.getCause() : error;
 *     if (cause instanceof RpcException rpc && rpc.httpStatus() != null) {
 *         // node or gateway rejected the call
 *     }
 *     return Optional.empty();
 * });
 * }</pre>
 */
public sealed class SluiceException extends RuntimeException
        permits RpcException,
        DecodeException {

    public SluiceException(final String message) {
        super(message);
    }

    public SluiceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
