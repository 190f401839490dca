// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;

import io.sluice.core.error.DecodeException;
import io.sluice.core.error.RpcException;

/**
 * Classifies failures by structured fields first and message text second.
 *
 * <p>
 * <strong>Rate limited:</strong> HTTP 429, JSON-RPC code -32005 or 429, or a
 * message mentioning {@code 429}, {@code rate limit},
 * {@code too many requests} or {@code exceeded}.
 *
 * <p>
 * <strong>Transient:</strong> HTTP 5xx, an {@link IOException} anywhere in the
 * cause chain, or a message mentioning network trouble (timeouts, refused or
 * reset connections, DNS failures, "try again").
 *
 * <p>
 * Everything else, including {@link DecodeException}, is permanent.
 */
public enum DefaultFailureClassifier implements FailureClassifier {
    INSTANCE;

    private static final Pattern REQUEST_ID_PREFIX = Pattern.compile("^\\[requestId=\\d+]\\s*");

    private static final List<String> RATE_LIMIT_MARKERS =
            List.of("429", "rate limit", "too many requests", "exceeded");

    private static final List<String> TRANSIENT_MARKERS = List.of(
            "network",
            "timeout",
            "timed out",
            "connection",
            "enotfound",
            "econnreset",
            "temporarily unavailable",
            "try again");

    private static final int MAX_CAUSE_DEPTH = 16;

    @Override
    public FailureKind classify(final Throwable error) {
        final Throwable root = unwrap(error);
        if (root == null || root instanceof DecodeException) {
            return FailureKind.PERMANENT;
        }

        if (root instanceof RpcException) {
            final RpcException rpc = (RpcException) root;
            if (rpc.isRateLimited()) {
                return FailureKind.RATE_LIMITED;
            }
            if (rpc.isServerError()) {
                return FailureKind.TRANSIENT;
            }
        }

        final String message = normalizedMessage(root);
        if (containsAny(message, RATE_LIMIT_MARKERS)) {
            return FailureKind.RATE_LIMITED;
        }
        if (hasIoCause(root) || containsAny(message, TRANSIENT_MARKERS)) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.PERMANENT;
    }

    static Throwable unwrap(final Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean hasIoCause(final Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof IOException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String normalizedMessage(final Throwable error) {
        final String message = error.getMessage();
        if (message == null) {
            return "";
        }
        return REQUEST_ID_PREFIX.matcher(message).replaceFirst("").toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(final String message, final List<String> markers) {
        for (String marker : markers) {
            if (message.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
