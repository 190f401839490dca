// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

/**
 * Outcome of classifying a failed attempt.
 */
public enum FailureKind {
    /** The provider throttled the call. Retried with a longer minimum delay. */
    RATE_LIMITED,
    /** Network trouble or a server-side error. Retried with backoff. */
    TRANSIENT,
    /** Anything else. Never retried. */
    PERMANENT;

    public boolean isRetryable() {
        return this != PERMANENT;
    }
}
