// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

import java.util.Objects;

/**
 * Computes retry delays from a {@link RetryConfig}.
 *
 * <pre>
 *   delay = min(baseDelayMs * 2^attempt, maxDelayMs)
 *   rate limited: delay = max(delay, rateLimitFloorMs)
 * </pre>
 */
public final class RetryBackoff {

    /** Minimum wait after the provider throttles us. */
    public static final long DEFAULT_RATE_LIMIT_FLOOR_MS = 5000;

    private final RetryConfig config;
    private final long rateLimitFloorMs;

    public RetryBackoff(final RetryConfig config, final long rateLimitFloorMs) {
        this.config = Objects.requireNonNull(config, "config");
        if (rateLimitFloorMs < 0) {
            throw new IllegalArgumentException("rateLimitFloorMs must be >= 0, got: " + rateLimitFloorMs);
        }
        this.rateLimitFloorMs = rateLimitFloorMs;
    }

    public static RetryBackoff standard(final RetryConfig config) {
        return new RetryBackoff(config, DEFAULT_RATE_LIMIT_FLOOR_MS);
    }

    /**
     * Returns the delay before retry number {@code attempt + 1}.
     *
     * @param attempt the zero-based retry attempt that just failed
     * @param kind    the classification of the failure
     * @return the delay in milliseconds
     */
    public long delayMs(final int attempt, final FailureKind kind) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got: " + attempt);
        }
        final long exponential;
        // 2^62 already exceeds any sane cap; avoid shifting into the sign bit
        if (attempt >= 62 || config.baseDelayMs() > (Long.MAX_VALUE >> attempt)) {
            exponential = config.maxDelayMs();
        } else {
            exponential = Math.min(config.baseDelayMs() << attempt, config.maxDelayMs());
        }
        if (kind == FailureKind.RATE_LIMITED) {
            return Math.max(exponential, rateLimitFloorMs);
        }
        return exponential;
    }
}
