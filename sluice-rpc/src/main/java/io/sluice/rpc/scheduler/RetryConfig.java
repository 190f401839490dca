// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

/**
 * Retry settings for a {@link RequestScheduler}, fixed for its lifetime.
 *
 * <p><strong>Backoff Formula:</strong>
 * <pre>
 *   delay = min(baseDelayMs * 2^retryAttempt, maxDelayMs)
 * </pre>
 * Rate-limited failures additionally wait at least the scheduler's rate-limit
 * floor (5000ms unless overridden); see {@link RetryBackoff}.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * RetryConfig patient = RetryConfig.builder()
 *     .maxRetries(8)
 *     .maxDelayMs(60_000)
 *     .build();
 * }</pre>
 *
 * @param maxRetries  retries allowed after the first attempt (must be &gt;= 0)
 * @param baseDelayMs delay before the first retry (must be &gt; 0)
 * @param maxDelayMs  upper bound on any retry delay (must be &gt;= baseDelayMs)
 */
public record RetryConfig(int maxRetries, long baseDelayMs, long maxDelayMs) {

    /** Default retry budget: 5. */
    public static final int DEFAULT_MAX_RETRIES = 5;

    /** Default base delay: 2000ms. */
    public static final long DEFAULT_BASE_DELAY_MS = 2000;

    /** Default maximum delay: 30000ms. */
    public static final long DEFAULT_MAX_DELAY_MS = 30_000;

    /**
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                    "maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs + " < " + baseDelayMs);
        }
    }

    public static RetryConfig defaults() {
        return new RetryConfig(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder initialized with the defaults.
     */
    public static final class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long baseDelayMs = DEFAULT_BASE_DELAY_MS;
        private long maxDelayMs = DEFAULT_MAX_DELAY_MS;

        private Builder() {}

        public Builder maxRetries(final int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseDelayMs(final long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
            return this;
        }

        public Builder maxDelayMs(final long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any parameter is invalid
         */
        public RetryConfig build() {
            return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs);
        }
    }
}
