// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

/**
 * Throttling parameters of a {@link RequestScheduler}.
 *
 * <p>
 * Instances are immutable. The scheduler holds the live value and swaps it
 * atomically on {@link RequestScheduler#updateRateConfig(RateConfigUpdate)}.
 *
 * @param minIntervalMs         minimum spacing between two dispatches (&gt;= 0)
 * @param maxConcurrentRequests maximum in-flight operations (&gt;= 1)
 * @param requestsPerSecond     nominal rate, kept consistent with
 *                              {@code minIntervalMs} when set through
 *                              {@link #of(double, int)}
 */
public record RateConfig(long minIntervalMs, int maxConcurrentRequests, double requestsPerSecond) {

    public static final double DEFAULT_REQUESTS_PER_SECOND = 1.0;
    public static final long DEFAULT_MIN_INTERVAL_MS = 1000;
    public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 2;

    public RateConfig {
        if (minIntervalMs < 0) {
            throw new IllegalArgumentException("minIntervalMs must be >= 0, got: " + minIntervalMs);
        }
        if (maxConcurrentRequests < 1) {
            throw new IllegalArgumentException("maxConcurrentRequests must be >= 1, got: " + maxConcurrentRequests);
        }
        if (!(requestsPerSecond > 0) || Double.isInfinite(requestsPerSecond)) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0, got: " + requestsPerSecond);
        }
    }

    /**
     * Returns 1 request per second, 1000ms spacing and 2 concurrent requests.
     */
    public static RateConfig defaults() {
        return new RateConfig(DEFAULT_MIN_INTERVAL_MS, DEFAULT_MAX_CONCURRENT_REQUESTS, DEFAULT_REQUESTS_PER_SECOND);
    }

    /**
     * Creates a config whose interval is derived from the rate.
     *
     * @param requestsPerSecond     the rate (&gt; 0)
     * @param maxConcurrentRequests the concurrency cap (&gt;= 1)
     * @return the new config
     */
    public static RateConfig of(final double requestsPerSecond, final int maxConcurrentRequests) {
        return new RateConfig(intervalFor(requestsPerSecond), maxConcurrentRequests, requestsPerSecond);
    }

    /**
     * Returns {@code ceil(1000 / requestsPerSecond)}.
     *
     * @throws IllegalArgumentException if {@code requestsPerSecond <= 0}
     */
    public static long intervalFor(final double requestsPerSecond) {
        if (!(requestsPerSecond > 0) || Double.isInfinite(requestsPerSecond)) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0, got: " + requestsPerSecond);
        }
        return (long) Math.ceil(1000.0 / requestsPerSecond);
    }

    public RateConfig withMinIntervalMs(final long minIntervalMs) {
        return new RateConfig(minIntervalMs, maxConcurrentRequests, requestsPerSecond);
    }

    /**
     * Applies a partial update. A present {@code requestsPerSecond} wins over an
     * explicit {@code minIntervalMs}.
     *
     * @param update the fields to change
     * @return the merged config
     * @throws IllegalArgumentException if a merged field is out of range
     */
    public RateConfig merge(final RateConfigUpdate update) {
        double rps = requestsPerSecond;
        long interval = minIntervalMs;
        int cap = maxConcurrentRequests;

        if (update.maxConcurrentRequests() != null) {
            cap = update.maxConcurrentRequests();
        }
        if (update.requestsPerSecond() != null) {
            rps = update.requestsPerSecond();
            interval = intervalFor(rps);
        } else if (update.minIntervalMs() != null) {
            interval = update.minIntervalMs();
        }
        return new RateConfig(interval, cap, rps);
    }
}
