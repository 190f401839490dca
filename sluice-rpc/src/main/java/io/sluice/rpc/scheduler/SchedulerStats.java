// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters behind {@link RequestScheduler#getStats()}.
 *
 * <p>
 * Counters are written by the dispatcher thread and read from any thread.
 */
final class SchedulerStats {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successful = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();
    private final AtomicLong retriesUsed = new AtomicLong();

    // guarded by this
    private double averageWaitTimeMs;

    void recordAttempt() {
        totalRequests.incrementAndGet();
    }

    /**
     * Records a terminal success. The average has weight 1/2 and starts at zero.
     */
    void recordSuccess(final long waitedMs) {
        successful.incrementAndGet();
        synchronized (this) {
            averageWaitTimeMs = (averageWaitTimeMs + waitedMs) / 2.0;
        }
    }

    void recordFailure() {
        failed.incrementAndGet();
    }

    void recordRateLimited() {
        rateLimited.incrementAndGet();
    }

    void recordRetry() {
        retriesUsed.incrementAndGet();
    }

    void reset() {
        totalRequests.set(0);
        successful.set(0);
        failed.set(0);
        rateLimited.set(0);
        retriesUsed.set(0);
        synchronized (this) {
            averageWaitTimeMs = 0;
        }
    }

    StatsSnapshot snapshot(final int queueLength, final int activeRequests, final RateConfig rateConfig) {
        final double average;
        synchronized (this) {
            average = averageWaitTimeMs;
        }
        return new StatsSnapshot(
                totalRequests.get(),
                successful.get(),
                failed.get(),
                rateLimited.get(),
                retriesUsed.get(),
                average,
                queueLength,
                activeRequests,
                rateConfig);
    }
}
