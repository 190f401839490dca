// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

/**
 * Point-in-time view of a {@link RequestScheduler}'s counters and queue.
 *
 * @param totalRequests     attempts dispatched, retries included
 * @param successful        requests that completed successfully
 * @param failed            requests that failed for good
 * @param rateLimited       attempts that failed with a rate-limit error
 * @param retriesUsed       retries scheduled
 * @param averageWaitTimeMs moving average of enqueue-to-success time
 * @param queueLength       requests waiting for dispatch
 * @param activeRequests    attempts in flight
 * @param rateConfig        the live rate configuration
 */
public record StatsSnapshot(
        long totalRequests,
        long successful,
        long failed,
        long rateLimited,
        long retriesUsed,
        double averageWaitTimeMs,
        int queueLength,
        int activeRequests,
        RateConfig rateConfig) {
}
