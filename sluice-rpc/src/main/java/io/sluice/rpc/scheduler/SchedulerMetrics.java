// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

import java.time.Duration;

/**
 * Listener for {@link RequestScheduler} events, for wiring into Micrometer,
 * Prometheus or a custom monitoring system. By default a no-op implementation
 * is used ({@link #noop()}).
 *
 * <pre>{@code
 * RequestScheduler scheduler = RequestScheduler.builder()
 *         .metrics(new MyMicrometerMetrics(meterRegistry))
 *         .build();
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> Callbacks run on the scheduler's dispatcher
 * thread and should return quickly. Exceptions thrown from a callback are
 * logged and otherwise ignored.
 */
public interface SchedulerMetrics {

    /**
     * Called when an attempt is dispatched.
     *
     * @param serviceId   the caller-supplied service tag
     * @param description the request description
     * @param attempt     zero for the first attempt, then the retry number
     */
    default void onDispatched(String serviceId, String description, int attempt) {
    }

    /**
     * Called when a request completes successfully.
     *
     * @param serviceId the caller-supplied service tag
     * @param waited    time from first enqueue to completion
     */
    default void onSucceeded(String serviceId, Duration waited) {
    }

    /**
     * Called for every attempt that failed with a rate-limit error.
     */
    default void onRateLimited(String serviceId) {
    }

    /**
     * Called when a retry is scheduled.
     *
     * @param serviceId the caller-supplied service tag
     * @param attempt   the retry number about to run (1-based)
     * @param delay     the backoff before the retry is requeued
     */
    default void onRetryScheduled(String serviceId, int attempt, Duration delay) {
    }

    /**
     * Called when a request fails for good.
     */
    default void onFailed(String serviceId, Throwable error) {
    }

    static SchedulerMetrics noop() {
        return NoopSchedulerMetrics.INSTANCE;
    }
}

enum NoopSchedulerMetrics implements SchedulerMetrics {
    INSTANCE
}
