// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sluice.core.DebugLogger;
import io.sluice.core.LogFormatter;
import io.sluice.rpc.SluiceExecutors;

/**
 * Rate-limited, retrying scheduler for calls to a shared provider.
 *
 * <p>
 * Requests run in FIFO order with at most
 * {@link RateConfig#maxConcurrentRequests()} in flight and at least
 * {@link RateConfig#minIntervalMs()} between two dispatches. Failed attempts
 * are classified by a {@link FailureClassifier}: rate-limited and transient
 * failures are retried with exponential backoff at the front of the queue,
 * everything else fails the caller's future at once.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try (RequestScheduler scheduler = RequestScheduler.builder()
 *         .rateConfig(RateConfig.of(2, 4))
 *         .build()) {
 *     CompletableFuture<Long> balance = scheduler.submit(
 *             () -> client.fetchBalanceAsync(address), "getBalance " + address, "wallet");
 * }
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> All methods may be called from any thread.
 * The queue, the in-flight count and the timers are owned by one dispatcher
 * thread ({@code sluice-dispatcher-N}); every mutation is posted to it.
 */
public final class RequestScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestScheduler.class);

    public static final String DEFAULT_DESCRIPTION = "RPC operation";
    public static final String DEFAULT_SERVICE_ID = "unknown";
    public static final Duration DEFAULT_EMERGENCY_PAUSE = Duration.ofSeconds(10);

    private final ScheduledExecutorService dispatcher;
    private final RetryConfig retryConfig;
    private final RetryBackoff backoff;
    private final FailureClassifier classifier;
    private final SchedulerMetrics metrics;
    private final SchedulerStats stats = new SchedulerStats();

    private final Object configLock = new Object();
    private volatile RateConfig rateConfig;
    // guarded by configLock
    private int activeBrakes;
    private long preBrakeIntervalMs;
    private volatile boolean closed;

    // Read-only mirrors for getStats(); the dispatcher owns the real state.
    private final AtomicInteger queueLength = new AtomicInteger();
    private final AtomicInteger activeCount = new AtomicInteger();

    // Dispatcher-confined state.
    private final Deque<PendingRequest<?>> queue = new ArrayDeque<>();
    private final Map<PendingRequest<?>, ScheduledFuture<?>> delayed = new HashMap<>();
    private int active;
    private boolean dispatchedOnce;
    private long lastDispatchNanos;
    private @Nullable ScheduledFuture<?> drainTimer;
    private long drainTimerDueNanos;

    private RequestScheduler(final Builder builder) {
        this.rateConfig = builder.rateConfig;
        this.retryConfig = builder.retryConfig;
        this.backoff = new RetryBackoff(builder.retryConfig, builder.rateLimitFloor.toMillis());
        this.classifier = builder.classifier;
        this.metrics = builder.metrics;
        this.dispatcher = SluiceExecutors.newDispatcher();
    }

    public static Builder builder() {
        return new Builder();
    }

    public <T> CompletableFuture<T> submit(final AsyncOperation<T> operation) {
        return submit(operation, DEFAULT_DESCRIPTION, DEFAULT_SERVICE_ID);
    }

    public <T> CompletableFuture<T> submit(final AsyncOperation<T> operation, final String description) {
        return submit(operation, description, DEFAULT_SERVICE_ID);
    }

    /**
     * Enqueues an operation and returns a future for its final outcome.
     *
     * <p>
     * The future completes with the first successful attempt's value, or fails
     * with the last attempt's error once retries are exhausted or a permanent
     * failure is seen. Cancelling the future before dispatch drops the request.
     *
     * @param operation   the work to run; started once per attempt
     * @param description a label for logs
     * @param serviceId   a tag for logs and metrics
     * @param <T>         the result type
     * @return the caller's future; fails with {@link RejectedExecutionException}
     *         if the scheduler is closed
     */
    public <T> CompletableFuture<T> submit(
            final AsyncOperation<T> operation, final String description, final String serviceId) {
        Objects.requireNonNull(operation, "operation");
        final PendingRequest<T> request = new PendingRequest<>(
                operation,
                description == null ? DEFAULT_DESCRIPTION : description,
                serviceId == null ? DEFAULT_SERVICE_ID : serviceId,
                System.nanoTime());

        if (closed) {
            request.completion().completeExceptionally(rejection());
            return request.completion();
        }

        post(() -> enqueue(request), () -> request.completion().completeExceptionally(rejection()));
        return request.completion();
    }

    /**
     * Returns a snapshot of the counters, the queue and the live config.
     * Calling it has no side effects.
     */
    public StatsSnapshot getStats() {
        return stats.snapshot(queueLength.get(), activeCount.get(), rateConfig);
    }

    /**
     * Zeroes the counters. Queued and in-flight work is untouched.
     */
    public void resetStats() {
        stats.reset();
        log.info("Scheduler stats reset");
    }

    public RateConfig getRateConfig() {
        return rateConfig;
    }

    public RetryConfig getRetryConfig() {
        return retryConfig;
    }

    /**
     * Merges {@code update} into the live config and runs a drain pass, so a
     * raised concurrency cap takes effect at once.
     *
     * @throws IllegalArgumentException if a merged value is out of range
     */
    public void updateRateConfig(final RateConfigUpdate update) {
        Objects.requireNonNull(update, "update");
        final RateConfig previous;
        final RateConfig next;
        synchronized (configLock) {
            previous = rateConfig;
            next = previous.merge(update);
            rateConfig = next;
        }
        log.info("Rate config updated: {} -> {}", previous, next);
        post(this::drain, () -> log.debug("Scheduler closed, rate config stored without drain"));
    }

    /**
     * Slows dispatch to one request per {@code duration}, then restores the
     * interval that was live before any brake was applied.
     *
     * <p>
     * Overlapping brakes stack: each one sets the interval to its own duration,
     * and the pre-brake interval comes back only when the last one releases. A
     * rate update during a brake may be overwritten by that restore.
     *
     * @param duration how long to brake, also used as the interval meanwhile
     */
    public void pause(final Duration duration) {
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must be >= 0, got: " + duration);
        }
        final long pauseMs = duration.toMillis();
        final long previousIntervalMs;
        synchronized (configLock) {
            previousIntervalMs = rateConfig.minIntervalMs();
            if (activeBrakes == 0) {
                preBrakeIntervalMs = previousIntervalMs;
            }
            activeBrakes++;
            rateConfig = rateConfig.withMinIntervalMs(pauseMs);
        }
        log.warn("Emergency brake applied: minIntervalMs {} -> {} for {}ms", previousIntervalMs, pauseMs, pauseMs);

        try {
            dispatcher.schedule(guard(this::releaseBrake), pauseMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler closed, brake release not scheduled");
        }
    }

    /**
     * Applies {@link #pause(Duration)} for {@link #DEFAULT_EMERGENCY_PAUSE}.
     */
    public void emergencyPause() {
        pause(DEFAULT_EMERGENCY_PAUSE);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops the dispatcher. Queued requests and pending retries fail with
     * {@link RejectedExecutionException}; attempts already in flight complete
     * with their own outcome but are not retried.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("Closing scheduler");
        try {
            dispatcher.execute(guard(this::rejectPendingAndShutdown));
        } catch (RejectedExecutionException e) {
            log.debug("Dispatcher already stopped");
        }
    }

    // ---- dispatcher thread ----

    private void enqueue(final PendingRequest<?> request) {
        if (closed) {
            request.completion().completeExceptionally(rejection());
            return;
        }
        queue.addLast(request);
        queueLength.incrementAndGet();
        log.debug("Queued {} for service {} (queue length {})",
                request.description(), request.serviceId(), queue.size());
        drain();
    }

    private void drain() {
        if (closed) {
            return;
        }
        final RateConfig config = rateConfig;
        final long intervalNanos = TimeUnit.MILLISECONDS.toNanos(config.minIntervalMs());

        while (!queue.isEmpty() && active < config.maxConcurrentRequests()) {
            final PendingRequest<?> head = queue.peekFirst();
            if (head.completion().isDone()) {
                queue.pollFirst();
                queueLength.decrementAndGet();
                log.debug("Dropping {}: completed before dispatch", head.description());
                continue;
            }

            final long now = System.nanoTime();
            if (dispatchedOnce) {
                final long remaining = intervalNanos - (now - lastDispatchNanos);
                if (remaining > 0) {
                    log.debug("Waiting {}ms before next dispatch", TimeUnit.NANOSECONDS.toMillis(remaining));
                    scheduleDrain(remaining);
                    return;
                }
            }

            queue.pollFirst();
            queueLength.decrementAndGet();
            lastDispatchNanos = now;
            dispatchedOnce = true;
            dispatch(head);
        }

        if (!queue.isEmpty() && intervalNanos > 0) {
            scheduleDrain(intervalNanos);
        }
    }

    private void scheduleDrain(final long delayNanos) {
        final long due = System.nanoTime() + delayNanos;
        if (drainTimer != null && !drainTimer.isDone()) {
            if (drainTimerDueNanos - due <= 0) {
                return;
            }
            drainTimer.cancel(false);
        }
        drainTimerDueNanos = due;
        drainTimer = dispatcher.schedule(guard(() -> {
            drainTimer = null;
            drain();
        }), delayNanos, TimeUnit.NANOSECONDS);
    }

    private <T> void dispatch(final PendingRequest<T> request) {
        active++;
        activeCount.incrementAndGet();
        stats.recordAttempt();

        final long waitedMs = elapsedMs(request);
        log.debug("Dispatching {} for service {} (attempt {}, waited {}ms)",
                request.description(), request.serviceId(), request.retryAttempt(), waitedMs);
        DebugLogger.logScheduler(LogFormatter.formatDispatch(
                request.description(), request.serviceId(), request.retryAttempt(), waitedMs));
        notifyMetrics(m -> m.onDispatched(request.serviceId(), request.description(), request.retryAttempt()));

        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(request.operation().start(), "operation returned null stage");
        } catch (Exception e) {
            stage = CompletableFuture.failedFuture(e);
        }

        stage.whenComplete((value, error) -> post(
                () -> onAttemptComplete(request, value, error),
                () -> completeAfterShutdown(request, value, error)));
    }

    private <T> void onAttemptComplete(final PendingRequest<T> request, final T value, final @Nullable Throwable error) {
        active--;
        activeCount.decrementAndGet();

        if (error == null) {
            final long waitedMs = elapsedMs(request);
            stats.recordSuccess(waitedMs);
            notifyMetrics(m -> m.onSucceeded(request.serviceId(), Duration.ofMillis(waitedMs)));
            log.debug("Completed {} for service {} in {}ms", request.description(), request.serviceId(), waitedMs);
            request.completion().complete(value);
        } else {
            handleFailure(request, DefaultFailureClassifier.unwrap(error));
        }
        drain();
    }

    private void handleFailure(final PendingRequest<?> request, final Throwable cause) {
        final FailureKind kind = classify(cause);
        if (kind == FailureKind.RATE_LIMITED) {
            stats.recordRateLimited();
            notifyMetrics(m -> m.onRateLimited(request.serviceId()));
            log.warn("Rate limit hit for {} (service {}): {}",
                    request.description(), request.serviceId(), cause.getMessage());
        }

        final int attempt = request.retryAttempt();
        if (kind.isRetryable() && attempt < retryConfig.maxRetries()
                && !closed && !request.completion().isDone()) {
            final long delayMs = backoff.delayMs(attempt, kind);
            request.incrementRetryAttempt();
            stats.recordRetry();
            notifyMetrics(m -> m.onRetryScheduled(request.serviceId(), attempt + 1, Duration.ofMillis(delayMs)));
            log.warn("Retrying {} for service {} in {}ms (retry {}/{}, {}): {}",
                    request.description(), request.serviceId(), delayMs, attempt + 1,
                    retryConfig.maxRetries(), kind, cause.getMessage());
            delayed.put(request, dispatcher.schedule(
                    guard(() -> requeue(request)), delayMs, TimeUnit.MILLISECONDS));
            return;
        }

        stats.recordFailure();
        notifyMetrics(m -> m.onFailed(request.serviceId(), cause));
        log.error("Request {} for service {} failed after {} attempt(s) ({}): {}",
                request.description(), request.serviceId(), attempt + 1, kind, cause.getMessage());
        request.completion().completeExceptionally(cause);
    }

    private void requeue(final PendingRequest<?> request) {
        delayed.remove(request);
        if (closed) {
            request.completion().completeExceptionally(rejection());
            return;
        }
        queue.addFirst(request);
        queueLength.incrementAndGet();
        drain();
    }

    private void releaseBrake() {
        final long restoredIntervalMs;
        synchronized (configLock) {
            activeBrakes--;
            if (activeBrakes > 0) {
                log.debug("Emergency brake expired, {} still active", activeBrakes);
                return;
            }
            restoredIntervalMs = preBrakeIntervalMs;
            rateConfig = rateConfig.withMinIntervalMs(restoredIntervalMs);
        }
        log.info("Emergency brake released: minIntervalMs restored to {}", restoredIntervalMs);
        drain();
    }

    private void rejectPendingAndShutdown() {
        if (drainTimer != null) {
            drainTimer.cancel(false);
            drainTimer = null;
        }
        final List<PendingRequest<?>> rejected = new ArrayList<>(queue);
        queue.clear();
        queueLength.set(0);
        for (Map.Entry<PendingRequest<?>, ScheduledFuture<?>> entry : delayed.entrySet()) {
            entry.getValue().cancel(false);
            rejected.add(entry.getKey());
        }
        delayed.clear();

        for (PendingRequest<?> request : rejected) {
            request.completion().completeExceptionally(rejection());
        }
        if (!rejected.isEmpty()) {
            log.info("Rejected {} pending request(s) on close", rejected.size());
        }
        dispatcher.shutdown();
    }

    // ---- any thread ----

    private <T> void completeAfterShutdown(final PendingRequest<T> request, final T value, final @Nullable Throwable error) {
        activeCount.decrementAndGet();
        if (error == null) {
            request.completion().complete(value);
        } else {
            request.completion().completeExceptionally(DefaultFailureClassifier.unwrap(error));
        }
    }

    private void post(final Runnable task, final Runnable onRejected) {
        try {
            dispatcher.execute(guard(task));
        } catch (RejectedExecutionException e) {
            onRejected.run();
        }
    }

    private FailureKind classify(final Throwable cause) {
        try {
            return Objects.requireNonNull(classifier.classify(cause), "classifier returned null");
        } catch (RuntimeException e) {
            log.warn("Failure classifier threw, treating failure as permanent", e);
            return FailureKind.PERMANENT;
        }
    }

    private void notifyMetrics(final Consumer<SchedulerMetrics> callback) {
        try {
            callback.accept(metrics);
        } catch (RuntimeException e) {
            log.warn("Scheduler metrics callback threw", e);
        }
    }

    private static Runnable guard(final Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduler task failed", e);
            }
        };
    }

    private static long elapsedMs(final PendingRequest<?> request) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - request.enqueuedAtNanos());
    }

    private static RejectedExecutionException rejection() {
        return new RejectedExecutionException("Scheduler is closed");
    }

    /**
     * Builder for {@link RequestScheduler}. All settings have defaults.
     */
    public static final class Builder {
        private RateConfig rateConfig = RateConfig.defaults();
        private RetryConfig retryConfig = RetryConfig.defaults();
        private FailureClassifier classifier = FailureClassifier.defaults();
        private SchedulerMetrics metrics = SchedulerMetrics.noop();
        private Duration rateLimitFloor = Duration.ofMillis(RetryBackoff.DEFAULT_RATE_LIMIT_FLOOR_MS);

        private Builder() {}

        public Builder rateConfig(final RateConfig rateConfig) {
            this.rateConfig = Objects.requireNonNull(rateConfig, "rateConfig");
            return this;
        }

        public Builder retryConfig(final RetryConfig retryConfig) {
            this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig");
            return this;
        }

        public Builder classifier(final FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier");
            return this;
        }

        public Builder metrics(final SchedulerMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics");
            return this;
        }

        /**
         * Sets the minimum delay before retrying a rate-limited attempt.
         * Defaults to 5 seconds.
         */
        public Builder rateLimitFloor(final Duration rateLimitFloor) {
            Objects.requireNonNull(rateLimitFloor, "rateLimitFloor");
            if (rateLimitFloor.isNegative()) {
                throw new IllegalArgumentException("rateLimitFloor must be >= 0, got: " + rateLimitFloor);
            }
            this.rateLimitFloor = rateLimitFloor;
            return this;
        }

        public RequestScheduler build() {
            return new RequestScheduler(this);
        }
    }
}
