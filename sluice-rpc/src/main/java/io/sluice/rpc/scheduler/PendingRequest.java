// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

import java.util.concurrent.CompletableFuture;

/**
 * A queued request. Mutable state is only touched on the dispatcher thread.
 */
final class PendingRequest<T> {

    private final AsyncOperation<T> operation;
    private final String description;
    private final String serviceId;
    private final long enqueuedAtNanos;
    private final CompletableFuture<T> completion = new CompletableFuture<>();
    private int retryAttempt;

    PendingRequest(
            final AsyncOperation<T> operation,
            final String description,
            final String serviceId,
            final long enqueuedAtNanos) {
        this.operation = operation;
        this.description = description;
        this.serviceId = serviceId;
        this.enqueuedAtNanos = enqueuedAtNanos;
    }

    AsyncOperation<T> operation() {
        return operation;
    }

    String description() {
        return description;
    }

    String serviceId() {
        return serviceId;
    }

    long enqueuedAtNanos() {
        return enqueuedAtNanos;
    }

    CompletableFuture<T> completion() {
        return completion;
    }

    int retryAttempt() {
        return retryAttempt;
    }

    void incrementRetryAttempt() {
        retryAttempt++;
    }
}
