// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * A unit of asynchronous work submitted to a {@link RequestScheduler}.
 *
 * <p>
 * The scheduler calls {@link #start()} once per attempt. Throwing from
 * {@code start()} counts as a failed attempt, just like returning a stage that
 * completes exceptionally.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    /**
     * Starts one attempt of this operation.
     *
     * @return a stage that completes with the attempt's outcome
     * @throws Exception if the attempt fails before producing a stage
     */
    CompletionStage<T> start() throws Exception;

    /**
     * Adapts a blocking call into an operation that runs on {@code executor}.
     *
     * @param call     the blocking call
     * @param executor the executor the call runs on
     * @param <T>      the result type
     * @return an operation that runs {@code call} once per attempt
     */
    static <T> AsyncOperation<T> blocking(final Callable<T> call, final Executor executor) {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(executor, "executor");
        return () -> CompletableFuture.supplyAsync(() -> {
            try {
                return call.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }
}
