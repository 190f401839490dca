// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for the executors Sluice runs on.
 *
 * <ul>
 * <li><strong>Dispatcher</strong>: one thread that owns a scheduler's queue and
 * timers. Delayed tasks are dropped on shutdown.</li>
 * <li><strong>I/O</strong>: an elastic pool for blocking transport calls. The
 * scheduler already caps concurrency, so the pool never grows past that cap in
 * practice.</li>
 * </ul>
 *
 * <p>
 * All threads are daemon threads with a recognizable name prefix.
 */
public final class SluiceExecutors {

    private static final AtomicInteger DISPATCHER_ID = new AtomicInteger(0);
    private static final AtomicInteger IO_ID = new AtomicInteger(0);

    private SluiceExecutors() {
        // Utility class
    }

    /**
     * Creates a single-threaded scheduled executor for a scheduler's drain loop.
     *
     * @return a scheduled executor with one daemon thread named {@code sluice-dispatcher-N}
     */
    public static ScheduledExecutorService newDispatcher() {
        final ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(1, daemonFactory("sluice-dispatcher-", DISPATCHER_ID));
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        return executor;
    }

    /**
     * Creates an executor for blocking I/O (transport calls).
     *
     * @return a cached thread pool with daemon threads named {@code sluice-io-N}
     */
    public static ExecutorService newIoBoundExecutor() {
        return Executors.newCachedThreadPool(daemonFactory("sluice-io-", IO_ID));
    }

    private static ThreadFactory daemonFactory(final String prefix, final AtomicInteger counter) {
        return r -> {
            // Mask off sign bit to ensure non-negative thread IDs even after integer overflow
            final int id = counter.getAndIncrement() & 0x7FFFFFFF;
            final Thread t = new Thread(r, prefix + id);
            t.setDaemon(true);
            return t;
        };
    }
}
