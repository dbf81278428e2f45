// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for the executors the engine runs its timers on.
 *
 * <p>
 * Refresh ticks are short: they recount or re-aggregate and publish one
 * message. A small pool of daemon platform threads serves every session of a
 * registry; sessions never share mutable state through it.
 *
 * <pre>{@code
 * ScheduledExecutorService scheduler = LiveQueryExecutors.newRefreshScheduler(4);
 * SubscriptionRegistry registry = new SubscriptionRegistry(index, engine, scheduler);
 * }</pre>
 */
public final class LiveQueryExecutors {

    /**
     * Counter for unique refresh thread names.
     */
    private static final AtomicInteger REFRESH_THREAD_ID = new AtomicInteger(0);

    private LiveQueryExecutors() {
        // Utility class
    }

    /**
     * Creates a refresh scheduler with two threads.
     *
     * @return a scheduler with daemon threads named {@code livequery-refresh-N}
     */
    public static ScheduledExecutorService newRefreshScheduler() {
        return newRefreshScheduler(2);
    }

    /**
     * Creates a refresh scheduler with a custom number of threads.
     *
     * <p>
     * Cancelled timers are removed from the work queue immediately, so
     * subscription churn does not accumulate dead tasks.
     *
     * @param threads the number of threads in the pool
     * @return a scheduled thread pool with daemon platform threads
     * @throws IllegalArgumentException if threads is less than 1
     */
    public static ScheduledExecutorService newRefreshScheduler(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(threads, r -> {
            // Mask off sign bit to ensure non-negative thread IDs even after integer overflow
            int id = REFRESH_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
            Thread t = new Thread(r, "livequery-refresh-" + id);
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
