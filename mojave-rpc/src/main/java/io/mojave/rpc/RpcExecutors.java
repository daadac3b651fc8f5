// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for the executors that run RPC handlers.
 *
 * <p>
 * Handlers are mostly I/O-bound (forwarding upstream, reading chain storage),
 * so the default executor grows with demand instead of queueing behind a fixed
 * pool; a handler that blocks must not delay its sibling batch items.
 *
 * @since 0.1.0
 */
public final class RpcExecutors {

    private static final AtomicInteger IO_THREAD_ID = new AtomicInteger(0);

    private RpcExecutors() {
        // Utility class
    }

    /**
     * Creates an executor for I/O-bound handler work.
     *
     * <p>
     * Threads are daemon threads named {@code mojave-rpc-N} and are reclaimed
     * after sixty seconds of idleness.
     *
     * @return a cached thread pool
     */
    public static ExecutorService newIoBoundExecutor() {
        return Executors.newCachedThreadPool(r -> {
            // Mask off sign bit to ensure non-negative thread IDs even after integer overflow
            int id = IO_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
            Thread t = new Thread(r, "mojave-rpc-" + id);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates a bounded executor, for deployments that want to cap handler
     * concurrency.
     *
     * @param threads the number of threads in the pool
     * @return a fixed-size thread pool
     * @throws IllegalArgumentException if threads is less than 1
     */
    public static ExecutorService newBoundedExecutor(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        return Executors.newFixedThreadPool(threads, r -> {
            int id = IO_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
            Thread t = new Thread(r, "mojave-rpc-" + id);
            t.setDaemon(true);
            return t;
        });
    }
}
