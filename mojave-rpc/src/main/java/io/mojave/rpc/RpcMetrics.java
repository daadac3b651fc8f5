// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import java.time.Duration;

/**
 * Metrics callback interface for observing dispatch activity.
 *
 * <p>
 * Implement this interface to bridge into Micrometer, Prometheus or any other
 * collector. All methods have empty default implementations, so only the
 * events of interest need overriding.
 *
 * <p>
 * <strong>Thread Safety:</strong> callbacks are invoked from handler
 * completion threads, concurrently for the items of a batch. Implementations
 * must be thread-safe and should not block.
 *
 * <pre>{@code
 * RpcServiceConfig config = RpcServiceConfig.builder()
 *         .metrics(new RpcMetrics() {
 *             @Override
 *             public void onRequestCompleted(String method, Duration latency) {
 *                 timer(method).record(latency);
 *             }
 *         })
 *         .build();
 * }</pre>
 *
 * @since 0.1.0
 */
public interface RpcMetrics {

    /**
     * Called when a resolved handler is about to be invoked.
     *
     * @param method the method name
     */
    default void onRequestStarted(String method) {
    }

    /**
     * Called when a handler produced a result.
     *
     * @param method  the method name
     * @param latency time from invocation to completion
     */
    default void onRequestCompleted(String method, Duration latency) {
    }

    /**
     * Called when a decoded request ended in an error response, including
     * validation and lookup failures and timeouts. Bodies or batch elements
     * that cannot be decoded into a request are not reported.
     *
     * @param method the method name, possibly empty
     * @param code   the wire error code
     */
    default void onRequestFailed(String method, int code) {
    }

    /**
     * Called when a handler did not complete within its timeout.
     *
     * @param method the method name
     */
    default void onRequestTimeout(String method) {
    }

    /**
     * Called once per batch body, before its items are dispatched.
     *
     * @param size the number of items in the batch
     */
    default void onBatch(int size) {
    }

    /**
     * Returns a no-op metrics instance.
     */
    static RpcMetrics noop() {
        return NoopMetrics.INSTANCE;
    }
}

/**
 * Singleton no-op implementation of {@link RpcMetrics}.
 */
enum NoopMetrics implements RpcMetrics {
    INSTANCE
}
