// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a caller-supplied {@link RpcMetrics} so that a failing callback is
 * logged instead of failing the request it reports on.
 */
final class GuardedMetrics implements RpcMetrics {

    private static final Logger log = LoggerFactory.getLogger(GuardedMetrics.class);

    private final RpcMetrics delegate;

    private GuardedMetrics(final RpcMetrics delegate) {
        this.delegate = delegate;
    }

    static RpcMetrics wrap(final RpcMetrics metrics) {
        if (metrics instanceof GuardedMetrics || metrics == RpcMetrics.noop()) {
            return metrics;
        }
        return new GuardedMetrics(metrics);
    }

    @Override
    public void onRequestStarted(final String method) {
        try {
            delegate.onRequestStarted(method);
        } catch (RuntimeException e) {
            log.warn("Metrics callback onRequestStarted failed for {}", method, e);
        }
    }

    @Override
    public void onRequestCompleted(final String method, final Duration latency) {
        try {
            delegate.onRequestCompleted(method, latency);
        } catch (RuntimeException e) {
            log.warn("Metrics callback onRequestCompleted failed for {}", method, e);
        }
    }

    @Override
    public void onRequestFailed(final String method, final int code) {
        try {
            delegate.onRequestFailed(method, code);
        } catch (RuntimeException e) {
            log.warn("Metrics callback onRequestFailed failed for {}", method, e);
        }
    }

    @Override
    public void onRequestTimeout(final String method) {
        try {
            delegate.onRequestTimeout(method);
        } catch (RuntimeException e) {
            log.warn("Metrics callback onRequestTimeout failed for {}", method, e);
        }
    }

    @Override
    public void onBatch(final int size) {
        try {
            delegate.onBatch(size);
        } catch (RuntimeException e) {
            log.warn("Metrics callback onBatch failed for batch of {}", size, e);
        }
    }
}
