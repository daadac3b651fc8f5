// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import java.time.Duration;
import java.util.concurrent.Executor;
import org.jspecify.annotations.Nullable;

/**
 * Configuration of an {@link RpcService}.
 *
 * @param handlerTimeout default bound on each handler invocation
 * @param executor       executor that runs handlers; when {@code null} the service
 *                       creates (and later closes) its own
 *                       {@link RpcExecutors#newIoBoundExecutor() I/O executor}
 * @param metrics        metrics callback, no-op by default
 */
public record RpcServiceConfig(
        Duration handlerTimeout,
        @Nullable Executor executor,
        RpcMetrics metrics) {

    public static final Duration DEFAULT_HANDLER_TIMEOUT = Duration.ofSeconds(30);

    public RpcServiceConfig {
        handlerTimeout = handlerTimeout == null ? DEFAULT_HANDLER_TIMEOUT : handlerTimeout;
        if (handlerTimeout.isNegative() || handlerTimeout.isZero()) {
            throw new IllegalArgumentException("handlerTimeout must be positive, got: " + handlerTimeout);
        }
        metrics = metrics == null ? RpcMetrics.noop() : metrics;
    }

    public static RpcServiceConfig defaults() {
        return new RpcServiceConfig(DEFAULT_HANDLER_TIMEOUT, null, RpcMetrics.noop());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration handlerTimeout = DEFAULT_HANDLER_TIMEOUT;
        private Executor executor;
        private RpcMetrics metrics = RpcMetrics.noop();

        private Builder() {
        }

        public Builder handlerTimeout(final Duration handlerTimeout) {
            if (handlerTimeout != null) {
                this.handlerTimeout = handlerTimeout;
            }
            return this;
        }

        public Builder executor(final Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder metrics(final RpcMetrics metrics) {
            if (metrics != null) {
                this.metrics = metrics;
            }
            return this;
        }

        public RpcServiceConfig build() {
            return new RpcServiceConfig(handlerTimeout, executor, metrics);
        }
    }
}
