// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import com.fasterxml.jackson.databind.node.NullNode;
import io.mojave.core.jsonrpc.ErrorShaper;
import io.mojave.core.jsonrpc.JsonRpcCodec;
import io.mojave.core.jsonrpc.JsonRpcResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for transports: binds a context and a registry and turns raw
 * request bodies into raw response bodies.
 *
 * <p>
 * The service is transport-agnostic. An HTTP binding passes the POST body to
 * {@link #handle(byte[])} and writes back {@link RpcReply#body()}, choosing a
 * 4xx status when {@link RpcReply#malformed()} is set and omitting the body when
 * there is none. See {@link NettyRpcServer} for a ready-made binding.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * RpcRegistry<SequencerContext> registry = RpcRegistry.<SequencerContext>builder()
 *         .register("moj_getPendingJobIds", pendingJobs)
 *         .registerFallback(Namespace.ETH, UpstreamForwarder.builder(rpcUrl).build())
 *         .build();
 *
 * try (RpcService<SequencerContext> service = new RpcService<>(context, registry)) {
 *     RpcReply reply = service.handle(body).join();
 * }
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> {@link #handle(byte[])} may be called
 * concurrently from any number of transport threads. It never blocks the
 * caller and the returned future never completes exceptionally.
 *
 * @param <C> the context type passed to handlers
 * @since 0.1.0
 */
public final class RpcService<C> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RpcService.class);

    private final C context;
    private final RpcRegistry<C> registry;
    private final RpcServiceConfig config;
    private final BatchProcessor<C> processor;
    /** Executor created by this service, shut down on {@link #close()}; null if supplied by the caller. */
    private final @Nullable ExecutorService ownedExecutor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RpcService(final C context, final RpcRegistry<C> registry) {
        this(context, registry, RpcServiceConfig.defaults());
    }

    public RpcService(final C context, final RpcRegistry<C> registry, final RpcServiceConfig config) {
        this.context = Objects.requireNonNull(context, "context");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        if (config.executor() != null) {
            this.ownedExecutor = null;
            this.processor = new BatchProcessor<>(
                    new RpcDispatcher<>(registry, config.executor(), config.metrics()), config.metrics());
        } else {
            this.ownedExecutor = RpcExecutors.newIoBoundExecutor();
            this.processor = new BatchProcessor<>(
                    new RpcDispatcher<>(registry, ownedExecutor, config.metrics()), config.metrics());
        }
    }

    /**
     * Handles one submitted body with the configured handler timeout.
     *
     * @param body the raw request body, UTF-8 JSON
     * @return the reply to send back
     */
    public CompletableFuture<RpcReply> handle(final byte[] body) {
        return handle(body, config.handlerTimeout());
    }

    /**
     * Handles one submitted body, bounding each handler invocation by
     * {@code timeout}.
     *
     * @param body    the raw request body, UTF-8 JSON
     * @param timeout bound on each handler invocation
     * @return the reply to send back
     */
    public CompletableFuture<RpcReply> handle(final byte[] body, final Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        CompletableFuture<RpcReply> reply;
        try {
            reply = processor.process(body, context, timeout);
        } catch (RuntimeException e) {
            reply = CompletableFuture.failedFuture(e);
        }
        return reply.exceptionally(failure -> {
            log.error("Unexpected failure while processing RPC body", failure);
            return RpcReply.of(JsonRpcCodec.write(
                    JsonRpcResponse.failure(NullNode.getInstance(), ErrorShaper.shape(failure))));
        });
    }

    public C context() {
        return context;
    }

    public RpcRegistry<C> registry() {
        return registry;
    }

    public RpcServiceConfig config() {
        return config;
    }

    /**
     * Shuts down the handler executor if this service created it. In-flight
     * handlers are allowed to finish; an executor supplied through
     * {@link RpcServiceConfig} is left untouched.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true) || ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(config.handlerTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("RPC handlers still running after {}, abandoning them", config.handlerTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for RPC handlers to finish", e);
        }
    }
}
