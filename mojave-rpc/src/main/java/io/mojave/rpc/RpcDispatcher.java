// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import io.mojave.core.DebugLogger;
import io.mojave.core.LogFormatter;
import io.mojave.core.error.RpcErrorKind;
import io.mojave.core.error.RpcException;
import io.mojave.core.jsonrpc.ErrorShaper;
import io.mojave.core.jsonrpc.JsonRpcCodec;
import io.mojave.core.jsonrpc.JsonRpcError;
import io.mojave.core.jsonrpc.JsonRpcRequest;
import io.mojave.core.jsonrpc.JsonRpcResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a single decoded request to its response.
 *
 * <p>
 * Each request goes through these steps:
 * <ol>
 * <li><strong>Validate</strong> - {@code jsonrpc} must be {@code "2.0"} and
 * {@code method} non-empty, otherwise an {@code INVALID_REQUEST} response is
 * returned (echoing the id, or {@code null}), even for requests without id</li>
 * <li><strong>Resolve</strong> - {@link RpcRegistry#lookup(String)}; an
 * unresolved method yields {@code METHOD_NOT_FOUND}, which is dropped for a
 * notification</li>
 * <li><strong>Invoke</strong> - the handler runs on the executor, bounded by the
 * timeout</li>
 * <li><strong>Shape</strong> - the result or failure becomes a response via
 * {@link ErrorShaper}</li>
 * <li><strong>Suppress</strong> - for a notification the response of an invoked
 * handler is dropped; the handler's side effects remain</li>
 * </ol>
 *
 * <p>
 * The returned future never completes exceptionally: handler faults, including
 * synchronous throws and {@code null} futures, are caught here and become
 * internal errors. A timed-out handler is not interrupted, and a throwing
 * {@link RpcMetrics} callback is logged without affecting the response.
 *
 * @param <C> the context type passed to handlers
 * @since 0.1.0
 */
public final class RpcDispatcher<C> {

    private static final Logger log = LoggerFactory.getLogger(RpcDispatcher.class);

    private final RpcRegistry<C> registry;
    private final Executor executor;
    private final RpcMetrics metrics;

    public RpcDispatcher(final RpcRegistry<C> registry, final Executor executor, final RpcMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = GuardedMetrics.wrap(Objects.requireNonNull(metrics, "metrics"));
    }

    /**
     * Dispatches one request.
     *
     * @param request the decoded request
     * @param context the shared context handed to the handler
     * @param timeout bound on the handler invocation
     * @return the response, or empty if the request was a well-formed
     *         notification
     */
    public CompletableFuture<Optional<JsonRpcResponse>> dispatch(
            final JsonRpcRequest request, final C context, final Duration timeout) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(timeout, "timeout");

        final String invalid = validate(request);
        if (invalid != null) {
            log.debug("Rejecting invalid request id={}: {}", request.id(), invalid);
            return CompletableFuture.completedFuture(Optional.of(
                    reject(request, ErrorShaper.shape(RpcException.invalidRequest(invalid)))));
        }

        final String method = request.method();
        final Optional<RpcHandler<C>> handler = registry.lookup(method).handler();
        if (handler.isEmpty()) {
            log.debug("Method not found: {}", method);
            final JsonRpcResponse notFound = reject(request, ErrorShaper.shape(RpcErrorKind.METHOD_NOT_FOUND));
            final Optional<JsonRpcResponse> reply = request.isNotification() ? Optional.empty() : Optional.of(notFound);
            return CompletableFuture.completedFuture(reply);
        }

        log.debug("Dispatching RPC request method={} id={}", method, request.id());
        DebugLogger.logRpc(LogFormatter.formatDispatch(method, request.id(), request.params()));
        metrics.onRequestStarted(method);

        final long start = System.nanoTime();
        return invoke(handler.get(), request, context)
                .orTimeout(timeout.toNanos(), TimeUnit.NANOSECONDS)
                .handle((value, failure) -> complete(request, value, failure, start));
    }

    private CompletableFuture<Object> invoke(
            final RpcHandler<C> handler, final JsonRpcRequest request, final C context) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> handler.handle(request, context), executor)
                    .thenCompose(future -> future != null
                            ? future
                            : CompletableFuture.failedFuture(
                                    new IllegalStateException("handler returned no future for " + request.method())));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Optional<JsonRpcResponse> complete(
            final JsonRpcRequest request,
            final @Nullable Object value,
            final @Nullable Throwable failure,
            final long start) {
        final String method = request.method();
        final long durationMicros = (System.nanoTime() - start) / 1_000L;

        JsonRpcResponse response;
        if (failure == null) {
            response = success(request, value);
        } else {
            response = JsonRpcResponse.failure(request.replyId(), ErrorShaper.shape(failure));
            if (ErrorShaper.isTimeout(failure)) {
                metrics.onRequestTimeout(method);
            } else if (ErrorShaper.isUnexpected(failure)) {
                log.warn("Handler for {} failed unexpectedly", method, ErrorShaper.unwrap(failure));
            }
        }

        final JsonRpcError error = response.error();
        if (error == null) {
            log.debug("RPC request completed method={} duration_us={}", method, durationMicros);
            DebugLogger.logRpc(LogFormatter.formatResult(method, durationMicros));
            metrics.onRequestCompleted(method, Duration.ofNanos(durationMicros * 1_000L));
        } else {
            log.warn("RPC request failed method={} code={} message={} duration_us={}",
                    method, error.code(), error.message(), durationMicros);
            DebugLogger.logRpc(LogFormatter.formatRpcError(method, error.code(), error.message(), durationMicros));
            metrics.onRequestFailed(method, error.code());
        }

        if (request.isNotification()) {
            return Optional.empty();
        }
        return Optional.of(response);
    }

    private JsonRpcResponse success(final JsonRpcRequest request, final @Nullable Object value) {
        final JsonNode result;
        try {
            result = JsonRpcCodec.toNode(value);
        } catch (IllegalArgumentException e) {
            log.warn("Result of {} is not serializable", request.method(), e);
            return JsonRpcResponse.failure(request.replyId(), ErrorShaper.shape(e));
        }
        return JsonRpcResponse.success(request.replyId(), result);
    }

    private JsonRpcResponse reject(final JsonRpcRequest request, final JsonRpcError error) {
        metrics.onRequestFailed(request.method(), error.code());
        return JsonRpcResponse.failure(request.replyId(), error);
    }

    private static @Nullable String validate(final JsonRpcRequest request) {
        if (!JsonRpcRequest.VERSION.equals(request.jsonrpc())) {
            return "jsonrpc must be \"2.0\"";
        }
        if (request.method() == null || request.method().isEmpty()) {
            return "method must be a non-empty string";
        }
        return null;
    }
}
