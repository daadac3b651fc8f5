// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import io.mojave.core.error.RpcException;
import io.mojave.core.jsonrpc.JsonRpcRequest;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Uniform contract for every JSON-RPC method handler and namespace fallback.
 *
 * <p>
 * A handler receives the decoded request and the shared context and returns a
 * future of its result. The result may be any Jackson-serializable value or a
 * {@link com.fasterxml.jackson.databind.JsonNode}; {@code null} becomes a JSON
 * {@code null} result.
 *
 * <p>
 * <strong>Failures:</strong> complete the future exceptionally (or throw) with
 * an {@link RpcException} to send a specific error to the client. Any other
 * throwable is treated as an unexpected fault and the client receives an opaque
 * internal error.
 *
 * <p>
 * <strong>Thread Safety:</strong> a handler may be invoked concurrently for
 * different requests, including items of the same batch. The context is shared
 * by reference; any mutable state inside it must synchronize itself.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * RpcHandler<NodeContext> chainId = RpcHandler.sync((request, ctx) -> ctx.chainIdHex());
 * RpcHandler<NodeContext> getProof = (request, ctx) -> ctx.prover().proofAsync(request.param(0));
 * }</pre>
 *
 * @param <C> the context type
 * @since 0.1.0
 */
@FunctionalInterface
public interface RpcHandler<C> {

    /**
     * Handles one request.
     *
     * @param request the decoded request, already validated
     * @param context the shared context supplied by the service
     * @return a future of the result
     */
    CompletableFuture<Object> handle(JsonRpcRequest request, C context);

    /**
     * Blocking variant of {@link RpcHandler}, for handlers that compute their
     * result directly.
     *
     * @param <C> the context type
     */
    @FunctionalInterface
    interface Blocking<C> {
        Object handle(JsonRpcRequest request, C context) throws Exception;
    }

    /**
     * Adapts a blocking handler. The dispatcher already runs handlers on its
     * executor, so the blocking call does not stall the caller.
     */
    static <C> RpcHandler<C> sync(final Blocking<C> handler) {
        Objects.requireNonNull(handler, "handler");
        return (request, context) -> {
            try {
                return CompletableFuture.completedFuture(handler.handle(request, context));
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }
}
