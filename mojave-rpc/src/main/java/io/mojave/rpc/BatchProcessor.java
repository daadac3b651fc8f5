// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.mojave.core.error.RpcException;
import io.mojave.core.jsonrpc.ErrorShaper;
import io.mojave.core.jsonrpc.JsonRpcCodec;
import io.mojave.core.jsonrpc.JsonRpcRequest;
import io.mojave.core.jsonrpc.JsonRpcResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a request body into single requests and recombines their responses.
 *
 * <p>
 * <strong>Body handling:</strong>
 * <ul>
 * <li>invalid JSON or an empty body - one {@code PARSE_ERROR} response, flagged malformed</li>
 * <li>a JSON scalar - one {@code INVALID_REQUEST} response, flagged malformed</li>
 * <li>an object - dispatched as a single request</li>
 * <li>an empty array - one {@code INVALID_REQUEST} response object, not an array</li>
 * <li>a non-empty array - every element decoded and dispatched independently</li>
 * </ul>
 *
 * <p>
 * Batch items are started together and run concurrently. Responses are
 * collected by their index in the request array, so the reply order matches the
 * request order whatever order the handlers complete in. An element that is not
 * a request object yields an {@code INVALID_REQUEST} entry with id {@code null}
 * at its position; notification entries are omitted, and a batch made only of
 * notifications produces no body.
 *
 * @param <C> the context type passed to handlers
 * @since 0.1.0
 */
public final class BatchProcessor<C> {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    private final RpcDispatcher<C> dispatcher;
    private final RpcMetrics metrics;

    public BatchProcessor(final RpcDispatcher<C> dispatcher, final RpcMetrics metrics) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.metrics = GuardedMetrics.wrap(Objects.requireNonNull(metrics, "metrics"));
    }

    /**
     * Processes one submitted body.
     *
     * @param body    the raw body bytes
     * @param context the shared context handed to every handler
     * @param timeout bound on each handler invocation
     * @return the reply; never completes exceptionally
     */
    public CompletableFuture<RpcReply> process(final byte[] body, final C context, final Duration timeout) {
        final JsonNode root;
        try {
            root = JsonRpcCodec.readTree(body);
        } catch (RpcException e) {
            log.debug("Rejecting unparseable body ({} bytes)", body == null ? 0 : body.length);
            return CompletableFuture.completedFuture(RpcReply.malformed(JsonRpcCodec.write(orphan(e))));
        }

        if (root.isObject()) {
            return processOne(root, context, timeout)
                    .thenApply(response -> response
                            .map(r -> RpcReply.of(JsonRpcCodec.write(r)))
                            .orElseGet(RpcReply::none));
        }
        if (root.isArray()) {
            return processBatch(root, context, timeout);
        }
        log.debug("Rejecting body of JSON type {}", root.getNodeType());
        return CompletableFuture.completedFuture(RpcReply.malformed(JsonRpcCodec.write(
                orphan(RpcException.invalidRequest("body must be a JSON object or array")))));
    }

    private CompletableFuture<RpcReply> processBatch(final JsonNode array, final C context, final Duration timeout) {
        if (array.isEmpty()) {
            return CompletableFuture.completedFuture(RpcReply.of(JsonRpcCodec.write(
                    orphan(RpcException.invalidRequest("batch must not be empty")))));
        }
        metrics.onBatch(array.size());

        final List<CompletableFuture<Optional<JsonRpcResponse>>> items = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            items.add(processOne(element, context, timeout));
        }

        return CompletableFuture.allOf(items.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    final List<JsonRpcResponse> responses = new ArrayList<>(items.size());
                    for (CompletableFuture<Optional<JsonRpcResponse>> item : items) {
                        item.join().ifPresent(responses::add);
                    }
                    if (responses.isEmpty()) {
                        return RpcReply.none();
                    }
                    return RpcReply.of(JsonRpcCodec.write(responses));
                });
    }

    private CompletableFuture<Optional<JsonRpcResponse>> processOne(
            final JsonNode element, final C context, final Duration timeout) {
        final JsonRpcRequest request;
        try {
            request = JsonRpcCodec.decodeRequest(element);
        } catch (RpcException e) {
            return CompletableFuture.completedFuture(Optional.of(orphan(e)));
        }
        return dispatcher.dispatch(request, context, timeout);
    }

    private static JsonRpcResponse orphan(final RpcException e) {
        return JsonRpcResponse.failure(NullNode.getInstance(), ErrorShaper.shape(e));
    }
}
