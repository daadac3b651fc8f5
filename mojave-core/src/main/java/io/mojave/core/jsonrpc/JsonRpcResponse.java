// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC 2.0 response: either a result or an error, never both.
 *
 * <p>
 * A successful response whose result is JSON {@code null} still carries a
 * {@code "result":null} member on the wire; {@link #hasError()} is the only
 * reliable way to tell the two shapes apart.
 *
 * @param id     the id echoed from the request, JSON {@code null} when unknown
 * @param result the result, {@code null} for an error response
 * @param error  the error, {@code null} for a successful response
 * @since 0.1.0
 */
public record JsonRpcResponse(JsonNode id, @Nullable JsonNode result, @Nullable JsonRpcError error) {

    public JsonRpcResponse {
        Objects.requireNonNull(id, "id");
        if (error != null && result != null) {
            throw new IllegalArgumentException("a response carries either a result or an error");
        }
    }

    public static JsonRpcResponse success(final JsonNode id, final @Nullable JsonNode result) {
        return new JsonRpcResponse(id, result == null ? NullNode.getInstance() : result, null);
    }

    public static JsonRpcResponse failure(final JsonNode id, final JsonRpcError error) {
        return new JsonRpcResponse(id, null, Objects.requireNonNull(error, "error"));
    }

    public boolean hasError() {
        return error != null;
    }
}
