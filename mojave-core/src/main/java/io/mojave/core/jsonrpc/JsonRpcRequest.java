// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core.jsonrpc;

import static io.mojave.core.jsonrpc.JsonRpcCodec.MAPPER;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.mojave.core.error.RpcException;
import org.jspecify.annotations.Nullable;

/**
 * A decoded JSON-RPC 2.0 request.
 *
 * <p>
 * Decoding ({@link JsonRpcCodec#decodeRequest(JsonNode)}) only guarantees the
 * shape of the fields; whether {@code jsonrpc} is {@code "2.0"} and
 * {@code method} is non-empty is checked by the dispatcher, so an invalid
 * request can still echo its id in the error response.
 *
 * <p>
 * <strong>Accessing Params:</strong>
 * <ul>
 * <li>{@link #param(int)} - positional parameter (e.g. {@code eth_getBalance})</li>
 * <li>{@link #paramsAs(Class)} - typed conversion using Jackson</li>
 * <li>{@link #paramsAs(TypeReference)} - generic conversion using Jackson</li>
 * </ul>
 * Conversion failures are reported as {@link RpcException} of kind
 * {@code INVALID_PARAMS}, so handlers can let them propagate.
 *
 * @param jsonrpc the protocol version, {@code null} when absent or not a string
 * @param method  the method name
 * @param params  the params array or object, {@code null} when absent
 * @param id      the request id (text, number or JSON null), {@code null} when absent
 * @since 0.1.0
 */
public record JsonRpcRequest(
        @Nullable String jsonrpc,
        String method,
        @Nullable JsonNode params,
        @Nullable JsonNode id) {

    public static final String VERSION = "2.0";

    /**
     * Creates a {@code "2.0"} request.
     */
    public static JsonRpcRequest of(final String method, final @Nullable JsonNode params, final @Nullable JsonNode id) {
        return new JsonRpcRequest(VERSION, method, params, id);
    }

    /**
     * Checks if this request is a notification: its id is absent or JSON
     * {@code null}, so no response is expected.
     */
    public boolean isNotification() {
        return id == null || id.isNull();
    }

    /**
     * Returns the id to echo in a response, JSON {@code null} when absent.
     */
    public JsonNode replyId() {
        return id == null ? NullNode.getInstance() : id;
    }

    /**
     * Returns the positional parameter at {@code index}.
     *
     * @return the parameter, or {@code null} if params are not an array or too short
     */
    public @Nullable JsonNode param(final int index) {
        if (params == null || !params.isArray() || index < 0 || index >= params.size()) {
            return null;
        }
        return params.get(index);
    }

    /**
     * Converts the params to the specified type using Jackson.
     *
     * @throws RpcException of kind {@code INVALID_PARAMS} if params are absent or
     *                      cannot be converted
     */
    public <T> T paramsAs(final Class<T> type) {
        if (params == null) {
            throw RpcException.invalidParams("missing params for " + method);
        }
        try {
            return MAPPER.convertValue(params, type);
        } catch (IllegalArgumentException e) {
            throw RpcException.invalidParams("unable to parse params for " + method, e);
        }
    }

    /**
     * Converts the params to a generic type such as {@code List<String>}.
     *
     * @throws RpcException of kind {@code INVALID_PARAMS} if params are absent or
     *                      cannot be converted
     */
    public <T> T paramsAs(final TypeReference<T> typeRef) {
        if (params == null) {
            throw RpcException.invalidParams("missing params for " + method);
        }
        try {
            return MAPPER.convertValue(params, typeRef);
        } catch (IllegalArgumentException e) {
            throw RpcException.invalidParams("unable to parse params for " + method, e);
        }
    }
}
