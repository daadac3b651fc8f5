// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core.jsonrpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mojave.core.error.RpcException;
import java.io.IOException;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Reads and writes JSON-RPC envelopes.
 *
 * <p>
 * This class is the only place that touches the wire representation:
 * <ul>
 * <li>Parsing request bodies into a tree ({@link #readTree(byte[])})</li>
 * <li>Decoding one request object ({@link #decodeRequest(JsonNode)})</li>
 * <li>Converting handler results to JSON ({@link #toNode(Object)})</li>
 * <li>Serializing responses and outgoing requests</li>
 * </ul>
 *
 * <p>
 * Responses are built as explicit trees rather than bound beans so that a
 * success always carries {@code result} (even when it is JSON {@code null}) and
 * an error never does.
 *
 * @since 0.1.0
 */
public final class JsonRpcCodec {

    /**
     * Shared, thread-safe ObjectMapper instance.
     * <p>
     * Floats are read as {@link java.math.BigDecimal} so numeric ids and params
     * are echoed exactly, and trailing content after the top-level value is a
     * parse error.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JsonRpcCodec() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses a request body.
     *
     * @param body the raw body bytes, UTF-8 JSON
     * @return the top-level JSON value
     * @throws RpcException of kind {@code PARSE_ERROR} if the body is empty or not valid JSON
     */
    public static JsonNode readTree(final byte @Nullable [] body) {
        if (body == null || body.length == 0) {
            throw RpcException.parseError();
        }
        final JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (IOException e) {
            throw RpcException.parseError(e);
        }
        if (root == null || root.isMissingNode()) {
            throw RpcException.parseError();
        }
        return root;
    }

    /**
     * Decodes one request object.
     *
     * <p>
     * Only the JSON types of the members are checked here: {@code method} must be
     * a string, {@code id} a string, number or null, and {@code params} an array,
     * object or null. The version and an empty method name are left to the
     * dispatcher.
     *
     * @throws RpcException of kind {@code INVALID_REQUEST} if the value is not a
     *                      request object
     */
    public static JsonRpcRequest decodeRequest(final JsonNode node) {
        if (node == null || !node.isObject()) {
            throw RpcException.invalidRequest("request must be a JSON object");
        }
        final JsonNode method = node.get("method");
        if (method == null || !method.isTextual()) {
            throw RpcException.invalidRequest("method must be a string");
        }
        final JsonNode id = node.get("id");
        if (id != null && !(id.isTextual() || id.isNumber() || id.isNull())) {
            throw RpcException.invalidRequest("id must be a string, number or null");
        }
        JsonNode params = node.get("params");
        if (params != null && !(params.isArray() || params.isObject() || params.isNull())) {
            throw RpcException.invalidRequest("params must be an array or an object");
        }
        if (params != null && params.isNull()) {
            params = null;
        }
        final JsonNode version = node.get("jsonrpc");
        final String jsonrpc = version != null && version.isTextual() ? version.textValue() : null;
        return new JsonRpcRequest(jsonrpc, method.textValue(), params, id);
    }

    /**
     * Converts a handler result to JSON.
     *
     * @param value any Jackson-serializable value, a {@link JsonNode}, or {@code null}
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public static JsonNode toNode(final @Nullable Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof JsonNode) {
            return (JsonNode) value;
        }
        return MAPPER.valueToTree(value);
    }

    public static ObjectNode toJson(final JsonRpcResponse response) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("jsonrpc", JsonRpcRequest.VERSION);
        node.set("id", response.id());
        final JsonRpcError error = response.error();
        if (error != null) {
            node.set("error", toJson(error));
        } else {
            node.set("result", response.result());
        }
        return node;
    }

    public static ObjectNode toJson(final JsonRpcError error) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("code", error.code());
        node.put("message", error.message());
        if (error.data() != null) {
            node.set("data", error.data());
        }
        return node;
    }

    public static ObjectNode toJson(final JsonRpcRequest request) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("jsonrpc", request.jsonrpc() == null ? JsonRpcRequest.VERSION : request.jsonrpc());
        node.put("method", request.method());
        if (request.params() != null) {
            node.set("params", request.params());
        }
        if (request.id() != null) {
            node.set("id", request.id());
        }
        return node;
    }

    public static byte[] write(final JsonRpcResponse response) {
        return writeBytes(toJson(response));
    }

    /**
     * Serializes a batch reply as a JSON array, in list order.
     */
    public static byte[] write(final List<JsonRpcResponse> responses) {
        final ArrayNode array = MAPPER.createArrayNode();
        for (JsonRpcResponse response : responses) {
            array.add(toJson(response));
        }
        return writeBytes(array);
    }

    public static byte[] write(final JsonRpcRequest request) {
        return writeBytes(toJson(request));
    }

    private static byte[] writeBytes(final JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw RpcException.internal("unable to serialize JSON-RPC payload", e);
        }
    }
}
