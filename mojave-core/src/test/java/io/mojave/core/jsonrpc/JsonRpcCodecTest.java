// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core.jsonrpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.mojave.core.error.RpcErrorKind;
import io.mojave.core.error.RpcException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonRpcCodecTest {

    private static JsonNode tree(String json) {
        return JsonRpcCodec.readTree(json.getBytes(StandardCharsets.UTF_8));
    }

    private static String json(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Test
    void readTreeRejectsInvalidJson() {
        RpcException ex = assertThrows(RpcException.class, () -> tree("{\"jsonrpc\":"));
        assertEquals(RpcErrorKind.PARSE_ERROR, ex.kind());
    }

    @Test
    void readTreeRejectsEmptyBody() {
        assertEquals(RpcErrorKind.PARSE_ERROR,
                assertThrows(RpcException.class, () -> JsonRpcCodec.readTree(new byte[0])).kind());
        assertEquals(RpcErrorKind.PARSE_ERROR,
                assertThrows(RpcException.class, () -> tree("   ")).kind());
    }

    @Test
    void readTreeRejectsTrailingContent() {
        RpcException ex = assertThrows(RpcException.class, () -> tree("{} {}"));
        assertEquals(RpcErrorKind.PARSE_ERROR, ex.kind());
    }

    @Test
    void decodesFullRequest() {
        JsonRpcRequest request = JsonRpcCodec.decodeRequest(
                tree("{\"jsonrpc\":\"2.0\",\"method\":\"eth_chainId\",\"params\":[1,\"a\"],\"id\":7}"));

        assertEquals("2.0", request.jsonrpc());
        assertEquals("eth_chainId", request.method());
        assertEquals(2, request.params().size());
        assertEquals(IntNode.valueOf(7), request.id());
        assertFalse(request.isNotification());
    }

    @Test
    void absentIdMeansNotification() {
        JsonRpcRequest request = JsonRpcCodec.decodeRequest(tree("{\"jsonrpc\":\"2.0\",\"method\":\"ping\"}"));

        assertNull(request.id());
        assertNull(request.params());
        assertTrue(request.isNotification());
        assertEquals(NullNode.getInstance(), request.replyId());
    }

    @Test
    void nullIdMeansNotification() {
        JsonRpcRequest request = JsonRpcCodec.decodeRequest(
                tree("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":null,\"params\":null}"));

        assertTrue(request.isNotification());
        assertNull(request.params());
    }

    @Test
    void decodingLeavesVersionCheckToDispatcher() {
        JsonRpcRequest request = JsonRpcCodec.decodeRequest(tree("{\"jsonrpc\":\"1.0\",\"method\":\"\",\"id\":\"a\"}"));
        assertEquals("1.0", request.jsonrpc());
        assertEquals("", request.method());

        JsonRpcRequest noVersion = JsonRpcCodec.decodeRequest(tree("{\"jsonrpc\":2,\"method\":\"x\",\"id\":1}"));
        assertNull(noVersion.jsonrpc());
    }

    @Test
    void rejectsMalformedRequests() {
        assertInvalid("[1]", "request must be a JSON object");
        assertInvalid("{\"jsonrpc\":\"2.0\",\"id\":1}", "method must be a string");
        assertInvalid("{\"jsonrpc\":\"2.0\",\"method\":42,\"id\":1}", "method must be a string");
        assertInvalid("{\"jsonrpc\":\"2.0\",\"method\":\"x\",\"id\":{}}", "id must be a string, number or null");
        assertInvalid("{\"jsonrpc\":\"2.0\",\"method\":\"x\",\"id\":true}", "id must be a string, number or null");
        assertInvalid("{\"jsonrpc\":\"2.0\",\"method\":\"x\",\"params\":\"a\",\"id\":1}",
                "params must be an array or an object");
    }

    private static void assertInvalid(String json, String reason) {
        JsonNode node = tree(json);
        RpcException ex = assertThrows(RpcException.class, () -> JsonRpcCodec.decodeRequest(node.isArray() ? node.get(0) : node));
        assertEquals(RpcErrorKind.INVALID_REQUEST, ex.kind());
        assertEquals(reason, ex.data());
    }

    @Test
    void fractionalIdIsEchoedExactly() {
        JsonRpcRequest request = JsonRpcCodec.decodeRequest(
                tree("{\"jsonrpc\":\"2.0\",\"method\":\"x\",\"id\":1.10}"));

        String out = json(JsonRpcCodec.write(JsonRpcResponse.success(request.replyId(), TextNode.valueOf("ok"))));
        assertEquals("{\"jsonrpc\":\"2.0\",\"id\":1.10,\"result\":\"ok\"}", out);
    }

    @Test
    void writesNullResult() {
        String out = json(JsonRpcCodec.write(JsonRpcResponse.success(IntNode.valueOf(1), null)));
        assertEquals("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}", out);
    }

    @Test
    void writesErrorWithoutData() {
        JsonRpcResponse response = JsonRpcResponse.failure(
                TextNode.valueOf("abc"), ErrorShaper.shape(RpcErrorKind.METHOD_NOT_FOUND));

        String out = json(JsonRpcCodec.write(response));
        assertEquals("{\"jsonrpc\":\"2.0\",\"id\":\"abc\",\"error\":{\"code\":-32601,\"message\":\"Method not found\"}}", out);
    }

    @Test
    void writesBatchInOrder() {
        List<JsonRpcResponse> responses = List.of(
                JsonRpcResponse.success(IntNode.valueOf(2), TextNode.valueOf("b")),
                JsonRpcResponse.success(IntNode.valueOf(1), TextNode.valueOf("a")));

        String out = json(JsonRpcCodec.write(responses));
        assertEquals("[{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":\"b\"},{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"a\"}]", out);
    }

    @Test
    void writesOutgoingRequest() {
        JsonRpcRequest request = JsonRpcRequest.of("eth_getBalance", tree("[\"0xabc\",\"latest\"]"), IntNode.valueOf(5));

        String out = json(JsonRpcCodec.write(request));
        assertEquals("{\"jsonrpc\":\"2.0\",\"method\":\"eth_getBalance\",\"params\":[\"0xabc\",\"latest\"],\"id\":5}", out);
    }

    @Test
    void toNodeConvertsPojos() {
        JsonNode node = JsonRpcCodec.toNode(Map.of("chainId", "0x1"));
        assertEquals("0x1", node.get("chainId").asText());
        assertEquals(NullNode.getInstance(), JsonRpcCodec.toNode(null));
    }

    @Test
    void responseRejectsResultAndError() {
        assertThrows(IllegalArgumentException.class,
                () -> new JsonRpcResponse(IntNode.valueOf(1), TextNode.valueOf("x"),
                        ErrorShaper.shape(RpcErrorKind.INTERNAL_ERROR)));
    }
}
