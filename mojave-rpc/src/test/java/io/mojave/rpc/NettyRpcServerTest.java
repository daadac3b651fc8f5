// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.mojave.core.error.RpcException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NettyRpcServerTest {

    private RpcService<String> service;
    private NettyRpcServer server;
    private HttpClient client;
    private URI uri;

    @BeforeEach
    void setUp() throws InterruptedException {
        RpcRegistry<String> registry = RpcRegistry.<String>builder()
                .register("moj_echo", RpcHandler.sync((request, ctx) -> Map.of("echo", request.params())))
                .register("moj_fail", RpcHandler.sync((request, ctx) -> {
                    throw RpcException.application(-32000, "nope", null);
                }))
                .build();
        service = new RpcService<>("ctx", registry);
        server = new NettyRpcServer(service, new NettyServerConfig("127.0.0.1", 0, 1024, 1));
        int port = server.start();
        uri = URI.create("http://127.0.0.1:" + port + "/");
        client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() {
        server.close();
        service.close();
    }

    private HttpResponse<String> post(URI target, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(target)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void servesSingleRequest() throws Exception {
        HttpResponse<String> response = post(uri, "{\"jsonrpc\":\"2.0\",\"method\":\"moj_echo\",\"params\":[\"hi\"],\"id\":1}");

        assertEquals(200, response.statusCode());
        assertEquals("application/json", response.headers().firstValue("content-type").orElse(""));
        assertEquals("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"echo\":[\"hi\"]}}", response.body());
    }

    @Test
    void jsonRpcErrorsAreStill200() throws Exception {
        HttpResponse<String> response = post(uri, "{\"jsonrpc\":\"2.0\",\"method\":\"moj_fail\",\"id\":1}");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("\"code\":-32000"));
    }

    @Test
    void notificationIs204() throws Exception {
        HttpResponse<String> response = post(uri, "{\"jsonrpc\":\"2.0\",\"method\":\"moj_echo\",\"params\":[1]}");

        assertEquals(204, response.statusCode());
        assertEquals("", response.body());
    }

    @Test
    void invalidJsonIs400() throws Exception {
        HttpResponse<String> response = post(uri, "not-json");

        assertEquals(400, response.statusCode());
        assertTrue(response.body().contains("-32700"));
    }

    @Test
    void otherMethodIs405() throws Exception {
        HttpResponse<String> response = client.send(
                HttpRequest.newBuilder(uri).GET().build(), HttpResponse.BodyHandlers.ofString());

        assertEquals(405, response.statusCode());
    }

    @Test
    void otherPathIs404() throws Exception {
        HttpResponse<String> response = post(uri.resolve("/rpc"), "{}");

        assertEquals(404, response.statusCode());
    }

    @Test
    void oversizedBodyIs413() throws Exception {
        String big = "{\"jsonrpc\":\"2.0\",\"method\":\"moj_echo\",\"params\":[\"" + "a".repeat(4096) + "\"],\"id\":1}";

        HttpResponse<String> response = post(uri, big);

        assertEquals(413, response.statusCode());
    }

    @Test
    void cannotStartTwice() {
        assertThrows(IllegalStateException.class, () -> server.start());
    }

    @Test
    void configValidation() {
        assertThrows(IllegalArgumentException.class, () -> new NettyServerConfig("127.0.0.1", 70000, 1024, 0));
        assertThrows(IllegalArgumentException.class, () -> new NettyServerConfig("127.0.0.1", 0, 0, 0));
        assertEquals(8545, NettyServerConfig.defaults().port());
    }
}
