// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.mojave.core.DebugLogger;
import io.mojave.core.LogFormatter;
import io.mojave.core.error.RpcException;
import io.mojave.core.jsonrpc.JsonRpcCodec;
import io.mojave.core.jsonrpc.JsonRpcRequest;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handler that forwards requests to an upstream JSON-RPC node over HTTP.
 *
 * <p>
 * Typically registered as the fallback of a namespace the service does not
 * implement itself, e.g. every {@code eth_*} method of a sequencer:
 *
 * <pre>{@code
 * RpcRegistry.<SequencerContext>builder()
 *         .register("eth_sendRawTransaction", submitToMempool)
 *         .registerFallback(Namespace.ETH, UpstreamForwarder.builder("http://127.0.0.1:8545").build())
 *         .build();
 * }</pre>
 *
 * <p>
 * The method and params are re-sent with a fresh numeric id; the client's id
 * never leaves this process. Outcomes:
 * <ul>
 * <li>upstream result - returned unchanged</li>
 * <li>upstream error - re-raised through {@link RpcException#fromWire(int, String, Object)},
 * keeping code, message and data</li>
 * <li>non-2xx status, network failure or unreadable body - {@code INTERNAL_ERROR}
 * with a generic message; the upstream address is only logged</li>
 * </ul>
 * Requests are sent asynchronously and failed calls are not retried.
 *
 * <p>
 * <strong>Thread Safety:</strong> instances are thread-safe and may serve any
 * number of concurrent requests.
 *
 * @param <C> the context type, unused by the forwarder
 * @since 0.1.0
 */
public final class UpstreamForwarder<C> implements RpcHandler<C> {

    private static final Logger log = LoggerFactory.getLogger(UpstreamForwarder.class);

    static final String UPSTREAM_FAILURE = "Upstream request failed";

    private final UpstreamConfig config;
    private final HttpClient httpClient;
    private final AtomicLong ids = new AtomicLong(1L);

    private UpstreamForwarder(final UpstreamConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public static <C> UpstreamForwarder<C> create(final UpstreamConfig config) {
        return new UpstreamForwarder<>(Objects.requireNonNull(config, "config"));
    }

    @Override
    public CompletableFuture<Object> handle(final JsonRpcRequest request, final C context) {
        final long upstreamId = ids.getAndIncrement();
        final JsonRpcRequest outgoing = JsonRpcRequest.of(
                request.method(), request.params(), LongNode.valueOf(upstreamId));
        final HttpRequest httpRequest = buildRequest(JsonRpcCodec.write(outgoing));

        final long start = System.nanoTime();
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())
                .handle((response, failure) -> {
                    final long durationMicros = (System.nanoTime() - start) / 1_000L;
                    DebugLogger.logRpc(LogFormatter.formatForward(request.method(), durationMicros));
                    if (failure != null) {
                        log.warn("Network error forwarding {} to {}: {}",
                                request.method(), config.url(), failure.toString());
                        throw RpcException.internal(UPSTREAM_FAILURE, failure);
                    }
                    return parseResponse(request.method(), response);
                });
    }

    public UpstreamConfig config() {
        return config;
    }

    private HttpRequest buildRequest(final byte[] payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.url()))
                .header("Content-Type", "application/json")
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload));

        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        return builder.build();
    }

    private Object parseResponse(final String method, final HttpResponse<byte[]> response) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.warn("Upstream {} answered {} with HTTP {}", config.url(), method, response.statusCode());
            throw RpcException.internal(UPSTREAM_FAILURE);
        }

        final JsonNode body;
        try {
            body = JsonRpcCodec.readTree(response.body());
        } catch (RpcException e) {
            log.warn("Upstream {} returned an unparseable body for {}", config.url(), method);
            throw RpcException.internal(UPSTREAM_FAILURE, e);
        }
        if (!body.isObject()) {
            log.warn("Upstream {} returned a non-object body for {}", config.url(), method);
            throw RpcException.internal(UPSTREAM_FAILURE);
        }

        final JsonNode error = body.get("error");
        if (error != null && !error.isNull()) {
            throw toException(error);
        }
        final JsonNode result = body.get("result");
        return result == null ? NullNode.getInstance() : result;
    }

    private static RpcException toException(final JsonNode error) {
        final JsonNode code = error.get("code");
        if (code == null || !code.canConvertToInt()) {
            return RpcException.internal(UPSTREAM_FAILURE);
        }
        final JsonNode message = error.get("message");
        final JsonNode data = error.get("data");
        return RpcException.fromWire(
                code.intValue(),
                message != null && message.isTextual() ? message.textValue() : null,
                data == null || data.isNull() ? null : data);
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        /**
         * Builds the forwarder; the context type is inferred from the registry it
         * is registered with.
         */
        public <C> UpstreamForwarder<C> build() {
            return new UpstreamForwarder<>(
                    new UpstreamConfig(url, connectTimeout, readTimeout, new LinkedHashMap<>(headers)));
        }
    }
}
