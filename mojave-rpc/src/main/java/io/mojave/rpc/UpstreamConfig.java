// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings of an {@link UpstreamForwarder}.
 *
 * @param url            the upstream JSON-RPC endpoint
 * @param connectTimeout TCP connect timeout, 10s by default
 * @param readTimeout    per-request timeout, 30s by default
 * @param headers        extra HTTP headers sent with every request
 */
public record UpstreamConfig(
        String url,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers) {

    private static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_READ = Duration.ofSeconds(30);

    public UpstreamConfig {
        Objects.requireNonNull(url, "url");
        final String scheme = URI.create(url).getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("upstream url must be http or https: " + url);
        }
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static UpstreamConfig withDefaults(final String url) {
        return new UpstreamConfig(url, DEFAULT_CONNECT, DEFAULT_READ, Map.of());
    }
}
