// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import java.util.Objects;

/**
 * Settings of a {@link NettyRpcServer}.
 *
 * @param host             address to bind, {@code 127.0.0.1} by default
 * @param port             port to bind, {@code 0} picks a free port
 * @param maxContentLength largest accepted request body in bytes; larger bodies get HTTP 413
 * @param ioThreads        number of Netty worker threads, {@code 0} for Netty's default
 */
public record NettyServerConfig(String host, int port, int maxContentLength, int ioThreads) {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8545;
    public static final int DEFAULT_MAX_CONTENT_LENGTH = 10 * 1024 * 1024; // 10MB

    public NettyServerConfig {
        Objects.requireNonNull(host, "host");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);
        }
        if (maxContentLength < 1) {
            throw new IllegalArgumentException("maxContentLength must be positive, got: " + maxContentLength);
        }
        if (ioThreads < 0) {
            throw new IllegalArgumentException("ioThreads must not be negative, got: " + ioThreads);
        }
    }

    public static NettyServerConfig defaults() {
        return new NettyServerConfig(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_MAX_CONTENT_LENGTH, 0);
    }

    public static NettyServerConfig onPort(final int port) {
        return new NettyServerConfig(DEFAULT_HOST, port, DEFAULT_MAX_CONTENT_LENGTH, 0);
    }
}
