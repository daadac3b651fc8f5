// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import io.mojave.rpc.internal.JsonRpcHttpHandler;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal HTTP binding for an {@link RpcService}: {@code POST /} on one port.
 *
 * <p>
 * Status codes:
 * <ul>
 * <li>200 - any JSON-RPC reply, including JSON-RPC errors</li>
 * <li>204 - the submission contained only notifications</li>
 * <li>400 - the body was not JSON, or not a JSON object or array</li>
 * <li>404 / 405 - another path or HTTP method</li>
 * <li>413 - body larger than {@link NettyServerConfig#maxContentLength()}</li>
 * </ul>
 * CORS, TLS and compression are left to a fronting proxy.
 *
 * <pre>{@code
 * try (NettyRpcServer server = new NettyRpcServer(service, NettyServerConfig.onPort(8545))) {
 *     server.start();
 *     server.awaitClose();
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class NettyRpcServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NettyRpcServer.class);

    private final RpcService<?> service;
    private final NettyServerConfig config;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile @Nullable Channel channel;

    public NettyRpcServer(final RpcService<?> service, final NettyServerConfig config) {
        this.service = Objects.requireNonNull(service, "service");
        this.config = Objects.requireNonNull(config, "config");
        this.bossGroup = new NioEventLoopGroup(1, r -> {
            Thread t = new Thread(r, "mojave-http-boss");
            t.setDaemon(true);
            return t;
        });
        this.workerGroup = new NioEventLoopGroup(config.ioThreads(), r -> {
            Thread t = new Thread(r, "mojave-http-io");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Binds the server socket.
     *
     * @return the bound port, useful when the configured port is {@code 0}
     * @throws InterruptedException  if interrupted while binding
     * @throws IllegalStateException if already started or closed
     */
    public int start() throws InterruptedException {
        if (closed.get()) {
            throw new IllegalStateException("server is closed");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("server already started");
        }
        final JsonRpcHttpHandler handler = new JsonRpcHttpHandler(service);
        final ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 1024)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new HttpServerCodec())
                                .addLast(new HttpObjectAggregator(config.maxContentLength()))
                                .addLast(handler);
                    }
                });

        channel = bootstrap.bind(config.host(), config.port()).sync().channel();
        final int port = port();
        log.info("Starting HTTP server at {}:{}", config.host(), port);
        return port;
    }

    /**
     * Returns the bound port.
     *
     * @throws IllegalStateException if the server has not been started
     */
    public int port() {
        final Channel current = channel;
        if (current == null) {
            throw new IllegalStateException("server not started");
        }
        return ((InetSocketAddress) current.localAddress()).getPort();
    }

    /**
     * Blocks until the server channel is closed.
     */
    public void awaitClose() throws InterruptedException {
        final Channel current = channel;
        if (current != null) {
            current.closeFuture().sync();
        }
    }

    /**
     * Closes the server socket and shuts down the event loops. The bound
     * {@link RpcService} is not closed.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        final Channel current = channel;
        if (current != null) {
            current.close().awaitUninterruptibly();
        }
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        log.info("HTTP server stopped");
    }
}
