// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc.internal;

import io.mojave.rpc.RpcReply;
import io.mojave.rpc.RpcService;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Netty handler that feeds aggregated HTTP requests into an {@link RpcService}.
 *
 * <p>
 * Only {@code POST /} is served. The reply is written from whichever thread
 * completes the service future; Netty hops back onto the channel's event loop.
 */
@ChannelHandler.Sharable
public final class JsonRpcHttpHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcHttpHandler.class);

    private final RpcService<?> service;

    public JsonRpcHttpHandler(final RpcService<?> service) {
        this.service = service;
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final FullHttpRequest request) {
        final boolean keepAlive = HttpUtil.isKeepAlive(request);

        if (!"/".equals(new QueryStringDecoder(request.uri()).path())) {
            write(ctx, HttpResponseStatus.NOT_FOUND, null, keepAlive);
            return;
        }
        if (!HttpMethod.POST.equals(request.method())) {
            write(ctx, HttpResponseStatus.METHOD_NOT_ALLOWED, null, keepAlive);
            return;
        }

        final byte[] body = ByteBufUtil.getBytes(request.content());
        service.handle(body).whenComplete((reply, failure) -> {
            if (failure != null) {
                // RpcService replies are never exceptional; guard the channel anyway
                log.error("RPC service failed to produce a reply", failure);
                write(ctx, HttpResponseStatus.INTERNAL_SERVER_ERROR, null, false);
                return;
            }
            write(ctx, statusOf(reply), reply.body().orElse(null), keepAlive);
        });
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.warn("HTTP channel exception", cause);
        ctx.close();
    }

    private static HttpResponseStatus statusOf(final RpcReply reply) {
        if (reply.malformed()) {
            return HttpResponseStatus.BAD_REQUEST;
        }
        return reply.hasBody() ? HttpResponseStatus.OK : HttpResponseStatus.NO_CONTENT;
    }

    private static void write(
            final ChannelHandlerContext ctx,
            final HttpResponseStatus status,
            final byte @Nullable [] body,
            final boolean keepAlive) {
        final FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                status,
                body == null ? Unpooled.EMPTY_BUFFER : Unpooled.wrappedBuffer(body));
        if (body != null) {
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
        }
        if (status != HttpResponseStatus.NO_CONTENT) {
            HttpUtil.setContentLength(response, body == null ? 0 : body.length);
        }
        if (keepAlive) {
            HttpUtil.setKeepAlive(response, true);
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
