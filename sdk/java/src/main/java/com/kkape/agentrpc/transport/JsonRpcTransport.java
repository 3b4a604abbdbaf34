package com.kkape.agentrpc.transport;

import com.kkape.agentrpc.ClientConfig;
import com.kkape.agentrpc.error.TransportException;
import io.grpc.Context;
import io.grpc.Deadline;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.CharsetUtil;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client for the JSON-RPC transport.
 *
 * <p>Every request opens its own connection, sends a fully buffered body with an explicit
 * content length and {@code Connection: close}, and waits at most {@link #CLIENT_TIMEOUT_MS}
 * or until the current {@link Context} deadline, whichever is sooner. The event loop group is
 * shared by all requests and outlives server URL changes.</p>
 */
public class JsonRpcTransport implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(JsonRpcTransport.class);

    /** Fixed client timeout, independent of the caller's deadline */
    public static final long CLIENT_TIMEOUT_MS = 30_000;

    /** Maximum response body accepted (16MB) */
    private static final int MAX_RESPONSE_SIZE = 16 * 1024 * 1024;

    private final EventLoopGroup group;

    public JsonRpcTransport() {
        this.group = new NioEventLoopGroup();
    }

    /**
     * Resolve where requests for a server URL go, using the TLS settings of the configuration.
     * Builds the TLS context but does no network I/O.
     */
    public static JsonRpcTarget target(String serverUrl, ClientConfig config) throws TransportException {
        String scheme = config.isInsecureTransport() ? "http" : "https";
        URI uri;
        try {
            uri = new URI(scheme + "://" + serverUrl + "/");
        } catch (URISyntaxException e) {
            throw new TransportException("parse json-rpc server url " + serverUrl + ": "
                    + e.getMessage(), e);
        }
        if (uri.getHost() == null) {
            throw new TransportException("parse json-rpc server url " + serverUrl + ": no host");
        }
        if (config.isInsecureTransport()) {
            return new JsonRpcTarget(uri, null);
        }

        TlsConfig tlsConfig = TlsConfig.builder()
                .serverName(uri.getHost())
                .insecureSkipVerify(config.isInsecureTls())
                .rootCertificates(config.getRootCertificates())
                .certPins(config.getCertPins())
                .build();
        try {
            return new JsonRpcTarget(uri, TlsContexts.forHttpClient(tlsConfig));
        } catch (SSLException e) {
            throw new TransportException("create json-rpc tls context: " + e.getMessage(), e);
        }
    }

    /**
     * POST a JSON body and return the response body.
     *
     * @throws TransportException on connect, TLS, timeout, cancellation or non-2xx status
     */
    public String post(JsonRpcTarget target, String body) throws TransportException {
        Context context = Context.current();
        if (context.isCancelled()) {
            throw new TransportException("json-rpc request cancelled", context.cancellationCause());
        }
        long timeoutMs = CLIENT_TIMEOUT_MS;
        Deadline deadline = context.getDeadline();
        if (deadline != null) {
            timeoutMs = Math.min(timeoutMs, deadline.timeRemaining(TimeUnit.MILLISECONDS));
        }
        if (timeoutMs <= 0) {
            throw new TransportException("json-rpc request: deadline exceeded");
        }

        Promise<HttpReply> reply = group.next().newPromise();
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMs, Integer.MAX_VALUE))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        SslContext sslContext = target.getSslContext();
                        if (sslContext != null) {
                            pipeline.addLast(sslContext.newHandler(ch.alloc(), target.getHost(), target.getPort()));
                        }
                        pipeline.addLast(new HttpClientCodec());
                        pipeline.addLast(new HttpObjectAggregator(MAX_RESPONSE_SIZE));
                        pipeline.addLast(new ReplyHandler(reply));
                    }
                });

        ChannelFuture connect = bootstrap.connect(target.getHost(), target.getPort());
        Channel channel = connect.channel();
        Context.CancellationListener onCancel = cancelled -> {
            reply.tryFailure(new CancellationException("json-rpc request cancelled"));
            channel.close();
        };
        context.addListener(onCancel, Runnable::run);

        try {
            connect.addListener(connected -> {
                if (!connected.isSuccess()) {
                    reply.tryFailure(connected.cause());
                    return;
                }
                SslHandler sslHandler = channel.pipeline().get(SslHandler.class);
                if (sslHandler == null) {
                    send(channel, target, body, reply);
                    return;
                }
                sslHandler.handshakeFuture().addListener(handshake -> {
                    if (handshake.isSuccess()) {
                        send(channel, target, body, reply);
                    } else {
                        reply.tryFailure(handshake.cause());
                    }
                });
            });

            if (!reply.await(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new TransportException("json-rpc request to " + target + " timed out after "
                        + timeoutMs + "ms");
            }
            if (!reply.isSuccess()) {
                throw HandshakeErrors.classify("json-rpc request to " + target, reply.cause());
            }

            HttpReply response = reply.getNow();
            if (response.status < 200 || response.status > 299) {
                throw new TransportException("json-rpc server returned status " + response.status + " "
                        + response.reason);
            }
            return response.body;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("json-rpc request interrupted", e);
        } finally {
            context.removeListener(onCancel);
            channel.close();
        }
    }

    private static void send(Channel channel, JsonRpcTarget target, String body, Promise<HttpReply> reply) {
        ByteBuf content = Unpooled.copiedBuffer(body, CharsetUtil.UTF_8);
        FullHttpRequest request = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1, HttpMethod.POST, target.getPath(), content);
        request.headers()
                .set(HttpHeaderNames.HOST, hostHeader(target))
                .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                .set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON)
                .set(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes())
                .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        channel.writeAndFlush(request).addListener(written -> {
            if (!written.isSuccess()) {
                reply.tryFailure(written.cause());
            }
        });
    }

    private static String hostHeader(JsonRpcTarget target) {
        URI uri = target.getUri();
        return uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
    }

    @Override
    public void close() {
        log.debug("Shutting down json-rpc transport");
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    private static final class HttpReply {
        private final int status;
        private final String reason;
        private final String body;

        private HttpReply(int status, String reason, String body) {
            this.status = status;
            this.reason = reason;
            this.body = body;
        }
    }

    private static final class ReplyHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final Promise<HttpReply> reply;

        private ReplyHandler(Promise<HttpReply> reply) {
            this.reply = reply;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
            reply.trySuccess(new HttpReply(response.status().code(), response.status().reasonPhrase(),
                    response.content().toString(CharsetUtil.UTF_8)));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            reply.tryFailure(new IOException("connection closed before response"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            reply.tryFailure(cause);
            ctx.close();
        }
    }
}
