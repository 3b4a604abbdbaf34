package com.kkape.agentrpc.server;

import com.kkape.agentrpc.KolideService;
import com.kkape.agentrpc.transport.TlsContexts;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.netty.NettyServerBuilder;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.ssl.SslContext;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Agent API server: a gRPC listener, a JSON-RPC listener, or both, backed by one
 * {@link KolideService}.
 *
 * <p>Example:</p>
 * <pre>
 * KolideServer server = KolideServer.builder()
 *     .grpcPort(8443)
 *     .jsonRpcPort(8080)
 *     .tlsCert("/etc/agentrpc/server.crt")
 *     .tlsKey("/etc/agentrpc/server.key")
 *     .service(myService)
 *     .build();
 * server.start();
 * </pre>
 *
 * <p>Port 0 binds an ephemeral port; the bound ports are available after {@link #start()}.</p>
 */
public class KolideServer {
    private static final Logger log = LoggerFactory.getLogger(KolideServer.class);

    /** Maximum inbound message size for both transports (16MB) */
    private static final int MAX_MESSAGE_SIZE = 16 * 1024 * 1024;
    private static final int SERVICE_THREADS = 8;
    private static final long SHUTDOWN_SECONDS = 5;

    private final Integer grpcPort;
    private final Integer jsonRpcPort;
    private final String tlsCertPath;
    private final String tlsKeyPath;
    private final KolideService service;

    private Server grpcServer;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup serviceGroup;
    private Channel jsonRpcChannel;

    private KolideServer(Builder builder) {
        this.grpcPort = builder.grpcPort;
        this.jsonRpcPort = builder.jsonRpcPort;
        this.tlsCertPath = builder.tlsCertPath;
        this.tlsKeyPath = builder.tlsKeyPath;
        this.service = builder.service;
    }

    /**
     * Create a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start the configured listeners.
     */
    public void start() throws IOException, InterruptedException {
        if (grpcPort != null) {
            startGrpc();
        }
        if (jsonRpcPort != null) {
            startJsonRpc();
        }
    }

    private void startGrpc() throws IOException {
        NettyServerBuilder builder = NettyServerBuilder.forPort(grpcPort)
                .withOption(ChannelOption.SO_REUSEADDR, true)
                .addService(ServerInterceptors.intercept(new ApiServiceImpl(service), new RequestIdServerInterceptor()))
                .maxInboundMessageSize(MAX_MESSAGE_SIZE);
        if (isTls()) {
            builder.sslContext(TlsContexts.forGrpcServer(new File(tlsCertPath), new File(tlsKeyPath)));
        }
        grpcServer = builder.build().start();
        log.info("gRPC agent API started on port {} (tls={})", grpcServer.getPort(), isTls());
    }

    private void startJsonRpc() throws IOException, InterruptedException {
        SslContext sslContext = isTls()
                ? TlsContexts.forHttpServer(new File(tlsCertPath), new File(tlsKeyPath))
                : null;

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        serviceGroup = new DefaultEventExecutorGroup(SERVICE_THREADS);

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        if (sslContext != null) {
                            pipeline.addLast(sslContext.newHandler(ch.alloc()));
                        }
                        pipeline.addLast(new HttpServerCodec());
                        pipeline.addLast(new HttpObjectAggregator(MAX_MESSAGE_SIZE));
                        pipeline.addLast(serviceGroup, new JsonRpcHandler(service));
                    }
                })
                .option(ChannelOption.SO_BACKLOG, 128)
                .option(ChannelOption.SO_REUSEADDR, true);

        jsonRpcChannel = bootstrap.bind(jsonRpcPort).sync().channel();
        log.info("JSON-RPC agent API started on port {} (tls={})", getJsonRpcPort(), isTls());
    }

    private boolean isTls() {
        return tlsCertPath != null && tlsKeyPath != null;
    }

    /**
     * Bound gRPC port, or -1 if gRPC is not running.
     */
    public int getGrpcPort() {
        return grpcServer != null ? grpcServer.getPort() : -1;
    }

    /**
     * Bound JSON-RPC port, or -1 if JSON-RPC is not running.
     */
    public int getJsonRpcPort() {
        return jsonRpcChannel != null ? ((InetSocketAddress) jsonRpcChannel.localAddress()).getPort() : -1;
    }

    /**
     * Stop the listeners and release their ports.
     */
    public void stop() {
        log.info("Stopping agent API server...");
        if (grpcServer != null) {
            grpcServer.shutdownNow();
            try {
                grpcServer.awaitTermination(SHUTDOWN_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (jsonRpcChannel != null) {
            jsonRpcChannel.close().syncUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, SHUTDOWN_SECONDS, TimeUnit.SECONDS).syncUninterruptibly();
            bossGroup.shutdownGracefully(0, SHUTDOWN_SECONDS, TimeUnit.SECONDS).syncUninterruptibly();
            serviceGroup.shutdownGracefully(0, SHUTDOWN_SECONDS, TimeUnit.SECONDS);
        }
        log.info("Agent API server stopped");
    }

    /**
     * Block until the listeners are closed
     */
    public void awaitTermination() throws InterruptedException {
        if (grpcServer != null) {
            grpcServer.awaitTermination();
        }
        if (jsonRpcChannel != null) {
            jsonRpcChannel.closeFuture().sync();
        }
    }

    /**
     * Builder for KolideServer
     */
    public static class Builder {
        private Integer grpcPort;
        private Integer jsonRpcPort;
        private String tlsCertPath;
        private String tlsKeyPath;
        private KolideService service;

        public Builder grpcPort(int port) {
            this.grpcPort = port;
            return this;
        }

        public Builder jsonRpcPort(int port) {
            this.jsonRpcPort = port;
            return this;
        }

        /**
         * PEM certificate chain, leaf first.
         */
        public Builder tlsCert(String certPath) {
            this.tlsCertPath = certPath;
            return this;
        }

        /**
         * PEM PKCS#8 private key.
         */
        public Builder tlsKey(String keyPath) {
            this.tlsKeyPath = keyPath;
            return this;
        }

        public Builder service(KolideService service) {
            this.service = service;
            return this;
        }

        public KolideServer build() {
            if (service == null) {
                throw new IllegalStateException("service is required");
            }
            if (grpcPort == null && jsonRpcPort == null) {
                throw new IllegalStateException("at least one of grpcPort or jsonRpcPort is required");
            }
            return new KolideServer(this);
        }
    }
}
