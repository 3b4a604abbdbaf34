package com.kkape.agentrpc.transport;

import io.grpc.netty.GrpcSslContexts;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;

import javax.net.ssl.SSLException;
import java.io.File;
import java.security.GeneralSecurityException;

/**
 * Builds Netty SSL contexts for agent clients and test or embedded servers.
 */
public final class TlsContexts {

    private TlsContexts() {
    }

    /**
     * Client context with ALPN h2, for gRPC channels.
     */
    public static SslContext forGrpcClient(TlsConfig config) throws SSLException {
        SslContextBuilder builder = GrpcSslContexts.configure(SslContextBuilder.forClient(), SslProvider.JDK);
        return builder.trustManager(trustManager(config)).build();
    }

    /**
     * Client context for HTTP/1.1, used by the JSON-RPC transport.
     */
    public static SslContext forHttpClient(TlsConfig config) throws SSLException {
        return SslContextBuilder.forClient()
                .sslProvider(SslProvider.JDK)
                .trustManager(trustManager(config))
                .build();
    }

    public static SslContext forGrpcServer(File certChain, File privateKey) throws SSLException {
        return GrpcSslContexts.configure(SslContextBuilder.forServer(certChain, privateKey), SslProvider.JDK)
                .build();
    }

    public static SslContext forHttpServer(File certChain, File privateKey) throws SSLException {
        return SslContextBuilder.forServer(certChain, privateKey)
                .sslProvider(SslProvider.JDK)
                .build();
    }

    private static PinningTrustManager trustManager(TlsConfig config) throws SSLException {
        try {
            return new PinningTrustManager(config);
        } catch (GeneralSecurityException e) {
            throw new SSLException("loading trust anchors: " + e.getMessage(), e);
        }
    }
}
