package com.kkape.agentrpc.transport;

import com.kkape.agentrpc.ClientConfig;
import com.kkape.agentrpc.error.TransportException;
import io.grpc.ManagedChannel;
import io.grpc.netty.NettyChannelBuilder;
import io.netty.handler.ssl.SslContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;

/**
 * Dials gRPC channels to the management server.
 */
public final class GrpcTransport {
    private static final Logger log = LoggerFactory.getLogger(GrpcTransport.class);

    private GrpcTransport() {
    }

    /**
     * Create a channel for {@code config.getServerUrl()}, which must be {@code host:port}.
     *
     * <p>Connecting is lazy: handshake failures surface on the first call.</p>
     */
    public static ManagedChannel dial(ClientConfig config) throws TransportException {
        String serverUrl = config.getServerUrl();
        log.info("dialing grpc server: server={}, tls_secure={}, transport_secure={}, cert_pinning={}",
                serverUrl, !config.isInsecureTls(), !config.isInsecureTransport(),
                !config.getCertPins().isEmpty());

        NettyChannelBuilder builder = NettyChannelBuilder.forTarget(serverUrl);
        if (config.isInsecureTransport()) {
            builder.usePlaintext();
        } else {
            TlsConfig tlsConfig = TlsConfig.builder()
                    .serverName(splitHost(serverUrl))
                    .insecureSkipVerify(config.isInsecureTls())
                    .rootCertificates(config.getRootCertificates())
                    .certPins(config.getCertPins())
                    .build();
            SslContext sslContext;
            try {
                sslContext = TlsContexts.forGrpcClient(tlsConfig);
            } catch (SSLException e) {
                throw new TransportException("create grpc tls context: " + e.getMessage(), e);
            }
            builder.sslContext(sslContext).useTransportSecurity();
        }
        return builder.intercept(new RequestIdClientInterceptor()).build();
    }

    /**
     * Host part of a {@code host:port} address. The port is ignored.
     */
    static String splitHost(String serverUrl) throws TransportException {
        if (serverUrl == null) {
            throw new TransportException("split grpc server host and port: no server url");
        }
        if (serverUrl.startsWith("[")) {
            int close = serverUrl.indexOf(']');
            if (close > 0 && serverUrl.length() > close + 1 && serverUrl.charAt(close + 1) == ':') {
                return serverUrl.substring(1, close);
            }
            throw new TransportException("split grpc server host and port: " + serverUrl);
        }
        int colon = serverUrl.lastIndexOf(':');
        if (colon <= 0 || serverUrl.indexOf(':') != colon) {
            throw new TransportException("split grpc server host and port: missing port in address " + serverUrl);
        }
        return serverUrl.substring(0, colon);
    }
}
