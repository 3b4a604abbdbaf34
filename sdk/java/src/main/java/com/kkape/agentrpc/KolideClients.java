package com.kkape.agentrpc;

import com.kkape.agentrpc.endpoint.Endpoints;
import com.kkape.agentrpc.endpoint.GrpcEndpointFactory;
import com.kkape.agentrpc.endpoint.JsonRpcEndpointFactory;
import com.kkape.agentrpc.error.TransportException;
import com.kkape.agentrpc.middleware.ServiceChain;
import com.kkape.agentrpc.transport.GrpcTransport;
import com.kkape.agentrpc.transport.JsonRpcTransport;
import io.grpc.ManagedChannel;

import java.io.Closeable;
import java.util.concurrent.TimeUnit;

/**
 * Factories for agent clients.
 *
 * <p>Example:</p>
 * <pre>
 * ClientConfig config = new ClientConfig("device.example.com:443");
 * config.setCertPins(CertPins.parse(pins));
 * try (KolideClient client = KolideClients.newJsonRpcClient(config)) {
 *     EnrollmentResult enrollment = client.requestEnrollment(secret, hostId, details);
 * }
 * </pre>
 */
public final class KolideClients {

    private static final long CHANNEL_SHUTDOWN_SECONDS = 5;

    private KolideClients() {
    }

    /**
     * JSON-RPC client. Follows server URL changes made on {@code config}.
     */
    public static KolideClient newJsonRpcClient(ClientConfig config) throws TransportException {
        JsonRpcTransport transport = new JsonRpcTransport();
        Endpoints endpoints;
        try {
            endpoints = new Endpoints(new JsonRpcEndpointFactory(transport, config), config, transport);
        } catch (TransportException e) {
            transport.close();
            throw e;
        }
        config.registerObserver(endpoints);
        return new KolideClient(ServiceChain.standard().apply(endpoints), endpoints, config);
    }

    /**
     * gRPC client dialed to {@code config.getServerUrl()}. The channel stays bound to that
     * address for the client's lifetime.
     */
    public static KolideClient newGrpcClient(ClientConfig config) throws TransportException {
        return newGrpcClient(config, GrpcTransport.dial(config));
    }

    /**
     * gRPC client over an existing channel, which the client takes ownership of.
     */
    public static KolideClient newGrpcClient(ClientConfig config, ManagedChannel channel) throws TransportException {
        Closeable shutdown = () -> {
            channel.shutdown();
            try {
                if (!channel.awaitTermination(CHANNEL_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                    channel.shutdownNow();
                }
            } catch (InterruptedException e) {
                channel.shutdownNow();
                Thread.currentThread().interrupt();
            }
        };
        Endpoints endpoints = new Endpoints(new GrpcEndpointFactory(channel), config, shutdown);
        return new KolideClient(ServiceChain.standard().apply(endpoints), endpoints, config);
    }
}
