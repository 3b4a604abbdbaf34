package com.kkape.agentrpc;

import com.kkape.agentrpc.error.DeviceDisabledException;
import com.kkape.agentrpc.model.EnrollmentDetails;
import com.kkape.agentrpc.model.LogType;
import com.kkape.agentrpc.model.QueriesResult;
import com.kkape.agentrpc.proto.ApiGrpc;
import com.kkape.agentrpc.proto.KolideAgentProto;
import com.kkape.agentrpc.server.KolideServer;
import io.grpc.Server;
import io.grpc.netty.NettyServerBuilder;
import io.grpc.stub.StreamObserver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A response flagged disable_device fails the call no matter what else it carries.
 */
class DeviceDisabledTest {

    private static final String DISABLED_EVERYTHING = "{\"disable_device\":true,\"node_invalid\":true,"
            + "\"node_key\":\"nk\",\"config\":\"{}\",\"message\":\"ok\",\"error_code\":\"\",\"status\":1,"
            + "\"Queries\":{\"queries\":{\"q1\":\"select 1\"}}}";

    private static void assertAllDisabled(KolideClient client) {
        assertThrows(DeviceDisabledException.class,
                () -> client.requestEnrollment("secret", "host", EnrollmentDetails.empty()));
        assertThrows(DeviceDisabledException.class, () -> client.requestConfig("nk"));
        assertThrows(DeviceDisabledException.class,
                () -> client.publishLogs("nk", LogType.STATUS, List.of("line")));
        assertThrows(DeviceDisabledException.class, () -> client.requestQueries("nk"));
        assertThrows(DeviceDisabledException.class, () -> client.publishResults("nk", List.of()));
        assertThrows(DeviceDisabledException.class, () -> client.checkHealth());
    }

    @Test
    @DisplayName("JSON-RPC: disable flag wins over every other field")
    void testJsonRpcDisabled() throws Exception {
        try (StubJsonRpcServer stub = new StubJsonRpcServer(() -> DISABLED_EVERYTHING)) {
            ClientConfig config = new ClientConfig(stub.getServerUrl());
            config.setInsecureTransport(true);
            try (KolideClient client = KolideClients.newJsonRpcClient(config)) {
                assertAllDisabled(client);
            }
        }
    }

    @Test
    @DisplayName("JSON-RPC: flag flipping on between calls")
    void testJsonRpcDisabledLater() throws Exception {
        AtomicBoolean disabled = new AtomicBoolean(false);
        try (StubJsonRpcServer stub = new StubJsonRpcServer(() -> "{\"disable_device\":" + disabled.get()
                + ",\"Queries\":{\"queries\":{\"q1\":\"select 1\"}}}")) {
            ClientConfig config = new ClientConfig(stub.getServerUrl());
            config.setInsecureTransport(true);
            try (KolideClient client = KolideClients.newJsonRpcClient(config)) {
                QueriesResult first = client.requestQueries("nk");
                assertEquals("select 1", first.getQueries().getQueries().get("q1"));

                disabled.set(true);
                assertThrows(DeviceDisabledException.class, () -> client.requestQueries("nk"));
            }
        }
    }

    @Test
    @DisplayName("gRPC: disable flag wins over every other field")
    void testGrpcDisabled() throws Exception {
        Server grpc = NettyServerBuilder.forPort(0).addService(new DisabledApi()).build().start();
        try {
            ClientConfig config = new ClientConfig("localhost:" + grpc.getPort());
            config.setInsecureTransport(true);
            try (KolideClient client = KolideClients.newGrpcClient(config)) {
                assertAllDisabled(client);
            }
        } finally {
            grpc.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @Test
    @DisplayName("Service throwing device-disabled reaches clients as the flag")
    void testServerSideDisable() throws Exception {
        KolideServer server = KolideServer.builder()
                .grpcPort(0)
                .jsonRpcPort(0)
                .service(new StubService().failWith(new DeviceDisabledException()))
                .build();
        server.start();
        try {
            ClientConfig grpcConfig = new ClientConfig("localhost:" + server.getGrpcPort());
            grpcConfig.setInsecureTransport(true);
            try (KolideClient client = KolideClients.newGrpcClient(grpcConfig)) {
                assertAllDisabled(client);
            }

            ClientConfig jsonConfig = new ClientConfig("localhost:" + server.getJsonRpcPort());
            jsonConfig.setInsecureTransport(true);
            try (KolideClient client = KolideClients.newJsonRpcClient(jsonConfig)) {
                assertAllDisabled(client);
            }
        } finally {
            server.stop();
        }
    }

    /**
     * Answers every call with a fully populated response that also sets disable_device.
     */
    private static class DisabledApi extends ApiGrpc.ApiImplBase {

        @Override
        public void requestEnrollment(KolideAgentProto.EnrollmentRequest request,
                                      StreamObserver<KolideAgentProto.EnrollmentResponse> responseObserver) {
            responseObserver.onNext(KolideAgentProto.EnrollmentResponse.newBuilder()
                    .setNodeKey("nk").setNodeInvalid(true).setDisableDevice(true).build());
            responseObserver.onCompleted();
        }

        @Override
        public void requestConfig(KolideAgentProto.AgentApiRequest request,
                                  StreamObserver<KolideAgentProto.ConfigResponse> responseObserver) {
            responseObserver.onNext(KolideAgentProto.ConfigResponse.newBuilder()
                    .setConfigJsonBlob("{}").setNodeInvalid(true).setDisableDevice(true).build());
            responseObserver.onCompleted();
        }

        @Override
        public void requestQueries(KolideAgentProto.AgentApiRequest request,
                                   StreamObserver<KolideAgentProto.QueryCollection> responseObserver) {
            responseObserver.onNext(KolideAgentProto.QueryCollection.newBuilder()
                    .addQueries(KolideAgentProto.QueryCollection.Query.newBuilder().setId("q1").setQuery("select 1"))
                    .setNodeInvalid(true).setDisableDevice(true).build());
            responseObserver.onCompleted();
        }

        @Override
        public void publishLogs(KolideAgentProto.LogCollection request,
                                StreamObserver<KolideAgentProto.AgentApiResponse> responseObserver) {
            responseObserver.onNext(accepted());
            responseObserver.onCompleted();
        }

        @Override
        public void publishResults(KolideAgentProto.ResultCollection request,
                                   StreamObserver<KolideAgentProto.AgentApiResponse> responseObserver) {
            responseObserver.onNext(accepted());
            responseObserver.onCompleted();
        }

        @Override
        public void checkHealth(KolideAgentProto.AgentApiRequest request,
                                StreamObserver<KolideAgentProto.HealthCheckResponse> responseObserver) {
            responseObserver.onNext(KolideAgentProto.HealthCheckResponse.newBuilder()
                    .setStatus(KolideAgentProto.HealthCheckResponse.ServingStatus.SERVING)
                    .setDisableDevice(true).build());
            responseObserver.onCompleted();
        }

        private static KolideAgentProto.AgentApiResponse accepted() {
            return KolideAgentProto.AgentApiResponse.newBuilder()
                    .setMessage("ok").setNodeInvalid(true).setDisableDevice(true).build();
        }
    }
}
