package com.kkape.agentrpc;

import com.kkape.agentrpc.error.TransportException;
import com.kkape.agentrpc.model.HealthStatus;
import com.kkape.agentrpc.server.KolideServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pinning against a TLS server presenting leaf + intermediate, rooted in root.crt.
 */
class CertPinningTest {

    private static KolideServer server;

    @BeforeAll
    static void startServer() throws Exception {
        server = KolideServer.builder()
                .grpcPort(0)
                .jsonRpcPort(0)
                .tlsCert(TestCerts.path("chain.pem"))
                .tlsKey(TestCerts.path("leaf.key"))
                .service(new StubService())
                .build();
        server.start();
    }

    @AfterAll
    static void stopServer() {
        server.stop();
    }

    private static KolideClient client(String transport, ClientConfig config) throws Exception {
        if ("grpc".equals(transport)) {
            config.setServerUrl("localhost:" + server.getGrpcPort());
            return KolideClients.newGrpcClient(config);
        }
        config.setServerUrl("localhost:" + server.getJsonRpcPort());
        return KolideClients.newJsonRpcClient(config);
    }

    private static ClientConfig trusting(List<byte[]> pins) throws Exception {
        ClientConfig config = new ClientConfig();
        config.setRootCertificates(TestCerts.certificates("root.crt"));
        config.setCertPins(pins);
        return config;
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"grpc", "jsonrpc"})
    @DisplayName("Trusted chain without pins connects")
    void testNoPins(String transport) throws Exception {
        try (KolideClient client = client(transport, trusting(List.of()))) {
            assertEquals(HealthStatus.SERVING, client.checkHealth());
        }
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"grpc", "jsonrpc"})
    @DisplayName("Pinning the leaf, intermediate or root connects")
    void testChainPins(String transport) throws Exception {
        for (String name : List.of("leaf.crt", "intermediate.crt", "root.crt")) {
            try (KolideClient client = client(transport, trusting(List.of(TestCerts.pin(name))))) {
                assertEquals(HealthStatus.SERVING, client.checkHealth(), name);
            }
        }
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"grpc", "jsonrpc"})
    @DisplayName("Pinning an unrelated key fails permanently")
    void testForeignPin(String transport) throws Exception {
        try (KolideClient client = client(transport, trusting(List.of(TestCerts.pin("other-root.crt"))))) {
            TransportException e = assertThrows(TransportException.class, client::checkHealth);
            assertFalse(e.isTemporary());
        }
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"grpc", "jsonrpc"})
    @DisplayName("Untrusted root fails even when a chain certificate is pinned")
    void testUntrustedRoot(String transport) throws Exception {
        ClientConfig config = new ClientConfig();
        config.setRootCertificates(TestCerts.certificates("other-root.crt"));
        config.setCertPins(List.of(TestCerts.pin("leaf.crt")));
        try (KolideClient client = client(transport, config)) {
            assertThrows(TransportException.class, client::checkHealth);
        }
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"grpc", "jsonrpc"})
    @DisplayName("Skipping verification with pins never connects")
    void testInsecureWithPins(String transport) throws Exception {
        ClientConfig config = new ClientConfig();
        config.setRootCertificates(Collections.emptyList());
        config.setInsecureTls(true);
        config.setCertPins(List.of(TestCerts.pin("leaf.crt")));
        try (KolideClient client = client(transport, config)) {
            assertThrows(TransportException.class, client::checkHealth);
        }
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"grpc", "jsonrpc"})
    @DisplayName("Skipping verification without pins connects to an unknown root")
    void testInsecureWithoutPins(String transport) throws Exception {
        ClientConfig config = new ClientConfig();
        config.setRootCertificates(Collections.emptyList());
        config.setInsecureTls(true);
        try (KolideClient client = client(transport, config)) {
            assertEquals(HealthStatus.SERVING, client.checkHealth());
        }
    }
}
