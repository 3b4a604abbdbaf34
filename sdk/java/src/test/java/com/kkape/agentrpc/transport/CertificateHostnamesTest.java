package com.kkape.agentrpc.transport;

import com.kkape.agentrpc.TestCerts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

import static org.junit.jupiter.api.Assertions.*;

class CertificateHostnamesTest {

    @Test
    @DisplayName("DNS and IP subjectAltNames are accepted")
    void testMatchingNames() throws Exception {
        X509Certificate leaf = TestCerts.certificate("leaf.crt");

        assertDoesNotThrow(() -> CertificateHostnames.verify(leaf, "localhost"));
        assertDoesNotThrow(() -> CertificateHostnames.verify(leaf, "LOCALHOST."));
        assertDoesNotThrow(() -> CertificateHostnames.verify(leaf, "127.0.0.1"));
    }

    @Test
    @DisplayName("Name mismatch uses the certificate-is-valid-for wording")
    void testMismatchMessage() throws Exception {
        X509Certificate bad = TestCerts.certificate("bad.crt");

        CertificateException e = assertThrows(CertificateException.class,
                () -> CertificateHostnames.verify(bad, "localhost"));
        assertEquals("x509: certificate is valid for wrong.example.com, not localhost", e.getMessage());
        assertTrue(HandshakeErrors.isHostnameMismatch(e));
    }

    @Test
    @DisplayName("IP hosts need an IP subjectAltName")
    void testIpWithoutIpSans() throws Exception {
        X509Certificate bad = TestCerts.certificate("bad.crt");

        CertificateException e = assertThrows(CertificateException.class,
                () -> CertificateHostnames.verify(bad, "10.0.0.1"));
        assertTrue(e.getMessage().contains("doesn't contain any IP SANs"));
    }

    @Test
    @DisplayName("Wildcards cover exactly one label")
    void testWildcard() {
        assertTrue(CertificateHostnames.matches("*.example.com", "api.example.com"));
        assertFalse(CertificateHostnames.matches("*.example.com", "a.b.example.com"));
        assertFalse(CertificateHostnames.matches("*.example.com", "example.com"));
        assertTrue(CertificateHostnames.matches("example.com", "example.com"));
        assertFalse(CertificateHostnames.matches("", "example.com"));
    }
}
