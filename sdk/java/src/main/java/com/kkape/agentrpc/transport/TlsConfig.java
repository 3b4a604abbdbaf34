package com.kkape.agentrpc.transport;

import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Client TLS settings for one server hostname.
 */
public final class TlsConfig {
    private final String serverName;
    private final boolean insecureSkipVerify;
    private final List<X509Certificate> rootCertificates;
    private final List<byte[]> certPins;

    private TlsConfig(Builder builder) {
        this.serverName = builder.serverName;
        this.insecureSkipVerify = builder.insecureSkipVerify;
        this.rootCertificates = builder.rootCertificates == null
                ? null : Collections.unmodifiableList(new ArrayList<>(builder.rootCertificates));
        this.certPins = Collections.unmodifiableList(new ArrayList<>(builder.certPins));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getServerName() {
        return serverName;
    }

    public boolean isInsecureSkipVerify() {
        return insecureSkipVerify;
    }

    /**
     * Explicit trust anchors, or {@code null} to use the JVM's default trust store.
     */
    public List<X509Certificate> getRootCertificates() {
        return rootCertificates;
    }

    public List<byte[]> getCertPins() {
        return certPins;
    }

    public static class Builder {
        private String serverName;
        private boolean insecureSkipVerify;
        private List<X509Certificate> rootCertificates;
        private List<byte[]> certPins = new ArrayList<>();

        public Builder serverName(String serverName) {
            this.serverName = serverName;
            return this;
        }

        public Builder insecureSkipVerify(boolean insecureSkipVerify) {
            this.insecureSkipVerify = insecureSkipVerify;
            return this;
        }

        public Builder rootCertificates(List<X509Certificate> rootCertificates) {
            this.rootCertificates = rootCertificates;
            return this;
        }

        public Builder certPins(List<byte[]> certPins) {
            this.certPins = certPins == null ? new ArrayList<>() : certPins;
            return this;
        }

        public TlsConfig build() {
            if (serverName == null || serverName.isEmpty()) {
                throw new IllegalArgumentException("serverName is required");
            }
            return new TlsConfig(this);
        }
    }
}
