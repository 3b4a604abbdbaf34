package com.kkape.agentrpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.cert.X509Certificate;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Client configuration.
 *
 * <p>The server URL is the only setting that may change at runtime; registered observers are
 * told about it so they can rebind. The TLS settings are read when a client is built.</p>
 */
public class ClientConfig {
    private static final Logger log = LoggerFactory.getLogger(ClientConfig.class);

    private volatile String serverUrl;
    private volatile boolean insecureTls = false;
    private volatile boolean insecureTransport = false;
    private volatile List<byte[]> certPins = List.of();
    private volatile List<X509Certificate> rootCertificates;

    private final List<ConfigObserver> observers = new CopyOnWriteArrayList<>();

    public ClientConfig() {
    }

    public ClientConfig(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    /**
     * Server address: {@code host:port} for gRPC, {@code host[:port]} for JSON-RPC.
     */
    public String getServerUrl() {
        return serverUrl;
    }

    /**
     * Change the server address and notify observers if it differs from the current one.
     */
    public void setServerUrl(String serverUrl) {
        synchronized (this) {
            if (Objects.equals(this.serverUrl, serverUrl)) {
                return;
            }
            this.serverUrl = serverUrl;
        }
        // observers run outside the monitor so a rebuild can re-read the URL
        log.info("Server URL changed to {}", serverUrl);
        notifyObservers(EnumSet.of(ConfigKey.SERVER_URL));
    }

    /**
     * Skip certificate chain and hostname verification.
     */
    public boolean isInsecureTls() {
        return insecureTls;
    }

    public void setInsecureTls(boolean insecureTls) {
        this.insecureTls = insecureTls;
    }

    /**
     * Talk plaintext instead of TLS.
     */
    public boolean isInsecureTransport() {
        return insecureTransport;
    }

    public void setInsecureTransport(boolean insecureTransport) {
        this.insecureTransport = insecureTransport;
    }

    /**
     * SHA-256 digests of pinned SubjectPublicKeyInfo structures, as an unmodifiable list.
     */
    public List<byte[]> getCertPins() {
        return certPins;
    }

    public void setCertPins(List<byte[]> certPins) {
        this.certPins = certPins == null ? List.of() : List.copyOf(certPins);
    }

    /**
     * Trust anchors, or {@code null} for the JVM defaults.
     */
    public List<X509Certificate> getRootCertificates() {
        return rootCertificates;
    }

    public void setRootCertificates(List<X509Certificate> rootCertificates) {
        this.rootCertificates = rootCertificates == null ? null : List.copyOf(rootCertificates);
    }

    public void registerObserver(ConfigObserver observer) {
        observers.add(observer);
    }

    public void unregisterObserver(ConfigObserver observer) {
        observers.remove(observer);
    }

    private void notifyObservers(EnumSet<ConfigKey> changed) {
        for (ConfigObserver observer : observers) {
            observer.configChanged(changed);
        }
    }
}
