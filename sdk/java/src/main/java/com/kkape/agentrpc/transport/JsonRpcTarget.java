package com.kkape.agentrpc.transport;

import io.netty.handler.ssl.SslContext;

import java.net.URI;

/**
 * Resolved address of a JSON-RPC server, with the TLS context bound to its hostname.
 */
public final class JsonRpcTarget {
    private final URI uri;
    private final SslContext sslContext;

    JsonRpcTarget(URI uri, SslContext sslContext) {
        this.uri = uri;
        this.sslContext = sslContext;
    }

    public URI getUri() {
        return uri;
    }

    public String getHost() {
        return uri.getHost();
    }

    public int getPort() {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return isSecure() ? 443 : 80;
    }

    public String getPath() {
        String path = uri.getRawPath();
        return path == null || path.isEmpty() ? "/" : path;
    }

    /**
     * {@code null} for plaintext HTTP.
     */
    public SslContext getSslContext() {
        return sslContext;
    }

    public boolean isSecure() {
        return sslContext != null;
    }

    @Override
    public String toString() {
        return uri.toString();
    }
}
