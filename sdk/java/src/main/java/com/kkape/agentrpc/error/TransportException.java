package com.kkape.agentrpc.error;

/**
 * Network level failure: dial, timeout, cancellation, TLS handshake or an unexpected
 * HTTP status. Only the TLS hostname mismatch is reported as temporary.
 */
public class TransportException extends KolideServiceException implements Temporary {
    private final boolean temporary;

    public TransportException(String message) {
        this(message, null, false);
    }

    public TransportException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public TransportException(String message, Throwable cause, boolean temporary) {
        super(message, cause);
        this.temporary = temporary;
    }

    @Override
    public boolean isTemporary() {
        return temporary;
    }
}
