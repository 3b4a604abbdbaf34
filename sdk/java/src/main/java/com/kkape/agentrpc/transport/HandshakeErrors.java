package com.kkape.agentrpc.transport;

import com.kkape.agentrpc.error.TransportException;

/**
 * Classifies connection and TLS handshake failures.
 *
 * <p>A certificate issued for another name usually means a captive portal or a certificate
 * rotation in progress, so that one failure is reported as temporary and callers keep
 * retrying. Every other handshake failure is permanent.</p>
 */
public final class HandshakeErrors {
    static final String HOSTNAME_MISMATCH = "certificate is valid for ";
    private static final int MAX_CAUSE_DEPTH = 32;

    private HandshakeErrors() {
    }

    public static boolean isHostnameMismatch(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            String message = current.getMessage();
            if (message != null && message.contains(HOSTNAME_MISMATCH)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Wrap a failure as a {@link TransportException}, temporary only for a hostname mismatch.
     */
    public static TransportException classify(String context, Throwable error) {
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new TransportException(context + ": " + detail, error, isHostnameMismatch(error));
    }
}
