package com.kkape.agentrpc.error;

/**
 * Base class for every failure surfaced by a {@code KolideService} call.
 */
public class KolideServiceException extends Exception {

    public KolideServiceException(String message) {
        super(message);
    }

    public KolideServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
