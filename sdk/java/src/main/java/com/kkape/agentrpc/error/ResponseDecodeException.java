package com.kkape.agentrpc.error;

/**
 * The server answered but the response could not be decoded.
 */
public class ResponseDecodeException extends TransportException {

    public ResponseDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
