package com.kkape.agentrpc.error;

/**
 * Application error returned by the server, either a JSON-RPC error object or a
 * non-transport gRPC status.
 */
public class RemoteServiceException extends KolideServiceException {
    private final int code;

    public RemoteServiceException(int code, String message) {
        super(message);
        this.code = code;
    }

    public RemoteServiceException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
