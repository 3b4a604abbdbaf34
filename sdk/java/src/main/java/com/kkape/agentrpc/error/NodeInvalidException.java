package com.kkape.agentrpc.error;

/**
 * Thrown by a server-side service implementation when the node key is not valid.
 * The server turns it into the dedicated node-invalid wire error.
 */
public class NodeInvalidException extends KolideServiceException {

    public NodeInvalidException(String message) {
        super(message);
    }
}
