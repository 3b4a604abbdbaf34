package com.kkape.agentrpc.server;

import com.kkape.agentrpc.codec.JsonRpcError;
import com.kkape.agentrpc.error.NodeInvalidException;
import io.grpc.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shapes service failures into wire errors. Only node-invalid is reported as such;
 * every other failure is a generic server error and its text stays in the server log.
 */
public final class ServerErrors {
    private static final Logger log = LoggerFactory.getLogger(ServerErrors.class);

    public static final String NODE_INVALID_MESSAGE = "Node Invalid";
    public static final String SERVER_ERROR_MESSAGE = "Server Error";

    private ServerErrors() {
    }

    public static Status grpcStatus(String method, Exception e) {
        if (e instanceof NodeInvalidException) {
            return Status.UNAUTHENTICATED.withDescription(NODE_INVALID_MESSAGE);
        }
        log.error("{} failed", method, e);
        return Status.UNKNOWN.withDescription(SERVER_ERROR_MESSAGE);
    }

    public static JsonRpcError jsonRpcError(String method, Exception e) {
        if (e instanceof NodeInvalidException) {
            return new JsonRpcError(JsonRpcError.NODE_INVALID, NODE_INVALID_MESSAGE);
        }
        log.error("{} failed", method, e);
        return new JsonRpcError(JsonRpcError.INTERNAL_ERROR, SERVER_ERROR_MESSAGE);
    }
}
