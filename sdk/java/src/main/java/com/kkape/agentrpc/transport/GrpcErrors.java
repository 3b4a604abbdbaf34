package com.kkape.agentrpc.transport;

import com.kkape.agentrpc.error.KolideServiceException;
import com.kkape.agentrpc.error.RemoteServiceException;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

/**
 * Maps gRPC call failures onto the service exception hierarchy.
 *
 * <p>Unavailable, deadline and cancellation statuses, and any status raised locally with an
 * underlying cause (connect and TLS failures), are transport errors. Statuses the server
 * sent are remote service errors.</p>
 */
public final class GrpcErrors {

    private GrpcErrors() {
    }

    public static KolideServiceException map(String method, StatusRuntimeException e) {
        Status status = e.getStatus();
        switch (status.getCode()) {
            case UNAVAILABLE:
            case DEADLINE_EXCEEDED:
            case CANCELLED:
                return HandshakeErrors.classify(method, e);
            default:
                if (status.getCause() != null) {
                    return HandshakeErrors.classify(method, e);
                }
                String description = status.getDescription();
                return new RemoteServiceException(status.getCode().value(),
                        method + ": " + status.getCode() + (description != null ? ": " + description : ""), e);
        }
    }
}
