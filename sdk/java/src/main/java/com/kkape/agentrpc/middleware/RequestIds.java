package com.kkape.agentrpc.middleware;

import io.grpc.Context;
import io.grpc.Metadata;

import java.util.UUID;

/**
 * Request correlation ids carried in the {@link io.grpc.Context}.
 */
public final class RequestIds {

    /** Context key holding the id of the request in flight */
    public static final Context.Key<String> REQUEST_ID = Context.key("uuid");

    /** gRPC metadata header the id travels in */
    public static final Metadata.Key<String> METADATA_KEY =
            Metadata.Key.of("uuid", Metadata.ASCII_STRING_MARSHALLER);

    private RequestIds() {
    }

    /**
     * The id bound to the current context, or {@code null} outside a request.
     */
    public static String current() {
        return REQUEST_ID.get();
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }
}
