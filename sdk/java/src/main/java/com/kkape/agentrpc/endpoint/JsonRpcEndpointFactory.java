package com.kkape.agentrpc.endpoint;

import com.kkape.agentrpc.ClientConfig;
import com.kkape.agentrpc.codec.JsonRpcCodec;
import com.kkape.agentrpc.error.KolideServiceException;
import com.kkape.agentrpc.error.TransportException;
import com.kkape.agentrpc.message.ConfigResponse;
import com.kkape.agentrpc.message.EnrollmentResponse;
import com.kkape.agentrpc.message.HealthCheckResponse;
import com.kkape.agentrpc.message.PublishResponse;
import com.kkape.agentrpc.message.QueryCollectionResponse;
import com.kkape.agentrpc.transport.JsonRpcTarget;
import com.kkape.agentrpc.transport.JsonRpcTransport;

/**
 * Endpoints posting JSON-RPC 2.0 requests through a shared {@link JsonRpcTransport}.
 */
public class JsonRpcEndpointFactory implements EndpointFactory {
    private final JsonRpcTransport transport;
    private final ClientConfig config;

    public JsonRpcEndpointFactory(JsonRpcTransport transport, ClientConfig config) {
        this.transport = transport;
        this.config = config;
    }

    @Override
    public EndpointSet create(String serverUrl) throws TransportException {
        JsonRpcTarget target = JsonRpcTransport.target(serverUrl, config);
        return new EndpointSet(serverUrl,
                request -> call(target, "RequestEnrollment", request, EnrollmentResponse.class),
                request -> call(target, "RequestConfig", request, ConfigResponse.class),
                request -> call(target, "PublishLogs", request, PublishResponse.class),
                request -> call(target, "RequestQueries", request, QueryCollectionResponse.class),
                request -> call(target, "PublishResults", request, PublishResponse.class),
                request -> call(target, "CheckHealth", request, HealthCheckResponse.class));
    }

    private <R> R call(JsonRpcTarget target, String method, Object params, Class<R> responseType)
            throws KolideServiceException {
        String body = transport.post(target, JsonRpcCodec.encodeRequest(method, params));
        return JsonRpcCodec.decodeResult(body, responseType);
    }
}
