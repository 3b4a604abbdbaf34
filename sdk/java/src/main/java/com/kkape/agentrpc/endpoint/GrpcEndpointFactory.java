package com.kkape.agentrpc.endpoint;

import com.kkape.agentrpc.codec.GrpcCodec;
import com.kkape.agentrpc.error.KolideServiceException;
import com.kkape.agentrpc.proto.ApiGrpc;
import com.kkape.agentrpc.transport.GrpcErrors;
import io.grpc.Channel;
import io.grpc.StatusRuntimeException;

/**
 * Endpoints calling the {@code kolide.agent.Api} service over a gRPC channel.
 *
 * <p>The channel is bound to its target when dialed, so the server URL passed to
 * {@link #create} is only recorded.</p>
 */
public class GrpcEndpointFactory implements EndpointFactory {
    private final ApiGrpc.ApiBlockingStub stub;

    public GrpcEndpointFactory(Channel channel) {
        this.stub = ApiGrpc.newBlockingStub(channel);
    }

    @Override
    public EndpointSet create(String serverUrl) {
        return new EndpointSet(serverUrl,
                request -> call("RequestEnrollment", () -> GrpcCodec.decodeEnrollmentResponse(
                        stub.requestEnrollment(GrpcCodec.encodeEnrollmentRequest(request)))),
                request -> call("RequestConfig", () -> GrpcCodec.decodeConfigResponse(
                        stub.requestConfig(GrpcCodec.encodeNodeKeyRequest(request)))),
                request -> call("PublishLogs", () -> GrpcCodec.decodePublishResponse(
                        stub.publishLogs(GrpcCodec.encodeLogCollection(request)))),
                request -> call("RequestQueries", () -> GrpcCodec.decodeQueryCollection(
                        stub.requestQueries(GrpcCodec.encodeNodeKeyRequest(request)))),
                request -> call("PublishResults", () -> GrpcCodec.decodePublishResponse(
                        stub.publishResults(GrpcCodec.encodeResultCollection(request)))),
                request -> call("CheckHealth", () -> GrpcCodec.decodeHealthCheckResponse(
                        stub.checkHealth(GrpcCodec.encodeNodeKeyRequest(request)))));
    }

    private static <R> R call(String method, StubCall<R> call) throws KolideServiceException {
        try {
            return call.run();
        } catch (StatusRuntimeException e) {
            throw GrpcErrors.map(method, e);
        }
    }

    @FunctionalInterface
    private interface StubCall<R> {
        R run();
    }
}
