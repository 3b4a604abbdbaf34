package com.kkape.agentrpc.server;

import com.kkape.agentrpc.KolideService;
import com.kkape.agentrpc.codec.GrpcCodec;
import com.kkape.agentrpc.error.KolideServiceException;
import com.kkape.agentrpc.middleware.RequestIds;
import com.kkape.agentrpc.proto.ApiGrpc;
import com.kkape.agentrpc.proto.KolideAgentProto;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * gRPC {@code kolide.agent.Api} implementation delegating to a {@link KolideService}.
 */
public class ApiServiceImpl extends ApiGrpc.ApiImplBase {
    private static final Logger log = LoggerFactory.getLogger(ApiServiceImpl.class);

    private final ServiceAdapter adapter;

    public ApiServiceImpl(KolideService service) {
        this.adapter = new ServiceAdapter(service);
    }

    @Override
    public void requestEnrollment(KolideAgentProto.EnrollmentRequest request,
                                  StreamObserver<KolideAgentProto.EnrollmentResponse> responseObserver) {
        handle("RequestEnrollment", responseObserver, () -> GrpcCodec.decodeEnrollmentRequest(request),
                decoded -> GrpcCodec.encodeEnrollmentResponse(adapter.requestEnrollment(decoded)));
    }

    @Override
    public void requestConfig(KolideAgentProto.AgentApiRequest request,
                              StreamObserver<KolideAgentProto.ConfigResponse> responseObserver) {
        handle("RequestConfig", responseObserver, () -> GrpcCodec.decodeNodeKeyRequest(request),
                decoded -> GrpcCodec.encodeConfigResponse(adapter.requestConfig(decoded)));
    }

    @Override
    public void requestQueries(KolideAgentProto.AgentApiRequest request,
                               StreamObserver<KolideAgentProto.QueryCollection> responseObserver) {
        handle("RequestQueries", responseObserver, () -> GrpcCodec.decodeNodeKeyRequest(request),
                decoded -> GrpcCodec.encodeQueryCollection(adapter.requestQueries(decoded)));
    }

    @Override
    public void publishLogs(KolideAgentProto.LogCollection request,
                            StreamObserver<KolideAgentProto.AgentApiResponse> responseObserver) {
        handle("PublishLogs", responseObserver, () -> GrpcCodec.decodeLogCollection(request),
                decoded -> GrpcCodec.encodePublishResponse(adapter.publishLogs(decoded)));
    }

    @Override
    public void publishResults(KolideAgentProto.ResultCollection request,
                               StreamObserver<KolideAgentProto.AgentApiResponse> responseObserver) {
        handle("PublishResults", responseObserver, () -> GrpcCodec.decodeResultCollection(request),
                decoded -> GrpcCodec.encodePublishResponse(adapter.publishResults(decoded)));
    }

    @Override
    public void checkHealth(KolideAgentProto.AgentApiRequest request,
                            StreamObserver<KolideAgentProto.HealthCheckResponse> responseObserver) {
        handle("CheckHealth", responseObserver, () -> GrpcCodec.decodeNodeKeyRequest(request),
                decoded -> GrpcCodec.encodeHealthCheckResponse(adapter.checkHealth()));
    }

    /**
     * Only a request that fails to decode is reported as INVALID_ARGUMENT with its reason. Anything
     * thrown past decoding goes through {@link ServerErrors} so its text stays in the server log.
     */
    private static <Q, R> void handle(String method, StreamObserver<R> responseObserver,
                                      Supplier<Q> decoder, Handler<Q, R> handler) {
        log.debug("{} request, uuid={}", method, RequestIds.current());
        Q decoded;
        try {
            decoded = decoder.get();
        } catch (IllegalArgumentException e) {
            log.warn("{}: undecodable request: {}", method, e.getMessage());
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException());
            return;
        }

        R response;
        try {
            response = handler.handle(decoded);
        } catch (KolideServiceException | RuntimeException e) {
            responseObserver.onError(ServerErrors.grpcStatus(method, e).asRuntimeException());
            return;
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    @FunctionalInterface
    private interface Handler<Q, R> {
        R handle(Q request) throws KolideServiceException;
    }
}
