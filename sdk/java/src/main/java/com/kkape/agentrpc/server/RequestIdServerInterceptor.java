package com.kkape.agentrpc.server;

import com.kkape.agentrpc.middleware.RequestIds;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;

/**
 * Binds the caller's {@code uuid} header, when present, to the call's context.
 */
public class RequestIdServerInterceptor implements ServerInterceptor {

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
        String requestId = headers.get(RequestIds.METADATA_KEY);
        if (requestId == null) {
            return next.startCall(call, headers);
        }
        Context context = Context.current().withValue(RequestIds.REQUEST_ID, requestId);
        return Contexts.interceptCall(context, call, headers, next);
    }
}
