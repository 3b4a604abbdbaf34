package com.kkape.agentrpc.server;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.kkape.agentrpc.KolideService;
import com.kkape.agentrpc.codec.JsonRpcCodec;
import com.kkape.agentrpc.codec.JsonRpcError;
import com.kkape.agentrpc.codec.JsonRpcRequest;
import com.kkape.agentrpc.error.KolideServiceException;
import com.kkape.agentrpc.message.EnrollmentRequest;
import com.kkape.agentrpc.message.LogCollection;
import com.kkape.agentrpc.message.NodeKeyRequest;
import com.kkape.agentrpc.message.ResultCollection;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves JSON-RPC 2.0 POST requests for the six agent methods.
 *
 * <p>Service calls block, so this handler belongs on its own executor group rather than the
 * I/O event loop.</p>
 */
public class JsonRpcHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger log = LoggerFactory.getLogger(JsonRpcHandler.class);

    private final ServiceAdapter adapter;

    public JsonRpcHandler(KolideService service) {
        this.adapter = new ServiceAdapter(service);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        if (!HttpMethod.POST.equals(request.method())) {
            sendStatus(ctx, request, HttpResponseStatus.METHOD_NOT_ALLOWED);
            return;
        }
        String body = request.content().toString(CharsetUtil.UTF_8);
        sendJson(ctx, request, handleMessage(body));
    }

    /**
     * Dispatch one request body and return the response body.
     */
    String handleMessage(String body) {
        JsonRpcRequest message;
        try {
            message = JsonRpcCodec.decodeRequest(body);
        } catch (JsonParseException e) {
            return JsonRpcCodec.encodeError(null, JsonRpcError.PARSE_ERROR, "Parse error: " + e.getMessage());
        }

        JsonElement id = message.getId();
        String method = message.getMethod();
        if (!JsonRpcCodec.VERSION.equals(message.getJsonrpc())) {
            return JsonRpcCodec.encodeError(id, JsonRpcError.INVALID_REQUEST, "Invalid JSON-RPC version");
        }

        try {
            switch (method) {
                case "RequestEnrollment":
                    return JsonRpcCodec.encodeResult(id,
                            adapter.requestEnrollment(params(message, EnrollmentRequest.class, "enrollment")));
                case "RequestConfig":
                    return JsonRpcCodec.encodeResult(id,
                            adapter.requestConfig(params(message, NodeKeyRequest.class, "config")));
                case "PublishLogs":
                    return JsonRpcCodec.encodeResult(id,
                            adapter.publishLogs(params(message, LogCollection.class, "log collection")));
                case "RequestQueries":
                    return JsonRpcCodec.encodeResult(id,
                            adapter.requestQueries(params(message, NodeKeyRequest.class, "queries")));
                case "PublishResults":
                    return JsonRpcCodec.encodeResult(id,
                            adapter.publishResults(params(message, ResultCollection.class, "result collection")));
                case "CheckHealth":
                    return JsonRpcCodec.encodeResult(id, adapter.checkHealth());
                default:
                    return JsonRpcCodec.encodeError(id, JsonRpcError.METHOD_NOT_FOUND, "Method not found: " + method);
            }
        } catch (UndecodableParamsException e) {
            log.warn("{}: {}", method, e.getMessage());
            return JsonRpcCodec.encodeError(id, JsonRpcError.DECODE_FAILED, e.getMessage());
        } catch (KolideServiceException | RuntimeException e) {
            JsonRpcError error = ServerErrors.jsonRpcError(method, e);
            return JsonRpcCodec.encodeError(id, error.getCode(), error.getMessage());
        }
    }

    private static <T> T params(JsonRpcRequest message, Class<T> type, String description)
            throws UndecodableParamsException {
        try {
            return JsonRpcCodec.decodeParams(message, type);
        } catch (JsonParseException e) {
            throw new UndecodableParamsException("couldn't unmarshal body to " + description + " request: "
                    + e.getMessage(), e);
        }
    }

    private void sendJson(ChannelHandlerContext ctx, FullHttpRequest request, String json) {
        ByteBuf content = Unpooled.copiedBuffer(json, CharsetUtil.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK, content);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
        write(ctx, request, response);
    }

    private void sendStatus(ChannelHandlerContext ctx, FullHttpRequest request, HttpResponseStatus status) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
                Unpooled.copiedBuffer(status.reasonPhrase(), CharsetUtil.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.TEXT_PLAIN);
        write(ctx, request, response);
    }

    private void write(ChannelHandlerContext ctx, FullHttpRequest request, FullHttpResponse response) {
        HttpUtil.setContentLength(response, response.content().readableBytes());
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        HttpUtil.setKeepAlive(response, keepAlive);
        ChannelFuture written = ctx.writeAndFlush(response);
        if (!keepAlive) {
            written.addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("JSON-RPC connection error: {}", cause.getMessage());
        ctx.close();
    }

    private static class UndecodableParamsException extends Exception {
        UndecodableParamsException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
