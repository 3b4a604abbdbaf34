package com.kkape.agentrpc.codec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.kkape.agentrpc.error.RemoteServiceException;
import com.kkape.agentrpc.error.ResponseDecodeException;
import com.kkape.agentrpc.model.LogType;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON encoding for the JSON-RPC transport.
 *
 * <p>Log types travel as osquery's integer codes. Envelopes follow JSON-RPC 2.0; responses
 * are accepted without an id.</p>
 */
public final class JsonRpcCodec {

    public static final String VERSION = "2.0";

    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(LogType.class, new LogTypeAdapter().nullSafe())
            .disableHtmlEscaping()
            .create();

    private static final AtomicLong REQUEST_IDS = new AtomicLong();

    private JsonRpcCodec() {
    }

    public static Gson gson() {
        return GSON;
    }

    /**
     * Build the request envelope for a call.
     */
    public static String encodeRequest(String method, Object params) {
        JsonElement id = new JsonPrimitive(REQUEST_IDS.incrementAndGet());
        return GSON.toJson(new JsonRpcRequest(method, GSON.toJsonTree(params), id));
    }

    /**
     * Decode a response body into the expected result type.
     *
     * @throws RemoteServiceException if the server answered with an error object
     * @throws ResponseDecodeException if the body or its result cannot be decoded
     */
    public static <T> T decodeResult(String body, Class<T> resultType)
            throws RemoteServiceException, ResponseDecodeException {
        JsonRpcResponse response;
        try {
            response = GSON.fromJson(body, JsonRpcResponse.class);
        } catch (JsonParseException e) {
            throw new ResponseDecodeException("decode json-rpc response: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new ResponseDecodeException("decode json-rpc response: empty body", null);
        }
        if (response.getError() != null) {
            JsonRpcError error = response.getError();
            throw new RemoteServiceException(error.getCode(), error.getMessage());
        }
        if (response.getResult() == null || response.getResult().isJsonNull()) {
            throw new ResponseDecodeException("decode json-rpc response: missing result", null);
        }
        try {
            return GSON.fromJson(response.getResult(), resultType);
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new ResponseDecodeException("decode " + resultType.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse an incoming request envelope.
     *
     * @throws JsonParseException if the body is not a JSON-RPC request
     */
    public static JsonRpcRequest decodeRequest(String body) {
        JsonRpcRequest request = GSON.fromJson(body, JsonRpcRequest.class);
        if (request == null || request.getMethod() == null) {
            throw new JsonParseException("not a json-rpc request");
        }
        return request;
    }

    /**
     * Decode request params into the expected type.
     *
     * @throws JsonParseException if the params do not fit
     */
    public static <T> T decodeParams(JsonRpcRequest request, Class<T> paramsType) {
        JsonElement params = request.getParams();
        if (params == null || params.isJsonNull()) {
            throw new JsonParseException("missing params");
        }
        try {
            return GSON.fromJson(params, paramsType);
        } catch (IllegalArgumentException e) {
            throw new JsonParseException(e.getMessage(), e);
        }
    }

    public static String encodeResult(JsonElement id, Object result) {
        return GSON.toJson(JsonRpcResponse.success(id, GSON.toJsonTree(result)));
    }

    public static String encodeError(JsonElement id, int code, String message) {
        return GSON.toJson(JsonRpcResponse.failure(id, code, message));
    }

    private static class LogTypeAdapter extends TypeAdapter<LogType> {
        @Override
        public void write(JsonWriter out, LogType value) throws IOException {
            out.value(value.getCode());
        }

        @Override
        public LogType read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.STRING) {
                return LogType.fromCode(Integer.parseInt(in.nextString()));
            }
            return LogType.fromCode(in.nextInt());
        }
    }
}
