package com.kkape.agentrpc.codec;

import com.google.gson.JsonElement;

/**
 * JSON-RPC 2.0 response envelope. Exactly one of result and error is set.
 */
public class JsonRpcResponse {
    private String jsonrpc;
    private JsonElement result;
    private JsonRpcError error;
    private JsonElement id;

    public JsonRpcResponse() {
    }

    public static JsonRpcResponse success(JsonElement id, JsonElement result) {
        JsonRpcResponse response = new JsonRpcResponse();
        response.jsonrpc = JsonRpcCodec.VERSION;
        response.id = id;
        response.result = result;
        return response;
    }

    public static JsonRpcResponse failure(JsonElement id, int code, String message) {
        JsonRpcResponse response = new JsonRpcResponse();
        response.jsonrpc = JsonRpcCodec.VERSION;
        response.id = id;
        response.error = new JsonRpcError(code, message);
        return response;
    }

    public String getJsonrpc() { return jsonrpc; }
    public JsonElement getResult() { return result; }
    public JsonRpcError getError() { return error; }
    public JsonElement getId() { return id; }
}
