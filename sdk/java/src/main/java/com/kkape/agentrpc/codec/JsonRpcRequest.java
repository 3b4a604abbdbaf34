package com.kkape.agentrpc.codec;

import com.google.gson.JsonElement;

/**
 * JSON-RPC 2.0 request envelope.
 */
public class JsonRpcRequest {
    private String jsonrpc;
    private String method;
    private JsonElement params;
    private JsonElement id;

    public JsonRpcRequest() {
    }

    public JsonRpcRequest(String method, JsonElement params, JsonElement id) {
        this.jsonrpc = JsonRpcCodec.VERSION;
        this.method = method;
        this.params = params;
        this.id = id;
    }

    public String getJsonrpc() { return jsonrpc; }
    public String getMethod() { return method; }
    public JsonElement getParams() { return params; }
    public JsonElement getId() { return id; }
}
