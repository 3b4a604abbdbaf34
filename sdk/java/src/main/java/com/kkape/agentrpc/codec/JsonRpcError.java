package com.kkape.agentrpc.codec;

/**
 * Error object of a JSON-RPC 2.0 response.
 */
public class JsonRpcError {
    /** Request parameters could not be decoded */
    public static final int DECODE_FAILED = -32000;
    /** The service reported the node key as invalid */
    public static final int NODE_INVALID = -32001;
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INTERNAL_ERROR = -32603;

    private int code;
    private String message;

    public JsonRpcError() {
    }

    public JsonRpcError(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() { return code; }
    public String getMessage() { return message; }
}
