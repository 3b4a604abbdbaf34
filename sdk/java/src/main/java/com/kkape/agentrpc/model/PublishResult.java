package com.kkape.agentrpc.model;

/**
 * Server acknowledgement for published logs or query results.
 */
public class PublishResult {
    private final String message;
    private final String errorCode;
    private final boolean nodeInvalid;

    public PublishResult(String message, String errorCode, boolean nodeInvalid) {
        this.message = message == null ? "" : message;
        this.errorCode = errorCode == null ? "" : errorCode;
        this.nodeInvalid = nodeInvalid;
    }

    public String getMessage() {
        return message;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isNodeInvalid() {
        return nodeInvalid;
    }
}
