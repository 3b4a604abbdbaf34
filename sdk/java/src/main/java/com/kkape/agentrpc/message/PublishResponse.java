package com.kkape.agentrpc.message;

import com.google.gson.annotations.SerializedName;

/**
 * Response to PublishLogs and PublishResults.
 */
public class PublishResponse extends ApiResponse {
    @SerializedName("message")
    private String message;
    @SerializedName("node_invalid")
    private boolean nodeInvalid;
    @SerializedName("error_code")
    private String errorCode;

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public boolean isNodeInvalid() { return nodeInvalid; }
    public void setNodeInvalid(boolean nodeInvalid) { this.nodeInvalid = nodeInvalid; }
    public String getErrorCode() { return errorCode; }
    public void setErrorCode(String errorCode) { this.errorCode = errorCode; }
}
