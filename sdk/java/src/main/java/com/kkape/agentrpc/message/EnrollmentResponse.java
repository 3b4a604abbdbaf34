package com.kkape.agentrpc.message;

import com.google.gson.annotations.SerializedName;

public class EnrollmentResponse extends ApiResponse {
    @SerializedName("node_key")
    private String nodeKey;
    @SerializedName("node_invalid")
    private boolean nodeInvalid;
    @SerializedName("error_code")
    private String errorCode;

    public String getNodeKey() { return nodeKey; }
    public void setNodeKey(String nodeKey) { this.nodeKey = nodeKey; }
    public boolean isNodeInvalid() { return nodeInvalid; }
    public void setNodeInvalid(boolean nodeInvalid) { this.nodeInvalid = nodeInvalid; }
    public String getErrorCode() { return errorCode; }
    public void setErrorCode(String errorCode) { this.errorCode = errorCode; }
}
