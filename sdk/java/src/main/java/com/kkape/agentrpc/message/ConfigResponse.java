package com.kkape.agentrpc.message;

import com.google.gson.annotations.SerializedName;

public class ConfigResponse extends ApiResponse {
    @SerializedName("config")
    private String config;
    @SerializedName("node_invalid")
    private boolean nodeInvalid;

    public String getConfig() { return config; }
    public void setConfig(String config) { this.config = config; }
    public boolean isNodeInvalid() { return nodeInvalid; }
    public void setNodeInvalid(boolean nodeInvalid) { this.nodeInvalid = nodeInvalid; }
}
