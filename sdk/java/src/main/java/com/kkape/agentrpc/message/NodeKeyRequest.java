package com.kkape.agentrpc.message;

import com.google.gson.annotations.SerializedName;

/**
 * Request carrying only the node key: config, queries and health checks.
 */
public class NodeKeyRequest {
    @SerializedName("node_key")
    private String nodeKey;

    public NodeKeyRequest() {
    }

    public NodeKeyRequest(String nodeKey) {
        this.nodeKey = nodeKey;
    }

    public String getNodeKey() {
        return nodeKey == null ? "" : nodeKey;
    }
}
