package com.kkape.agentrpc.model;

/**
 * Outcome of a successful enrollment call.
 */
public class EnrollmentResult {
    private final String nodeKey;
    private final boolean nodeInvalid;

    public EnrollmentResult(String nodeKey, boolean nodeInvalid) {
        this.nodeKey = nodeKey == null ? "" : nodeKey;
        this.nodeInvalid = nodeInvalid;
    }

    public String getNodeKey() {
        return nodeKey;
    }

    public boolean isNodeInvalid() {
        return nodeInvalid;
    }
}
