package com.kkape.agentrpc.model;

/**
 * Device configuration as returned by the server. The config is an opaque JSON blob.
 */
public class ConfigResult {
    private final String config;
    private final boolean nodeInvalid;

    public ConfigResult(String config, boolean nodeInvalid) {
        this.config = config == null ? "" : config;
        this.nodeInvalid = nodeInvalid;
    }

    public String getConfig() {
        return config;
    }

    public boolean isNodeInvalid() {
        return nodeInvalid;
    }
}
