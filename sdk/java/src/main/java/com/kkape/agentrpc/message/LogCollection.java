package com.kkape.agentrpc.message;

import com.google.gson.annotations.SerializedName;
import com.kkape.agentrpc.model.LogType;

import java.util.List;

public class LogCollection {
    @SerializedName("node_key")
    private String nodeKey;
    @SerializedName("LogType")
    private LogType logType;
    @SerializedName("Logs")
    private List<String> logs;

    public LogCollection() {
    }

    public LogCollection(String nodeKey, LogType logType, List<String> logs) {
        this.nodeKey = nodeKey;
        this.logType = logType;
        this.logs = logs;
    }

    public String getNodeKey() { return nodeKey == null ? "" : nodeKey; }
    public LogType getLogType() { return logType; }
    public List<String> getLogs() { return logs == null ? List.of() : logs; }
}
