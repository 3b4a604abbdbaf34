package com.kkape.agentrpc.message;

import com.google.gson.annotations.SerializedName;
import com.kkape.agentrpc.model.QueryResult;

import java.util.List;

public class ResultCollection {
    @SerializedName("node_key")
    private String nodeKey;
    @SerializedName("Results")
    private List<QueryResult> results;

    public ResultCollection() {
    }

    public ResultCollection(String nodeKey, List<QueryResult> results) {
        this.nodeKey = nodeKey;
        this.results = results;
    }

    public String getNodeKey() { return nodeKey == null ? "" : nodeKey; }
    public List<QueryResult> getResults() { return results == null ? List.of() : results; }
}
