package com.kkape.agentrpc.model;

import com.google.gson.annotations.SerializedName;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Distributed queries to run, keyed by query id, plus optional discovery predicates
 * that gate each query.
 */
public class DistributedQueries {
    @SerializedName("queries")
    private Map<String, String> queries = new LinkedHashMap<>();
    @SerializedName("discovery")
    private Map<String, String> discovery = new LinkedHashMap<>();
    @SerializedName("accelerate")
    private int accelerateSeconds;

    public Map<String, String> getQueries() {
        if (queries == null) {
            queries = new LinkedHashMap<>();
        }
        return queries;
    }

    public void setQueries(Map<String, String> queries) {
        this.queries = queries;
    }

    public Map<String, String> getDiscovery() {
        if (discovery == null) {
            discovery = new LinkedHashMap<>();
        }
        return discovery;
    }

    public void setDiscovery(Map<String, String> discovery) {
        this.discovery = discovery;
    }

    public int getAccelerateSeconds() {
        return accelerateSeconds;
    }

    public void setAccelerateSeconds(int accelerateSeconds) {
        this.accelerateSeconds = accelerateSeconds;
    }
}
