package com.kkape.agentrpc.model;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Result of one distributed query: its rows, osquery status code and optional
 * execution stats.
 */
public class QueryResult {
    @SerializedName("query_name")
    private String queryName;
    @SerializedName("status")
    private int status;
    @SerializedName("rows")
    private List<Map<String, String>> rows = new ArrayList<>();
    @SerializedName("stats")
    private QueryStats stats;

    public QueryResult() {
    }

    public QueryResult(String queryName, int status, List<Map<String, String>> rows) {
        this.queryName = queryName;
        this.status = status;
        this.rows = rows;
    }

    public String getQueryName() { return queryName; }
    public void setQueryName(String queryName) { this.queryName = queryName; }
    public int getStatus() { return status; }
    public void setStatus(int status) { this.status = status; }
    public List<Map<String, String>> getRows() { return rows == null ? List.of() : rows; }
    public void setRows(List<Map<String, String>> rows) { this.rows = rows; }
    public QueryStats getStats() { return stats; }
    public void setStats(QueryStats stats) { this.stats = stats; }
}
