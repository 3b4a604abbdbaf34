package com.kkape.agentrpc.message;

import com.google.gson.annotations.SerializedName;
import com.kkape.agentrpc.model.DistributedQueries;

public class QueryCollectionResponse extends ApiResponse {
    @SerializedName("Queries")
    private DistributedQueries queries;
    @SerializedName("node_invalid")
    private boolean nodeInvalid;
    @SerializedName("error_code")
    private String errorCode;

    public DistributedQueries getQueries() {
        return queries == null ? new DistributedQueries() : queries;
    }

    public void setQueries(DistributedQueries queries) { this.queries = queries; }
    public boolean isNodeInvalid() { return nodeInvalid; }
    public void setNodeInvalid(boolean nodeInvalid) { this.nodeInvalid = nodeInvalid; }
    public String getErrorCode() { return errorCode; }
    public void setErrorCode(String errorCode) { this.errorCode = errorCode; }
}
