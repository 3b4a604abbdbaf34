package com.kkape.agentrpc.model;

/**
 * Pending distributed queries for this node.
 */
public class QueriesResult {
    private final DistributedQueries queries;
    private final boolean nodeInvalid;

    public QueriesResult(DistributedQueries queries, boolean nodeInvalid) {
        this.queries = queries == null ? new DistributedQueries() : queries;
        this.nodeInvalid = nodeInvalid;
    }

    public DistributedQueries getQueries() {
        return queries;
    }

    public boolean isNodeInvalid() {
        return nodeInvalid;
    }
}
