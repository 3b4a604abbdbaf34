package com.kkape.agentrpc.endpoint;

import com.kkape.agentrpc.message.ConfigResponse;
import com.kkape.agentrpc.message.EnrollmentRequest;
import com.kkape.agentrpc.message.EnrollmentResponse;
import com.kkape.agentrpc.message.HealthCheckResponse;
import com.kkape.agentrpc.message.LogCollection;
import com.kkape.agentrpc.message.NodeKeyRequest;
import com.kkape.agentrpc.message.PublishResponse;
import com.kkape.agentrpc.message.QueryCollectionResponse;
import com.kkape.agentrpc.message.ResultCollection;

import java.util.Objects;

/**
 * The six endpoints bound to one server. Replaced as a whole on reconfiguration, so a
 * caller never sees bindings to two different servers.
 */
public final class EndpointSet {
    private final String serverUrl;
    private final Endpoint<EnrollmentRequest, EnrollmentResponse> requestEnrollment;
    private final Endpoint<NodeKeyRequest, ConfigResponse> requestConfig;
    private final Endpoint<LogCollection, PublishResponse> publishLogs;
    private final Endpoint<NodeKeyRequest, QueryCollectionResponse> requestQueries;
    private final Endpoint<ResultCollection, PublishResponse> publishResults;
    private final Endpoint<NodeKeyRequest, HealthCheckResponse> checkHealth;

    public EndpointSet(String serverUrl,
                       Endpoint<EnrollmentRequest, EnrollmentResponse> requestEnrollment,
                       Endpoint<NodeKeyRequest, ConfigResponse> requestConfig,
                       Endpoint<LogCollection, PublishResponse> publishLogs,
                       Endpoint<NodeKeyRequest, QueryCollectionResponse> requestQueries,
                       Endpoint<ResultCollection, PublishResponse> publishResults,
                       Endpoint<NodeKeyRequest, HealthCheckResponse> checkHealth) {
        this.serverUrl = serverUrl;
        this.requestEnrollment = Objects.requireNonNull(requestEnrollment, "requestEnrollment");
        this.requestConfig = Objects.requireNonNull(requestConfig, "requestConfig");
        this.publishLogs = Objects.requireNonNull(publishLogs, "publishLogs");
        this.requestQueries = Objects.requireNonNull(requestQueries, "requestQueries");
        this.publishResults = Objects.requireNonNull(publishResults, "publishResults");
        this.checkHealth = Objects.requireNonNull(checkHealth, "checkHealth");
    }

    public String getServerUrl() { return serverUrl; }
    public Endpoint<EnrollmentRequest, EnrollmentResponse> getRequestEnrollment() { return requestEnrollment; }
    public Endpoint<NodeKeyRequest, ConfigResponse> getRequestConfig() { return requestConfig; }
    public Endpoint<LogCollection, PublishResponse> getPublishLogs() { return publishLogs; }
    public Endpoint<NodeKeyRequest, QueryCollectionResponse> getRequestQueries() { return requestQueries; }
    public Endpoint<ResultCollection, PublishResponse> getPublishResults() { return publishResults; }
    public Endpoint<NodeKeyRequest, HealthCheckResponse> getCheckHealth() { return checkHealth; }
}
