package com.kkape.agentrpc;

import com.kkape.agentrpc.endpoint.Endpoints;
import com.kkape.agentrpc.error.KolideServiceException;
import com.kkape.agentrpc.model.ConfigResult;
import com.kkape.agentrpc.model.EnrollmentDetails;
import com.kkape.agentrpc.model.EnrollmentResult;
import com.kkape.agentrpc.model.HealthStatus;
import com.kkape.agentrpc.model.LogType;
import com.kkape.agentrpc.model.PublishResult;
import com.kkape.agentrpc.model.QueriesResult;
import com.kkape.agentrpc.model.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * A fully wrapped client: middleware around the transport endpoints. Obtain one from
 * {@link KolideClients} and close it to release the transport.
 */
public class KolideClient implements KolideService, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KolideClient.class);

    private final KolideService service;
    private final Endpoints endpoints;
    private final ClientConfig config;

    KolideClient(KolideService service, Endpoints endpoints, ClientConfig config) {
        this.service = service;
        this.endpoints = endpoints;
        this.config = config;
    }

    @Override
    public EnrollmentResult requestEnrollment(String enrollSecret, String hostIdentifier, EnrollmentDetails details)
            throws KolideServiceException {
        return service.requestEnrollment(enrollSecret, hostIdentifier, details);
    }

    @Override
    public ConfigResult requestConfig(String nodeKey) throws KolideServiceException {
        return service.requestConfig(nodeKey);
    }

    @Override
    public PublishResult publishLogs(String nodeKey, LogType logType, List<String> logs)
            throws KolideServiceException {
        return service.publishLogs(nodeKey, logType, logs);
    }

    @Override
    public QueriesResult requestQueries(String nodeKey) throws KolideServiceException {
        return service.requestQueries(nodeKey);
    }

    @Override
    public PublishResult publishResults(String nodeKey, List<QueryResult> results) throws KolideServiceException {
        return service.publishResults(nodeKey, results);
    }

    @Override
    public HealthStatus checkHealth() throws KolideServiceException {
        return service.checkHealth();
    }

    /**
     * Server URL the client currently sends requests to.
     */
    public String getServerUrl() {
        return endpoints.currentServerUrl();
    }

    @Override
    public void close() throws IOException {
        config.unregisterObserver(endpoints);
        endpoints.close();
        log.debug("Client for {} closed", endpoints.currentServerUrl());
    }
}
