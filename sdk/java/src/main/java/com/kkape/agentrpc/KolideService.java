package com.kkape.agentrpc;

import com.kkape.agentrpc.error.KolideServiceException;
import com.kkape.agentrpc.model.ConfigResult;
import com.kkape.agentrpc.model.EnrollmentDetails;
import com.kkape.agentrpc.model.EnrollmentResult;
import com.kkape.agentrpc.model.HealthStatus;
import com.kkape.agentrpc.model.LogType;
import com.kkape.agentrpc.model.PublishResult;
import com.kkape.agentrpc.model.QueriesResult;
import com.kkape.agentrpc.model.QueryResult;

import java.util.List;

/**
 * The operations an agent performs against the management server.
 *
 * <p>Implemented by the transport endpoints, by each middleware layer, and on the
 * server side by whatever backs the API. Calls block on network I/O and honour the
 * deadline and cancellation of the current {@link io.grpc.Context}.</p>
 *
 * <p>Callers check the outcome in this order: a thrown exception first (including
 * {@link com.kkape.agentrpc.error.DeviceDisabledException}), then the node-invalid
 * flag on the result.</p>
 */
public interface KolideService {

    /**
     * Register the device and obtain a node key.
     */
    EnrollmentResult requestEnrollment(String enrollSecret, String hostIdentifier, EnrollmentDetails details)
            throws KolideServiceException;

    /**
     * Fetch the osquery configuration for this node.
     */
    ConfigResult requestConfig(String nodeKey) throws KolideServiceException;

    /**
     * Ship a batch of status or result logs.
     */
    PublishResult publishLogs(String nodeKey, LogType logType, List<String> logs) throws KolideServiceException;

    /**
     * Fetch the distributed queries pending for this node.
     */
    QueriesResult requestQueries(String nodeKey) throws KolideServiceException;

    /**
     * Ship the results of distributed queries.
     */
    PublishResult publishResults(String nodeKey, List<QueryResult> results) throws KolideServiceException;

    /**
     * Liveness check.
     */
    HealthStatus checkHealth() throws KolideServiceException;
}
