package com.kkape.agentrpc.server;

import com.kkape.agentrpc.KolideService;
import com.kkape.agentrpc.error.DeviceDisabledException;
import com.kkape.agentrpc.error.KolideServiceException;
import com.kkape.agentrpc.message.ConfigResponse;
import com.kkape.agentrpc.message.EnrollmentRequest;
import com.kkape.agentrpc.message.EnrollmentResponse;
import com.kkape.agentrpc.message.HealthCheckResponse;
import com.kkape.agentrpc.message.LogCollection;
import com.kkape.agentrpc.message.NodeKeyRequest;
import com.kkape.agentrpc.message.PublishResponse;
import com.kkape.agentrpc.message.QueryCollectionResponse;
import com.kkape.agentrpc.message.ResultCollection;
import com.kkape.agentrpc.model.ConfigResult;
import com.kkape.agentrpc.model.EnrollmentResult;
import com.kkape.agentrpc.model.PublishResult;
import com.kkape.agentrpc.model.QueriesResult;

/**
 * Runs decoded requests against a {@link KolideService} and builds the response messages
 * shared by both server transports. A service that throws {@link DeviceDisabledException}
 * gets a response carrying only the disable flag.
 */
class ServiceAdapter {
    private final KolideService service;

    ServiceAdapter(KolideService service) {
        this.service = service;
    }

    EnrollmentResponse requestEnrollment(EnrollmentRequest request) throws KolideServiceException {
        EnrollmentResponse response = new EnrollmentResponse();
        try {
            EnrollmentResult result = service.requestEnrollment(
                    request.getEnrollSecret(), request.getHostIdentifier(), request.getEnrollmentDetails());
            response.setNodeKey(result.getNodeKey());
            response.setNodeInvalid(result.isNodeInvalid());
        } catch (DeviceDisabledException e) {
            response.setDisableDevice(true);
        }
        return response;
    }

    ConfigResponse requestConfig(NodeKeyRequest request) throws KolideServiceException {
        ConfigResponse response = new ConfigResponse();
        try {
            ConfigResult result = service.requestConfig(request.getNodeKey());
            response.setConfig(result.getConfig());
            response.setNodeInvalid(result.isNodeInvalid());
        } catch (DeviceDisabledException e) {
            response.setDisableDevice(true);
        }
        return response;
    }

    PublishResponse publishLogs(LogCollection request) throws KolideServiceException {
        PublishResponse response = new PublishResponse();
        try {
            fill(response, service.publishLogs(request.getNodeKey(), request.getLogType(), request.getLogs()));
        } catch (DeviceDisabledException e) {
            response.setDisableDevice(true);
        }
        return response;
    }

    QueryCollectionResponse requestQueries(NodeKeyRequest request) throws KolideServiceException {
        QueryCollectionResponse response = new QueryCollectionResponse();
        try {
            QueriesResult result = service.requestQueries(request.getNodeKey());
            response.setQueries(result.getQueries());
            response.setNodeInvalid(result.isNodeInvalid());
        } catch (DeviceDisabledException e) {
            response.setDisableDevice(true);
        }
        return response;
    }

    PublishResponse publishResults(ResultCollection request) throws KolideServiceException {
        PublishResponse response = new PublishResponse();
        try {
            fill(response, service.publishResults(request.getNodeKey(), request.getResults()));
        } catch (DeviceDisabledException e) {
            response.setDisableDevice(true);
        }
        return response;
    }

    HealthCheckResponse checkHealth() throws KolideServiceException {
        HealthCheckResponse response = new HealthCheckResponse();
        try {
            response.setStatus(service.checkHealth().getCode());
        } catch (DeviceDisabledException e) {
            response.setDisableDevice(true);
        }
        return response;
    }

    private static void fill(PublishResponse response, PublishResult result) {
        response.setMessage(result.getMessage());
        response.setErrorCode(result.getErrorCode());
        response.setNodeInvalid(result.isNodeInvalid());
    }
}
