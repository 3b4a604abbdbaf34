package com.kkape.agentrpc.middleware;

import com.kkape.agentrpc.KolideService;
import com.kkape.agentrpc.error.KolideServiceException;
import com.kkape.agentrpc.model.ConfigResult;
import com.kkape.agentrpc.model.EnrollmentDetails;
import com.kkape.agentrpc.model.EnrollmentResult;
import com.kkape.agentrpc.model.HealthStatus;
import com.kkape.agentrpc.model.LogType;
import com.kkape.agentrpc.model.PublishResult;
import com.kkape.agentrpc.model.QueriesResult;
import com.kkape.agentrpc.model.QueryResult;
import io.grpc.Context;

import java.util.List;

/**
 * Gives every call a fresh correlation id, bound in the {@link Context} for its duration.
 */
public class RequestIdMiddleware implements KolideService {
    private final KolideService next;

    public RequestIdMiddleware(KolideService next) {
        this.next = next;
    }

    @Override
    public EnrollmentResult requestEnrollment(String enrollSecret, String hostIdentifier, EnrollmentDetails details)
            throws KolideServiceException {
        return withRequestId(() -> next.requestEnrollment(enrollSecret, hostIdentifier, details));
    }

    @Override
    public ConfigResult requestConfig(String nodeKey) throws KolideServiceException {
        return withRequestId(() -> next.requestConfig(nodeKey));
    }

    @Override
    public PublishResult publishLogs(String nodeKey, LogType logType, List<String> logs)
            throws KolideServiceException {
        return withRequestId(() -> next.publishLogs(nodeKey, logType, logs));
    }

    @Override
    public QueriesResult requestQueries(String nodeKey) throws KolideServiceException {
        return withRequestId(() -> next.requestQueries(nodeKey));
    }

    @Override
    public PublishResult publishResults(String nodeKey, List<QueryResult> results) throws KolideServiceException {
        return withRequestId(() -> next.publishResults(nodeKey, results));
    }

    @Override
    public HealthStatus checkHealth() throws KolideServiceException {
        return withRequestId(next::checkHealth);
    }

    private static <T> T withRequestId(ServiceCall<T> call) throws KolideServiceException {
        Context context = Context.current().withValue(RequestIds.REQUEST_ID, RequestIds.newId());
        Context previous = context.attach();
        try {
            return call.run();
        } finally {
            context.detach(previous);
        }
    }

    @FunctionalInterface
    interface ServiceCall<T> {
        T run() throws KolideServiceException;
    }
}
