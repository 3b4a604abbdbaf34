package com.kkape.agentrpc;

import com.kkape.agentrpc.error.KolideServiceException;
import com.kkape.agentrpc.middleware.RequestIds;
import com.kkape.agentrpc.model.ConfigResult;
import com.kkape.agentrpc.model.DistributedQueries;
import com.kkape.agentrpc.model.EnrollmentDetails;
import com.kkape.agentrpc.model.EnrollmentResult;
import com.kkape.agentrpc.model.HealthStatus;
import com.kkape.agentrpc.model.LogType;
import com.kkape.agentrpc.model.PublishResult;
import com.kkape.agentrpc.model.QueriesResult;
import com.kkape.agentrpc.model.QueryResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Canned {@link KolideService} for server side tests. Records what it received.
 */
public class StubService implements KolideService {
    private volatile String config = "{\"schedule\":{}}";
    private volatile boolean nodeInvalid;
    private volatile KolideServiceException failure;

    public final List<String> requestIds = new CopyOnWriteArrayList<>();
    public volatile String lastEnrollSecret;
    public volatile EnrollmentDetails lastDetails;
    public volatile LogType lastLogType;
    public volatile List<String> lastLogs;
    public volatile List<QueryResult> lastResults;

    public StubService config(String config) {
        this.config = config;
        return this;
    }

    public StubService nodeInvalid(boolean nodeInvalid) {
        this.nodeInvalid = nodeInvalid;
        return this;
    }

    public StubService failWith(KolideServiceException failure) {
        this.failure = failure;
        return this;
    }

    private void enter() throws KolideServiceException {
        String requestId = RequestIds.current();
        if (requestId != null) {
            requestIds.add(requestId);
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public EnrollmentResult requestEnrollment(String enrollSecret, String hostIdentifier, EnrollmentDetails details)
            throws KolideServiceException {
        lastEnrollSecret = enrollSecret;
        lastDetails = details;
        enter();
        return new EnrollmentResult("node-key-1", nodeInvalid);
    }

    @Override
    public ConfigResult requestConfig(String nodeKey) throws KolideServiceException {
        enter();
        return new ConfigResult(config, nodeInvalid);
    }

    @Override
    public PublishResult publishLogs(String nodeKey, LogType logType, List<String> logs)
            throws KolideServiceException {
        lastLogType = logType;
        lastLogs = logs;
        enter();
        return new PublishResult("logs accepted", "", nodeInvalid);
    }

    @Override
    public QueriesResult requestQueries(String nodeKey) throws KolideServiceException {
        enter();
        Map<String, String> queries = new LinkedHashMap<>();
        queries.put("q1", "select * from processes");
        DistributedQueries distributed = new DistributedQueries();
        distributed.setQueries(queries);
        return new QueriesResult(distributed, nodeInvalid);
    }

    @Override
    public PublishResult publishResults(String nodeKey, List<QueryResult> results) throws KolideServiceException {
        lastResults = results;
        enter();
        return new PublishResult("results accepted", "", nodeInvalid);
    }

    @Override
    public HealthStatus checkHealth() throws KolideServiceException {
        enter();
        return HealthStatus.SERVING;
    }
}
