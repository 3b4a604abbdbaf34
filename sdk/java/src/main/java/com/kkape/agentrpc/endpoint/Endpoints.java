package com.kkape.agentrpc.endpoint;

import com.kkape.agentrpc.ClientConfig;
import com.kkape.agentrpc.ConfigKey;
import com.kkape.agentrpc.ConfigObserver;
import com.kkape.agentrpc.KolideService;
import com.kkape.agentrpc.error.DeviceDisabledException;
import com.kkape.agentrpc.error.KolideServiceException;
import com.kkape.agentrpc.error.TransportException;
import com.kkape.agentrpc.message.ApiResponse;
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
import com.kkape.agentrpc.model.EnrollmentDetails;
import com.kkape.agentrpc.model.EnrollmentResult;
import com.kkape.agentrpc.model.HealthStatus;
import com.kkape.agentrpc.model.LogType;
import com.kkape.agentrpc.model.PublishResult;
import com.kkape.agentrpc.model.QueriesResult;
import com.kkape.agentrpc.model.QueryResult;
import io.grpc.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link KolideService} backed by the current set of remote endpoints.
 *
 * <p>Each call snapshots the endpoint set under the read lock, releases it, and performs the
 * network round trip inside a context with a {@link #REQUEST_TIMEOUT_SECONDS} deadline. A
 * response flagged {@code disable_device} turns into {@link DeviceDisabledException} before
 * anything else on it is looked at.</p>
 *
 * <p>When registered as a {@link ConfigObserver}, a server URL change rebuilds all six
 * endpoints and swaps them under the write lock, so in-flight calls finish against the old
 * server and later calls only see the new one.</p>
 */
public class Endpoints implements KolideService, ConfigObserver, Closeable {
    private static final Logger log = LoggerFactory.getLogger(Endpoints.class);

    /** Deadline applied on top of the caller's context */
    public static final long REQUEST_TIMEOUT_SECONDS = 60;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final EndpointFactory factory;
    private final ClientConfig config;
    private final Closeable transport;
    private final ScheduledExecutorService deadlines;

    private EndpointSet endpoints;

    public Endpoints(EndpointFactory factory, ClientConfig config, Closeable transport) throws TransportException {
        this.factory = factory;
        this.config = config;
        this.transport = transport;
        this.endpoints = factory.create(config.getServerUrl());
        this.deadlines = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "agentrpc-deadlines");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void configChanged(Set<ConfigKey> changedKeys) {
        if (!changedKeys.contains(ConfigKey.SERVER_URL)) {
            return;
        }
        String serverUrl = config.getServerUrl();
        while (true) {
            EndpointSet replacement;
            try {
                replacement = factory.create(serverUrl);
            } catch (TransportException e) {
                log.error("Failed to rebuild endpoints for {}, keeping {}", serverUrl, currentServerUrl(), e);
                return;
            }

            String latest;
            lock.writeLock().lock();
            try {
                latest = config.getServerUrl();
                if (Objects.equals(latest, serverUrl)) {
                    endpoints = replacement;
                    break;
                }
                if (Objects.equals(latest, endpoints.getServerUrl())) {
                    // a newer change already rebound us
                    log.debug("Discarding endpoints for superseded server URL {}", serverUrl);
                    return;
                }
            } finally {
                lock.writeLock().unlock();
            }
            serverUrl = latest;
        }
        log.info("Endpoints now bound to {}", serverUrl);
    }

    /**
     * Server URL the current endpoint set is bound to.
     */
    public String currentServerUrl() {
        return snapshot().getServerUrl();
    }

    @Override
    public EnrollmentResult requestEnrollment(String enrollSecret, String hostIdentifier, EnrollmentDetails details)
            throws KolideServiceException {
        EnrollmentResponse response = call(snapshot().getRequestEnrollment(),
                new EnrollmentRequest(enrollSecret, hostIdentifier, details));
        checkDeviceDisabled(response);
        return new EnrollmentResult(response.getNodeKey(), response.isNodeInvalid());
    }

    @Override
    public ConfigResult requestConfig(String nodeKey) throws KolideServiceException {
        ConfigResponse response = call(snapshot().getRequestConfig(), new NodeKeyRequest(nodeKey));
        checkDeviceDisabled(response);
        return new ConfigResult(response.getConfig(), response.isNodeInvalid());
    }

    @Override
    public PublishResult publishLogs(String nodeKey, LogType logType, List<String> logs)
            throws KolideServiceException {
        PublishResponse response = call(snapshot().getPublishLogs(), new LogCollection(nodeKey, logType, logs));
        checkDeviceDisabled(response);
        return new PublishResult(response.getMessage(), response.getErrorCode(), response.isNodeInvalid());
    }

    @Override
    public QueriesResult requestQueries(String nodeKey) throws KolideServiceException {
        QueryCollectionResponse response = call(snapshot().getRequestQueries(), new NodeKeyRequest(nodeKey));
        checkDeviceDisabled(response);
        return new QueriesResult(response.getQueries(), response.isNodeInvalid());
    }

    @Override
    public PublishResult publishResults(String nodeKey, List<QueryResult> results) throws KolideServiceException {
        PublishResponse response = call(snapshot().getPublishResults(), new ResultCollection(nodeKey, results));
        checkDeviceDisabled(response);
        return new PublishResult(response.getMessage(), response.getErrorCode(), response.isNodeInvalid());
    }

    @Override
    public HealthStatus checkHealth() throws KolideServiceException {
        HealthCheckResponse response = call(snapshot().getCheckHealth(), new NodeKeyRequest());
        checkDeviceDisabled(response);
        return HealthStatus.fromCode(response.getStatus());
    }

    private EndpointSet snapshot() {
        lock.readLock().lock();
        try {
            return endpoints;
        } finally {
            lock.readLock().unlock();
        }
    }

    private <Q, R> R call(Endpoint<Q, R> endpoint, Q request) throws KolideServiceException {
        Context.CancellableContext context = Context.current()
                .withDeadlineAfter(REQUEST_TIMEOUT_SECONDS, TimeUnit.SECONDS, deadlines);
        Context previous = context.attach();
        try {
            return endpoint.invoke(request);
        } finally {
            context.detach(previous);
            context.cancel(null);
        }
    }

    private static void checkDeviceDisabled(ApiResponse response) throws DeviceDisabledException {
        if (response.isDisableDevice()) {
            throw new DeviceDisabledException();
        }
    }

    @Override
    public void close() throws IOException {
        deadlines.shutdownNow();
        transport.close();
    }
}
