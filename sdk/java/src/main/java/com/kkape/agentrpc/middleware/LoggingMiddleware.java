package com.kkape.agentrpc.middleware;

import com.kkape.agentrpc.KolideService;
import com.kkape.agentrpc.codec.JsonRpcCodec;
import com.kkape.agentrpc.error.DeviceDisabledException;
import com.kkape.agentrpc.error.KolideServiceException;
import com.kkape.agentrpc.error.TransportException;
import com.kkape.agentrpc.model.ConfigResult;
import com.kkape.agentrpc.model.EnrollmentDetails;
import com.kkape.agentrpc.model.EnrollmentResult;
import com.kkape.agentrpc.model.HealthStatus;
import com.kkape.agentrpc.model.LogType;
import com.kkape.agentrpc.model.PublishResult;
import com.kkape.agentrpc.model.QueriesResult;
import com.kkape.agentrpc.model.QueryResult;
import com.kkape.agentrpc.model.QueryStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Logs one line per call: method, correlation id, request shape, outcome and elapsed time.
 *
 * <p>Successes go to DEBUG with a bucketed duration. Failures carry the exact duration and go
 * to WARN when the network or the kill switch is to blame, ERROR otherwise. Enroll secrets
 * and node keys are never logged.</p>
 */
public class LoggingMiddleware implements KolideService {
    private static final Logger log = LoggerFactory.getLogger(LoggingMiddleware.class);

    /** Queries running longer than this are flagged in the stats log */
    static final long LONG_RUNNING_MS = 5000;
    static final int RESULTS_TRUNCATE_LENGTH = 200;

    private final KolideService next;
    private final Clock clock;

    public LoggingMiddleware(KolideService next, Clock clock) {
        this.next = next;
        this.clock = clock;
    }

    public static ServiceMiddleware middleware(Clock clock) {
        return next -> new LoggingMiddleware(next, clock);
    }

    @Override
    public EnrollmentResult requestEnrollment(String enrollSecret, String hostIdentifier, EnrollmentDetails details)
            throws KolideServiceException {
        Instant begin = clock.instant();
        EnrollmentResult result = null;
        KolideServiceException err = null;
        try {
            result = next.requestEnrollment(enrollSecret, hostIdentifier, details);
            return result;
        } catch (KolideServiceException e) {
            err = e;
            throw e;
        } finally {
            record("RequestEnrollment", "failure requesting enrollment", begin, err,
                    "hostIdentifier", hostIdentifier,
                    "reauth", result != null && result.isNodeInvalid());
        }
    }

    @Override
    public ConfigResult requestConfig(String nodeKey) throws KolideServiceException {
        Instant begin = clock.instant();
        ConfigResult result = null;
        KolideServiceException err = null;
        try {
            result = next.requestConfig(nodeKey);
            return result;
        } catch (KolideServiceException e) {
            err = e;
            throw e;
        } finally {
            record("RequestConfig", "failure requesting config", begin, err,
                    "config_size", result != null && result.getConfig() != null ? result.getConfig().length() : 0,
                    "reauth", result != null && result.isNodeInvalid());
        }
    }

    @Override
    public PublishResult publishLogs(String nodeKey, LogType logType, List<String> logs)
            throws KolideServiceException {
        Instant begin = clock.instant();
        PublishResult result = null;
        KolideServiceException err = null;
        try {
            result = next.publishLogs(nodeKey, logType, logs);
            return result;
        } catch (KolideServiceException e) {
            err = e;
            throw e;
        } finally {
            record("PublishLogs", "failure publishing logs", begin, err,
                    "logType", logType,
                    "log_count", logs == null ? 0 : logs.size(),
                    "message", result != null ? result.getMessage() : "",
                    "errcode", result != null ? result.getErrorCode() : "",
                    "reauth", result != null && result.isNodeInvalid());
        }
    }

    @Override
    public QueriesResult requestQueries(String nodeKey) throws KolideServiceException {
        Instant begin = clock.instant();
        QueriesResult result = null;
        KolideServiceException err = null;
        try {
            result = next.requestQueries(nodeKey);
            return result;
        } catch (KolideServiceException e) {
            err = e;
            throw e;
        } finally {
            record("RequestQueries", "failure requesting queries", begin, err,
                    "query_count", result != null && result.getQueries() != null
                            ? result.getQueries().getQueries().size() : 0,
                    "reauth", result != null && result.isNodeInvalid());
        }
    }

    @Override
    public PublishResult publishResults(String nodeKey, List<QueryResult> results) throws KolideServiceException {
        Instant begin = clock.instant();
        PublishResult result = null;
        KolideServiceException err = null;
        try {
            result = next.publishResults(nodeKey, results);
            return result;
        } catch (KolideServiceException e) {
            err = e;
            throw e;
        } finally {
            // serializing results is only worth it when the line is written
            if (err != null || log.isDebugEnabled()) {
                String resultJson = JsonRpcCodec.gson().toJson(results);
                record("PublishResults", "failure publishing results", begin, err,
                        "results_truncated", truncate(resultJson, RESULTS_TRUNCATE_LENGTH),
                        "result_count", results == null ? 0 : results.size(),
                        "result_size", resultJson.length(),
                        "errcode", result != null ? result.getErrorCode() : "",
                        "reauth", result != null && result.isNodeInvalid());
            }
            logQueryStats(results);
        }
    }

    @Override
    public HealthStatus checkHealth() throws KolideServiceException {
        Instant begin = clock.instant();
        HealthStatus result = null;
        KolideServiceException err = null;
        try {
            result = next.checkHealth();
            return result;
        } catch (KolideServiceException e) {
            err = e;
            throw e;
        } finally {
            record("CheckHealth", "failure checking health", begin, err,
                    "status", result);
        }
    }

    private void logQueryStats(List<QueryResult> results) {
        if (results == null) {
            return;
        }
        for (QueryResult result : results) {
            QueryStats stats = result.getStats();
            if (stats == null) {
                continue;
            }
            log.info("received distributed query stats: query_name={}, query_status={}, wall_time_ms={}, "
                            + "user_time={}, system_time={}, memory={}, long_running={}",
                    result.getQueryName(), result.getStatus(), stats.getWallTimeMs(), stats.getUserTime(),
                    stats.getSystemTime(), stats.getMemory(), stats.getWallTimeMs() > LONG_RUNNING_MS);
        }
    }

    private void record(String method, String failureMessage, Instant begin, KolideServiceException err,
                        Object... keyvals) {
        Duration took = Duration.between(begin, clock.instant());
        if (err == null) {
            if (log.isDebugEnabled()) {
                log.debug("success: {}", line(method, keyvals, null, TimeBuckets.bucket(took)));
            }
        } else if (err instanceof TransportException || err instanceof DeviceDisabledException) {
            log.warn("{}: {}", failureMessage, line(method, keyvals, err, took));
        } else {
            log.error("{}: {}", failureMessage, line(method, keyvals, err, took));
        }
    }

    private static String line(String method, Object[] keyvals, KolideServiceException err, Duration took) {
        StringBuilder line = new StringBuilder();
        line.append("method=").append(method);
        line.append(", uuid=").append(RequestIds.current());
        for (int i = 0; i + 1 < keyvals.length; i += 2) {
            line.append(", ").append(keyvals[i]).append('=').append(keyvals[i + 1]);
        }
        if (err != null) {
            line.append(", err=").append(err.getMessage());
        }
        line.append(", took=").append(TimeBuckets.format(took));
        return line.toString();
    }

    static String truncate(String value, int maxLength) {
        if (value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength) + "...";
    }
}
