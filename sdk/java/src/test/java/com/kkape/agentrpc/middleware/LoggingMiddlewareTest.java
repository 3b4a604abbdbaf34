package com.kkape.agentrpc.middleware;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.kkape.agentrpc.KolideService;
import com.kkape.agentrpc.StubService;
import com.kkape.agentrpc.error.DeviceDisabledException;
import com.kkape.agentrpc.error.KolideServiceException;
import com.kkape.agentrpc.error.RemoteServiceException;
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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.AbstractMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LoggingMiddlewareTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(LoggingMiddleware.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final MutableClock clock = new MutableClock();

    @BeforeEach
    void attachAppender() {
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
    }

    @Test
    @DisplayName("Success is logged at DEBUG with a bucketed duration")
    void testSuccessUsesBucket() throws Exception {
        KolideService service = new LoggingMiddleware(new SlowService(clock, null), clock);

        service.requestConfig("nk");

        ILoggingEvent event = lastEvent();
        assertEquals(Level.DEBUG, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("method=RequestConfig"));
        assertTrue(event.getFormattedMessage().contains("took=6s"), event.getFormattedMessage());
    }

    @Test
    @DisplayName("Failure is logged with the exact duration")
    void testFailureUsesExactDuration() {
        KolideService service = new LoggingMiddleware(
                new SlowService(clock, new RemoteServiceException(-32603, "Server Error")), clock);

        assertThrows(RemoteServiceException.class, () -> service.requestConfig("nk"));

        ILoggingEvent event = lastEvent();
        assertEquals(Level.ERROR, event.getLevel());
        assertTrue(event.getFormattedMessage().startsWith("failure requesting config"));
        assertTrue(event.getFormattedMessage().contains("took=6.4s"), event.getFormattedMessage());
    }

    @Test
    @DisplayName("Transport and device-disabled failures are warnings")
    void testTransportFailureIsWarning() {
        KolideService transportFailure = new LoggingMiddleware(
                new SlowService(clock, new TransportException("connection refused")), clock);
        assertThrows(TransportException.class, () -> transportFailure.checkHealth());
        assertEquals(Level.WARN, lastEvent().getLevel());

        KolideService disabled = new LoggingMiddleware(new SlowService(clock, new DeviceDisabledException()), clock);
        assertThrows(DeviceDisabledException.class, () -> disabled.requestQueries("nk"));
        assertEquals(Level.WARN, lastEvent().getLevel());
    }

    @Test
    @DisplayName("Enroll secrets are never logged")
    void testEnrollSecretNotLogged() {
        KolideService service = new LoggingMiddleware(
                new SlowService(clock, new RemoteServiceException(-32603, "Server Error")), clock);

        assertThrows(RemoteServiceException.class,
                () -> service.requestEnrollment("top-secret-value", "host-1", EnrollmentDetails.empty()));

        String message = lastEvent().getFormattedMessage();
        assertTrue(message.contains("hostIdentifier=host-1"));
        assertFalse(message.contains("top-secret-value"));
    }

    @Test
    @DisplayName("Query stats are logged per result and long queries are flagged")
    void testQueryStatsLogged() throws Exception {
        QueryStats stats = new QueryStats();
        stats.setWallTimeMs(7200);
        stats.setMemory(1024);
        QueryResult slow = new QueryResult("slow_query", 0, List.of(Map.of("a", "b")));
        slow.setStats(stats);
        QueryResult plain = new QueryResult("plain_query", 0, List.of());

        new LoggingMiddleware(new StubService(), clock).publishResults("nk", List.of(slow, plain));

        List<ILoggingEvent> statsEvents = appender.list.stream()
                .filter(e -> e.getFormattedMessage().startsWith("received distributed query stats"))
                .collect(java.util.stream.Collectors.toList());
        assertEquals(1, statsEvents.size());
        assertEquals(Level.INFO, statsEvents.get(0).getLevel());
        assertTrue(statsEvents.get(0).getFormattedMessage().contains("query_name=slow_query"));
        assertTrue(statsEvents.get(0).getFormattedMessage().contains("long_running=true"));
    }

    @Test
    @DisplayName("Published results are truncated in the log")
    void testResultsTruncated() throws Exception {
        QueryResult big = new QueryResult("q", 0, List.of(Map.of("data", "x".repeat(500))));

        new LoggingMiddleware(new StubService(), clock).publishResults("nk", List.of(big));

        String message = appender.list.get(appender.list.size() - 1).getFormattedMessage();
        assertTrue(message.contains("..."));
        assertFalse(message.contains("x".repeat(300)));
        assertTrue(message.contains("result_count=1"));
    }

    @Test
    @DisplayName("Results are not serialized when successful calls are not logged")
    void testResultsNotSerializedAboveDebug() throws Exception {
        logger.setLevel(Level.INFO);
        Map<String, String> row = new AbstractMap<>() {
            @Override
            public Set<Entry<String, String>> entrySet() {
                throw new IllegalStateException("row was serialized");
            }
        };
        QueryResult result = new QueryResult("q1", 0, List.of(row));

        PublishResult published = new LoggingMiddleware(new StubService(), clock).publishResults("nk", List.of(result));

        assertEquals("results accepted", published.getMessage());
        assertTrue(appender.list.isEmpty());
    }

    @Test
    @DisplayName("Request id set by the outer middleware appears in the log")
    void testRequestIdLogged() throws Exception {
        KolideService service = ServiceChain.standard(clock).apply(new StubService());

        service.checkHealth();

        String message = lastEvent().getFormattedMessage();
        assertFalse(message.contains("uuid=null"), message);
        assertTrue(message.matches(".*uuid=[0-9a-f\\-]{36}.*"), message);
    }

    private ILoggingEvent lastEvent() {
        assertFalse(appender.list.isEmpty(), "nothing logged");
        return appender.list.get(appender.list.size() - 1);
    }

    /**
     * Clock that only moves when told to.
     */
    static class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    /**
     * Service taking 6.4 seconds of clock time per call, then answering or failing.
     */
    static class SlowService extends StubService {
        private final MutableClock clock;
        private final KolideServiceException failure;

        SlowService(MutableClock clock, KolideServiceException failure) {
            this.clock = clock;
            this.failure = failure;
        }

        private void work() throws KolideServiceException {
            clock.advance(Duration.ofMillis(6400));
            if (failure != null) {
                throw failure;
            }
        }

        @Override
        public EnrollmentResult requestEnrollment(String enrollSecret, String hostIdentifier,
                                                  EnrollmentDetails details) throws KolideServiceException {
            work();
            return super.requestEnrollment(enrollSecret, hostIdentifier, details);
        }

        @Override
        public ConfigResult requestConfig(String nodeKey) throws KolideServiceException {
            work();
            return super.requestConfig(nodeKey);
        }

        @Override
        public PublishResult publishLogs(String nodeKey, LogType logType, List<String> logs)
                throws KolideServiceException {
            work();
            return super.publishLogs(nodeKey, logType, logs);
        }

        @Override
        public QueriesResult requestQueries(String nodeKey) throws KolideServiceException {
            work();
            return super.requestQueries(nodeKey);
        }

        @Override
        public HealthStatus checkHealth() throws KolideServiceException {
            work();
            return super.checkHealth();
        }
    }
}
