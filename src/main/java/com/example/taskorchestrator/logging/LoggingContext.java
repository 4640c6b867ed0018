package com.example.taskorchestrator.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC scope for job execution logs.
 *
 * <pre>
 * try (var ctx = LoggingContext.forJob(triggerId, jobId, attempt)) {
 *     log.info("Executing"); // carries triggerId, jobId and attempt
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TRIGGER_ID = "triggerId";
    public static final String JOB_ID = "jobId";
    public static final String ATTEMPT = "attempt";

    private final String previousTriggerId;
    private final String previousJobId;
    private final String previousAttempt;

    private LoggingContext() {
        this.previousTriggerId = MDC.get(TRIGGER_ID);
        this.previousJobId = MDC.get(JOB_ID);
        this.previousAttempt = MDC.get(ATTEMPT);
    }

    public static LoggingContext forTrigger(UUID triggerId) {
        var ctx = new LoggingContext();
        putIfPresent(TRIGGER_ID, triggerId);
        return ctx;
    }

    public static LoggingContext forJob(UUID triggerId, UUID jobId, Integer attempt) {
        var ctx = new LoggingContext();
        putIfPresent(TRIGGER_ID, triggerId);
        putIfPresent(JOB_ID, jobId);
        putIfPresent(ATTEMPT, attempt);
        return ctx;
    }

    private static void putIfPresent(String key, Object value) {
        if (value != null) {
            MDC.put(key, value.toString());
        }
    }

    @Override
    public void close() {
        restore(TRIGGER_ID, previousTriggerId);
        restore(JOB_ID, previousJobId);
        restore(ATTEMPT, previousAttempt);
    }

    private static void restore(String key, String previous) {
        if (previous != null) {
            MDC.put(key, previous);
        } else {
            MDC.remove(key);
        }
    }
}
