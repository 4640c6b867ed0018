package com.example.taskorchestrator.service.handler;

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * What a handler returns for one job attempt.
 * <p>
 * The executor turns it into a job transition: success completes the job and stores
 * {@link #responseData} as the job result, a failure goes through the trigger's retry
 * policy unless {@link #retryable} is false.
 */
@Data
@Builder
public class TaskExecutionResult {

    private static final int MAX_TRACE_FRAMES = 20;
    private static final int MAX_TRACE_CHARS = 4000;

    private boolean success;

    private String errorMessage;

    /**
     * Handler supplied error type, stored on the job as-is
     */
    private String errorType;

    private String stackTrace;

    @Builder.Default
    private Map<String, Object> responseData = new HashMap<>();

    @Builder.Default
    private boolean retryable = true;

    public static TaskExecutionResult success() {
        return TaskExecutionResult.builder().success(true).build();
    }

    public static TaskExecutionResult success(Map<String, Object> responseData) {
        var result = success();
        if (responseData != null) {
            result.responseData.putAll(responseData);
        }
        return result;
    }

    public static TaskExecutionResult failure(String errorMessage) {
        return failure(errorMessage, null);
    }

    public static TaskExecutionResult failure(String errorMessage, String errorType) {
        return TaskExecutionResult.builder()
                .errorMessage(errorMessage)
                .errorType(errorType)
                .build();
    }

    public static TaskExecutionResult failure(Throwable cause) {
        var result = failure(cause.getMessage(), cause.getClass().getSimpleName());
        result.stackTrace = truncateStackTrace(cause);
        return result;
    }

    /**
     * Failure that ends the retry chain, e.g. a payload the handler can never process
     */
    public static TaskExecutionResult permanentFailure(String errorMessage, String errorType) {
        return failure(errorMessage, errorType).nonRetryable();
    }

    /**
     * Render at most {@value #MAX_TRACE_FRAMES} frames, cut to {@value #MAX_TRACE_CHARS} characters
     */
    public static String truncateStackTrace(Throwable cause) {
        if (cause == null) {
            return null;
        }

        var frames = cause.getStackTrace();
        var shown = Math.min(frames.length, MAX_TRACE_FRAMES);
        var trace = new StringBuilder()
                .append(cause.getClass().getName()).append(": ").append(cause.getMessage()).append('\n');
        for (var i = 0; i < shown; i++) {
            trace.append("\tat ").append(frames[i]).append('\n');
        }
        if (frames.length > shown) {
            trace.append("\t... ").append(frames.length - shown).append(" more\n");
        }

        return trace.length() > MAX_TRACE_CHARS
                ? trace.substring(0, MAX_TRACE_CHARS) + "..."
                : trace.toString();
    }

    public TaskExecutionResult withResponseData(String key, Object value) {
        if (responseData == null) {
            responseData = new HashMap<>();
        }
        responseData.put(key, value);
        return this;
    }

    public TaskExecutionResult nonRetryable() {
        retryable = false;
        return this;
    }
}
