package com.example.taskorchestrator.service.executor;

import com.example.taskorchestrator.domain.enums.ErrorClassification;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Map;

/**
 * Result of a handler invocation as seen at the dispatch boundary.
 * Exceptions never leave the handler call; retry logic works on this value instead.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExecutionOutcome {

    public enum Kind {
        COMPLETED,
        FAILED,
        TIMED_OUT,
        CANCELLED
    }

    Kind kind;

    Map<String, Object> result;

    ErrorClassification classification;

    String errorType;

    String errorMessage;

    String stackTrace;

    public static ExecutionOutcome completed(Map<String, Object> result) {
        return new ExecutionOutcome(Kind.COMPLETED, result, null, null, null, null);
    }

    public static ExecutionOutcome failed(ErrorClassification classification, String errorType,
                                          String errorMessage, String stackTrace) {
        return new ExecutionOutcome(Kind.FAILED, null, classification, errorType, errorMessage, stackTrace);
    }

    public static ExecutionOutcome timedOut(String errorMessage) {
        return new ExecutionOutcome(Kind.TIMED_OUT, null, ErrorClassification.HANDLER_TIMEOUT,
                "Timeout", errorMessage, null);
    }

    public static ExecutionOutcome cancelled(String reason) {
        return new ExecutionOutcome(Kind.CANCELLED, null, null, null, reason, null);
    }

    public boolean isFailure() {
        return kind == Kind.FAILED || kind == Kind.TIMED_OUT;
    }

    public boolean isRetryable() {
        return isFailure() && classification != null && classification.isRetryable();
    }
}
