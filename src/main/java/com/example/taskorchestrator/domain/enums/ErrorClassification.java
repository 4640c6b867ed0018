package com.example.taskorchestrator.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Classification recorded on a failed job. Drives whether the retry policy is consulted.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorClassification {

    /**
     * No handler is registered for the trigger's task type. Configuration error.
     */
    HANDLER_NOT_FOUND(false),

    /**
     * Handler exceeded the trigger's max execution duration and was cancelled.
     */
    HANDLER_TIMEOUT(true),

    /**
     * Handler returned a failure or threw.
     */
    HANDLER_EXECUTION_ERROR(true),

    /**
     * Handler reported a failure it marked as permanent.
     */
    HANDLER_FATAL_ERROR(false),

    /**
     * The execution lock expired or was taken over while the handler was running.
     */
    LOCK_LOST(true),

    /**
     * Detected by the reconciliation sweep: running past its deadline with no live lock.
     */
    WORKER_CRASHED(true),

    /**
     * The trigger was deleted or deactivated before a queued job could start.
     */
    TRIGGER_UNAVAILABLE(false);

    private final boolean retryable;
}
