package com.example.taskorchestrator.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of a single job execution attempt.
 * <p>
 * pending -> running -> {completed | failed | cancelled}, plus pending -> cancelled
 * for queued retry or manual jobs. A failed job never goes back to running: a retry
 * is a new pending job linked to the failed one.
 */
@Getter
@RequiredArgsConstructor
public enum JobStatus {

    /**
     * Created and waiting for a worker to win the trigger lock.
     */
    PENDING("pending", "Pending"),

    /**
     * A worker holds the trigger lock and the handler is executing.
     */
    RUNNING("running", "Running"),

    /**
     * Handler returned successfully. Terminal.
     */
    COMPLETED("completed", "Completed"),

    /**
     * Handler failed, timed out or the worker died. Terminal for this attempt.
     */
    FAILED("failed", "Failed"),

    /**
     * Cancelled by an operator before or during execution. Terminal.
     */
    CANCELLED("cancelled", "Cancelled");

    private final String code;
    private final String displayName;

    /**
     * Find JobStatus by its code value
     */
    public static JobStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status code: " + code);
    }

    /**
     * Check if this status represents a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if the state machine allows moving from this status to the target
     */
    public boolean canTransitionTo(JobStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
