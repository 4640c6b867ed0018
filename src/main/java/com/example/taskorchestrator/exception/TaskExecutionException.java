package com.example.taskorchestrator.exception;

import lombok.Getter;

/**
 * Thrown by handlers to report a failure together with its retryability.
 * A non-retryable exception marks the job as fatally failed.
 */
@Getter
public class TaskExecutionException extends RuntimeException {

    private final String taskType;
    private final boolean retryable;

    public TaskExecutionException(String taskType, String message, boolean retryable) {
        super(String.format("Task %s execution failed: %s", taskType, message));
        this.taskType = taskType;
        this.retryable = retryable;
    }

    public TaskExecutionException(String taskType, Exception cause, boolean retryable) {
        super(String.format("Task %s execution failed: %s", taskType, cause.getMessage()), cause);
        this.taskType = taskType;
        this.retryable = retryable;
    }
}
