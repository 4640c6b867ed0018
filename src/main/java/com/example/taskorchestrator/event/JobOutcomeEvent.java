package com.example.taskorchestrator.event;

import com.example.taskorchestrator.domain.entity.Job;
import com.example.taskorchestrator.domain.enums.ErrorClassification;
import com.example.taskorchestrator.domain.enums.JobStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a job reaches a terminal status. Delivery to people or other systems
 * is up to listeners outside the engine.
 */
@Value
@Builder
public class JobOutcomeEvent {

    UUID jobId;

    UUID triggerId;

    String taskType;

    JobStatus status;

    int attemptNumber;

    int maxAttempts;

    ErrorClassification errorClassification;

    String errorMessage;

    /**
     * A retry job was created for this failure
     */
    boolean retryScheduled;

    /**
     * The failure ended the retry chain: the attempt limit was reached or the error was not retryable
     */
    boolean retryExhausted;

    Instant occurredAt;

    public static JobOutcomeEvent of(Job job, String taskType, boolean retryScheduled, Instant occurredAt) {
        var failed = job.getStatus() == JobStatus.FAILED;
        return JobOutcomeEvent.builder()
                .jobId(job.getId())
                .triggerId(job.getTriggerId())
                .taskType(taskType)
                .status(job.getStatus())
                .attemptNumber(job.getAttemptNumber())
                .maxAttempts(job.getMaxAttempts())
                .errorClassification(job.getErrorClassification())
                .errorMessage(job.getErrorMessage())
                .retryScheduled(retryScheduled)
                .retryExhausted(failed && !retryScheduled)
                .occurredAt(occurredAt)
                .build();
    }
}
