package com.example.taskorchestrator.domain.entity;

import com.example.taskorchestrator.domain.enums.ErrorClassification;
import com.example.taskorchestrator.domain.enums.JobSource;
import com.example.taskorchestrator.domain.enums.JobStatus;
import com.example.taskorchestrator.domain.enums.TriggerPriority;
import com.example.taskorchestrator.exception.InvalidJobStateException;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One execution attempt of a trigger.
 * <p>
 * Jobs are append-only: every retry is a new row linked through {@code previousJobId},
 * so the history of a trigger shows the whole failure chain. A job is immutable once it
 * reaches a terminal status; all transitions go through the {@code mark*} methods which
 * enforce the state machine.
 */
@Entity
@Table(name = "job_executions", indexes = {
        @Index(name = "idx_job_trigger_created", columnList = "trigger_id, created_at"),
        @Index(name = "idx_job_status_scheduled", columnList = "status, scheduled_for"),
        @Index(name = "idx_job_status_deadline", columnList = "status, deadline_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "trigger_id", nullable = false, updatable = false)
    private UUID triggerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 20)
    private JobSource source;

    /**
     * 1-based attempt number within the retry chain
     */
    @Column(name = "attempt_number", nullable = false)
    private Integer attemptNumber;

    @Column(name = "max_attempts", nullable = false)
    private Integer maxAttempts;

    @Column(name = "previous_job_id")
    private UUID previousJobId;

    /**
     * Queue priority of this attempt, kept across the retry chain
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "priority", length = 20)
    private TriggerPriority priority;

    /**
     * Due time of the trigger firing this chain belongs to
     */
    @Column(name = "firing_due_at", nullable = false)
    private Instant firingDueAt;

    /**
     * Earliest time this attempt may start
     */
    @Column(name = "scheduled_for", nullable = false)
    private Instant scheduledFor;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    // === Execution ===

    @Column(name = "worker_id", length = 150)
    private String workerId;

    @Column(name = "started_at")
    private Instant startedAt;

    /**
     * startedAt + max execution duration
     */
    @Column(name = "deadline_at")
    private Instant deadlineAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    /**
     * Set when cancellation is requested for a job running on another worker
     */
    @Column(name = "cancel_requested", nullable = false)
    @Builder.Default
    private boolean cancelRequested = false;

    // === Result ===

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result")
    private Map<String, Object> result;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_classification", length = 40)
    private ErrorClassification errorClassification;

    /**
     * Handler supplied error type, e.g. the exception class
     */
    @Column(name = "error_type", length = 100)
    private String errorType;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "error_stack_trace", columnDefinition = "TEXT")
    private String errorStackTrace;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.status == null) {
            this.status = JobStatus.PENDING;
        }
    }

    // === Factories ===

    public static Job firstAttempt(Trigger trigger, JobSource source, int maxAttempts, Instant dueAt, Instant now) {
        return Job.builder()
                .triggerId(trigger.getId())
                .status(JobStatus.PENDING)
                .source(source)
                .priority(priorityFor(trigger, source))
                .attemptNumber(1)
                .maxAttempts(maxAttempts)
                .firingDueAt(dueAt)
                .scheduledFor(dueAt)
                .createdAt(now)
                .build();
    }

    /**
     * Next attempt in the chain of a failed job
     */
    public static Job nextAttemptOf(Job failed, JobSource source, Instant retryAt, Instant now) {
        return Job.builder()
                .triggerId(failed.getTriggerId())
                .status(JobStatus.PENDING)
                .source(source)
                .priority(failed.getPriority())
                .attemptNumber(failed.getAttemptNumber() + 1)
                .maxAttempts(failed.getMaxAttempts())
                .previousJobId(failed.getId())
                .firingDueAt(failed.getFiringDueAt())
                .scheduledFor(retryAt)
                .createdAt(now)
                .build();
    }

    /**
     * Operator runs jump the queue, everything else inherits the trigger's priority
     */
    private static TriggerPriority priorityFor(Trigger trigger, JobSource source) {
        if (source == JobSource.MANUAL) {
            return TriggerPriority.CRITICAL;
        }
        return trigger.getPriority() != null ? trigger.getPriority() : TriggerPriority.NORMAL;
    }

    // === Transitions ===

    public void markRunning(String workerId, Instant startedAt, Instant deadlineAt) {
        transitionTo(JobStatus.RUNNING);
        this.workerId = workerId;
        this.startedAt = startedAt;
        this.deadlineAt = deadlineAt;
    }

    public void markCompleted(Instant completedAt, Map<String, Object> result) {
        transitionTo(JobStatus.COMPLETED);
        this.completedAt = completedAt;
        this.durationMs = elapsedMs(completedAt);
        this.result = result;
    }

    public void markFailed(Instant completedAt, ErrorClassification classification, String errorType,
                           String errorMessage, String stackTrace, Instant nextRetryAt) {
        transitionTo(JobStatus.FAILED);
        this.completedAt = completedAt;
        this.durationMs = elapsedMs(completedAt);
        this.errorClassification = classification;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.errorStackTrace = stackTrace;
        this.nextRetryAt = nextRetryAt;
    }

    public void markCancelled(Instant completedAt, String reason) {
        transitionTo(JobStatus.CANCELLED);
        this.completedAt = completedAt;
        this.durationMs = elapsedMs(completedAt);
        this.errorMessage = reason;
    }

    private void transitionTo(JobStatus target) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new InvalidJobStateException(String.valueOf(id), String.valueOf(status), target.name());
        }
        this.status = target;
    }

    private Long elapsedMs(Instant end) {
        return startedAt != null ? Duration.between(startedAt, end).toMillis() : null;
    }

    // === Helper Methods ===

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * Check if the job overran its deadline by more than the grace period
     */
    public boolean isStale(Instant now, Duration grace) {
        return status == JobStatus.RUNNING && deadlineAt != null && deadlineAt.plus(grace).isBefore(now);
    }
}
