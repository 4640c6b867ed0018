package com.example.taskorchestrator.dto;

import com.example.taskorchestrator.domain.enums.ErrorClassification;
import com.example.taskorchestrator.domain.enums.JobSource;
import com.example.taskorchestrator.domain.enums.JobStatus;
import com.example.taskorchestrator.domain.enums.TriggerPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for a job execution
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private UUID id;
    private UUID triggerId;
    private JobStatus status;
    private JobSource source;
    private Integer attemptNumber;
    private Integer maxAttempts;
    private UUID previousJobId;
    private TriggerPriority priority;
    private Instant firingDueAt;
    private Instant scheduledFor;
    private Instant nextRetryAt;
    private String workerId;
    private Instant createdAt;
    private Instant startedAt;
    private Instant deadlineAt;
    private Instant completedAt;
    private Long durationMs;
    private boolean cancelRequested;
    private Map<String, Object> result;
    private ErrorClassification errorClassification;
    private String errorType;
    private String errorMessage;
    private String errorStackTrace;
}
