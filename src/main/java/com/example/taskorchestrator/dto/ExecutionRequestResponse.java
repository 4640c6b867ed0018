package com.example.taskorchestrator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Returned when a manual execution or an event signal created a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRequestResponse {

    private UUID jobId;
    private UUID triggerId;
}
