package com.example.taskorchestrator.controller;

import com.example.taskorchestrator.dto.ApiResponse;
import com.example.taskorchestrator.dto.EngineHealth;
import com.example.taskorchestrator.dto.ExecutionRequestResponse;
import com.example.taskorchestrator.dto.JobResponse;
import com.example.taskorchestrator.service.OrchestrationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Operational REST API of the orchestration engine.
 * <p>
 * Trigger definitions are owned elsewhere; this API only starts, cancels and inspects executions.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/orchestration")
@Tag(name = "Orchestration", description = "APIs for running and inspecting trigger executions")
public class OrchestrationController {

    private final OrchestrationService orchestrationService;

    // === Execution ===

    @PostMapping("/triggers/{triggerId}/executions")
    @Operation(summary = "Run a trigger now", description = "Create a job that runs ahead of scheduled work")
    public ResponseEntity<ApiResponse<ExecutionRequestResponse>> triggerManualExecution(
            @Parameter(description = "Trigger UUID") @PathVariable UUID triggerId) {
        log.info("API: Manual execution request for trigger {}", triggerId);

        var jobId = orchestrationService.triggerManualExecution(triggerId);
        var body = ExecutionRequestResponse.builder().jobId(jobId).triggerId(triggerId).build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(body, "Execution queued"));
    }

    @PostMapping("/triggers/{triggerId}/events")
    @Operation(summary = "Signal an event", description = "Fire an event trigger")
    public ResponseEntity<ApiResponse<ExecutionRequestResponse>> signalEvent(
            @Parameter(description = "Trigger UUID") @PathVariable UUID triggerId) {
        log.info("API: Event signal for trigger {}", triggerId);

        var jobId = orchestrationService.signalEvent(triggerId);
        var body = ExecutionRequestResponse.builder().jobId(jobId).triggerId(triggerId).build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(body, "Event accepted"));
    }

    // === Jobs ===

    @GetMapping("/triggers/{triggerId}/jobs")
    @Operation(summary = "Job history", description = "Jobs of a trigger, newest first")
    public ResponseEntity<ApiResponse<Page<JobResponse>>> getJobHistory(
            @Parameter(description = "Trigger UUID") @PathVariable UUID triggerId,
            @Parameter(description = "Page number, starting at 1") @RequestParam(defaultValue = "1") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int pageSize) {

        var jobs = orchestrationService.getJobHistory(triggerId, page, pageSize);
        return ResponseEntity.ok(ApiResponse.success(jobs));
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Get job by ID")
    public ResponseEntity<ApiResponse<JobResponse>> getJob(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        return orchestrationService.getJob(jobId)
                .map(job -> ResponseEntity.ok(ApiResponse.success(job)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/jobs/{jobId}/cancel")
    @Operation(summary = "Cancel a job", description = "Cancel a pending or running job")
    public ResponseEntity<ApiResponse<Boolean>> cancelJob(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        log.info("API: Cancel job {}", jobId);

        var cancelled = orchestrationService.cancelJob(jobId);
        var message = cancelled ? "Cancellation accepted" : "Job already finished";
        return ResponseEntity.ok(ApiResponse.success(cancelled, message));
    }

    // === Health ===

    @GetMapping("/health")
    @Operation(summary = "Engine health", description = "Worker, queue and lock statistics")
    public ResponseEntity<ApiResponse<EngineHealth>> getEngineHealth() {
        return ResponseEntity.ok(ApiResponse.success(orchestrationService.getEngineHealth()));
    }
}
