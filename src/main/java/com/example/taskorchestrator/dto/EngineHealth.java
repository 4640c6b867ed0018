package com.example.taskorchestrator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time view of this worker and the cluster it belongs to
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineHealth {

    private long activeWorkers;
    private int queueDepth;
    private double lockContentionRate;
    private double avgDispatchLatencyMs;

    private String workerId;
    private int runningJobs;
    private int availableSlots;
    private long activeTriggers;
    private Instant generatedAt;
}
