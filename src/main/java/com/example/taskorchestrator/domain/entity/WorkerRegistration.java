package com.example.taskorchestrator.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Liveness record of an engine worker process.
 */
@Entity
@Table(name = "worker_registrations", indexes = {
        @Index(name = "idx_worker_last_heartbeat", columnList = "last_heartbeat_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkerRegistration {

    @Id
    @Column(name = "worker_id", length = 150, updatable = false, nullable = false)
    private String workerId;

    @Column(name = "hostname", length = 150)
    private String hostname;

    @Column(name = "execution_slots", nullable = false)
    private Integer executionSlots;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "last_heartbeat_at", nullable = false)
    private Instant lastHeartbeatAt;
}
