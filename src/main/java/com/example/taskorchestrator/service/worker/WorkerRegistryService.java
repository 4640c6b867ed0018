package com.example.taskorchestrator.service.worker;

import com.example.taskorchestrator.config.OrchestratorProperties;
import com.example.taskorchestrator.domain.entity.WorkerRegistration;
import com.example.taskorchestrator.domain.repository.WorkerRegistrationRepository;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Keeps this worker's row in {@code worker_registrations} fresh so health can count live workers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkerRegistryService {

    private final WorkerRegistrationRepository repository;
    private final WorkerIdentity workerIdentity;
    private final OrchestratorProperties properties;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void register() {
        var now = clock.instant();
        var registration = WorkerRegistration.builder()
                .workerId(workerIdentity.getWorkerId())
                .hostname(workerIdentity.getHostname())
                .executionSlots(properties.getExecutionSlots())
                .startedAt(now)
                .lastHeartbeatAt(now)
                .build();
        repository.save(registration);
        log.info("Registered worker {} on {} with {} execution slots",
                registration.getWorkerId(), registration.getHostname(), registration.getExecutionSlots());
    }

    @Scheduled(fixedDelayString = "${task-orchestrator.worker-heartbeat-interval-ms:15000}")
    public void heartbeat() {
        try {
            var registration = repository.findById(workerIdentity.getWorkerId()).orElse(null);
            if (registration == null) {
                // purged while we were unreachable
                register();
                return;
            }
            registration.setLastHeartbeatAt(clock.instant());
            repository.save(registration);
        } catch (DataAccessException e) {
            log.warn("Worker heartbeat failed: {}", e.getMessage());
        }
    }

    public long countActiveWorkers() {
        return repository.countByLastHeartbeatAtAfter(clock.instant().minus(properties.getWorkerStaleThreshold()));
    }

    /**
     * @return number of registrations removed
     */
    public int purgeStaleWorkers() {
        return repository.deleteStale(clock.instant().minus(properties.getWorkerStaleThreshold()));
    }

    @PreDestroy
    public void deregister() {
        try {
            repository.deleteById(workerIdentity.getWorkerId());
            log.info("Deregistered worker {}", workerIdentity.getWorkerId());
        } catch (DataAccessException e) {
            log.warn("Could not deregister worker {}: {}", workerIdentity.getWorkerId(), e.getMessage());
        }
    }
}
