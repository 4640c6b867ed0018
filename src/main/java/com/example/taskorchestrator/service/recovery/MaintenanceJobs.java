package com.example.taskorchestrator.service.recovery;

import com.example.taskorchestrator.exception.StoreUnavailableException;
import com.example.taskorchestrator.service.lock.ExecutionLockManager;
import com.example.taskorchestrator.service.worker.WorkerRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cluster singleton housekeeping. ShedLock makes sure one worker runs each job per interval.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaintenanceJobs {

    private final ReconciliationService reconciliationService;
    private final ExecutionLockManager lockManager;
    private final WorkerRegistryService workerRegistryService;

    @Scheduled(fixedDelayString = "${task-orchestrator.reconciliation-interval-ms:30000}")
    @SchedulerLock(name = "reconciliationSweep", lockAtLeastFor = "5s", lockAtMostFor = "5m")
    public void reconcileStaleJobs() {
        try {
            reconciliationService.reconcileStaleJobs();
        } catch (StoreUnavailableException | DataAccessException e) {
            log.warn("Reconciliation sweep skipped: {}", e.getMessage());
        }
    }

    /**
     * Expired locks are already ignored by every lock operation; this only removes the dead rows
     */
    @Scheduled(fixedDelayString = "${task-orchestrator.lock-purge-interval-ms:300000}")
    @SchedulerLock(name = "executionLockPurge", lockAtLeastFor = "30s", lockAtMostFor = "5m")
    public void purgeExpired() {
        try {
            var locks = lockManager.purgeExpired();
            var workers = workerRegistryService.purgeStaleWorkers();
            if (locks > 0 || workers > 0) {
                log.info("Purged {} expired execution locks and {} stale worker registrations", locks, workers);
            }
        } catch (StoreUnavailableException | DataAccessException e) {
            log.warn("Purge skipped: {}", e.getMessage());
        }
    }
}
