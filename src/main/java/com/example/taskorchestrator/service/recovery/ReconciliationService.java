package com.example.taskorchestrator.service.recovery;

import com.example.taskorchestrator.config.OrchestratorProperties;
import com.example.taskorchestrator.domain.entity.Job;
import com.example.taskorchestrator.domain.enums.ErrorClassification;
import com.example.taskorchestrator.domain.enums.JobSource;
import com.example.taskorchestrator.domain.enums.JobStatus;
import com.example.taskorchestrator.domain.repository.JobRepository;
import com.example.taskorchestrator.event.JobOutcomeEvent;
import com.example.taskorchestrator.exception.StoreUnavailableException;
import com.example.taskorchestrator.service.lock.ExecutionLockManager;
import com.example.taskorchestrator.service.retry.JobRetryService;
import com.example.taskorchestrator.service.retry.RetryPolicy;
import com.example.taskorchestrator.service.retry.RetryPolicyRegistry;
import com.example.taskorchestrator.service.store.TriggerStore;
import com.example.taskorchestrator.service.worker.WorkerIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Fails jobs orphaned by a crashed worker.
 * <p>
 * A job is orphaned when it is still RUNNING past {@code deadline + grace} and nobody holds
 * its trigger's lock any more. The sweep takes that lock itself before touching the job, so
 * it cannot race a new dispatch of the same trigger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService {

    private final JobRepository jobRepository;
    private final TriggerStore triggerStore;
    private final ExecutionLockManager lockManager;
    private final RetryPolicyRegistry retryPolicyRegistry;
    private final JobRetryService jobRetryService;
    private final WorkerIdentity workerIdentity;
    private final OrchestratorProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * @return number of jobs transitioned to failed
     */
    public int reconcileStaleJobs() {
        var threshold = clock.instant().minus(properties.getReconciliationGrace());
        var stale = jobRepository.findByStatusDeadlineBefore(JobStatus.RUNNING, threshold);

        if (stale.isEmpty()) {
            log.debug("No stale running jobs found");
            return 0;
        }

        log.warn("Found {} running jobs past their deadline, checking their locks", stale.size());

        var reaped = 0;
        for (var job : stale) {
            try {
                if (reap(job)) {
                    reaped++;
                }
            } catch (ObjectOptimisticLockingFailureException e) {
                log.info("Job {} was finalized concurrently, leaving it", job.getId());
            } catch (StoreUnavailableException | DataAccessException e) {
                log.warn("Could not reconcile job {}: {}", job.getId(), e.getMessage());
            }
        }

        if (reaped > 0) {
            log.info("Reaped {} orphaned jobs", reaped);
        }
        return reaped;
    }

    private boolean reap(Job stale) {
        var resourceId = stale.getTriggerId().toString();
        var lock = lockManager.acquire(resourceId, workerIdentity.getWorkerId(), properties.getLockTtl());
        if (lock.isEmpty()) {
            log.debug("Trigger {} still has a live lock, job {} is not orphaned", resourceId, stale.getId());
            return false;
        }

        try {
            var job = jobRepository.findById(stale.getId()).orElse(null);
            if (job == null || job.getStatus() != JobStatus.RUNNING) {
                return false;
            }

            var trigger = triggerStore.findById(job.getTriggerId()).orElse(null);
            var policy = trigger != null
                    ? retryPolicyRegistry.resolve(trigger.getRetryPolicy())
                    : RetryPolicy.noRetry("trigger-deleted");
            var taskType = trigger != null ? trigger.getTaskType() : null;

            var message = String.format("Worker %s stopped responding: job was running past %s with no live lock",
                    job.getWorkerId(), job.getDeadlineAt());
            log.warn("Reaped job {} of trigger {} (worker {}, attempt {})",
                    job.getId(), job.getTriggerId(), job.getWorkerId(), job.getAttemptNumber());

            var decision = jobRetryService.failAndScheduleRetry(job, ErrorClassification.WORKER_CRASHED,
                    "WorkerCrashed", message, null, trigger != null, policy, JobSource.RECOVERY, taskType);

            if (trigger != null) {
                try {
                    triggerStore.recordExecutionOutcome(trigger.getId(), JobStatus.FAILED.name(), false, 0L);
                } catch (StoreUnavailableException e) {
                    log.warn("Could not record outcome statistics for trigger {}: {}", trigger.getId(), e.getMessage());
                }
            }
            eventPublisher.publishEvent(JobOutcomeEvent.of(decision.failedJob(), taskType,
                    decision.isRetryScheduled(), clock.instant()));
            return true;
        } finally {
            lockManager.release(lock.get());
        }
    }
}
