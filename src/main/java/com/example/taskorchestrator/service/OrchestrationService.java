package com.example.taskorchestrator.service;

import com.example.taskorchestrator.config.MetricsConfig;
import com.example.taskorchestrator.domain.entity.Job;
import com.example.taskorchestrator.domain.entity.Trigger;
import com.example.taskorchestrator.domain.enums.JobSource;
import com.example.taskorchestrator.domain.enums.JobStatus;
import com.example.taskorchestrator.domain.enums.ScheduleType;
import com.example.taskorchestrator.domain.repository.JobRepository;
import com.example.taskorchestrator.domain.repository.TriggerRepository;
import com.example.taskorchestrator.dto.EngineHealth;
import com.example.taskorchestrator.dto.JobResponse;
import com.example.taskorchestrator.event.JobOutcomeEvent;
import com.example.taskorchestrator.exception.JobNotFoundException;
import com.example.taskorchestrator.exception.TriggerNotFoundException;
import com.example.taskorchestrator.mapper.JobMapper;
import com.example.taskorchestrator.service.executor.ExecutionSlotPool;
import com.example.taskorchestrator.service.executor.JobExecutorService;
import com.example.taskorchestrator.service.queue.QueueEntry;
import com.example.taskorchestrator.service.queue.SchedulingQueue;
import com.example.taskorchestrator.service.retry.RetryPolicyRegistry;
import com.example.taskorchestrator.service.store.TriggerStore;
import com.example.taskorchestrator.service.worker.WorkerIdentity;
import com.example.taskorchestrator.service.worker.WorkerRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Operational entry points: manual execution, event signals, cancellation, history and health.
 * <p>
 * Nothing here runs a handler directly. Created jobs go through the scheduling queue and
 * the trigger's execution lock like any other work.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrchestrationService {

    private final TriggerStore triggerStore;
    private final TriggerRepository triggerRepository;
    private final JobRepository jobRepository;
    private final SchedulingQueue schedulingQueue;
    private final JobExecutorService jobExecutorService;
    private final ExecutionSlotPool slotPool;
    private final RetryPolicyRegistry retryPolicyRegistry;
    private final WorkerRegistryService workerRegistryService;
    private final WorkerIdentity workerIdentity;
    private final MetricsConfig metricsConfig;
    private final JobMapper jobMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    // === Job Creation ===

    /**
     * Run a trigger now regardless of its due time.
     *
     * @return id of the pending job; it starts once this or another worker holds the trigger lock
     */
    public UUID triggerManualExecution(UUID triggerId) {
        var trigger = requireActiveTrigger(triggerId);
        var job = createPendingJob(trigger, JobSource.MANUAL);

        log.info("Manual execution of trigger {} requested, job {}", triggerId, job.getId());
        metricsConfig.incrementCounter("manual_executions");
        return job.getId();
    }

    /**
     * Signal the event an EVENT trigger waits for
     *
     * @return id of the pending job
     */
    public UUID signalEvent(UUID triggerId) {
        var trigger = requireActiveTrigger(triggerId);
        if (trigger.getScheduleType() != ScheduleType.EVENT) {
            throw new IllegalArgumentException(String.format("Trigger %s is a %s trigger, not an event trigger",
                    triggerId, trigger.getScheduleType()));
        }

        var job = createPendingJob(trigger, JobSource.EVENT);
        log.info("Event signalled for trigger {}, job {}", triggerId, job.getId());
        metricsConfig.incrementCounter("event_signals");
        return job.getId();
    }

    private Trigger requireActiveTrigger(UUID triggerId) {
        var trigger = triggerStore.findById(triggerId)
                .orElseThrow(() -> new TriggerNotFoundException(triggerId));
        if (!trigger.isActive()) {
            throw new IllegalStateException(String.format("Trigger %s is inactive", triggerId));
        }
        return trigger;
    }

    private Job createPendingJob(Trigger trigger, JobSource source) {
        var now = clock.instant();
        var policy = retryPolicyRegistry.resolve(trigger.getRetryPolicy());
        var job = jobRepository.save(Job.firstAttempt(trigger, source, policy.getMaxAttempts(), now, now));

        schedulingQueue.offer(QueueEntry.forJob(job));
        return job;
    }

    // === Cancellation ===

    /**
     * Cancel a pending or running job.
     * <p>
     * A pending job is cancelled in place. A job running on this worker is interrupted. A job
     * running on another worker is flagged and its owner cancels it on the next heartbeat.
     *
     * @return false if the job already reached a terminal status
     */
    public boolean cancelJob(UUID jobId) {
        var job = jobRepository.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));

        if (job.getStatus() == JobStatus.PENDING) {
            try {
                job.markCancelled(clock.instant(), "Cancelled by request");
                var saved = jobRepository.save(job);
                log.info("Cancelled pending job {}", jobId);
                eventPublisher.publishEvent(JobOutcomeEvent.of(saved, null, false, clock.instant()));
                return true;
            } catch (ObjectOptimisticLockingFailureException e) {
                log.info("Job {} was picked up while cancelling, re-reading", jobId);
                job = jobRepository.findById(jobId)
                        .orElseThrow(() -> new JobNotFoundException(jobId));
            }
        }

        if (job.getStatus() != JobStatus.RUNNING) {
            log.debug("Job {} is already {}, nothing to cancel", jobId, job.getStatus());
            return false;
        }

        if (jobExecutorService.cancelLocal(jobId)) {
            return true;
        }

        var flagged = jobRepository.requestCancellation(jobId, JobStatus.RUNNING) > 0;
        if (flagged) {
            log.info("Cancellation of job {} requested from worker {}", jobId, job.getWorkerId());
        }
        return flagged;
    }

    // === Queries ===

    /**
     * Execution history of a trigger, newest first
     *
     * @param page 1-based page number
     */
    public Page<JobResponse> getJobHistory(UUID triggerId, int page, int pageSize) {
        if (page < 1 || pageSize < 1) {
            throw new IllegalArgumentException("page and pageSize must be positive");
        }
        if (triggerStore.findById(triggerId).isEmpty()) {
            throw new TriggerNotFoundException(triggerId);
        }

        return jobRepository.findByTriggerIdOrderByCreatedAtDescAttemptNumberDesc(triggerId,
                        PageRequest.of(page - 1, pageSize))
                .map(jobMapper::toResponse);
    }

    public Optional<JobResponse> getJob(UUID jobId) {
        return jobRepository.findById(jobId).map(jobMapper::toResponse);
    }

    public EngineHealth getEngineHealth() {
        return EngineHealth.builder()
                .activeWorkers(workerRegistryService.countActiveWorkers())
                .queueDepth(schedulingQueue.size())
                .lockContentionRate(metricsConfig.getLockContentionRate())
                .avgDispatchLatencyMs(metricsConfig.getAverageDispatchLatencyMs())
                .workerId(workerIdentity.getWorkerId())
                .runningJobs(jobExecutorService.getRunningCount())
                .availableSlots(slotPool.available())
                .activeTriggers(triggerRepository.countByActiveTrue())
                .generatedAt(clock.instant())
                .build();
    }
}
