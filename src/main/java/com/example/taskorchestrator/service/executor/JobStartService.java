package com.example.taskorchestrator.service.executor;

import com.example.taskorchestrator.config.OrchestratorProperties;
import com.example.taskorchestrator.domain.entity.Job;
import com.example.taskorchestrator.domain.entity.Trigger;
import com.example.taskorchestrator.domain.enums.JobSource;
import com.example.taskorchestrator.domain.repository.JobRepository;
import com.example.taskorchestrator.service.schedule.NextDueCalculator;
import com.example.taskorchestrator.service.store.TriggerStore;
import com.example.taskorchestrator.service.worker.WorkerIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Moves a job to RUNNING together with the trigger bookkeeping of that start.
 * <p>
 * Both writes commit or roll back as one unit: a failed schedule update leaves
 * neither a job row nor an advanced trigger behind, so the firing is retried on a later poll.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStartService {

    private final TriggerStore triggerStore;
    private final JobRepository jobRepository;
    private final NextDueCalculator nextDueCalculator;
    private final OrchestratorProperties properties;
    private final WorkerIdentity workerIdentity;
    private final Clock clock;

    /**
     * Insert the first attempt of a scheduled firing as RUNNING and advance the trigger
     */
    @Transactional
    public Job startScheduled(Trigger trigger, int maxAttempts, Instant now) {
        var dueAt = trigger.getNextDueAt();
        var job = jobRepository.save(Job.firstAttempt(trigger, JobSource.SCHEDULE, maxAttempts, dueAt, now));

        var running = markRunning(job, trigger);
        advanceSchedule(trigger, dueAt, running.getStartedAt());
        return running;
    }

    /**
     * Start a retry, manual or event job and stamp the trigger's last execution time
     */
    @Transactional
    public Job startPending(Job job, Trigger trigger) {
        var running = markRunning(job, trigger);
        triggerStore.updateLastExecutedAt(trigger.getId(), running.getStartedAt());
        return running;
    }

    private Job markRunning(Job job, Trigger trigger) {
        var startedAt = clock.instant();
        var maxExecution = trigger.getEffectiveMaxExecution(properties.getDefaultMaxExecution());

        job.markRunning(workerIdentity.getWorkerId(), startedAt, startedAt.plus(maxExecution));
        return jobRepository.save(job);
    }

    /**
     * Move the trigger to its next fire time, computed from the due time of this firing
     */
    private void advanceSchedule(Trigger trigger, Instant dueAt, Instant startedAt) {
        Instant nextDue;
        try {
            nextDue = nextDueCalculator.nextDueAfter(trigger, dueAt, startedAt);
        } catch (IllegalArgumentException e) {
            log.error("Trigger {} has an invalid schedule and will not fire again until fixed: {}",
                    trigger.getId(), e.getMessage());
            nextDue = null;
        }
        triggerStore.updateTriggerScheduleState(trigger.getId(), nextDue, startedAt);
        log.debug("Trigger {} advanced from {} to {}", trigger.getId(), dueAt, nextDue);
    }
}
