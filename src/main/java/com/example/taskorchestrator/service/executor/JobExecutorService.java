package com.example.taskorchestrator.service.executor;

import com.example.taskorchestrator.config.MetricsConfig;
import com.example.taskorchestrator.config.OrchestratorProperties;
import com.example.taskorchestrator.domain.entity.Job;
import com.example.taskorchestrator.domain.entity.Trigger;
import com.example.taskorchestrator.domain.enums.ErrorClassification;
import com.example.taskorchestrator.domain.enums.JobSource;
import com.example.taskorchestrator.domain.enums.JobStatus;
import com.example.taskorchestrator.domain.repository.JobRepository;
import com.example.taskorchestrator.event.JobOutcomeEvent;
import com.example.taskorchestrator.exception.StoreUnavailableException;
import com.example.taskorchestrator.exception.TaskExecutionException;
import com.example.taskorchestrator.logging.LoggingContext;
import com.example.taskorchestrator.service.handler.TaskExecutionResult;
import com.example.taskorchestrator.service.handler.TaskHandlerRegistry;
import com.example.taskorchestrator.service.lock.ExecutionLock;
import com.example.taskorchestrator.service.lock.ExecutionLockManager;
import com.example.taskorchestrator.service.queue.QueueEntry;
import com.example.taskorchestrator.service.queue.SchedulingQueue;
import com.example.taskorchestrator.service.retry.JobRetryService;
import com.example.taskorchestrator.service.retry.RetryPolicy;
import com.example.taskorchestrator.service.retry.RetryPolicyRegistry;
import com.example.taskorchestrator.service.store.TriggerStore;
import com.example.taskorchestrator.service.worker.WorkerIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Executes one queue entry under the trigger's execution lock.
 * <p>
 * Handles:
 * - Lock acquisition, heartbeat and release on every exit path
 * - Job state transitions after the start, which {@link JobStartService} commits
 * - Handler invocation under the trigger's max execution duration
 * - Retry scheduling and outcome events
 * <p>
 * Handler errors are converted into job transitions here and never propagate further.
 */
@Slf4j
@Service
public class JobExecutorService {

    public enum DispatchResult {
        EXECUTED,
        LOCK_DENIED,
        SKIPPED
    }

    private final TriggerStore triggerStore;
    private final JobRepository jobRepository;
    private final JobStartService jobStartService;
    private final ExecutionLockManager lockManager;
    private final TaskHandlerRegistry handlerRegistry;
    private final RetryPolicyRegistry retryPolicyRegistry;
    private final JobRetryService jobRetryService;
    private final SchedulingQueue schedulingQueue;
    private final MetricsConfig metricsConfig;
    private final OrchestratorProperties properties;
    private final WorkerIdentity workerIdentity;
    private final ApplicationEventPublisher eventPublisher;
    private final AsyncTaskExecutor handlerExecutor;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final Map<UUID, RunningExecution> runningExecutions = new ConcurrentHashMap<>();

    public JobExecutorService(TriggerStore triggerStore, JobRepository jobRepository, JobStartService jobStartService,
                              ExecutionLockManager lockManager, TaskHandlerRegistry handlerRegistry,
                              RetryPolicyRegistry retryPolicyRegistry, JobRetryService jobRetryService,
                              SchedulingQueue schedulingQueue, MetricsConfig metricsConfig,
                              OrchestratorProperties properties, WorkerIdentity workerIdentity,
                              ApplicationEventPublisher eventPublisher,
                              @Qualifier("handlerExecutor") AsyncTaskExecutor handlerExecutor,
                              @Qualifier("taskScheduler") TaskScheduler taskScheduler,
                              Clock clock) {
        this.triggerStore = triggerStore;
        this.jobRepository = jobRepository;
        this.jobStartService = jobStartService;
        this.lockManager = lockManager;
        this.handlerRegistry = handlerRegistry;
        this.retryPolicyRegistry = retryPolicyRegistry;
        this.jobRetryService = jobRetryService;
        this.schedulingQueue = schedulingQueue;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.workerIdentity = workerIdentity;
        this.eventPublisher = eventPublisher;
        this.handlerExecutor = handlerExecutor;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /**
     * Run a dequeued entry if this worker wins the trigger lock.
     * A denied lock is not an error: the entry is picked up again by a later poll.
     */
    public DispatchResult dispatch(QueueEntry entry) {
        var resourceId = entry.getTriggerId().toString();

        Optional<ExecutionLock> acquired;
        try {
            acquired = lockManager.acquire(resourceId, workerIdentity.getWorkerId(), properties.getLockTtl());
        } catch (StoreUnavailableException e) {
            log.warn("Skipping {}: {}", entry.key(), e.getMessage());
            return DispatchResult.SKIPPED;
        }

        metricsConfig.recordLockAttempt(acquired.isPresent());
        if (acquired.isEmpty()) {
            log.debug("Lock for trigger {} denied, leaving {} for a later cycle", resourceId, entry.key());
            return DispatchResult.LOCK_DENIED;
        }

        var lock = new AtomicReference<>(acquired.get());
        try (var ctx = LoggingContext.forTrigger(entry.getTriggerId())) {
            return entry.isTriggerFiring() ? fireTrigger(entry, lock) : runPendingJob(entry, lock);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("Job state of {} changed concurrently, dispatch abandoned: {}", entry.key(), e.getMessage());
            return DispatchResult.SKIPPED;
        } catch (StoreUnavailableException | DataAccessException e) {
            log.warn("Store error while dispatching {}: {}", entry.key(), e.getMessage());
            return DispatchResult.SKIPPED;
        } finally {
            releaseLock(lock.get());
        }
    }

    /**
     * Cancel a job running on this worker
     *
     * @return false if the job is not running here
     */
    public boolean cancelLocal(UUID jobId) {
        var execution = runningExecutions.get(jobId);
        if (execution == null) {
            return false;
        }
        log.info("Cancelling job {} running on this worker", jobId);
        execution.cancel();
        return true;
    }

    public boolean isRunningLocally(UUID jobId) {
        return runningExecutions.containsKey(jobId);
    }

    public int getRunningCount() {
        return runningExecutions.size();
    }

    private DispatchResult fireTrigger(QueueEntry entry, AtomicReference<ExecutionLock> lock) {
        var now = clock.instant();
        var trigger = triggerStore.findById(entry.getTriggerId()).orElse(null);

        // Re-read under the lock: another worker may have fired it since it was queued
        if (trigger == null || !trigger.isDue(now)) {
            log.debug("Trigger {} is no longer due, skipping", entry.getTriggerId());
            return DispatchResult.SKIPPED;
        }

        var policy = retryPolicyRegistry.resolve(trigger.getRetryPolicy());
        var job = started(jobStartService.startScheduled(trigger, policy.getMaxAttempts(), now));
        execute(job, trigger, policy, lock);
        return DispatchResult.EXECUTED;
    }

    private DispatchResult runPendingJob(QueueEntry entry, AtomicReference<ExecutionLock> lock) {
        var job = jobRepository.findById(entry.getJobId()).orElse(null);
        if (job == null || job.getStatus() != JobStatus.PENDING) {
            log.debug("Job {} is no longer pending, skipping", entry.getJobId());
            return DispatchResult.SKIPPED;
        }

        var trigger = triggerStore.findById(job.getTriggerId()).filter(Trigger::isActive).orElse(null);
        if (trigger == null) {
            job.markCancelled(clock.instant(), "Trigger deleted or deactivated before the job could start");
            job.setErrorClassification(ErrorClassification.TRIGGER_UNAVAILABLE);
            job = jobRepository.save(job);
            log.info("Cancelled job {}: trigger {} is no longer active", job.getId(), job.getTriggerId());
            eventPublisher.publishEvent(JobOutcomeEvent.of(job, null, false, clock.instant()));
            return DispatchResult.SKIPPED;
        }

        var policy = retryPolicyRegistry.resolve(trigger.getRetryPolicy());
        job = started(jobStartService.startPending(job, trigger));
        execute(job, trigger, policy, lock);
        return DispatchResult.EXECUTED;
    }

    private Job started(Job running) {
        metricsConfig.recordDispatchLatency(Duration.between(running.getScheduledFor(), running.getStartedAt()));
        return running;
    }

    private void execute(Job job, Trigger trigger, RetryPolicy policy, AtomicReference<ExecutionLock> lock) {
        try (var ctx = LoggingContext.forJob(trigger.getId(), job.getId(), job.getAttemptNumber())) {
            log.info("Executing job {} (task type: {}, attempt {}/{}, source: {})",
                    job.getId(), trigger.getTaskType(), job.getAttemptNumber(), job.getMaxAttempts(), job.getSource());

            var execution = new RunningExecution(job.getId());
            runningExecutions.put(job.getId(), execution);
            var heartbeat = scheduleHeartbeat(execution, lock);
            var timerSample = metricsConfig.startJobExecutionTimer();

            ExecutionOutcome outcome;
            try {
                var timeout = Duration.between(job.getStartedAt(), job.getDeadlineAt());
                outcome = invokeHandler(execution, trigger, job.getDeadlineAt(), timeout);
            } finally {
                heartbeat.cancel(false);
                runningExecutions.remove(job.getId());
            }

            metricsConfig.recordJobExecution(timerSample, trigger.getTaskType(), outcome.getKind().name().toLowerCase());
            finish(job, trigger, policy, outcome);
        }
    }

    private ExecutionOutcome invokeHandler(RunningExecution execution, Trigger trigger, Instant deadline, Duration timeout) {
        var taskType = trigger.getTaskType();
        var handler = handlerRegistry.lookup(taskType);
        if (handler.isEmpty()) {
            log.error("No handler registered for task type '{}'", taskType);
            return ExecutionOutcome.failed(ErrorClassification.HANDLER_NOT_FOUND, "HandlerNotFound",
                    "No handler registered for task type: " + taskType, null);
        }

        var payload = Collections.unmodifiableMap(trigger.getParameters() != null
                ? new HashMap<>(trigger.getParameters())
                : new HashMap<String, Object>());

        Future<TaskExecutionResult> future;
        try {
            future = handlerExecutor.submit(() -> handler.get().execute(payload, deadline));
        } catch (RejectedExecutionException e) {
            log.warn("Handler executor rejected task type {}: {}", taskType, e.getMessage());
            return ExecutionOutcome.failed(ErrorClassification.HANDLER_EXECUTION_ERROR, "Rejected",
                    "No handler thread available", null);
        }
        execution.attach(future);

        try {
            return toOutcome(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Handler for task type {} exceeded {} and was cancelled", taskType, timeout);
            return ExecutionOutcome.timedOut("Handler exceeded max execution duration of " + timeout);
        } catch (CancellationException e) {
            if (execution.getAbortReason() == ErrorClassification.LOCK_LOST) {
                return ExecutionOutcome.failed(ErrorClassification.LOCK_LOST, "LockLost",
                        "Execution lock was lost while the handler was running", null);
            }
            return ExecutionOutcome.cancelled("Cancelled by operator request");
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            var fatal = cause instanceof TaskExecutionException taskException && !taskException.isRetryable();
            log.warn("Handler for task type {} threw {}: {}", taskType, cause.getClass().getSimpleName(), cause.getMessage());
            return ExecutionOutcome.failed(
                    fatal ? ErrorClassification.HANDLER_FATAL_ERROR : ErrorClassification.HANDLER_EXECUTION_ERROR,
                    cause.getClass().getSimpleName(), cause.getMessage(), TaskExecutionResult.truncateStackTrace(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ExecutionOutcome.cancelled("Worker interrupted while waiting for the handler");
        }
    }

    private static ExecutionOutcome toOutcome(TaskExecutionResult result) {
        if (result == null) {
            return ExecutionOutcome.failed(ErrorClassification.HANDLER_EXECUTION_ERROR, "NullResult",
                    "Handler returned no result", null);
        }
        if (result.isSuccess()) {
            return ExecutionOutcome.completed(result.getResponseData());
        }
        return ExecutionOutcome.failed(
                result.isRetryable() ? ErrorClassification.HANDLER_EXECUTION_ERROR : ErrorClassification.HANDLER_FATAL_ERROR,
                result.getErrorType(), result.getErrorMessage(), result.getStackTrace());
    }

    private void finish(Job job, Trigger trigger, RetryPolicy policy, ExecutionOutcome outcome) {
        var now = clock.instant();

        switch (outcome.getKind()) {
            case COMPLETED -> {
                job.markCompleted(now, outcome.getResult());
                var completed = jobRepository.save(job);
                log.info("Job {} completed successfully in {}ms", completed.getId(), completed.getDurationMs());
                recordOutcome(trigger, completed, true);
                eventPublisher.publishEvent(JobOutcomeEvent.of(completed, trigger.getTaskType(), false, now));
            }
            case CANCELLED -> {
                job.markCancelled(now, outcome.getErrorMessage());
                var cancelled = jobRepository.save(job);
                log.info("Job {} cancelled: {}", cancelled.getId(), outcome.getErrorMessage());
                recordOutcome(trigger, cancelled, false);
                eventPublisher.publishEvent(JobOutcomeEvent.of(cancelled, trigger.getTaskType(), false, now));
            }
            case FAILED, TIMED_OUT -> {
                var decision = jobRetryService.failAndScheduleRetry(job, outcome.getClassification(),
                        outcome.getErrorType(), outcome.getErrorMessage(), outcome.getStackTrace(),
                        outcome.isRetryable(), policy, JobSource.RETRY, trigger.getTaskType());
                decision.retryJob().ifPresent(retry -> schedulingQueue.offer(QueueEntry.forJob(retry)));
                recordOutcome(trigger, decision.failedJob(), false);
                eventPublisher.publishEvent(JobOutcomeEvent.of(decision.failedJob(), trigger.getTaskType(),
                        decision.isRetryScheduled(), now));
            }
        }
    }

    private void recordOutcome(Trigger trigger, Job job, boolean success) {
        try {
            var duration = job.getDurationMs() != null ? job.getDurationMs() : 0L;
            triggerStore.recordExecutionOutcome(trigger.getId(), job.getStatus().name(), success, duration);
        } catch (StoreUnavailableException e) {
            log.warn("Could not record outcome statistics for trigger {}: {}", trigger.getId(), e.getMessage());
        }
    }

    private ScheduledFuture<?> scheduleHeartbeat(RunningExecution execution, AtomicReference<ExecutionLock> lock) {
        var interval = properties.getLockHeartbeatInterval();
        return taskScheduler.scheduleWithFixedDelay(() -> heartbeat(execution, lock), clock.instant().plus(interval), interval);
    }

    private void heartbeat(RunningExecution execution, AtomicReference<ExecutionLock> lock) {
        try {
            var renewed = lockManager.heartbeat(lock.get(), properties.getLockTtl());
            if (renewed.isEmpty()) {
                log.warn("Lost execution lock {} while job {} was running, cancelling handler",
                        lock.get().getResourceId(), execution.getJobId());
                execution.abort(ErrorClassification.LOCK_LOST);
                return;
            }
            lock.set(renewed.get());

            if (jobRepository.findCancelRequested(execution.getJobId()).orElse(false)) {
                log.info("Cancellation requested for job {}", execution.getJobId());
                execution.cancel();
            }
        } catch (StoreUnavailableException | DataAccessException e) {
            log.warn("Heartbeat for job {} failed, retrying next interval: {}", execution.getJobId(), e.getMessage());
        }
    }

    private void releaseLock(ExecutionLock lock) {
        try {
            lockManager.release(lock);
        } catch (StoreUnavailableException e) {
            log.warn("Could not release lock {}, it expires at {}: {}", lock.getResourceId(), lock.getExpiresAt(), e.getMessage());
        }
    }

    /**
     * Handle on a handler call in progress. Cancellation may arrive before the future exists.
     */
    static final class RunningExecution {

        private final UUID jobId;
        private Future<?> future;
        private boolean cancelled;
        private volatile ErrorClassification abortReason;

        RunningExecution(UUID jobId) {
            this.jobId = jobId;
        }

        UUID getJobId() {
            return jobId;
        }

        ErrorClassification getAbortReason() {
            return abortReason;
        }

        synchronized void attach(Future<?> future) {
            this.future = future;
            if (cancelled) {
                future.cancel(true);
            }
        }

        synchronized void cancel() {
            cancelled = true;
            if (future != null) {
                future.cancel(true);
            }
        }

        synchronized void abort(ErrorClassification reason) {
            abortReason = reason;
            cancel();
        }
    }
}
