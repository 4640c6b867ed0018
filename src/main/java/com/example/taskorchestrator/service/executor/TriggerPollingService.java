package com.example.taskorchestrator.service.executor;

import com.example.taskorchestrator.config.MetricsConfig;
import com.example.taskorchestrator.config.OrchestratorProperties;
import com.example.taskorchestrator.domain.entity.Job;
import com.example.taskorchestrator.domain.entity.Trigger;
import com.example.taskorchestrator.domain.enums.JobStatus;
import com.example.taskorchestrator.domain.repository.JobRepository;
import com.example.taskorchestrator.exception.StoreUnavailableException;
import com.example.taskorchestrator.service.queue.QueueEntry;
import com.example.taskorchestrator.service.queue.SchedulingQueue;
import com.example.taskorchestrator.service.store.TriggerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Feeds the scheduling queue from the store and drains it into execution slots.
 * <p>
 * Runs on every worker; there is no leader. Two workers may queue the same trigger,
 * the execution lock decides which one runs it.
 * <p>
 * Flow:
 * 1. Poll loop reads due triggers and due pending jobs into the in-memory heap
 * 2. Dispatch loop pops ready entries while execution slots are free
 * 3. Each entry is handed to {@link JobExecutorService#dispatch} on the dispatch executor
 * 4. When slots are exhausted, entries wait in the heap
 */
@Slf4j
@Service
public class TriggerPollingService {

    private final TriggerStore triggerStore;
    private final JobRepository jobRepository;
    private final SchedulingQueue schedulingQueue;
    private final JobExecutorService jobExecutorService;
    private final ExecutionSlotPool slotPool;
    private final MetricsConfig metricsConfig;
    private final OrchestratorProperties properties;
    private final Executor dispatchExecutor;
    private final Clock clock;

    private final AtomicBoolean isPolling = new AtomicBoolean(false);

    public TriggerPollingService(TriggerStore triggerStore, JobRepository jobRepository, SchedulingQueue schedulingQueue,
                                 JobExecutorService jobExecutorService, ExecutionSlotPool slotPool,
                                 MetricsConfig metricsConfig, OrchestratorProperties properties,
                                 @Qualifier("dispatchExecutor") Executor dispatchExecutor, Clock clock) {
        this.triggerStore = triggerStore;
        this.jobRepository = jobRepository;
        this.schedulingQueue = schedulingQueue;
        this.jobExecutorService = jobExecutorService;
        this.slotPool = slotPool;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
    }

    /**
     * The heap is never trusted across restarts: rebuild it from the store before the first dispatch.
     * Anything whose due time passed while no worker ran is due immediately, once.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void rebuildQueue() {
        schedulingQueue.clear();
        refreshQueue();
        log.info("Scheduling queue rebuilt from store with {} entries", schedulingQueue.size());
    }

    /**
     * Poll loop. Store outages skip the cycle and never stop the loop.
     */
    @Scheduled(fixedDelayString = "${task-orchestrator.poll-interval-ms:2000}")
    public void refreshQueue() {
        if (!isPolling.compareAndSet(false, true)) {
            log.debug("Previous polling cycle still running, skipping");
            return;
        }

        try {
            var now = clock.instant();
            pollDueTriggers(now);
            pollPendingJobs(now);
            metricsConfig.incrementCounter("poll_cycles");
        } catch (StoreUnavailableException | DataAccessException e) {
            log.warn("Store unavailable, skipping polling cycle: {}", e.getMessage());
            metricsConfig.incrementCounter("poll_failures");
        } finally {
            isPolling.set(false);
        }
    }

    /**
     * Push every active trigger due at {@code now} into the heap
     *
     * @return the due triggers read from the store
     */
    public List<Trigger> pollDueTriggers(Instant now) {
        var due = triggerStore.listActiveTriggersDueBefore(now);
        if (due.isEmpty()) {
            log.debug("No triggers due");
            return due;
        }

        var added = due.stream()
                .filter(trigger -> schedulingQueue.offer(QueueEntry.forTrigger(trigger)))
                .count();
        log.debug("Found {} due triggers, {} newly queued", due.size(), added);
        return due;
    }

    /**
     * Push retry, manual and event jobs whose start time has come into the heap
     */
    public List<Job> pollPendingJobs(Instant now) {
        var pending = jobRepository.findByStatusScheduledBefore(JobStatus.PENDING, now,
                PageRequest.of(0, properties.getPollBatchSize()));

        for (var job : pending) {
            schedulingQueue.offer(QueueEntry.forJob(job));
        }
        if (!pending.isEmpty()) {
            log.debug("Found {} pending jobs ready to start", pending.size());
        }
        return pending;
    }

    /**
     * Dispatch loop: move ready entries into free execution slots.
     *
     * @return number of entries handed to the dispatch executor
     */
    @Scheduled(fixedDelayString = "${task-orchestrator.dispatch-interval-ms:250}")
    public int dispatchReady() {
        var dispatched = 0;

        while (slotPool.tryAcquire()) {
            var next = schedulingQueue.dequeueReady(clock.instant());
            if (next.isEmpty()) {
                slotPool.release();
                break;
            }

            var entry = next.get();
            try {
                dispatchExecutor.execute(() -> runDispatch(entry));
                dispatched++;
            } catch (RejectedExecutionException e) {
                log.warn("Dispatch executor rejected {}, returning it to the queue", entry.key());
                schedulingQueue.requeue(entry);
                slotPool.release();
                break;
            }
        }

        if (dispatched > 0) {
            log.debug("Dispatched {} entries, {} slots free, {} queued", dispatched, slotPool.available(), schedulingQueue.size());
        }
        return dispatched;
    }

    private void runDispatch(QueueEntry entry) {
        try {
            var result = jobExecutorService.dispatch(entry);
            metricsConfig.incrementCounter("dispatches", "result", result.name().toLowerCase());
        } catch (RuntimeException e) {
            log.error("Unexpected error dispatching {}: {}", entry.key(), e.getMessage(), e);
        } finally {
            schedulingQueue.complete(entry);
            slotPool.release();
        }
    }
}
