package com.example.taskorchestrator.service.executor;

import com.example.taskorchestrator.config.MetricsConfig;
import com.example.taskorchestrator.config.OrchestratorProperties;
import com.example.taskorchestrator.domain.entity.Job;
import com.example.taskorchestrator.domain.entity.Trigger;
import com.example.taskorchestrator.domain.enums.JobSource;
import com.example.taskorchestrator.domain.enums.JobStatus;
import com.example.taskorchestrator.domain.enums.ScheduleType;
import com.example.taskorchestrator.domain.enums.TriggerPriority;
import com.example.taskorchestrator.domain.repository.JobRepository;
import com.example.taskorchestrator.exception.StoreUnavailableException;
import com.example.taskorchestrator.service.queue.QueueEntry;
import com.example.taskorchestrator.service.queue.SchedulingQueue;
import com.example.taskorchestrator.service.store.TriggerStore;
import com.example.taskorchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TriggerPollingService Tests")
class TriggerPollingServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private TriggerStore triggerStore;

    @Mock
    private JobRepository jobRepository;

    @Mock
    private JobExecutorService jobExecutorService;

    @Mock
    private MetricsConfig metricsConfig;

    private SchedulingQueue schedulingQueue;
    private ExecutionSlotPool slotPool;
    private List<Runnable> submitted;
    private TriggerPollingService pollingService;

    private static Trigger dueTrigger(Instant dueAt, TriggerPriority priority) {
        return Trigger.builder()
                .id(UUID.randomUUID())
                .name("trigger")
                .scheduleType(ScheduleType.INTERVAL)
                .taskType("export")
                .priority(priority)
                .nextDueAt(dueAt)
                .build();
    }

    private static Job pendingJob(JobSource source, TriggerPriority priority, Instant scheduledFor) {
        return Job.builder()
                .id(UUID.randomUUID())
                .triggerId(UUID.randomUUID())
                .status(JobStatus.PENDING)
                .source(source)
                .priority(priority)
                .attemptNumber(1)
                .maxAttempts(3)
                .scheduledFor(scheduledFor)
                .build();
    }

    private TriggerPollingService service(Executor dispatchExecutor) {
        return new TriggerPollingService(triggerStore, jobRepository, schedulingQueue, jobExecutorService, slotPool,
                metricsConfig, new OrchestratorProperties(), dispatchExecutor, new MutableClock(NOW));
    }

    @BeforeEach
    void setUp() {
        schedulingQueue = new SchedulingQueue();
        slotPool = new ExecutionSlotPool(2);
        submitted = new ArrayList<>();
        // Runs are collected and executed by the test, which keeps slots occupied in between
        pollingService = service(submitted::add);
    }

    @Nested
    @DisplayName("Polling Tests")
    class PollingTests {

        @Test
        @DisplayName("Due triggers are pushed into the queue once")
        void queuesDueTriggers() {
            var trigger = dueTrigger(NOW.minusSeconds(5), TriggerPriority.NORMAL);
            when(triggerStore.listActiveTriggersDueBefore(NOW)).thenReturn(List.of(trigger));

            pollingService.pollDueTriggers(NOW);
            pollingService.pollDueTriggers(NOW);

            assertThat(schedulingQueue.size()).isEqualTo(1);
            assertThat(schedulingQueue.peek()).get()
                    .extracting(QueueEntry::getTriggerId).isEqualTo(trigger.getId());
        }

        @Test
        @DisplayName("Manual jobs are queued at critical priority, retries at normal")
        void queuesPendingJobs() {
            var manual = pendingJob(JobSource.MANUAL, TriggerPriority.CRITICAL, NOW);
            var retry = pendingJob(JobSource.RETRY, TriggerPriority.NORMAL, NOW);
            when(jobRepository.findByStatusScheduledBefore(eq(JobStatus.PENDING), eq(NOW), any()))
                    .thenReturn(List.of(retry, manual));

            pollingService.pollPendingJobs(NOW);

            assertThat(schedulingQueue.dequeueReady(NOW)).get()
                    .satisfies(entry -> {
                        assertThat(entry.getJobId()).isEqualTo(manual.getId());
                        assertThat(entry.getPriority()).isEqualTo(TriggerPriority.CRITICAL.getValue());
                    });
            assertThat(schedulingQueue.dequeueReady(NOW)).get()
                    .extracting(QueueEntry::getJobId).isEqualTo(retry.getId());
        }

        @Test
        @DisplayName("Retry and event jobs read back from the store keep their trigger's priority")
        void pendingJobsKeepStoredPriority() {
            var highRetry = pendingJob(JobSource.RETRY, TriggerPriority.HIGH, NOW);
            var lowEvent = pendingJob(JobSource.EVENT, TriggerPriority.LOW, NOW);
            var legacy = pendingJob(JobSource.RETRY, null, NOW);
            when(jobRepository.findByStatusScheduledBefore(eq(JobStatus.PENDING), eq(NOW), any()))
                    .thenReturn(List.of(lowEvent, legacy, highRetry));

            pollingService.pollPendingJobs(NOW);

            assertThat(schedulingQueue.dequeueReady(NOW)).get()
                    .satisfies(entry -> {
                        assertThat(entry.getJobId()).isEqualTo(highRetry.getId());
                        assertThat(entry.getPriority()).isEqualTo(TriggerPriority.HIGH.getValue());
                    });
            assertThat(schedulingQueue.dequeueReady(NOW)).get()
                    .satisfies(entry -> {
                        assertThat(entry.getJobId()).isEqualTo(legacy.getId());
                        assertThat(entry.getPriority()).isEqualTo(TriggerPriority.NORMAL.getValue());
                    });
            assertThat(schedulingQueue.dequeueReady(NOW)).get()
                    .extracting(QueueEntry::getPriority).isEqualTo(TriggerPriority.LOW.getValue());
        }

        @Test
        @DisplayName("Store outage skips the cycle without throwing")
        void storeOutageSkipsCycle() {
            when(triggerStore.listActiveTriggersDueBefore(any()))
                    .thenThrow(new StoreUnavailableException("list due triggers", new RuntimeException("down")));

            pollingService.refreshQueue();

            assertThat(schedulingQueue.size()).isZero();
            verify(metricsConfig).incrementCounter("poll_failures");
        }

        @Test
        @DisplayName("Rebuild discards entries that are no longer in the store")
        void rebuildFromStore() {
            schedulingQueue.offer(QueueEntry.forTrigger(dueTrigger(NOW, TriggerPriority.NORMAL)));
            var stillDue = dueTrigger(NOW.minusSeconds(3600), TriggerPriority.NORMAL);
            when(triggerStore.listActiveTriggersDueBefore(NOW)).thenReturn(List.of(stillDue));
            when(jobRepository.findByStatusScheduledBefore(any(), any(), any())).thenReturn(List.of());

            pollingService.rebuildQueue();

            assertThat(schedulingQueue.size()).isEqualTo(1);
            assertThat(schedulingQueue.peek()).get()
                    .extracting(QueueEntry::getTriggerId).isEqualTo(stillDue.getId());
        }
    }

    @Nested
    @DisplayName("Dispatch Tests")
    class DispatchTests {

        @Test
        @DisplayName("Dispatch stops when every slot is busy")
        void boundedBySlots() {
            for (var i = 0; i < 5; i++) {
                schedulingQueue.offer(QueueEntry.forTrigger(dueTrigger(NOW.minusSeconds(i), TriggerPriority.NORMAL)));
            }

            var dispatched = pollingService.dispatchReady();

            assertThat(dispatched).isEqualTo(2);
            assertThat(slotPool.available()).isZero();
            assertThat(schedulingQueue.size()).isEqualTo(3);
            assertThat(pollingService.dispatchReady()).isZero();
        }

        @Test
        @DisplayName("Finished dispatch frees its slot and its queue key")
        void finishedDispatchFreesSlot() {
            var trigger = dueTrigger(NOW, TriggerPriority.NORMAL);
            schedulingQueue.offer(QueueEntry.forTrigger(trigger));
            when(jobExecutorService.dispatch(any())).thenReturn(JobExecutorService.DispatchResult.EXECUTED);

            pollingService.dispatchReady();
            assertThat(schedulingQueue.inFlightCount()).isEqualTo(1);
            submitted.forEach(Runnable::run);

            assertThat(slotPool.available()).isEqualTo(2);
            assertThat(schedulingQueue.inFlightCount()).isZero();
            assertThat(schedulingQueue.offer(QueueEntry.forTrigger(trigger))).isTrue();
        }

        @Test
        @DisplayName("Unexpected dispatch error still frees the slot")
        void dispatchErrorFreesSlot() {
            schedulingQueue.offer(QueueEntry.forTrigger(dueTrigger(NOW, TriggerPriority.NORMAL)));
            when(jobExecutorService.dispatch(any())).thenThrow(new IllegalStateException("bug"));

            pollingService.dispatchReady();
            submitted.forEach(Runnable::run);

            assertThat(slotPool.available()).isEqualTo(2);
            assertThat(schedulingQueue.inFlightCount()).isZero();
        }

        @Test
        @DisplayName("Future entries are not dispatched")
        void futureEntriesWait() {
            schedulingQueue.offer(QueueEntry.forTrigger(dueTrigger(NOW.plusSeconds(30), TriggerPriority.NORMAL)));

            assertThat(pollingService.dispatchReady()).isZero();
            assertThat(slotPool.available()).isEqualTo(2);
        }

        @Test
        @DisplayName("Rejected entry goes back to the queue")
        void rejectedEntryRequeued() {
            var rejecting = service(runnable -> {
                throw new RejectedExecutionException("saturated");
            });
            schedulingQueue.offer(QueueEntry.forTrigger(dueTrigger(NOW, TriggerPriority.NORMAL)));

            assertThat(rejecting.dispatchReady()).isZero();
            assertThat(schedulingQueue.size()).isEqualTo(1);
            assertThat(schedulingQueue.inFlightCount()).isZero();
            assertThat(slotPool.available()).isEqualTo(2);
        }
    }
}
