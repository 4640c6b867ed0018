package com.example.taskorchestrator.domain.entity;

import com.example.taskorchestrator.domain.enums.ErrorClassification;
import com.example.taskorchestrator.domain.enums.JobSource;
import com.example.taskorchestrator.domain.enums.JobStatus;
import com.example.taskorchestrator.domain.enums.ScheduleType;
import com.example.taskorchestrator.domain.enums.TriggerPriority;
import com.example.taskorchestrator.exception.InvalidJobStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Job Entity Tests")
class JobTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private Trigger trigger;

    @BeforeEach
    void setUp() {
        trigger = Trigger.builder()
                .id(UUID.randomUUID())
                .name("nightly-report")
                .scheduleType(ScheduleType.INTERVAL)
                .taskType("report")
                .build();
    }

    @Nested
    @DisplayName("Factory Tests")
    class FactoryTests {

        @Test
        @DisplayName("First attempt starts pending with attempt number one")
        void firstAttempt() {
            var job = Job.firstAttempt(trigger, JobSource.SCHEDULE, 3, T0, T0.plusSeconds(1));

            assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
            assertThat(job.getTriggerId()).isEqualTo(trigger.getId());
            assertThat(job.getAttemptNumber()).isEqualTo(1);
            assertThat(job.getMaxAttempts()).isEqualTo(3);
            assertThat(job.getFiringDueAt()).isEqualTo(T0);
            assertThat(job.getScheduledFor()).isEqualTo(T0);
            assertThat(job.getPreviousJobId()).isNull();
            assertThat(job.isCancelRequested()).isFalse();
            assertThat(job.getPriority()).isEqualTo(TriggerPriority.NORMAL);
        }

        @Test
        @DisplayName("First attempt takes the trigger's priority, manual runs are critical")
        void firstAttemptPriority() {
            trigger.setPriority(TriggerPriority.HIGH);

            assertThat(Job.firstAttempt(trigger, JobSource.SCHEDULE, 3, T0, T0).getPriority())
                    .isEqualTo(TriggerPriority.HIGH);
            assertThat(Job.firstAttempt(trigger, JobSource.EVENT, 3, T0, T0).getPriority())
                    .isEqualTo(TriggerPriority.HIGH);
            assertThat(Job.firstAttempt(trigger, JobSource.MANUAL, 3, T0, T0).getPriority())
                    .isEqualTo(TriggerPriority.CRITICAL);
        }

        @Test
        @DisplayName("Next attempt links to the failed job and keeps the firing due time")
        void nextAttempt() {
            var failed = Job.firstAttempt(trigger, JobSource.SCHEDULE, 3, T0, T0);
            failed.setId(UUID.randomUUID());
            var retryAt = T0.plusSeconds(60);

            var next = Job.nextAttemptOf(failed, JobSource.RETRY, retryAt, T0.plusSeconds(5));

            assertThat(next.getStatus()).isEqualTo(JobStatus.PENDING);
            assertThat(next.getSource()).isEqualTo(JobSource.RETRY);
            assertThat(next.getAttemptNumber()).isEqualTo(2);
            assertThat(next.getMaxAttempts()).isEqualTo(3);
            assertThat(next.getPreviousJobId()).isEqualTo(failed.getId());
            assertThat(next.getFiringDueAt()).isEqualTo(T0);
            assertThat(next.getScheduledFor()).isEqualTo(retryAt);
        }

        @Test
        @DisplayName("Next attempt keeps the priority of the chain")
        void nextAttemptKeepsPriority() {
            var failed = Job.firstAttempt(trigger, JobSource.MANUAL, 3, T0, T0);

            var next = Job.nextAttemptOf(failed, JobSource.RETRY, T0.plusSeconds(60), T0.plusSeconds(5));

            assertThat(next.getPriority()).isEqualTo(TriggerPriority.CRITICAL);
        }
    }

    @Nested
    @DisplayName("Transition Tests")
    class TransitionTests {

        @Test
        @DisplayName("Completed job records duration and result")
        void completes() {
            var job = Job.firstAttempt(trigger, JobSource.SCHEDULE, 3, T0, T0);
            job.markRunning("worker-1", T0, T0.plusSeconds(60));
            job.markCompleted(T0.plusMillis(1500), Map.of("rows", 10));

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.getDurationMs()).isEqualTo(1500L);
            assertThat(job.getResult()).containsEntry("rows", 10);
            assertThat(job.isTerminal()).isTrue();
        }

        @Test
        @DisplayName("Failed job records classification and next retry time")
        void fails() {
            var job = Job.firstAttempt(trigger, JobSource.SCHEDULE, 3, T0, T0);
            job.markRunning("worker-1", T0, T0.plusSeconds(60));
            job.markFailed(T0.plusSeconds(2), ErrorClassification.HANDLER_EXECUTION_ERROR,
                    "IOException", "connection reset", "stack", T0.plusSeconds(62));

            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(job.getErrorClassification()).isEqualTo(ErrorClassification.HANDLER_EXECUTION_ERROR);
            assertThat(job.getErrorType()).isEqualTo("IOException");
            assertThat(job.getNextRetryAt()).isEqualTo(T0.plusSeconds(62));
        }

        @Test
        @DisplayName("Pending job can be cancelled without ever starting")
        void cancelsPending() {
            var job = Job.firstAttempt(trigger, JobSource.MANUAL, 3, T0, T0);
            job.markCancelled(T0.plusSeconds(1), "operator");

            assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
            assertThat(job.getDurationMs()).isNull();
            assertThat(job.getErrorMessage()).isEqualTo("operator");
        }

        @Test
        @DisplayName("Pending job cannot complete")
        void pendingCannotComplete() {
            var job = Job.firstAttempt(trigger, JobSource.SCHEDULE, 3, T0, T0);

            assertThatThrownBy(() -> job.markCompleted(T0, Map.of()))
                    .isInstanceOf(InvalidJobStateException.class);
            assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        }

        @Test
        @DisplayName("Terminal job is immutable")
        void terminalIsImmutable() {
            var job = Job.firstAttempt(trigger, JobSource.SCHEDULE, 3, T0, T0);
            job.markRunning("worker-1", T0, T0.plusSeconds(60));
            job.markCompleted(T0.plusSeconds(1), Map.of());

            assertThatThrownBy(() -> job.markRunning("worker-2", T0, T0))
                    .isInstanceOf(InvalidJobStateException.class);
            assertThatThrownBy(() -> job.markCancelled(T0, "late"))
                    .isInstanceOf(InvalidJobStateException.class);
        }
    }

    @Test
    @DisplayName("Running job is stale only after deadline plus grace")
    void staleness() {
        var job = Job.firstAttempt(trigger, JobSource.SCHEDULE, 3, T0, T0);
        job.markRunning("worker-1", T0, T0.plusSeconds(60));
        var grace = Duration.ofSeconds(30);

        assertThat(job.isStale(T0.plusSeconds(80), grace)).isFalse();
        assertThat(job.isStale(T0.plusSeconds(91), grace)).isTrue();
    }
}
