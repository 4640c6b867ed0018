package com.example.taskorchestrator.service.queue;

import com.example.taskorchestrator.domain.enums.TriggerPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SchedulingQueue Tests")
class SchedulingQueueTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private SchedulingQueue queue;

    @BeforeEach
    void setUp() {
        queue = new SchedulingQueue();
    }

    private static QueueEntry firing(UUID triggerId, Instant dueAt, TriggerPriority priority) {
        return QueueEntry.builder()
                .kind(QueueEntry.Kind.TRIGGER_FIRING)
                .triggerId(triggerId)
                .dueAt(dueAt)
                .priority(priority.getValue())
                .build();
    }

    private static QueueEntry pendingJob(UUID triggerId, Instant dueAt, TriggerPriority priority) {
        return QueueEntry.builder()
                .kind(QueueEntry.Kind.PENDING_JOB)
                .triggerId(triggerId)
                .jobId(UUID.randomUUID())
                .dueAt(dueAt)
                .priority(priority.getValue())
                .build();
    }

    @Nested
    @DisplayName("Ordering Tests")
    class OrderingTests {

        @Test
        @DisplayName("Entries leave the heap in due-time order")
        void dueTimeOrder() {
            var late = firing(UUID.randomUUID(), NOW.minusSeconds(1), TriggerPriority.CRITICAL);
            var early = firing(UUID.randomUUID(), NOW.minusSeconds(30), TriggerPriority.LOW);
            var middle = firing(UUID.randomUUID(), NOW.minusSeconds(10), TriggerPriority.NORMAL);
            queue.offer(late);
            queue.offer(early);
            queue.offer(middle);

            var order = new ArrayList<QueueEntry>();
            queue.dequeueReady(NOW).ifPresent(order::add);
            queue.dequeueReady(NOW).ifPresent(order::add);
            queue.dequeueReady(NOW).ifPresent(order::add);

            assertThat(order).containsExactly(early, middle, late);
        }

        @Test
        @DisplayName("Higher priority wins among equal due times")
        void priorityBreaksTies() {
            var normal = firing(UUID.randomUUID(), NOW, TriggerPriority.NORMAL);
            var manual = pendingJob(UUID.randomUUID(), NOW, TriggerPriority.CRITICAL);
            queue.offer(normal);
            queue.offer(manual);

            assertThat(queue.dequeueReady(NOW)).contains(manual);
            assertThat(queue.dequeueReady(NOW)).contains(normal);
        }

        @Test
        @DisplayName("Entries due in the future are not released")
        void futureEntriesStay() {
            queue.offer(firing(UUID.randomUUID(), NOW.plusSeconds(5), TriggerPriority.NORMAL));

            assertThat(queue.dequeueReady(NOW)).isEmpty();
            assertThat(queue.size()).isEqualTo(1);
            assertThat(queue.dequeueReady(NOW.plusSeconds(5))).isPresent();
        }
    }

    @Nested
    @DisplayName("Deduplication Tests")
    class DeduplicationTests {

        @Test
        @DisplayName("The same trigger is queued once")
        void duplicateTriggerRejected() {
            var triggerId = UUID.randomUUID();

            assertThat(queue.offer(firing(triggerId, NOW, TriggerPriority.NORMAL))).isTrue();
            assertThat(queue.offer(firing(triggerId, NOW, TriggerPriority.NORMAL))).isFalse();
            assertThat(queue.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("An in-flight trigger cannot be queued again until completed")
        void inFlightBlocksReoffer() {
            var triggerId = UUID.randomUUID();
            queue.offer(firing(triggerId, NOW, TriggerPriority.NORMAL));
            var running = queue.dequeueReady(NOW).orElseThrow();

            assertThat(queue.offer(firing(triggerId, NOW, TriggerPriority.NORMAL))).isFalse();
            assertThat(queue.inFlightCount()).isEqualTo(1);

            queue.complete(running);

            assertThat(queue.offer(firing(triggerId, NOW, TriggerPriority.NORMAL))).isTrue();
        }

        @Test
        @DisplayName("A trigger firing and a pending job of the same trigger are distinct work")
        void firingAndJobAreDistinct() {
            var triggerId = UUID.randomUUID();

            assertThat(queue.offer(firing(triggerId, NOW, TriggerPriority.NORMAL))).isTrue();
            assertThat(queue.offer(pendingJob(triggerId, NOW, TriggerPriority.NORMAL))).isTrue();
        }

        @Test
        @DisplayName("Requeued entry returns to the heap once")
        void requeue() {
            queue.offer(firing(UUID.randomUUID(), NOW, TriggerPriority.NORMAL));
            var entry = queue.dequeueReady(NOW).orElseThrow();

            queue.requeue(entry);
            queue.requeue(entry);

            assertThat(queue.size()).isEqualTo(1);
            assertThat(queue.inFlightCount()).isZero();
            assertThat(queue.peek()).contains(entry);
        }
    }

    @Test
    @DisplayName("Clear drops queued entries but keeps in-flight ones")
    void clearKeepsInFlight() {
        queue.offer(firing(UUID.randomUUID(), NOW, TriggerPriority.NORMAL));
        queue.offer(firing(UUID.randomUUID(), NOW, TriggerPriority.NORMAL));
        queue.dequeueReady(NOW);

        queue.clear();

        assertThat(queue.size()).isZero();
        assertThat(queue.inFlightCount()).isEqualTo(1);
    }
}
