package com.example.taskorchestrator.service.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * In-memory min-heap of due work for this worker.
 * <p>
 * Never the source of truth: it is refilled from the store on every poll and rebuilt from
 * scratch on start, so losing it loses nothing. Entries are deduplicated by key while
 * queued and while in flight, which stops a trigger that is still executing from being
 * offered again by the next poll.
 */
@Slf4j
@Component
public class SchedulingQueue {

    private final PriorityQueue<QueueEntry> heap = new PriorityQueue<>(QueueEntry.DUE_ORDER);
    private final Set<String> queuedKeys = new HashSet<>();
    private final Set<String> inFlightKeys = new HashSet<>();

    /**
     * Add an entry unless the same work is already queued or executing
     *
     * @return true if the entry was added
     */
    public synchronized boolean offer(QueueEntry entry) {
        var key = entry.key();
        if (queuedKeys.contains(key) || inFlightKeys.contains(key)) {
            return false;
        }
        heap.add(entry);
        queuedKeys.add(key);
        return true;
    }

    /**
     * Pop the head if it is due at {@code now}. The entry stays in flight until {@link #complete}.
     */
    public synchronized Optional<QueueEntry> dequeueReady(Instant now) {
        var head = heap.peek();
        if (head == null || head.getDueAt().isAfter(now)) {
            return Optional.empty();
        }
        heap.poll();
        queuedKeys.remove(head.key());
        inFlightKeys.add(head.key());
        return Optional.of(head);
    }

    /**
     * Mark a dequeued entry as finished so its key can be offered again
     */
    public synchronized void complete(QueueEntry entry) {
        inFlightKeys.remove(entry.key());
    }

    /**
     * Put a dequeued entry back, e.g. when no executor thread accepted it
     */
    public synchronized void requeue(QueueEntry entry) {
        inFlightKeys.remove(entry.key());
        if (queuedKeys.add(entry.key())) {
            heap.add(entry);
        }
    }

    /**
     * Drop everything queued. In-flight entries are left to finish.
     */
    public synchronized void clear() {
        var dropped = heap.size();
        heap.clear();
        queuedKeys.clear();
        log.debug("Cleared {} queued entries", dropped);
    }

    public synchronized int size() {
        return heap.size();
    }

    public synchronized int inFlightCount() {
        return inFlightKeys.size();
    }

    public synchronized Optional<QueueEntry> peek() {
        return Optional.ofNullable(heap.peek());
    }
}
