package com.example.taskorchestrator.service.queue;

import com.example.taskorchestrator.domain.entity.Job;
import com.example.taskorchestrator.domain.entity.Trigger;
import com.example.taskorchestrator.domain.enums.TriggerPriority;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Comparator;
import java.util.UUID;

/**
 * An item in the in-memory scheduling heap: either a due trigger firing, or a pending
 * job (retry, manual or event) whose start time has come.
 */
@Value
@Builder
public class QueueEntry {

    /**
     * Earliest due first, then higher priority, then trigger id, then kind so the order is total
     */
    public static final Comparator<QueueEntry> DUE_ORDER = Comparator
            .comparing(QueueEntry::getDueAt)
            .thenComparing(QueueEntry::getPriority, Comparator.reverseOrder())
            .thenComparing(QueueEntry::getTriggerId)
            .thenComparing(QueueEntry::key);

    public enum Kind {
        TRIGGER_FIRING,
        PENDING_JOB
    }

    Kind kind;

    UUID triggerId;

    /**
     * Set for {@link Kind#PENDING_JOB} only
     */
    UUID jobId;

    Instant dueAt;

    int priority;

    public static QueueEntry forTrigger(Trigger trigger) {
        return QueueEntry.builder()
                .kind(Kind.TRIGGER_FIRING)
                .triggerId(trigger.getId())
                .dueAt(trigger.getNextDueAt())
                .priority(trigger.getPriority() != null ? trigger.getPriority().getValue() : TriggerPriority.NORMAL.getValue())
                .build();
    }

    public static QueueEntry forJob(Job job) {
        var priority = job.getPriority() != null ? job.getPriority() : TriggerPriority.NORMAL;
        return QueueEntry.builder()
                .kind(Kind.PENDING_JOB)
                .triggerId(job.getTriggerId())
                .jobId(job.getId())
                .dueAt(job.getScheduledFor())
                .priority(priority.getValue())
                .build();
    }

    public boolean isTriggerFiring() {
        return kind == Kind.TRIGGER_FIRING;
    }

    /**
     * Identity used to avoid queueing the same work twice
     */
    public String key() {
        return isTriggerFiring() ? "trigger:" + triggerId : "job:" + jobId;
    }
}
