package com.example.taskorchestrator.service.store;

import com.example.taskorchestrator.domain.entity.Trigger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read path into trigger definitions plus the few schedule-state writes the engine owns.
 * Implementations throw {@link com.example.taskorchestrator.exception.StoreUnavailableException}
 * on I/O failure.
 */
public interface TriggerStore {

    List<Trigger> listActiveTriggersDueBefore(Instant timestamp);

    Optional<Trigger> findById(UUID triggerId);

    void updateTriggerScheduleState(UUID triggerId, Instant nextDue, Instant lastExecutedAt);

    /**
     * Record the start of an execution that does not move the schedule (manual, event, retry)
     */
    void updateLastExecutedAt(UUID triggerId, Instant lastExecutedAt);

    void recordExecutionOutcome(UUID triggerId, String outcome, boolean success, long durationMs);
}
