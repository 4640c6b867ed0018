package com.example.taskorchestrator.service.store;

import com.example.taskorchestrator.config.OrchestratorProperties;
import com.example.taskorchestrator.domain.entity.Trigger;
import com.example.taskorchestrator.domain.repository.TriggerRepository;
import com.example.taskorchestrator.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaTriggerStore implements TriggerStore {

    private final TriggerRepository triggerRepository;
    private final OrchestratorProperties properties;

    @Override
    public List<Trigger> listActiveTriggersDueBefore(Instant timestamp) {
        try {
            return triggerRepository.findActiveDueBefore(timestamp, PageRequest.of(0, properties.getPollBatchSize()));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("list due triggers", e);
        }
    }

    @Override
    public Optional<Trigger> findById(UUID triggerId) {
        try {
            return triggerRepository.findById(triggerId);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("find trigger " + triggerId, e);
        }
    }

    @Override
    public void updateTriggerScheduleState(UUID triggerId, Instant nextDue, Instant lastExecutedAt) {
        try {
            var updated = triggerRepository.updateScheduleState(triggerId, nextDue, lastExecutedAt);
            if (updated == 0) {
                log.warn("Trigger {} disappeared before its schedule state could be updated", triggerId);
            }
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("update schedule state " + triggerId, e);
        }
    }

    @Override
    public void updateLastExecutedAt(UUID triggerId, Instant lastExecutedAt) {
        try {
            triggerRepository.updateLastExecutedAt(triggerId, lastExecutedAt);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("update last execution " + triggerId, e);
        }
    }

    @Override
    public void recordExecutionOutcome(UUID triggerId, String outcome, boolean success, long durationMs) {
        try {
            triggerRepository.recordExecutionOutcome(triggerId, outcome, durationMs, success ? 1L : 0L, success ? 0L : 1L);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("record outcome " + triggerId, e);
        }
    }
}
