package com.example.taskorchestrator.domain.repository;

import com.example.taskorchestrator.domain.entity.Trigger;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for Trigger entity.
 * <p>
 * The engine writes triggers only through the bulk updates below, which touch the
 * schedule state and statistics columns and nothing the CRUD layer owns.
 */
@Repository
public interface TriggerRepository extends JpaRepository<Trigger, UUID> {

    /**
     * Active triggers with a due time at or before {@code now}, earliest first.
     * Served by the (active, next_due_at) index.
     */
    @Query("""
            SELECT t FROM Trigger t
            WHERE t.active = true
              AND t.nextDueAt IS NOT NULL
              AND t.nextDueAt <= :now
            ORDER BY t.nextDueAt ASC
            """)
    List<Trigger> findActiveDueBefore(@Param("now") Instant now, Pageable pageable);

    @Modifying
    @Transactional
    @Query("""
            UPDATE Trigger t
            SET t.nextDueAt = :nextDue,
                t.lastExecutedAt = :lastExecutedAt
            WHERE t.id = :id
            """)
    int updateScheduleState(@Param("id") UUID id,
                            @Param("nextDue") Instant nextDue,
                            @Param("lastExecutedAt") Instant lastExecutedAt);

    @Modifying
    @Transactional
    @Query("UPDATE Trigger t SET t.lastExecutedAt = :lastExecutedAt WHERE t.id = :id")
    int updateLastExecutedAt(@Param("id") UUID id, @Param("lastExecutedAt") Instant lastExecutedAt);

    /**
     * Record one finished execution. The running average is computed from the
     * pre-update counters, which SQL evaluates before assigning any column.
     */
    @Modifying
    @Transactional
    @Query("""
            UPDATE Trigger t
            SET t.lastOutcome = :outcome,
                t.averageExecutionMs = ((t.averageExecutionMs * t.totalExecutions) + :durationMs) / (t.totalExecutions + 1),
                t.totalExecutions = t.totalExecutions + 1,
                t.successfulExecutions = t.successfulExecutions + :successIncrement,
                t.failedExecutions = t.failedExecutions + :failureIncrement
            WHERE t.id = :id
            """)
    int recordExecutionOutcome(@Param("id") UUID id,
                               @Param("outcome") String outcome,
                               @Param("durationMs") double durationMs,
                               @Param("successIncrement") long successIncrement,
                               @Param("failureIncrement") long failureIncrement);

    long countByActiveTrue();
}
