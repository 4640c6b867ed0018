package com.example.taskorchestrator.domain.repository;

import com.example.taskorchestrator.domain.entity.Job;
import com.example.taskorchestrator.domain.enums.JobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Job entity.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Execution history of a trigger, newest first
     */
    Page<Job> findByTriggerIdOrderByCreatedAtDescAttemptNumberDesc(UUID triggerId, Pageable pageable);

    List<Job> findByTriggerIdOrderByCreatedAtAscAttemptNumberAsc(UUID triggerId);

    /**
     * Retry, manual and event jobs whose start time has come
     */
    @Query("""
            SELECT j FROM Job j
            WHERE j.status = :status
              AND j.scheduledFor <= :now
            ORDER BY j.scheduledFor ASC
            """)
    List<Job> findByStatusScheduledBefore(@Param("status") JobStatus status,
                                          @Param("now") Instant now,
                                          Pageable pageable);

    /**
     * Running jobs whose deadline passed before {@code threshold}
     */
    @Query("""
            SELECT j FROM Job j
            WHERE j.status = :status
              AND j.deadlineAt < :threshold
            ORDER BY j.deadlineAt ASC
            """)
    List<Job> findByStatusDeadlineBefore(@Param("status") JobStatus status,
                                         @Param("threshold") Instant threshold);

    /**
     * Flag a running job for cancellation by whichever worker runs it.
     * Does not bump the version, so the running worker can still finalize the job.
     */
    @Modifying
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.cancelRequested = true
            WHERE j.id = :id
              AND j.status = :status
            """)
    int requestCancellation(@Param("id") UUID id, @Param("status") JobStatus status);

    @Query("SELECT j.cancelRequested FROM Job j WHERE j.id = :id")
    Optional<Boolean> findCancelRequested(@Param("id") UUID id);

    long countByStatus(JobStatus status);
}
