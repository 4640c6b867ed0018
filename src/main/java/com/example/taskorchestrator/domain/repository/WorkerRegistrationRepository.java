package com.example.taskorchestrator.domain.repository;

import com.example.taskorchestrator.domain.entity.WorkerRegistration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface WorkerRegistrationRepository extends JpaRepository<WorkerRegistration, String> {

    long countByLastHeartbeatAtAfter(Instant threshold);

    @Modifying
    @Transactional
    @Query("DELETE FROM WorkerRegistration w WHERE w.lastHeartbeatAt < :threshold")
    int deleteStale(@Param("threshold") Instant threshold);
}
