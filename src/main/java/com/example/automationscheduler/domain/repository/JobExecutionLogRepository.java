package com.example.automationscheduler.domain.repository;

import com.example.automationscheduler.domain.entity.JobExecutionLog;
import com.example.automationscheduler.domain.enums.ExecutionOutcome;
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
import java.util.UUID;

@Repository
public interface JobExecutionLogRepository extends JpaRepository<JobExecutionLog, UUID> {

    List<JobExecutionLog> findByJobIdOrderByStartedAtDesc(UUID jobId);

    Page<JobExecutionLog> findByAutomationIdOrderByStartedAtDesc(String automationId, Pageable pageable);

    long countByAutomationIdAndOutcome(String automationId, ExecutionOutcome outcome);

    @Modifying
    @Transactional
    @Query("DELETE FROM JobExecutionLog l WHERE l.startedAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
