package com.example.automationscheduler.domain.repository;

import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.domain.enums.JobStatus;
import com.example.automationscheduler.domain.enums.QueueName;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for QueuedJob entity.
 * <p>
 * Uses PostgreSQL-specific features for distributed claiming:
 * - FOR UPDATE SKIP LOCKED so concurrent workers never pick the same row
 * - A sequence for strict FIFO order within a priority
 * - Claim-holder checks on every terminal update
 */
@Repository
public interface QueuedJobRepository extends JpaRepository<QueuedJob, UUID> {

    /**
     * Find jobs ready to be claimed, locking the returned rows for the current transaction.
     * <p>
     * Ready means waiting and due, or claimed but past its visibility timeout (stalled).
     * Orders by priority (ascending) then arrival.
     */
    @Query(value = """
            SELECT j.* FROM queued_jobs j
            WHERE j.queue_name = :queueName
              AND ((j.status IN ('PENDING', 'RETRY_PENDING') AND j.available_at <= :now)
                   OR (j.status = 'PROCESSING' AND j.locked_until < :now))
            ORDER BY j.priority ASC, j.enqueue_seq ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<QueuedJob> findJobsForClaim(@Param("queueName") String queueName, @Param("now") Instant now, @Param("limit") int limit);

    @Query(value = "SELECT nextval('queued_jobs_enqueue_seq')", nativeQuery = true)
    long nextEnqueueSequence();

    /**
     * Finish a claimed job. Only applies while {@code workerId} still holds the claim identified by {@code claimToken}.
     *
     * @return 1 if updated, 0 if the claim was lost
     */
    @Modifying
    @Query("""
            UPDATE QueuedJob j
            SET j.status = :status,
                j.lockedBy = NULL,
                j.lockedUntil = NULL,
                j.claimToken = NULL,
                j.lastError = :note,
                j.finishedAt = :now,
                j.updatedAt = :now
            WHERE j.id = :jobId
              AND j.lockedBy = :workerId
              AND j.claimToken = :claimToken
              AND j.status = com.example.automationscheduler.domain.enums.JobStatus.PROCESSING
            """)
    int finishClaimedJob(
            @Param("jobId") UUID jobId,
            @Param("workerId") String workerId,
            @Param("claimToken") UUID claimToken,
            @Param("status") JobStatus status,
            @Param("note") String note,
            @Param("now") Instant now);

    /**
     * Put a claimed job back to waiting without consuming an attempt.
     */
    @Modifying
    @Query("""
            UPDATE QueuedJob j
            SET j.status = com.example.automationscheduler.domain.enums.JobStatus.PENDING,
                j.lockedBy = NULL,
                j.lockedUntil = NULL,
                j.claimToken = NULL,
                j.availableAt = :availableAt,
                j.enqueueSeq = :enqueueSeq,
                j.enqueuedAt = :now,
                j.updatedAt = :now
            WHERE j.id = :jobId
              AND j.lockedBy = :workerId
              AND j.claimToken = :claimToken
              AND j.status = com.example.automationscheduler.domain.enums.JobStatus.PROCESSING
            """)
    int deferClaimedJob(
            @Param("jobId") UUID jobId,
            @Param("workerId") String workerId,
            @Param("claimToken") UUID claimToken,
            @Param("availableAt") Instant availableAt,
            @Param("enqueueSeq") long enqueueSeq,
            @Param("now") Instant now);

    /**
     * Find stalled claims (visibility timeout elapsed)
     */
    @Query("""
            SELECT j FROM QueuedJob j
            WHERE j.status = com.example.automationscheduler.domain.enums.JobStatus.PROCESSING
              AND j.lockedUntil < :now
            """)
    List<QueuedJob> findStalledJobs(@Param("now") Instant now);

    /**
     * Return stalled jobs to waiting. Attempts are left untouched: a crashed worker is not a failed attempt.
     */
    @Modifying
    @Query("""
            UPDATE QueuedJob j
            SET j.status = com.example.automationscheduler.domain.enums.JobStatus.PENDING,
                j.lockedBy = NULL,
                j.lockedUntil = NULL,
                j.claimToken = NULL,
                j.availableAt = :now,
                j.lastError = 'Claim visibility timeout elapsed (worker stalled or crashed)',
                j.updatedAt = :now
            WHERE j.id IN :jobIds
              AND j.status = com.example.automationscheduler.domain.enums.JobStatus.PROCESSING
              AND j.lockedUntil < :now
            """)
    int resetStalledJobs(@Param("jobIds") List<UUID> jobIds, @Param("now") Instant now);

    boolean existsByQueueNameAndAutomationIdAndCycle(QueueName queueName, String automationId, long cycle);

    /**
     * Whether the automation has a scheduler job that is still waiting or running
     */
    @Query("""
            SELECT COUNT(j) > 0 FROM QueuedJob j
            WHERE j.queueName = com.example.automationscheduler.domain.enums.QueueName.SCHEDULER
              AND j.automationId = :automationId
              AND j.status IN :liveStatuses
            """)
    boolean existsLiveSchedulerJob(@Param("automationId") String automationId, @Param("liveStatuses") Collection<JobStatus> liveStatuses);

    @Query("""
            SELECT COALESCE(MAX(j.cycle), 0) FROM QueuedJob j
            WHERE j.automationId = :automationId
            """)
    long findMaxCycle(@Param("automationId") String automationId);

    Page<QueuedJob> findByQueueNameAndStatus(QueueName queueName, JobStatus status, Pageable pageable);

    /**
     * Job counts grouped by priority and status for one queue
     */
    @Query("""
            SELECT j.priority, j.status, COUNT(j)
            FROM QueuedJob j
            WHERE j.queueName = :queueName
            GROUP BY j.priority, j.status
            """)
    List<Object[]> countByPriorityAndStatus(@Param("queueName") QueueName queueName);

    /**
     * Delete finished jobs older than the cutoff. Dead letters are kept until requeued or purged by hand.
     */
    @Modifying
    @Query("""
            DELETE FROM QueuedJob j
            WHERE j.status IN (com.example.automationscheduler.domain.enums.JobStatus.COMPLETED,
                               com.example.automationscheduler.domain.enums.JobStatus.SKIPPED)
              AND j.finishedAt < :cutoff
            """)
    int deleteFinishedJobs(@Param("cutoff") Instant cutoff);
}
