package com.example.automationscheduler.domain.entity;

import com.example.automationscheduler.domain.enums.AutomationType;
import com.example.automationscheduler.domain.enums.JobStatus;
import com.example.automationscheduler.domain.enums.PlanTier;
import com.example.automationscheduler.domain.enums.QueueName;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A job in either the scheduler queue or the execution queue.
 * <p>
 * Supports:
 * - Delayed delivery via {@code availableAt}
 * - Priority ordering with FIFO inside a tier via {@code enqueueSeq}
 * - Exclusive claims with a visibility timeout ({@code lockedBy}/{@code lockedUntil})
 * - Attempt accounting and exponential backoff
 * - One job per (queue, automation, cycle), which de-duplicates re-fired chain jobs
 */
@Entity
@Table(name = "queued_jobs",
        uniqueConstraints = @UniqueConstraint(name = "uq_job_queue_automation_cycle", columnNames = {"queue_name", "automation_id", "cycle"}),
        indexes = {
                @Index(name = "idx_job_claim", columnList = "queue_name, status, priority, enqueue_seq"),
                @Index(name = "idx_job_available_at", columnList = "available_at"),
                @Index(name = "idx_job_automation", columnList = "automation_id, queue_name, status"),
                @Index(name = "idx_job_locked_until", columnList = "status, locked_until")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class QueuedJob {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "queue_name", nullable = false, length = 30)
    private QueueName queueName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private JobStatus status;

    /**
     * Lower value is claimed first
     */
    @Column(name = "priority", nullable = false)
    private int priority;

    /**
     * Monotonic arrival number, reassigned on every re-enqueue
     */
    @Column(name = "enqueue_seq", nullable = false)
    private long enqueueSeq;

    @Column(name = "automation_id", nullable = false, length = 100)
    private String automationId;

    /**
     * Chain generation. A successor carries cycle + 1, its execution job the same cycle.
     */
    @Column(name = "cycle", nullable = false)
    private long cycle;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Column(name = "exchange_account_id", length = 100)
    private String exchangeAccountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "automation_type", length = 30)
    private AutomationType automationType;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_tier", nullable = false, length = 20)
    private PlanTier planTier;

    /**
     * Scheduler jobs only
     */
    @Column(name = "interval_minutes")
    private Integer intervalMinutes;

    /**
     * Automation config copied at enqueue time
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "config", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> config = new HashMap<>();

    /**
     * Execution jobs only: prices captured when the job was enqueued
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "market_snapshot", columnDefinition = "jsonb")
    private Map<String, Object> marketSnapshot;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "attempts_remaining", nullable = false)
    private int attemptsRemaining;

    @Column(name = "backoff_base_ms", nullable = false)
    private long backoffBaseMs;

    @Column(name = "backoff_multiplier", nullable = false)
    private double backoffMultiplier;

    /**
     * Not claimable before this instant
     */
    @Column(name = "available_at", nullable = false)
    private Instant availableAt;

    @Column(name = "enqueued_at", nullable = false)
    private Instant enqueuedAt;

    // === Claim Fields ===

    @Column(name = "locked_by", length = 100)
    private String lockedBy;

    @Column(name = "locked_until")
    private Instant lockedUntil;

    /**
     * Fresh on every claim, so a re-claim by the same worker invalidates the earlier holder
     */
    @Column(name = "claim_token")
    private UUID claimToken;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "claim_count", nullable = false)
    private int claimCount;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        if (this.id == null) {
            this.id = UUID.randomUUID();
        }
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
        if (this.status == null) {
            this.status = JobStatus.PENDING;
        }
        if (this.config == null) {
            this.config = new HashMap<>();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    /**
     * Attempts consumed so far by failures
     */
    public int getAttemptsUsed() {
        return maxAttempts - attemptsRemaining;
    }

    /**
     * Ready to be claimed at {@code now}: waiting and due, or claimed but stalled
     */
    public boolean isClaimableAt(Instant now) {
        if (status != null && status.isClaimable()) {
            return !availableAt.isAfter(now);
        }
        return status == JobStatus.PROCESSING && lockedUntil != null && lockedUntil.isBefore(now);
    }

    /**
     * Whether {@code claim} (a copy handed out by a claim) still holds the live claim on this job
     */
    public boolean isClaimedBy(QueuedJob claim) {
        return status == JobStatus.PROCESSING
                && claim.getLockedBy() != null && claim.getLockedBy().equals(lockedBy)
                && claim.getClaimToken() != null && claim.getClaimToken().equals(claimToken);
    }

    public void releaseClaim() {
        this.lockedBy = null;
        this.lockedUntil = null;
        this.claimToken = null;
    }
}
