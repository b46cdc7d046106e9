package com.example.automationscheduler.domain.entity;

import com.example.automationscheduler.domain.enums.ExecutionOutcome;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of one attempt of an execution job, kept for later inspection.
 */
@Entity
@Table(name = "job_execution_logs", indexes = {
        @Index(name = "idx_exec_log_job_id", columnList = "job_id"),
        @Index(name = "idx_exec_log_automation", columnList = "automation_id, started_at"),
        @Index(name = "idx_exec_log_outcome", columnList = "outcome")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobExecutionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "automation_id", nullable = false, length = 100)
    private String automationId;

    @Column(name = "owner_id", length = 100)
    private String ownerId;

    @Column(name = "attempt_number", nullable = false)
    private Integer attemptNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 30)
    private ExecutionOutcome outcome;

    /**
     * Worker that ran this attempt
     */
    @Column(name = "executor_instance", length = 100)
    private String executorInstance;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "error_type", length = 200)
    private String errorType;

    /**
     * Actions taken by the handler (e.g. margin added per position)
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result_data", columnDefinition = "jsonb")
    private Map<String, Object> resultData;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }

    public void calculateDuration() {
        if (startedAt != null && completedAt != null) {
            this.durationMs = completedAt.toEpochMilli() - startedAt.toEpochMilli();
        }
    }
}
