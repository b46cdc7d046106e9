package com.example.automationscheduler.dto;

import com.example.automationscheduler.domain.enums.AutomationType;
import com.example.automationscheduler.domain.enums.JobStatus;
import com.example.automationscheduler.domain.enums.PlanTier;
import com.example.automationscheduler.domain.enums.QueueName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for a queued job. Config and market snapshot are left out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueuedJobResponse {

    private UUID id;
    private QueueName queueName;
    private JobStatus status;
    private int priority;
    private PlanTier planTier;
    private String automationId;
    private long cycle;
    private String ownerId;
    private AutomationType automationType;
    private Integer intervalMinutes;
    private int maxAttempts;
    private int attemptsRemaining;
    private int claimCount;
    private String lockedBy;
    private Instant lockedUntil;
    private Instant availableAt;
    private Instant enqueuedAt;
    private String lastError;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant finishedAt;
}
