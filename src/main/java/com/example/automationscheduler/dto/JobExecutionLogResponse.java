package com.example.automationscheduler.dto;

import com.example.automationscheduler.domain.enums.ExecutionOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for execution log
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobExecutionLogResponse {

    private UUID id;
    private UUID jobId;
    private String automationId;
    private Integer attemptNumber;
    private ExecutionOutcome outcome;
    private String executorInstance;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private String errorMessage;
    private String errorType;
    private Map<String, Object> resultData;
    private String notes;
}
