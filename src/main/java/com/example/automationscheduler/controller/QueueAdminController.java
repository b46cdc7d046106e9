package com.example.automationscheduler.controller;

import com.example.automationscheduler.domain.enums.QueueName;
import com.example.automationscheduler.dto.ApiResponse;
import com.example.automationscheduler.dto.JobExecutionLogResponse;
import com.example.automationscheduler.dto.QueueStatsResponse;
import com.example.automationscheduler.dto.QueuedJobResponse;
import com.example.automationscheduler.service.QueueAdminService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Operational endpoints for the scheduler and execution queues.
 * <p>
 * Provides endpoints for:
 * - Per-tier queue counts
 * - Browsing and requeueing dead letters
 * - Attempt history of a job
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/queues")
@Tag(name = "Queue Operations", description = "Inspect queues and recover dead-lettered jobs")
public class QueueAdminController {

    private final QueueAdminService queueAdminService;

    @GetMapping("/{queue}/stats")
    @Operation(summary = "Queue counts", description = "Pending, in-flight and dead-lettered jobs per plan tier")
    public ResponseEntity<ApiResponse<QueueStatsResponse>> getStats(
            @Parameter(description = "Queue code, e.g. automation-execution") @PathVariable String queue) {
        return ResponseEntity.ok(ApiResponse.success(queueAdminService.getStats(QueueName.fromCode(queue))));
    }

    @GetMapping("/{queue}/dead-letters")
    @Operation(summary = "List dead letters", description = "Jobs that exhausted their attempts or failed permanently")
    public ResponseEntity<ApiResponse<Page<QueuedJobResponse>>> getDeadLetters(
            @Parameter(description = "Queue code") @PathVariable String queue,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {
        var pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "finishedAt"));
        return ResponseEntity.ok(ApiResponse.success(queueAdminService.getDeadLetters(QueueName.fromCode(queue), pageable)));
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Get job", description = "Retrieve a queued job by id")
    public ResponseEntity<ApiResponse<QueuedJobResponse>> getJob(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        return ResponseEntity.ok(ApiResponse.success(queueAdminService.getJob(jobId)));
    }

    @PostMapping("/jobs/{jobId}/requeue")
    @Operation(summary = "Requeue dead letter", description = "Return a dead-lettered job to the queue with a fresh attempt budget")
    public ResponseEntity<ApiResponse<QueuedJobResponse>> requeue(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        log.info("API: Requeue dead-lettered job {}", jobId);
        return ResponseEntity.ok(ApiResponse.success(queueAdminService.requeue(jobId), "Job requeued"));
    }

    @GetMapping("/jobs/{jobId}/executions")
    @Operation(summary = "Attempt history", description = "Execution log rows for a job, newest first")
    public ResponseEntity<ApiResponse<List<JobExecutionLogResponse>>> getExecutions(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        return ResponseEntity.ok(ApiResponse.success(queueAdminService.getExecutions(jobId)));
    }
}
