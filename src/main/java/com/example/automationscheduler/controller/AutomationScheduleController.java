package com.example.automationscheduler.controller;

import com.example.automationscheduler.dto.ApiResponse;
import com.example.automationscheduler.dto.JobExecutionLogResponse;
import com.example.automationscheduler.exception.RateLimitExceededException;
import com.example.automationscheduler.ratelimit.RateLimitPolicy;
import com.example.automationscheduler.ratelimit.RateLimiterService;
import com.example.automationscheduler.service.QueueAdminService;
import com.example.automationscheduler.service.scheduler.AutomationScheduleService;
import com.example.automationscheduler.service.scheduler.ScheduleResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Starts scheduler chains on demand and exposes an automation's execution history.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/automations")
@Tag(name = "Automation Scheduling", description = "Start and inspect automation scheduler chains")
public class AutomationScheduleController {

    static final String USER_HEADER = "X-User-Id";

    private final AutomationScheduleService automationScheduleService;
    private final QueueAdminService queueAdminService;
    private final RateLimiterService rateLimiterService;

    @PostMapping("/{automationId}/schedule")
    @Operation(summary = "Schedule automation", description = "Start the scheduler chain of an active automation. Idempotent.")
    public ResponseEntity<ApiResponse<ScheduleResult>> schedule(
            @Parameter(description = "Automation id") @PathVariable String automationId,
            @Parameter(description = "Calling user, used for rate limiting") @RequestHeader(USER_HEADER) String userId) {
        var decision = rateLimiterService.check(RateLimitPolicy.USER_ACTION, userId);
        if (decision.isDenied()) {
            throw new RateLimitExceededException(RateLimitPolicy.USER_ACTION.getCode(), decision);
        }

        log.info("API: Schedule automation {} requested by {}", automationId, userId);
        var result = automationScheduleService.scheduleAutomation(automationId);
        if (result.isAlreadyScheduled()) {
            return ResponseEntity.ok(ApiResponse.success(result, "Automation already scheduled"));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(result, "Scheduler chain started"));
    }

    @GetMapping("/{automationId}/executions")
    @Operation(summary = "Execution history", description = "Execution attempts of an automation, newest first")
    public ResponseEntity<ApiResponse<Page<JobExecutionLogResponse>>> getExecutions(
            @Parameter(description = "Automation id") @PathVariable String automationId,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(ApiResponse.success(queueAdminService.getAutomationExecutions(automationId, PageRequest.of(page, size))));
    }
}
