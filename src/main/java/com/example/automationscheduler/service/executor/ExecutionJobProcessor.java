package com.example.automationscheduler.service.executor;

import com.example.automationscheduler.client.AutomationRegistryClient;
import com.example.automationscheduler.client.ClientModels.AutomationRecord;
import com.example.automationscheduler.config.MetricsConfig;
import com.example.automationscheduler.domain.entity.JobExecutionLog;
import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.domain.enums.ExecutionOutcome;
import com.example.automationscheduler.domain.enums.QueueName;
import com.example.automationscheduler.domain.model.ExecutionJob;
import com.example.automationscheduler.domain.repository.JobExecutionLogRepository;
import com.example.automationscheduler.queue.JobQueue;
import com.example.automationscheduler.queue.QueueException;
import com.example.automationscheduler.ratelimit.RateLimitPolicy;
import com.example.automationscheduler.ratelimit.RateLimiterService;
import com.example.automationscheduler.service.alert.SlackAlertService;
import com.example.automationscheduler.service.handler.AutomationExecutionResult;
import com.example.automationscheduler.service.handler.AutomationHandlerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Runs one claimed execution job and settles it in the queue.
 * <p>
 * Handles:
 * - Registry re-check (inactive automations are skipped)
 * - Per-owner rate limiting (denied jobs are deferred without using an attempt)
 * - Handler lookup, validation and invocation
 * - Ack / skip / fail with retry or dead-letter
 * - One execution log row per attempt
 * - Metrics and dead-letter alerts
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionJobProcessor {

    private final JobQueue jobQueue;
    private final AutomationRegistryClient registryClient;
    private final RateLimiterService rateLimiterService;
    private final AutomationHandlerRegistry handlerRegistry;
    private final JobExecutionLogRepository executionLogRepository;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final WorkerIdentity workerIdentity;
    private final Clock clock;

    public ExecutionOutcome process(QueuedJob queuedJob) {
        var job = ExecutionJob.fromQueuedJob(queuedJob);
        log.info("Starting execution job {} for automation {} (type {}, cycle {}, attempt {})",
                job.getJobId(), job.getAutomationId(), job.getAutomationType(), job.getCycle(), job.getAttemptNumber());

        var timerSample = metricsConfig.startExecutionTimer();
        var executionLog = JobExecutionLog.builder()
                .jobId(job.getJobId())
                .automationId(job.getAutomationId())
                .ownerId(job.getOwnerId())
                .attemptNumber(job.getAttemptNumber())
                .executorInstance(workerIdentity.getWorkerId())
                .startedAt(clock.instant())
                .build();

        ExecutionOutcome outcome;
        try {
            outcome = run(queuedJob, job, executionLog);
        } catch (QueueException e) {
            // the claim expires and the job is delivered again
            log.error("Could not settle execution job {} in the queue: {}", job.getJobId(), e.getMessage());
            executionLog.setErrorMessage(e.getMessage());
            executionLog.setErrorType(e.getClass().getSimpleName());
            outcome = ExecutionOutcome.FAILED;
        }

        executionLog.setOutcome(outcome);
        executionLog.setCompletedAt(clock.instant());
        executionLog.calculateDuration();
        saveLog(executionLog);
        metricsConfig.recordExecution(timerSample, job.getAutomationType(), outcome);
        return outcome;
    }

    private ExecutionOutcome run(QueuedJob queuedJob, ExecutionJob job, JobExecutionLog executionLog) {
        Optional<AutomationRecord> record;
        try {
            record = registryClient.get(job.getAutomationId());
        } catch (RuntimeException e) {
            log.warn("Registry check failed for execution job {}: {}", job.getJobId(), e.getMessage());
            return failed(queuedJob, executionLog, AutomationExecutionResult.failure(e));
        }
        if (record.isEmpty() || !record.get().isActive()) {
            return skipped(queuedJob, executionLog, "automation_inactive");
        }

        if (job.getOwnerId() != null) {
            var decision = rateLimiterService.check(RateLimitPolicy.AUTOMATION_EXECUTION, job.getOwnerId());
            if (decision.isDenied()) {
                var delay = Duration.ofSeconds(decision.getRetryAfterSeconds());
                log.info("Owner {} over execution rate limit, deferring job {} by {}s",
                        job.getOwnerId(), job.getJobId(), delay.getSeconds());
                if (!jobQueue.defer(queuedJob, delay)) {
                    log.warn("Claim on execution job {} lost before it could be deferred", job.getJobId());
                }
                executionLog.setNotes("deferred " + delay.getSeconds() + "s by rate limit");
                return ExecutionOutcome.RATE_LIMITED;
            }
        }

        var handler = handlerRegistry.getHandler(job.getAutomationType());
        if (handler.isEmpty()) {
            return skipped(queuedJob, executionLog, "no_handler:" + job.getAutomationType());
        }

        try {
            handler.get().validate(job);
        } catch (IllegalArgumentException e) {
            log.warn("Execution job {} failed validation: {}", job.getJobId(), e.getMessage());
            return skipped(queuedJob, executionLog, "validation_failed: " + e.getMessage());
        }

        AutomationExecutionResult result;
        try {
            result = handler.get().execute(job);
        } catch (RuntimeException e) {
            log.error("Unexpected error executing job {}: {}", job.getJobId(), e.getMessage(), e);
            result = AutomationExecutionResult.failure(e);
        }

        executionLog.setResultData(result.getResultData());
        if (result.isSuccess()) {
            if (!jobQueue.ack(queuedJob)) {
                log.warn("Claim on execution job {} lost before ack", job.getJobId());
            }
            log.info("Execution job {} for automation {} succeeded", job.getJobId(), job.getAutomationId());
            return ExecutionOutcome.SUCCEEDED;
        }
        if (result.isSkipped()) {
            return skipped(queuedJob, executionLog, result.getSkipReason());
        }
        return failed(queuedJob, executionLog, result);
    }

    private ExecutionOutcome skipped(QueuedJob queuedJob, JobExecutionLog executionLog, String reason) {
        log.info("Skipping execution job {} for automation {}: {}", queuedJob.getId(), queuedJob.getAutomationId(), reason);
        if (!jobQueue.skip(queuedJob, reason)) {
            log.warn("Claim on execution job {} lost before skip", queuedJob.getId());
        }
        executionLog.setNotes(reason);
        return ExecutionOutcome.SKIPPED;
    }

    private ExecutionOutcome failed(QueuedJob queuedJob, JobExecutionLog executionLog, AutomationExecutionResult result) {
        executionLog.setErrorMessage(result.getErrorMessage());
        executionLog.setErrorType(result.getErrorType());

        var failure = jobQueue.fail(queuedJob, result.getErrorMessage(), result.isRetryable());
        if (failure.isRetryScheduled()) {
            log.warn("Execution job {} failed ({}), retry in {}ms, {} attempts left",
                    queuedJob.getId(), result.getErrorMessage(), failure.getRetryDelay().toMillis(), failure.getAttemptsRemaining());
            metricsConfig.recordRetry(QueueName.EXECUTION, failure.getAttemptsRemaining());
            return ExecutionOutcome.RETRY_SCHEDULED;
        }
        if (failure.isDeadLettered()) {
            log.error("Execution job {} for automation {} dead-lettered: {}",
                    queuedJob.getId(), queuedJob.getAutomationId(), result.getErrorMessage());
            metricsConfig.recordDeadLetter(QueueName.EXECUTION);
            queuedJob.setLastError(result.getErrorMessage());
            slackAlertService.sendDeadLetterAlert(queuedJob);
            return ExecutionOutcome.DEAD_LETTERED;
        }

        log.warn("Claim on execution job {} lost before the failure was recorded", queuedJob.getId());
        executionLog.setNotes("claim lost");
        return ExecutionOutcome.FAILED;
    }

    private void saveLog(JobExecutionLog executionLog) {
        try {
            executionLogRepository.save(executionLog);
        } catch (DataAccessException e) {
            log.warn("Could not store execution log for job {}: {}", executionLog.getJobId(), e.getMessage());
        }
    }
}
