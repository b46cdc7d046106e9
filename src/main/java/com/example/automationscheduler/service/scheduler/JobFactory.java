package com.example.automationscheduler.service.scheduler;

import com.example.automationscheduler.config.AutomationSchedulerProperties;
import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.domain.enums.AutomationType;
import com.example.automationscheduler.domain.enums.QueueName;
import com.example.automationscheduler.domain.model.MarketSnapshot;
import com.example.automationscheduler.domain.model.SchedulerJob;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;

/**
 * Builds queue rows for scheduler and execution jobs with the configured retry policy.
 */
@Component
@RequiredArgsConstructor
public class JobFactory {

    private final AutomationSchedulerProperties properties;

    public QueuedJob schedulerJob(SchedulerJob job) {
        var execution = properties.getExecution();
        var maxAttempts = properties.getScheduler().getMaxAttempts();
        return QueuedJob.builder()
                .queueName(QueueName.SCHEDULER)
                .priority(job.getPlanTier().getPriority())
                .automationId(job.getAutomationId())
                .cycle(job.getCycle())
                .ownerId(job.getOwnerId())
                .exchangeAccountId(job.getExchangeAccountId())
                .planTier(job.getPlanTier())
                .intervalMinutes(job.getIntervalMinutes())
                .config(new HashMap<>(job.getConfig()))
                .maxAttempts(maxAttempts)
                .attemptsRemaining(maxAttempts)
                .backoffBaseMs(execution.getBackoffBaseMs())
                .backoffMultiplier(execution.getBackoffMultiplier())
                .build();
    }

    /**
     * Execution job for one firing: priority from the plan tier, same cycle as the firing scheduler job
     */
    public QueuedJob executionJob(SchedulerJob job, AutomationType type, MarketSnapshot snapshot) {
        var execution = properties.getExecution();
        return QueuedJob.builder()
                .queueName(QueueName.EXECUTION)
                .priority(job.getPlanTier().getPriority())
                .automationId(job.getAutomationId())
                .cycle(job.getCycle())
                .ownerId(job.getOwnerId())
                .exchangeAccountId(job.getExchangeAccountId())
                .automationType(type)
                .planTier(job.getPlanTier())
                .config(new HashMap<>(job.getConfig()))
                .marketSnapshot(snapshot.toMap())
                .maxAttempts(execution.getMaxAttempts())
                .attemptsRemaining(execution.getMaxAttempts())
                .backoffBaseMs(execution.getBackoffBaseMs())
                .backoffMultiplier(execution.getBackoffMultiplier())
                .build();
    }
}
