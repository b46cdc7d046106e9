package com.example.automationscheduler.domain.model;

import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.domain.enums.AutomationType;
import com.example.automationscheduler.domain.enums.PlanTier;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A single "run this automation now" unit of work with the data captured when it was enqueued.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionJob {

    UUID jobId;
    String automationId;
    long cycle;
    String ownerId;
    String exchangeAccountId;
    AutomationType automationType;

    @Builder.Default
    Map<String, Object> config = Map.of();

    PlanTier planTier;
    int priority;
    MarketSnapshot marketSnapshot;
    int attemptsRemaining;

    /**
     * 1-based number of the attempt being run
     */
    int attemptNumber;

    public static ExecutionJob fromQueuedJob(QueuedJob job) {
        return ExecutionJob.builder()
                .jobId(job.getId())
                .automationId(job.getAutomationId())
                .cycle(job.getCycle())
                .ownerId(job.getOwnerId())
                .exchangeAccountId(job.getExchangeAccountId())
                .automationType(job.getAutomationType())
                .config(job.getConfig() != null ? new HashMap<>(job.getConfig()) : Map.of())
                .planTier(job.getPlanTier())
                .priority(job.getPriority())
                .marketSnapshot(MarketSnapshot.fromMap(job.getMarketSnapshot()))
                .attemptsRemaining(job.getAttemptsRemaining())
                .attemptNumber(job.getAttemptsUsed() + 1)
                .build();
    }

    public String getConfigString(String key) {
        var value = config.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Numeric config value, accepting numbers and numeric strings
     */
    public BigDecimal getConfigDecimal(String key) {
        var value = config.get(key);
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public List<String> getConfigStringList(String key) {
        var value = config.get(key);
        if (value instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
