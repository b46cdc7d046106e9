package com.example.automationscheduler.domain.model;

import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.domain.enums.PlanTier;
import lombok.Builder;
import lombok.Value;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One scheduling cycle of one automation. Each firing produces the successor {@link #next()}.
 */
@Value
@Builder(toBuilder = true)
public class SchedulerJob {

    /**
     * Queue id once enqueued, null before
     */
    UUID jobId;

    String automationId;

    /**
     * Chain generation, incremented per successor
     */
    long cycle;

    String ownerId;
    String exchangeAccountId;

    @Builder.Default
    Map<String, Object> config = Map.of();

    PlanTier planTier;
    int intervalMinutes;

    /**
     * The successor carrying the same automation data, one cycle later
     */
    public SchedulerJob next() {
        return toBuilder()
                .jobId(null)
                .cycle(cycle + 1)
                .build();
    }

    public long delaySeconds() {
        return intervalMinutes * 60L;
    }

    public static SchedulerJob fromQueuedJob(QueuedJob job) {
        var tier = job.getPlanTier() != null ? job.getPlanTier() : PlanTier.FREE;
        return SchedulerJob.builder()
                .jobId(job.getId())
                .automationId(job.getAutomationId())
                .cycle(job.getCycle())
                .ownerId(job.getOwnerId())
                .exchangeAccountId(job.getExchangeAccountId())
                .config(job.getConfig() != null ? new HashMap<>(job.getConfig()) : Map.of())
                .planTier(tier)
                .intervalMinutes(job.getIntervalMinutes() != null ? job.getIntervalMinutes() : tier.getDefaultIntervalMinutes())
                .build();
    }
}
