package com.example.automationscheduler.service.scheduler;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of starting a scheduler chain.
 */
@Value
public class ScheduleResult {

    String automationId;

    /**
     * Id of the first scheduler job, null when a chain already existed
     */
    UUID jobId;

    long cycle;

    boolean alreadyScheduled;

    public static ScheduleResult started(String automationId, UUID jobId, long cycle) {
        return new ScheduleResult(automationId, jobId, cycle, false);
    }

    public static ScheduleResult existing(String automationId) {
        return new ScheduleResult(automationId, null, 0, true);
    }
}
