package com.example.automationscheduler.service.scheduler;

import lombok.Value;

import java.util.UUID;

/**
 * What one scheduler firing produced.
 */
@Value
public class FireResult {

    public enum Outcome {
        /**
         * Successor scheduled (or already present from an earlier delivery of the same firing)
         */
        CONTINUED,

        /**
         * Automation missing or inactive: no successor
         */
        TERMINATED
    }

    String automationId;
    Outcome outcome;

    /**
     * Null when no execution job was created in this delivery
     */
    UUID executionJobId;

    /**
     * Null when terminated or the successor already existed
     */
    UUID successorJobId;

    /**
     * Why the execution step failed, null if it did not
     */
    String cycleError;

    public static FireResult terminated(String automationId) {
        return new FireResult(automationId, Outcome.TERMINATED, null, null, null);
    }

    public static FireResult continued(String automationId, UUID executionJobId, UUID successorJobId, String cycleError) {
        return new FireResult(automationId, Outcome.CONTINUED, executionJobId, successorJobId, cycleError);
    }

    public boolean isTerminated() {
        return outcome == Outcome.TERMINATED;
    }
}
