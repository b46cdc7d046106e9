package com.example.automationscheduler.domain.enums;

/**
 * Result recorded for a single attempt of an execution job.
 */
public enum ExecutionOutcome {
    SUCCEEDED,
    SKIPPED,
    RATE_LIMITED,
    RETRY_SCHEDULED,
    DEAD_LETTERED,
    FAILED;

    public boolean isSuccess() {
        return this == SUCCEEDED;
    }
}
