package com.example.automationscheduler.queue;

import lombok.Value;

import java.time.Duration;

/**
 * What {@link JobQueue#fail} did with a failed job.
 */
@Value
public class FailureResult {

    public enum Disposition {
        RETRY_SCHEDULED,
        DEAD_LETTERED,
        CLAIM_LOST
    }

    Disposition disposition;

    /**
     * Backoff before the retry, null unless a retry was scheduled
     */
    Duration retryDelay;

    int attemptsRemaining;

    public static FailureResult retry(Duration delay, int attemptsRemaining) {
        return new FailureResult(Disposition.RETRY_SCHEDULED, delay, attemptsRemaining);
    }

    public static FailureResult deadLettered() {
        return new FailureResult(Disposition.DEAD_LETTERED, null, 0);
    }

    public static FailureResult claimLost() {
        return new FailureResult(Disposition.CLAIM_LOST, null, -1);
    }

    public boolean isDeadLettered() {
        return disposition == Disposition.DEAD_LETTERED;
    }

    public boolean isRetryScheduled() {
        return disposition == Disposition.RETRY_SCHEDULED;
    }
}
