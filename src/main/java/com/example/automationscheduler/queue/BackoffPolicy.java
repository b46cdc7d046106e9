package com.example.automationscheduler.queue;

import java.time.Duration;

/**
 * Exponential retry delay: {@code base * multiplier^priorFailures}.
 */
public final class BackoffPolicy {

    private BackoffPolicy() {
    }

    /**
     * @param baseMs        delay before the first retry
     * @param multiplier    growth factor per failure
     * @param priorFailures failures recorded before the current one (0 for the first failure)
     */
    public static Duration delayFor(long baseMs, double multiplier, int priorFailures) {
        if (priorFailures < 0) {
            throw new IllegalArgumentException("priorFailures must be >= 0");
        }
        var delayMs = baseMs * Math.pow(multiplier, priorFailures);
        return Duration.ofMillis(Math.round(Math.min(delayMs, Long.MAX_VALUE)));
    }
}
