package com.example.automationscheduler.ratelimit;

import lombok.Value;

/**
 * Outcome of a rate-limit check: Allowed, or Denied with the seconds until the window resets.
 */
@Value
public class RateLimitDecision {

    boolean allowed;
    long count;
    int limit;

    /**
     * Remaining window time when denied, 0 when allowed
     */
    long retryAfterSeconds;

    /**
     * Allowed without consulting the store because it was unreachable
     */
    boolean degraded;

    public static RateLimitDecision allowed(long count, int limit) {
        return new RateLimitDecision(true, count, limit, 0, false);
    }

    public static RateLimitDecision denied(long count, int limit, long retryAfterSeconds) {
        return new RateLimitDecision(false, count, limit, retryAfterSeconds, false);
    }

    public static RateLimitDecision failOpen(int limit) {
        return new RateLimitDecision(true, 0, limit, 0, true);
    }

    public boolean isDenied() {
        return !allowed;
    }

    public long getRemaining() {
        return Math.max(0, limit - count);
    }
}
