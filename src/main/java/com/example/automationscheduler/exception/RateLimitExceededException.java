package com.example.automationscheduler.exception;

import com.example.automationscheduler.ratelimit.RateLimitDecision;
import lombok.Getter;

/**
 * A rate-limited action was denied. Carries the seconds until the caller may try again.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

    private final String action;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String action, RateLimitDecision decision) {
        super(String.format("Rate limit exceeded for %s, try again in %d seconds", action, decision.getRetryAfterSeconds()));
        this.action = action;
        this.retryAfterSeconds = decision.getRetryAfterSeconds();
    }
}
