package com.example.automationscheduler.ratelimit;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Named limiters sharing the fixed-window mechanism. Limits are defaults and can be
 * overridden per policy code under {@code automation-scheduler.rate-limits.policies}.
 */
@Getter
@RequiredArgsConstructor
public enum RateLimitPolicy {

    LOGIN("login", 5, 900, SubjectType.NETWORK_ADDRESS),
    REGISTRATION("registration", 3, 3600, SubjectType.NETWORK_ADDRESS),
    PASSWORD_RESET("password-reset", 3, 3600, SubjectType.NETWORK_ADDRESS),
    USER_ACTION("user-action", 100, 60, SubjectType.USER_ID),
    AUTOMATION_EXECUTION("automation-execution", 30, 60, SubjectType.USER_ID);

    /**
     * Action name used in counter keys and configuration
     */
    private final String code;
    private final int defaultLimit;
    private final long defaultWindowSeconds;
    private final SubjectType subjectType;
}
