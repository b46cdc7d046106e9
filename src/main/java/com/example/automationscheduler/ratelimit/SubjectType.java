package com.example.automationscheduler.ratelimit;

/**
 * What a rate-limit counter is keyed by.
 */
public enum SubjectType {
    /**
     * Caller's network address, for unauthenticated actions
     */
    NETWORK_ADDRESS,

    /**
     * Authenticated user id
     */
    USER_ID
}
