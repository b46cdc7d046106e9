package com.example.automationscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The two logical queues sharing the job store.
 */
@Getter
@RequiredArgsConstructor
public enum QueueName {

    /**
     * Delayed queue carrying one scheduler job per automation chain.
     */
    SCHEDULER("automation-scheduler"),

    /**
     * Priority queue carrying one-shot execution jobs.
     */
    EXECUTION("automation-execution");

    private final String code;

    public static QueueName fromCode(String code) {
        for (var queue : values()) {
            if (queue.getCode().equalsIgnoreCase(code) || queue.name().equalsIgnoreCase(code)) {
                return queue;
            }
        }
        throw new IllegalArgumentException("Unknown queue: " + code);
    }
}
