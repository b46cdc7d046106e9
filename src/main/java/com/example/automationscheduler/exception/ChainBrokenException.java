package com.example.automationscheduler.exception;

import lombok.Getter;

/**
 * The successor of a scheduler job could not be enqueued: the automation is no longer scheduled.
 */
@Getter
public class ChainBrokenException extends RuntimeException {

    private final String automationId;
    private final long cycle;

    public ChainBrokenException(String automationId, long cycle, Throwable cause) {
        super(String.format("Scheduler chain broken for automation %s at cycle %d: %s", automationId, cycle, cause.getMessage()), cause);
        this.automationId = automationId;
        this.cycle = cycle;
    }
}
