package com.example.automationscheduler.queue;

import lombok.Getter;

/**
 * Categorized queue failure.
 */
@Getter
public class QueueException extends RuntimeException {

    public enum Reason {
        /**
         * Store unreachable or the operation failed in the backend. Transient.
         */
        BACKEND_UNAVAILABLE,

        /**
         * A job for the same automation and cycle already exists.
         */
        DUPLICATE_JOB,

        JOB_NOT_FOUND
    }

    private final Reason reason;

    public QueueException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public QueueException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public boolean isDuplicate() {
        return reason == Reason.DUPLICATE_JOB;
    }

    public static QueueException unavailable(String operation, Throwable cause) {
        return new QueueException(Reason.BACKEND_UNAVAILABLE, "Queue backend unavailable during " + operation + ": " + cause.getMessage(), cause);
    }

    public static QueueException duplicate(String queue, String automationId, long cycle) {
        return new QueueException(Reason.DUPLICATE_JOB,
                String.format("Job already exists in %s for automation %s cycle %d", queue, automationId, cycle));
    }
}
