package com.example.automationscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of a queued job.
 * <p>
 * PENDING/RETRY_PENDING jobs are claimable once their availability time passes.
 * PROCESSING jobs are hidden from other claimers until their visibility timeout elapses.
 */
@Getter
@RequiredArgsConstructor
public enum JobStatus {

    /**
     * Enqueued and waiting (possibly delayed) for a worker.
     */
    PENDING("pending", "Pending", true),

    /**
     * Claimed by exactly one worker.
     */
    PROCESSING("processing", "Processing", false),

    /**
     * Failed once or more and waiting out its backoff delay.
     */
    RETRY_PENDING("retry-pending", "Retry Pending", true),

    /**
     * Acked by the claiming worker.
     */
    COMPLETED("completed", "Completed", false),

    /**
     * Deliberately not executed (automation inactive, insufficient data).
     */
    SKIPPED("skipped", "Skipped", false),

    /**
     * Retry budget exhausted or failed permanently. Requires operator attention.
     */
    DEAD_LETTER("dead-letter", "Dead Letter", false);

    private final String code;
    private final String displayName;

    /**
     * Indicates if a job in this status may be handed to a worker
     */
    private final boolean claimable;

    public static JobStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status code: " + code);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED || this == DEAD_LETTER;
    }

    /**
     * Waiting or running, i.e. still part of a live chain
     */
    public boolean isLive() {
        return !isTerminal();
    }
}
