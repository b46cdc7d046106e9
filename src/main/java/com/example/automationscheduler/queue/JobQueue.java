package com.example.automationscheduler.queue;

import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.domain.enums.QueueName;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable job queue with delayed delivery, priority ordering and at-least-once semantics.
 * <p>
 * Claims are exclusive for the configured visibility timeout. A claim that is neither
 * acked, skipped, deferred nor failed within that window becomes claimable again.
 * Terminal operations only apply while the caller still holds the claim; they return
 * {@code false} (or {@link FailureResult.Disposition#CLAIM_LOST}) otherwise.
 * <p>
 * Every operation raises {@link QueueException} on backend errors, never a raw storage exception.
 */
public interface JobQueue {

    /**
     * Enqueue a job, deliverable no earlier than {@code delay} from now.
     *
     * @return the job id
     * @throws QueueException with {@link QueueException.Reason#DUPLICATE_JOB} if the queue already
     *                        holds a job for the same automation and cycle
     */
    UUID enqueue(QueuedJob job, Duration delay);

    /**
     * Claim up to {@code limit} ready jobs: lowest priority value first, FIFO within a priority.
     */
    List<QueuedJob> claim(QueueName queue, String workerId, int limit);

    default Optional<QueuedJob> claim(QueueName queue, String workerId) {
        return claim(queue, workerId, 1).stream().findFirst();
    }

    /**
     * Mark a claimed job as succeeded.
     */
    boolean ack(QueuedJob job);

    /**
     * Mark a claimed job as deliberately not executed. Terminal, never retried.
     */
    boolean skip(QueuedJob job, String reason);

    /**
     * Record a failed attempt. Retries with exponential backoff while attempts remain,
     * otherwise (or when {@code retryable} is false) moves the job to the dead-letter view.
     */
    FailureResult fail(QueuedJob job, String error, boolean retryable);

    /**
     * Return a claimed job to waiting for {@code delay} without consuming an attempt.
     */
    boolean defer(QueuedJob job, Duration delay);

    /**
     * Release claims whose visibility timeout elapsed.
     *
     * @return number of jobs returned to waiting
     */
    int recoverStalled();

    /**
     * Whether a scheduler job for this automation is waiting or running
     */
    boolean hasLiveChain(String automationId);

    /**
     * Cycle number to use when starting a new chain for this automation
     */
    long nextCycle(String automationId);

    Optional<QueuedJob> findJob(UUID jobId);

    Page<QueuedJob> deadLetters(QueueName queue, Pageable pageable);

    /**
     * Move a dead-lettered job back to waiting with a fresh attempt budget.
     *
     * @throws QueueException with {@link QueueException.Reason#JOB_NOT_FOUND} if no dead letter has this id
     */
    QueuedJob requeueDeadLetter(UUID jobId);

    /**
     * Pending / in-flight / dead-lettered counts per plan tier
     */
    QueueStats stats(QueueName queue);

    /**
     * Delete succeeded and skipped jobs finished before the cutoff
     */
    int purgeFinished(Instant before);
}
