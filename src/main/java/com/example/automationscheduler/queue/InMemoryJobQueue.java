package com.example.automationscheduler.queue;

import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.domain.enums.JobStatus;
import com.example.automationscheduler.domain.enums.QueueName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-process {@link JobQueue} holding jobs in memory.
 * <p>
 * Same ordering, visibility and retry rules as the database queue; state is lost on restart.
 * Callers always receive copies, so a job only changes through queue operations.
 */
@Slf4j
public class InMemoryJobQueue implements JobQueue {

    private static final Comparator<QueuedJob> CLAIM_ORDER = Comparator
            .comparingInt(QueuedJob::getPriority)
            .thenComparingLong(QueuedJob::getEnqueueSeq);

    private final Map<UUID, QueuedJob> jobs = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;
    private final Duration visibilityTimeout;

    public InMemoryJobQueue(Clock clock, Duration visibilityTimeout) {
        this.clock = clock;
        this.visibilityTimeout = visibilityTimeout;
    }

    @Override
    public synchronized UUID enqueue(QueuedJob job, Duration delay) {
        var duplicate = jobs.values().stream().anyMatch(existing -> existing.getQueueName() == job.getQueueName()
                && existing.getAutomationId().equals(job.getAutomationId())
                && existing.getCycle() == job.getCycle());
        if (duplicate) {
            throw QueueException.duplicate(job.getQueueName().getCode(), job.getAutomationId(), job.getCycle());
        }

        var now = clock.instant();
        var stored = job.toBuilder()
                .id(job.getId() != null ? job.getId() : UUID.randomUUID())
                .status(JobStatus.PENDING)
                .enqueueSeq(sequence.incrementAndGet())
                .enqueuedAt(now)
                .availableAt(now.plus(delay))
                .attemptsRemaining(job.getAttemptsRemaining() > 0 ? job.getAttemptsRemaining() : job.getMaxAttempts())
                .createdAt(now)
                .updatedAt(now)
                .build();
        jobs.put(stored.getId(), stored);

        log.debug("Enqueued job {} on {} (automation {}, cycle {}, priority {}, delay {})",
                stored.getId(), stored.getQueueName(), stored.getAutomationId(), stored.getCycle(), stored.getPriority(), delay);
        return stored.getId();
    }

    @Override
    public synchronized List<QueuedJob> claim(QueueName queue, String workerId, int limit) {
        var now = clock.instant();
        var ready = jobs.values().stream()
                .filter(job -> job.getQueueName() == queue)
                .filter(job -> job.isClaimableAt(now))
                .sorted(CLAIM_ORDER)
                .limit(limit)
                .toList();

        var claimed = new ArrayList<QueuedJob>(ready.size());
        for (var job : ready) {
            if (job.getStatus() == JobStatus.PROCESSING) {
                log.warn("Re-claiming stalled job {} previously held by {}", job.getId(), job.getLockedBy());
            }
            job.setStatus(JobStatus.PROCESSING);
            job.setLockedBy(workerId);
            job.setClaimToken(UUID.randomUUID());
            job.setLockedUntil(now.plus(visibilityTimeout));
            job.setClaimedAt(now);
            job.setClaimCount(job.getClaimCount() + 1);
            job.setUpdatedAt(now);
            claimed.add(copy(job));
        }
        return claimed;
    }

    @Override
    public synchronized boolean ack(QueuedJob job) {
        return finish(job, JobStatus.COMPLETED, null);
    }

    @Override
    public synchronized boolean skip(QueuedJob job, String reason) {
        return finish(job, JobStatus.SKIPPED, reason);
    }

    @Override
    public synchronized FailureResult fail(QueuedJob job, String error, boolean retryable) {
        var stored = jobs.get(job.getId());
        if (stored == null || !stored.isClaimedBy(job)) {
            log.warn("Cannot fail job {}: claim no longer held by {}", job.getId(), job.getLockedBy());
            return FailureResult.claimLost();
        }

        var now = clock.instant();
        var priorFailures = stored.getAttemptsUsed();
        stored.setAttemptsRemaining(Math.max(0, stored.getAttemptsRemaining() - 1));
        stored.setLastError(error);
        stored.releaseClaim();
        stored.setUpdatedAt(now);

        if (!retryable || stored.getAttemptsRemaining() == 0) {
            stored.setStatus(JobStatus.DEAD_LETTER);
            stored.setFinishedAt(now);
            return FailureResult.deadLettered();
        }

        var delay = BackoffPolicy.delayFor(stored.getBackoffBaseMs(), stored.getBackoffMultiplier(), priorFailures);
        stored.setStatus(JobStatus.RETRY_PENDING);
        stored.setAvailableAt(now.plus(delay));
        stored.setEnqueueSeq(sequence.incrementAndGet());
        stored.setEnqueuedAt(now);
        return FailureResult.retry(delay, stored.getAttemptsRemaining());
    }

    @Override
    public synchronized boolean defer(QueuedJob job, Duration delay) {
        var stored = jobs.get(job.getId());
        if (stored == null || !stored.isClaimedBy(job)) {
            return false;
        }
        var now = clock.instant();
        stored.setStatus(JobStatus.PENDING);
        stored.releaseClaim();
        stored.setAvailableAt(now.plus(delay));
        stored.setEnqueueSeq(sequence.incrementAndGet());
        stored.setEnqueuedAt(now);
        stored.setUpdatedAt(now);
        return true;
    }

    @Override
    public synchronized int recoverStalled() {
        var now = clock.instant();
        var recovered = 0;
        for (var job : jobs.values()) {
            if (job.getStatus() == JobStatus.PROCESSING && job.getLockedUntil() != null && job.getLockedUntil().isBefore(now)) {
                job.setStatus(JobStatus.PENDING);
                job.releaseClaim();
                job.setAvailableAt(now);
                job.setLastError("Claim visibility timeout elapsed (worker stalled or crashed)");
                job.setUpdatedAt(now);
                recovered++;
            }
        }
        return recovered;
    }

    @Override
    public synchronized boolean hasLiveChain(String automationId) {
        return jobs.values().stream().anyMatch(job -> job.getQueueName() == QueueName.SCHEDULER
                && job.getAutomationId().equals(automationId)
                && job.getStatus().isLive());
    }

    @Override
    public synchronized long nextCycle(String automationId) {
        return jobs.values().stream()
                .filter(job -> job.getAutomationId().equals(automationId))
                .mapToLong(QueuedJob::getCycle)
                .max()
                .orElse(0L) + 1;
    }

    @Override
    public synchronized Optional<QueuedJob> findJob(UUID jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(this::copy);
    }

    @Override
    public synchronized Page<QueuedJob> deadLetters(QueueName queue, Pageable pageable) {
        var all = jobs.values().stream()
                .filter(job -> job.getQueueName() == queue && job.getStatus() == JobStatus.DEAD_LETTER)
                .map(this::copy)
                .toList();
        if (pageable.isUnpaged()) {
            return new PageImpl<>(all);
        }
        var from = (int) Math.min(pageable.getOffset(), all.size());
        var to = Math.min(from + pageable.getPageSize(), all.size());
        return new PageImpl<>(all.subList(from, to), pageable, all.size());
    }

    @Override
    public synchronized QueuedJob requeueDeadLetter(UUID jobId) {
        var stored = jobs.get(jobId);
        if (stored == null || stored.getStatus() != JobStatus.DEAD_LETTER) {
            throw new QueueException(QueueException.Reason.JOB_NOT_FOUND, "No dead-lettered job with id " + jobId);
        }
        var now = clock.instant();
        stored.setStatus(JobStatus.PENDING);
        stored.setAttemptsRemaining(stored.getMaxAttempts());
        stored.setAvailableAt(now);
        stored.setEnqueueSeq(sequence.incrementAndGet());
        stored.setEnqueuedAt(now);
        stored.setFinishedAt(null);
        stored.setUpdatedAt(now);
        return copy(stored);
    }

    @Override
    public synchronized QueueStats stats(QueueName queue) {
        var builder = new QueueStats.Accumulator(queue);
        jobs.values().stream()
                .filter(job -> job.getQueueName() == queue)
                .forEach(job -> builder.add(job.getPriority(), job.getStatus(), 1));
        return builder.build();
    }

    @Override
    public synchronized int purgeFinished(Instant before) {
        var purged = 0;
        var iterator = jobs.values().iterator();
        while (iterator.hasNext()) {
            var job = iterator.next();
            if ((job.getStatus() == JobStatus.COMPLETED || job.getStatus() == JobStatus.SKIPPED)
                    && job.getFinishedAt() != null && job.getFinishedAt().isBefore(before)) {
                iterator.remove();
                purged++;
            }
        }
        return purged;
    }

    private boolean finish(QueuedJob job, JobStatus status, String note) {
        var stored = jobs.get(job.getId());
        if (stored == null || !stored.isClaimedBy(job)) {
            log.warn("Cannot mark job {} {}: claim no longer held by {}", job.getId(), status, job.getLockedBy());
            return false;
        }
        var now = clock.instant();
        stored.setStatus(status);
        stored.releaseClaim();
        stored.setLastError(note);
        stored.setFinishedAt(now);
        stored.setUpdatedAt(now);
        return true;
    }

    private QueuedJob copy(QueuedJob job) {
        return job.toBuilder().build();
    }
}
