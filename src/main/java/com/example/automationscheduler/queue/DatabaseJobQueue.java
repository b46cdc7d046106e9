package com.example.automationscheduler.queue;

import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.domain.enums.JobStatus;
import com.example.automationscheduler.domain.enums.QueueName;
import com.example.automationscheduler.domain.repository.QueuedJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link JobQueue} backed by the {@code queued_jobs} table.
 * <p>
 * Claims use {@code FOR UPDATE SKIP LOCKED} so any number of instances can poll concurrently.
 * Each operation runs in its own transaction; storage errors, including those raised at
 * commit, surface as {@link QueueException}.
 */
@Slf4j
public class DatabaseJobQueue implements JobQueue {

    private static final EnumSet<JobStatus> LIVE_STATUSES = EnumSet.of(JobStatus.PENDING, JobStatus.RETRY_PENDING, JobStatus.PROCESSING);

    private final QueuedJobRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration visibilityTimeout;

    public DatabaseJobQueue(QueuedJobRepository repository, TransactionTemplate transactionTemplate, Clock clock, Duration visibilityTimeout) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.visibilityTimeout = visibilityTimeout;
    }

    @Override
    public UUID enqueue(QueuedJob job, Duration delay) {
        try {
            return inTransaction("enqueue", () -> {
                if (repository.existsByQueueNameAndAutomationIdAndCycle(job.getQueueName(), job.getAutomationId(), job.getCycle())) {
                    throw QueueException.duplicate(job.getQueueName().getCode(), job.getAutomationId(), job.getCycle());
                }

                var now = clock.instant();
                var toSave = job.toBuilder()
                        .id(job.getId() != null ? job.getId() : UUID.randomUUID())
                        .status(JobStatus.PENDING)
                        .enqueueSeq(repository.nextEnqueueSequence())
                        .enqueuedAt(now)
                        .availableAt(now.plus(delay))
                        .attemptsRemaining(job.getAttemptsRemaining() > 0 ? job.getAttemptsRemaining() : job.getMaxAttempts())
                        .createdAt(now)
                        .updatedAt(now)
                        .version(null)
                        .build();

                var saved = repository.saveAndFlush(toSave);
                log.debug("Enqueued job {} on {} (automation {}, cycle {}, priority {}, delay {})",
                        saved.getId(), saved.getQueueName(), saved.getAutomationId(), saved.getCycle(), saved.getPriority(), delay);
                return saved.getId();
            });
        } catch (QueueException e) {
            if (e.getCause() instanceof DataIntegrityViolationException && cycleExists(job)) {
                // lost the race against a concurrent enqueue of the same cycle
                throw QueueException.duplicate(job.getQueueName().getCode(), job.getAutomationId(), job.getCycle());
            }
            if (e.getCause() instanceof DataIntegrityViolationException) {
                log.error("Rejected job for automation {} (cycle {}) on {}: {}",
                        job.getAutomationId(), job.getCycle(), job.getQueueName(), e.getCause().getMessage());
            }
            throw e;
        }
    }

    /**
     * Whether the cycle is really taken. Other integrity violations, such as a missing required column, are not duplicates.
     */
    private boolean cycleExists(QueuedJob job) {
        return inTransaction("enqueue", () ->
                repository.existsByQueueNameAndAutomationIdAndCycle(job.getQueueName(), job.getAutomationId(), job.getCycle()));
    }

    @Override
    public List<QueuedJob> claim(QueueName queue, String workerId, int limit) {
        return inTransaction("claim", () -> {
            var now = clock.instant();
            var ready = repository.findJobsForClaim(queue.name(), now, limit);
            if (ready.isEmpty()) {
                return List.<QueuedJob>of();
            }

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
            }
            return repository.saveAll(ready);
        });
    }

    @Override
    public boolean ack(QueuedJob job) {
        return finish(job, JobStatus.COMPLETED, null);
    }

    @Override
    public boolean skip(QueuedJob job, String reason) {
        return finish(job, JobStatus.SKIPPED, reason);
    }

    @Override
    public FailureResult fail(QueuedJob job, String error, boolean retryable) {
        try {
            return inTransaction("fail", () -> {
                var stored = repository.findById(job.getId()).orElse(null);
                if (stored == null || !stored.isClaimedBy(job)) {
                    log.warn("Cannot fail job {}: claim no longer held by {}", job.getId(), job.getLockedBy());
                    return FailureResult.claimLost();
                }

                var now = clock.instant();
                var priorFailures = stored.getAttemptsUsed();
                stored.setAttemptsRemaining(Math.max(0, stored.getAttemptsRemaining() - 1));
                stored.setLastError(error);
                stored.releaseClaim();

                if (!retryable || stored.getAttemptsRemaining() == 0) {
                    stored.setStatus(JobStatus.DEAD_LETTER);
                    stored.setFinishedAt(now);
                    repository.saveAndFlush(stored);
                    return FailureResult.deadLettered();
                }

                var delay = BackoffPolicy.delayFor(stored.getBackoffBaseMs(), stored.getBackoffMultiplier(), priorFailures);
                stored.setStatus(JobStatus.RETRY_PENDING);
                stored.setAvailableAt(now.plus(delay));
                stored.setEnqueueSeq(repository.nextEnqueueSequence());
                stored.setEnqueuedAt(now);
                repository.saveAndFlush(stored);
                return FailureResult.retry(delay, stored.getAttemptsRemaining());
            });
        } catch (QueueException e) {
            if (e.getCause() instanceof OptimisticLockingFailureException) {
                log.warn("Job {} was modified concurrently while recording failure, claim lost", job.getId());
                return FailureResult.claimLost();
            }
            throw e;
        }
    }

    @Override
    public boolean defer(QueuedJob job, Duration delay) {
        return inTransaction("defer", () -> {
            var now = clock.instant();
            var updated = repository.deferClaimedJob(job.getId(), job.getLockedBy(), job.getClaimToken(), now.plus(delay), repository.nextEnqueueSequence(), now);
            if (updated == 0) {
                log.warn("Cannot defer job {}: claim no longer held by {}", job.getId(), job.getLockedBy());
            }
            return updated == 1;
        });
    }

    @Override
    public int recoverStalled() {
        return inTransaction("recoverStalled", () -> {
            var now = clock.instant();
            var stalled = repository.findStalledJobs(now);
            if (stalled.isEmpty()) {
                return 0;
            }
            var ids = stalled.stream().map(QueuedJob::getId).toList();
            return repository.resetStalledJobs(ids, now);
        });
    }

    @Override
    public boolean hasLiveChain(String automationId) {
        return inTransaction("hasLiveChain", () -> repository.existsLiveSchedulerJob(automationId, LIVE_STATUSES));
    }

    @Override
    public long nextCycle(String automationId) {
        return inTransaction("nextCycle", () -> repository.findMaxCycle(automationId) + 1);
    }

    @Override
    public Optional<QueuedJob> findJob(UUID jobId) {
        return inTransaction("findJob", () -> repository.findById(jobId));
    }

    @Override
    public Page<QueuedJob> deadLetters(QueueName queue, Pageable pageable) {
        return inTransaction("deadLetters", () -> repository.findByQueueNameAndStatus(queue, JobStatus.DEAD_LETTER, pageable));
    }

    @Override
    public QueuedJob requeueDeadLetter(UUID jobId) {
        return inTransaction("requeueDeadLetter", () -> {
            var stored = repository.findById(jobId)
                    .filter(job -> job.getStatus() == JobStatus.DEAD_LETTER)
                    .orElseThrow(() -> new QueueException(QueueException.Reason.JOB_NOT_FOUND, "No dead-lettered job with id " + jobId));

            var now = clock.instant();
            stored.setStatus(JobStatus.PENDING);
            stored.setAttemptsRemaining(stored.getMaxAttempts());
            stored.setAvailableAt(now);
            stored.setEnqueueSeq(repository.nextEnqueueSequence());
            stored.setEnqueuedAt(now);
            stored.setFinishedAt(null);
            return repository.save(stored);
        });
    }

    @Override
    public QueueStats stats(QueueName queue) {
        return inTransaction("stats", () -> {
            var builder = new QueueStats.Accumulator(queue);
            for (var row : repository.countByPriorityAndStatus(queue)) {
                builder.add(((Number) row[0]).intValue(), (JobStatus) row[1], ((Number) row[2]).longValue());
            }
            return builder.build();
        });
    }

    @Override
    public int purgeFinished(Instant before) {
        return inTransaction("purgeFinished", () -> repository.deleteFinishedJobs(before));
    }

    private boolean finish(QueuedJob job, JobStatus status, String note) {
        return inTransaction("finish", () -> {
            var updated = repository.finishClaimedJob(job.getId(), job.getLockedBy(), job.getClaimToken(), status, note, clock.instant());
            if (updated == 0) {
                log.warn("Cannot mark job {} {}: claim no longer held by {}", job.getId(), status, job.getLockedBy());
            }
            return updated == 1;
        });
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (QueueException e) {
            throw e;
        } catch (DataAccessException | TransactionException e) {
            throw QueueException.unavailable(operation, e);
        }
    }
}
