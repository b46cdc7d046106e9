package com.example.automationscheduler.queue;

import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.domain.enums.JobStatus;
import com.example.automationscheduler.domain.enums.PlanTier;
import com.example.automationscheduler.domain.enums.QueueName;
import com.example.automationscheduler.domain.repository.QueuedJobRepository;
import com.example.automationscheduler.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.example.automationscheduler.support.TestJobs.executionJob;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DatabaseJobQueue Tests")
class DatabaseJobQueueTest {

    @Mock
    private QueuedJobRepository repository;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Captor
    private ArgumentCaptor<QueuedJob> jobCaptor;

    private MutableClock clock;
    private DatabaseJobQueue queue;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        queue = new DatabaseJobQueue(repository, new TransactionTemplate(transactionManager), clock, Duration.ofSeconds(120));
    }

    private static QueuedJob claimed(String workerId, int attemptsRemaining) {
        var job = executionJob("auto-1", PlanTier.PRO);
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.PROCESSING);
        job.setLockedBy(workerId);
        job.setClaimToken(UUID.randomUUID());
        job.setAttemptsRemaining(attemptsRemaining);
        return job;
    }

    @Nested
    @DisplayName("Enqueue")
    class EnqueueTests {

        @Test
        @DisplayName("Should stamp sequence, delay and a full attempt budget")
        void shouldStampNewJob() {
            // Given
            when(repository.existsByQueueNameAndAutomationIdAndCycle(QueueName.EXECUTION, "auto-1", 1)).thenReturn(false);
            when(repository.nextEnqueueSequence()).thenReturn(41L);
            when(repository.saveAndFlush(jobCaptor.capture())).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            var id = queue.enqueue(executionJob("auto-1", PlanTier.PRO), Duration.ofSeconds(30));

            // Then
            var saved = jobCaptor.getValue();
            assertThat(saved.getId()).isEqualTo(id);
            assertThat(saved.getStatus()).isEqualTo(JobStatus.PENDING);
            assertThat(saved.getEnqueueSeq()).isEqualTo(41L);
            assertThat(saved.getAvailableAt()).isEqualTo(clock.instant().plusSeconds(30));
            assertThat(saved.getAttemptsRemaining()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should report a duplicate cycle without writing")
        void shouldRejectExistingCycle() {
            when(repository.existsByQueueNameAndAutomationIdAndCycle(QueueName.EXECUTION, "auto-1", 1)).thenReturn(true);

            assertThatThrownBy(() -> queue.enqueue(executionJob("auto-1", PlanTier.PRO), Duration.ZERO))
                    .isInstanceOf(QueueException.class)
                    .matches(e -> ((QueueException) e).isDuplicate());
        }

        @Test
        @DisplayName("Should map a unique constraint race to a duplicate")
        void shouldMapConstraintViolation() {
            // Given
            when(repository.existsByQueueNameAndAutomationIdAndCycle(QueueName.EXECUTION, "auto-1", 1))
                    .thenReturn(false, true);
            when(repository.nextEnqueueSequence()).thenReturn(1L);
            when(repository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("uq_job_queue_automation_cycle"));

            // When / Then
            assertThatThrownBy(() -> queue.enqueue(executionJob("auto-1", PlanTier.PRO), Duration.ZERO))
                    .isInstanceOf(QueueException.class)
                    .matches(e -> ((QueueException) e).isDuplicate());
        }

        @Test
        @DisplayName("Should not report a duplicate when another constraint rejects the row")
        void shouldNotMistakeOtherViolationForDuplicate() {
            // Given
            when(repository.existsByQueueNameAndAutomationIdAndCycle(QueueName.EXECUTION, "auto-1", 1)).thenReturn(false);
            when(repository.nextEnqueueSequence()).thenReturn(1L);
            when(repository.saveAndFlush(any()))
                    .thenThrow(new DataIntegrityViolationException("null value in column \"owner_id\" violates not-null constraint"));

            // When / Then
            assertThatThrownBy(() -> queue.enqueue(executionJob("auto-1", PlanTier.PRO), Duration.ZERO))
                    .isInstanceOf(QueueException.class)
                    .matches(e -> !((QueueException) e).isDuplicate())
                    .extracting("reason").isEqualTo(QueueException.Reason.BACKEND_UNAVAILABLE);
        }

        @Test
        @DisplayName("Should surface storage errors as an unavailable backend")
        void shouldMapStorageError() {
            when(repository.existsByQueueNameAndAutomationIdAndCycle(any(), any(), anyLong()))
                    .thenThrow(new DataAccessResourceFailureException("connection refused"));

            assertThatThrownBy(() -> queue.enqueue(executionJob("auto-1", PlanTier.PRO), Duration.ZERO))
                    .isInstanceOf(QueueException.class)
                    .extracting("reason").isEqualTo(QueueException.Reason.BACKEND_UNAVAILABLE);
        }
    }

    @Nested
    @DisplayName("Claim and settle")
    class ClaimTests {

        @Test
        @DisplayName("Should lock claimed rows for the worker until the visibility timeout")
        void shouldClaimRows() {
            // Given
            var ready = executionJob("auto-1", PlanTier.PRO);
            ready.setStatus(JobStatus.PENDING);
            when(repository.findJobsForClaim("EXECUTION", clock.instant(), 5)).thenReturn(List.of(ready));
            when(repository.saveAll(any())).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            var claimed = queue.claim(QueueName.EXECUTION, "worker-1", 5);

            // Then
            assertThat(claimed).hasSize(1);
            assertThat(claimed.get(0).getStatus()).isEqualTo(JobStatus.PROCESSING);
            assertThat(claimed.get(0).getLockedBy()).isEqualTo("worker-1");
            assertThat(claimed.get(0).getLockedUntil()).isEqualTo(clock.instant().plusSeconds(120));
            assertThat(claimed.get(0).getClaimCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should schedule a retry with backoff from prior failures")
        void shouldScheduleRetry() {
            // Given
            var job = claimed("worker-1", 2);
            when(repository.findById(job.getId())).thenReturn(Optional.of(job));
            when(repository.nextEnqueueSequence()).thenReturn(99L);

            // When
            var result = queue.fail(job, "timeout", true);

            // Then
            assertThat(result.isRetryScheduled()).isTrue();
            assertThat(result.getRetryDelay()).isEqualTo(Duration.ofSeconds(4));
            assertThat(job.getStatus()).isEqualTo(JobStatus.RETRY_PENDING);
            assertThat(job.getAvailableAt()).isEqualTo(clock.instant().plusSeconds(4));
            assertThat(job.getLockedBy()).isNull();
        }

        @Test
        @DisplayName("Should dead-letter on the last attempt")
        void shouldDeadLetterLastAttempt() {
            var job = claimed("worker-1", 1);
            when(repository.findById(job.getId())).thenReturn(Optional.of(job));

            var result = queue.fail(job, "timeout", true);

            assertThat(result.isDeadLettered()).isTrue();
            assertThat(job.getStatus()).isEqualTo(JobStatus.DEAD_LETTER);
            assertThat(job.getFinishedAt()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("Should report a lost claim when another worker holds the job")
        void shouldDetectLostClaim() {
            var mine = claimed("worker-1", 3);
            var stored = claimed("worker-2", 3);
            stored.setId(mine.getId());
            when(repository.findById(mine.getId())).thenReturn(Optional.of(stored));

            assertThat(queue.fail(mine, "timeout", true).getDisposition()).isEqualTo(FailureResult.Disposition.CLAIM_LOST);
        }

        @Test
        @DisplayName("Should report a lost claim when the same worker re-claimed the job after it expired")
        void shouldDetectLostClaimFromSameWorker() {
            // Given
            var stale = claimed("worker-1", 3);
            var current = stale.toBuilder().claimToken(UUID.randomUUID()).build();
            when(repository.findById(stale.getId())).thenReturn(Optional.of(current));

            // When
            var result = queue.fail(stale, "timeout", true);

            // Then
            assertThat(result.getDisposition()).isEqualTo(FailureResult.Disposition.CLAIM_LOST);
            assertThat(current.getStatus()).isEqualTo(JobStatus.PROCESSING);
            assertThat(current.getAttemptsRemaining()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should issue a fresh claim token on every claim")
        void shouldIssueFreshClaimToken() {
            // Given
            var stalled = claimed("worker-1", 3);
            var previousToken = stalled.getClaimToken();
            when(repository.findJobsForClaim("EXECUTION", clock.instant(), 1)).thenReturn(List.of(stalled));
            when(repository.saveAll(any())).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            var reclaimed = queue.claim(QueueName.EXECUTION, "worker-1", 1);

            // Then
            assertThat(reclaimed.get(0).getClaimToken()).isNotNull().isNotEqualTo(previousToken);
        }

        @Test
        @DisplayName("Should report a lost claim on a concurrent modification")
        void shouldMapOptimisticLock() {
            var job = claimed("worker-1", 3);
            when(repository.findById(job.getId())).thenReturn(Optional.of(job));
            when(repository.nextEnqueueSequence()).thenReturn(7L);
            when(repository.saveAndFlush(any())).thenThrow(new ObjectOptimisticLockingFailureException(QueuedJob.class, job.getId()));

            assertThat(queue.fail(job, "timeout", true).getDisposition()).isEqualTo(FailureResult.Disposition.CLAIM_LOST);
        }

        @Test
        @DisplayName("Should ack only while the claim is held")
        void shouldAckWithClaimCheck() {
            var job = claimed("worker-1", 3);
            when(repository.finishClaimedJob(eq(job.getId()), eq("worker-1"), eq(job.getClaimToken()), eq(JobStatus.COMPLETED), isNull(), any()))
                    .thenReturn(1);

            assertThat(queue.ack(job)).isTrue();
        }

        @Test
        @DisplayName("Should defer without touching attempts")
        void shouldDefer() {
            var job = claimed("worker-1", 3);
            when(repository.nextEnqueueSequence()).thenReturn(12L);
            when(repository.deferClaimedJob(job.getId(), "worker-1", job.getClaimToken(), clock.instant().plusSeconds(30), 12L, clock.instant()))
                    .thenReturn(0);

            assertThat(queue.defer(job, Duration.ofSeconds(30))).isFalse();
        }
    }

    @Test
    @DisplayName("Should fold grouped counts into per-tier stats")
    void shouldBuildStats() {
        // Given
        when(repository.countByPriorityAndStatus(QueueName.EXECUTION)).thenReturn(List.of(
                new Object[]{1, JobStatus.PENDING, 3L},
                new Object[]{1, JobStatus.RETRY_PENDING, 2L},
                new Object[]{5, JobStatus.DEAD_LETTER, 1L}));

        // When
        var stats = queue.stats(QueueName.EXECUTION);

        // Then
        assertThat(stats.forTier(PlanTier.LIFETIME).getPending()).isEqualTo(5);
        assertThat(stats.forTier(PlanTier.FREE).getDeadLettered()).isEqualTo(1);
        assertThat(stats.totalPending()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should raise JOB_NOT_FOUND when requeueing a live job")
    void shouldRejectRequeueOfLiveJob() {
        var job = claimed("worker-1", 3);
        when(repository.findById(job.getId())).thenReturn(Optional.of(job));

        assertThatThrownBy(() -> queue.requeueDeadLetter(job.getId()))
                .isInstanceOf(QueueException.class)
                .extracting("reason").isEqualTo(QueueException.Reason.JOB_NOT_FOUND);
    }
}
