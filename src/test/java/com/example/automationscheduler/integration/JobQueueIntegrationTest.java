package com.example.automationscheduler.integration;

import com.example.automationscheduler.TestcontainersConfiguration;
import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.domain.enums.JobStatus;
import com.example.automationscheduler.domain.enums.PlanTier;
import com.example.automationscheduler.domain.enums.QueueName;
import com.example.automationscheduler.domain.repository.JobExecutionLogRepository;
import com.example.automationscheduler.domain.repository.QueuedJobRepository;
import com.example.automationscheduler.queue.JobQueue;
import com.example.automationscheduler.queue.QueueException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.example.automationscheduler.support.TestJobs.executionJob;
import static com.example.automationscheduler.support.TestJobs.schedulerJob;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "spring.main.web-application-type=servlet",
                "automation-scheduler.queue.backend=database",
                "automation-scheduler.scheduler.poll-interval-ms=999999999",
                "automation-scheduler.scheduler.bootstrap-on-startup=false",
                "automation-scheduler.execution.poll-interval-ms=999999999",
                "automation-scheduler.queue.stale-check-interval-ms=999999999",
                "automation-scheduler.supervisor.enabled=false",
                "automation-scheduler.liveness.enabled=false",
                "automation-scheduler.rate-limits.store=memory",
                "slack.enabled=false"
        }
)
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Job Queue Integration Tests")
class JobQueueIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private QueuedJobRepository jobRepository;

    @Autowired
    private JobExecutionLogRepository executionLogRepository;

    @BeforeEach
    void setUp() {
        executionLogRepository.deleteAll();
        jobRepository.deleteAll();
    }

    @Nested
    @DisplayName("Claiming against PostgreSQL")
    class ClaimTests {

        @Test
        @DisplayName("Should claim by tier priority then arrival order")
        void shouldClaimInPriorityOrder() {
            // Given
            var freeFirst = jobQueue.enqueue(executionJob("auto-free-1", PlanTier.FREE), Duration.ZERO);
            var lifetime = jobQueue.enqueue(executionJob("auto-life", PlanTier.LIFETIME), Duration.ZERO);
            var freeSecond = jobQueue.enqueue(executionJob("auto-free-2", PlanTier.FREE), Duration.ZERO);
            var pro = jobQueue.enqueue(executionJob("auto-pro", PlanTier.PRO), Duration.ZERO);

            // When
            var claimed = jobQueue.claim(QueueName.EXECUTION, "worker-1", 10);

            // Then
            assertThat(claimed).extracting(QueuedJob::getId).containsExactly(lifetime, pro, freeFirst, freeSecond);
            assertThat(claimed).allMatch(job -> job.getStatus() == JobStatus.PROCESSING && "worker-1".equals(job.getLockedBy()));
        }

        @Test
        @DisplayName("Should hold back delayed jobs and keep queues apart")
        void shouldRespectDelayAndQueue() {
            // Given
            jobQueue.enqueue(executionJob("auto-later", PlanTier.PRO), Duration.ofMinutes(5));
            var scheduler = jobQueue.enqueue(schedulerJob("auto-chain", PlanTier.PRO, 1), Duration.ZERO);

            // When / Then
            assertThat(jobQueue.claim(QueueName.EXECUTION, "worker-1", 10)).isEmpty();
            assertThat(jobQueue.claim(QueueName.SCHEDULER, "worker-1", 10))
                    .extracting(QueuedJob::getId).containsExactly(scheduler);
        }

        @Test
        @DisplayName("Should never hand the same job to two concurrent workers")
        void shouldNotDoubleDeliver() throws Exception {
            // Given
            for (var i = 0; i < 60; i++) {
                jobQueue.enqueue(executionJob("auto-" + i, PlanTier.PRO), Duration.ZERO);
            }
            var seen = ConcurrentHashMap.<UUID>newKeySet();
            var deliveries = new AtomicInteger();
            var start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(6);

            // When
            for (var w = 0; w < 6; w++) {
                var workerId = "worker-" + w;
                pool.submit(() -> {
                    start.await();
                    List<QueuedJob> batch;
                    while (!(batch = jobQueue.claim(QueueName.EXECUTION, workerId, 4)).isEmpty()) {
                        for (var job : batch) {
                            deliveries.incrementAndGet();
                            seen.add(job.getId());
                            jobQueue.ack(job);
                        }
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(60, TimeUnit.SECONDS)).isTrue();

            // Then
            assertThat(deliveries.get()).isEqualTo(60);
            assertThat(seen).hasSize(60);
            assertThat(jobQueue.stats(QueueName.EXECUTION).forTier(PlanTier.PRO).getCompleted()).isEqualTo(60);
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureTests {

        @Test
        @DisplayName("Should reject a second job for the same automation cycle")
        void shouldRejectDuplicateCycle() {
            jobQueue.enqueue(executionJob("auto-1", PlanTier.PRO, 7), Duration.ZERO);

            assertThatThrownBy(() -> jobQueue.enqueue(executionJob("auto-1", PlanTier.PRO, 7), Duration.ZERO))
                    .isInstanceOf(QueueException.class)
                    .matches(e -> ((QueueException) e).isDuplicate());
        }

        @Test
        @DisplayName("Should schedule a backoff retry and then dead-letter on exhaustion")
        void shouldRetryThenDeadLetter() {
            // Given
            var id = jobQueue.enqueue(executionJob("auto-1", PlanTier.PRO), Duration.ZERO);
            var job = jobQueue.claim(QueueName.EXECUTION, "worker-1").orElseThrow();

            // When
            var first = jobQueue.fail(job, "exchange timeout", true);

            // Then
            assertThat(first.isRetryScheduled()).isTrue();
            assertThat(first.getRetryDelay()).isEqualTo(Duration.ofSeconds(2));
            var stored = jobRepository.findById(id).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(JobStatus.RETRY_PENDING);
            assertThat(stored.getAttemptsRemaining()).isEqualTo(2);
            assertThat(jobQueue.claim(QueueName.EXECUTION, "worker-1", 10)).isEmpty();

            // Given
            stored.setAttemptsRemaining(1);
            stored.setStatus(JobStatus.PROCESSING);
            stored.setLockedBy("worker-2");
            stored.setClaimToken(UUID.randomUUID());
            stored = jobRepository.save(stored);

            // When
            var last = jobQueue.fail(stored, "exchange timeout", true);

            // Then
            assertThat(last.isDeadLettered()).isTrue();
            assertThat(jobRepository.findById(id).orElseThrow().getStatus()).isEqualTo(JobStatus.DEAD_LETTER);
        }

        @Test
        @DisplayName("Should return a deferred job without consuming an attempt")
        void shouldDeferWithoutAttempt() {
            var id = jobQueue.enqueue(executionJob("auto-1", PlanTier.PRO), Duration.ZERO);
            var job = jobQueue.claim(QueueName.EXECUTION, "worker-1").orElseThrow();

            assertThat(jobQueue.defer(job, Duration.ofSeconds(30))).isTrue();

            var stored = jobRepository.findById(id).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(JobStatus.PENDING);
            assertThat(stored.getAttemptsRemaining()).isEqualTo(3);
            assertThat(stored.getLockedBy()).isNull();
        }

        @Test
        @DisplayName("Should reject settlement from an expired claim re-taken under the same worker id")
        void shouldRejectStaleClaimFromSameWorker() {
            // Given
            var id = jobQueue.enqueue(executionJob("auto-1", PlanTier.PRO), Duration.ZERO);
            var stale = jobQueue.claim(QueueName.EXECUTION, "worker-1").orElseThrow();
            var row = jobRepository.findById(id).orElseThrow();
            row.setLockedUntil(row.getLockedUntil().minusSeconds(600));
            jobRepository.save(row);
            var current = jobQueue.claim(QueueName.EXECUTION, "worker-1").orElseThrow();

            // When / Then
            assertThat(jobQueue.fail(stale, "timeout", true).isRetryScheduled()).isFalse();
            assertThat(jobQueue.ack(stale)).isFalse();
            assertThat(jobQueue.defer(stale, Duration.ofSeconds(5))).isFalse();
            assertThat(jobRepository.findById(id).orElseThrow().getAttemptsRemaining()).isEqualTo(3);
            assertThat(jobQueue.ack(current)).isTrue();
        }

        @Test
        @DisplayName("Should reject acknowledgements from a worker that no longer holds the claim")
        void shouldRejectStaleAck() {
            jobQueue.enqueue(executionJob("auto-1", PlanTier.PRO), Duration.ZERO);
            var job = jobQueue.claim(QueueName.EXECUTION, "worker-1").orElseThrow();
            job.setLockedBy("worker-9");

            assertThat(jobQueue.ack(job)).isFalse();
        }
    }

    @Nested
    @DisplayName("Queue administration API")
    class AdminApiTests {

        @Test
        @DisplayName("Should report per-tier counts")
        void shouldReportStats() throws Exception {
            jobQueue.enqueue(executionJob("auto-1", PlanTier.LIFETIME), Duration.ZERO);
            jobQueue.enqueue(executionJob("auto-2", PlanTier.LIFETIME), Duration.ZERO);
            jobQueue.enqueue(executionJob("auto-3", PlanTier.FREE), Duration.ZERO);

            mockMvc.perform(get("/api/v1/queues/automation-execution/stats"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.tiers.lifetime.pending").value(2))
                    .andExpect(jsonPath("$.data.tiers.free.pending").value(1));
        }

        @Test
        @DisplayName("Should list and requeue dead letters")
        void shouldRequeueDeadLetter() throws Exception {
            // Given
            var id = jobQueue.enqueue(executionJob("auto-1", PlanTier.PRO), Duration.ZERO);
            var job = jobQueue.claim(QueueName.EXECUTION, "worker-1").orElseThrow();
            jobQueue.fail(job, "invalid api key", false);

            // When / Then
            mockMvc.perform(get("/api/v1/queues/automation-execution/dead-letters"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.content", hasSize(1)))
                    .andExpect(jsonPath("$.data.content[0].lastError").value("invalid api key"));

            mockMvc.perform(post("/api/v1/queues/jobs/{jobId}/requeue", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.status").value("PENDING"))
                    .andExpect(jsonPath("$.data.attemptsRemaining").value(3));

            assertThat(jobQueue.claim(QueueName.EXECUTION, "worker-2")).isPresent();
        }

        @Test
        @DisplayName("Should return 404 for an unknown job")
        void shouldReturnNotFound() throws Exception {
            mockMvc.perform(get("/api/v1/queues/jobs/{jobId}", UUID.randomUUID()))
                    .andExpect(status().isNotFound());
        }
    }
}
