package com.example.automationscheduler.service;

import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.domain.enums.JobStatus;
import com.example.automationscheduler.domain.enums.PlanTier;
import com.example.automationscheduler.domain.enums.QueueName;
import com.example.automationscheduler.domain.repository.JobExecutionLogRepository;
import com.example.automationscheduler.dto.QueuedJobResponse;
import com.example.automationscheduler.exception.JobNotFoundException;
import com.example.automationscheduler.mapper.QueueJobMapper;
import com.example.automationscheduler.queue.JobQueue;
import com.example.automationscheduler.queue.QueueException;
import com.example.automationscheduler.queue.QueueStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;
import java.util.UUID;

import static com.example.automationscheduler.support.TestJobs.executionJob;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueueAdminService Tests")
class QueueAdminServiceTest {

    @Mock
    private JobQueue jobQueue;

    @Mock
    private JobExecutionLogRepository executionLogRepository;

    @Mock
    private QueueJobMapper mapper;

    @InjectMocks
    private QueueAdminService queueAdminService;

    private UUID jobId;
    private QueuedJob job;
    private QueuedJobResponse response;

    @BeforeEach
    void setUp() {
        jobId = UUID.randomUUID();
        job = executionJob("auto-1", PlanTier.PRO);
        job.setId(jobId);
        response = QueuedJobResponse.builder().id(jobId).status(JobStatus.PENDING).build();
    }

    @Test
    @DisplayName("Should expose per-tier stats keyed by tier code")
    void shouldMapStats() {
        // Given
        when(jobQueue.stats(QueueName.EXECUTION)).thenReturn(new QueueStats.Accumulator(QueueName.EXECUTION)
                .add(PlanTier.ADVANCED.getPriority(), JobStatus.PENDING, 4)
                .add(PlanTier.ADVANCED.getPriority(), JobStatus.PROCESSING, 1)
                .build());

        // When
        var stats = queueAdminService.getStats(QueueName.EXECUTION);

        // Then
        assertThat(stats.getTiers().get("advanced").getPending()).isEqualTo(4);
        assertThat(stats.getTiers().get("advanced").getInFlight()).isEqualTo(1);
    }

    @Nested
    @DisplayName("Job lookup")
    class JobLookupTests {

        @Test
        @DisplayName("Should return mapped job")
        void shouldReturnJob() {
            when(jobQueue.findJob(jobId)).thenReturn(Optional.of(job));
            when(mapper.toResponse(job)).thenReturn(response);

            assertThat(queueAdminService.getJob(jobId)).isSameAs(response);
        }

        @Test
        @DisplayName("Should throw when the job does not exist")
        void shouldThrowWhenMissing() {
            when(jobQueue.findJob(jobId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> queueAdminService.getJob(jobId)).isInstanceOf(JobNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Requeue")
    class RequeueTests {

        @Test
        @DisplayName("Should requeue a dead letter")
        void shouldRequeue() {
            when(jobQueue.requeueDeadLetter(jobId)).thenReturn(job);
            when(mapper.toResponse(any(QueuedJob.class))).thenReturn(response);

            assertThat(queueAdminService.requeue(jobId).getStatus()).isEqualTo(JobStatus.PENDING);
        }

        @Test
        @DisplayName("Should translate a missing dead letter into not found")
        void shouldTranslateMissing() {
            when(jobQueue.requeueDeadLetter(jobId))
                    .thenThrow(new QueueException(QueueException.Reason.JOB_NOT_FOUND, "No dead-lettered job"));

            assertThatThrownBy(() -> queueAdminService.requeue(jobId)).isInstanceOf(JobNotFoundException.class);
        }

        @Test
        @DisplayName("Should propagate backend outages")
        void shouldPropagateOutage() {
            when(jobQueue.requeueDeadLetter(jobId))
                    .thenThrow(QueueException.unavailable("requeueDeadLetter", new DataAccessResourceFailureException("down")));

            assertThatThrownBy(() -> queueAdminService.requeue(jobId))
                    .isInstanceOf(QueueException.class)
                    .extracting("reason").isEqualTo(QueueException.Reason.BACKEND_UNAVAILABLE);
        }
    }
}
