package com.example.automationscheduler.health;

import com.example.automationscheduler.domain.enums.PlanTier;
import com.example.automationscheduler.domain.enums.QueueName;
import com.example.automationscheduler.queue.InMemoryJobQueue;
import com.example.automationscheduler.queue.JobQueue;
import com.example.automationscheduler.queue.QueueException;
import com.example.automationscheduler.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.Map;

import static com.example.automationscheduler.support.TestJobs.executionJob;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("QueueHealthIndicator Tests")
class QueueHealthIndicatorTest {

    @Test
    @DisplayName("Should report UP with per-tier counts for both queues")
    void shouldReportCounts() {
        // Given
        var queue = new InMemoryJobQueue(MutableClock.startingAt("2024-01-01T00:00:00Z"), Duration.ofSeconds(120));
        queue.enqueue(executionJob("auto-1", PlanTier.LIFETIME), Duration.ZERO);
        queue.enqueue(executionJob("auto-2", PlanTier.LIFETIME), Duration.ZERO);

        // When
        var health = new QueueHealthIndicator(queue).health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsKeys("automation-scheduler", "automation-execution");
        @SuppressWarnings("unchecked")
        var tiers = (Map<String, Map<String, Long>>) health.getDetails().get("automation-execution");
        assertThat(tiers.get("lifetime")).containsEntry("pending", 2L);
    }

    @Test
    @DisplayName("Should report DOWN when the queue backend is unreachable")
    void shouldReportDownOnOutage() {
        // Given
        var queue = mock(JobQueue.class);
        when(queue.stats(QueueName.SCHEDULER))
                .thenThrow(QueueException.unavailable("stats", new DataAccessResourceFailureException("connection refused")));

        // When
        var health = new QueueHealthIndicator(queue).health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("queue", "automation-scheduler");
    }
}
