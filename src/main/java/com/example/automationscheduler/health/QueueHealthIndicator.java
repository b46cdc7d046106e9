package com.example.automationscheduler.health;

import com.example.automationscheduler.domain.enums.PlanTier;
import com.example.automationscheduler.domain.enums.QueueName;
import com.example.automationscheduler.queue.JobQueue;
import com.example.automationscheduler.queue.QueueException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports per-tier counts of both queues, DOWN when the queue backend is unreachable.
 */
@Component("queues")
@RequiredArgsConstructor
public class QueueHealthIndicator implements HealthIndicator {

    private final JobQueue jobQueue;

    @Override
    public Health health() {
        var builder = Health.up();
        for (var queue : QueueName.values()) {
            try {
                var stats = jobQueue.stats(queue);
                var tiers = new LinkedHashMap<String, Object>();
                for (var tier : PlanTier.values()) {
                    var tierStats = stats.forTier(tier);
                    tiers.put(tier.getCode(), Map.of(
                            "pending", tierStats.getPending(),
                            "inFlight", tierStats.getInFlight(),
                            "deadLettered", tierStats.getDeadLettered()));
                }
                builder.withDetail(queue.getCode(), tiers);
            } catch (QueueException e) {
                return Health.down()
                        .withDetail("queue", queue.getCode())
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
        return builder.build();
    }
}
