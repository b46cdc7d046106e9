package com.example.automationscheduler.config;

import com.example.automationscheduler.domain.enums.AutomationType;
import com.example.automationscheduler.domain.enums.ExecutionOutcome;
import com.example.automationscheduler.domain.enums.PlanTier;
import com.example.automationscheduler.domain.enums.QueueName;
import com.example.automationscheduler.queue.JobQueue;
import com.example.automationscheduler.queue.QueueException;
import com.example.automationscheduler.queue.QueueStats;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for queue depth, execution outcomes and scheduler chain health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Jobs per queue, plan tier and state (pending, in_flight, dead_lettered)
 * - Execution time and outcomes
 * - Retries, dead letters and broken chains
 * - Rate limiter denials and degraded-mode decisions
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private static final String[] STATES = {"pending", "in_flight", "dead_lettered"};

    private final MeterRegistry meterRegistry;
    private final JobQueue jobQueue;

    private final ConcurrentHashMap<String, AtomicLong> queueGauges = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var queue : QueueName.values()) {
            for (var tier : PlanTier.values()) {
                for (var state : STATES) {
                    var value = queueGauges.computeIfAbsent(gaugeKey(queue, tier, state), key -> new AtomicLong(0));
                    Gauge.builder("automation_queue_jobs", value, AtomicLong::get)
                            .tag("queue", queue.getCode())
                            .tag("tier", tier.getCode())
                            .tag("state", state)
                            .description("Number of queued jobs by queue, plan tier and state")
                            .register(meterRegistry);
                }
            }
        }
    }

    /**
     * Periodically refresh queue gauges from the queue backend
     */
    @Scheduled(fixedDelayString = "${automation-scheduler.metrics-update-interval-ms:30000}")
    public void updateMetrics() {
        for (var queue : QueueName.values()) {
            try {
                record(jobQueue.stats(queue));
            } catch (QueueException e) {
                log.warn("Could not refresh metrics for queue {}: {}", queue, e.getMessage());
            }
        }
    }

    void record(QueueStats stats) {
        for (var tier : PlanTier.values()) {
            var tierStats = stats.forTier(tier);
            queueGauges.get(gaugeKey(stats.getQueue(), tier, "pending")).set(tierStats.getPending());
            queueGauges.get(gaugeKey(stats.getQueue(), tier, "in_flight")).set(tierStats.getInFlight());
            queueGauges.get(gaugeKey(stats.getQueue(), tier, "dead_lettered")).set(tierStats.getDeadLettered());
        }
    }

    public Timer.Sample startExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordExecution(Timer.Sample sample, AutomationType type, ExecutionOutcome outcome) {
        var typeTag = type != null ? type.getCode() : "unknown";
        sample.stop(Timer.builder("automation_execution_time")
                .tag("type", typeTag)
                .tag("outcome", outcome.name().toLowerCase())
                .description("Automation execution time")
                .register(meterRegistry));
        meterRegistry.counter("automation_executions", "type", typeTag, "outcome", outcome.name().toLowerCase()).increment();
    }

    public void recordRetry(QueueName queue, int attemptsRemaining) {
        meterRegistry.counter("automation_queue_retries",
                "queue", queue.getCode(),
                "attempts_remaining", String.valueOf(attemptsRemaining)
        ).increment();
    }

    public void recordDeadLetter(QueueName queue) {
        meterRegistry.counter("automation_queue_dead_letters", "queue", queue.getCode()).increment();
    }

    public void recordChainTerminated(String reason) {
        meterRegistry.counter("automation_chain_terminations", "reason", reason).increment();
    }

    public void recordChainBroken() {
        meterRegistry.counter("automation_chain_broken").increment();
    }

    public void recordRateLimitDenied(String policy) {
        meterRegistry.counter("automation_rate_limit_denied", "policy", policy).increment();
    }

    public void recordRateLimiterDegraded(String policy) {
        meterRegistry.counter("automation_rate_limiter_degraded", "policy", policy).increment();
    }

    private static String gaugeKey(QueueName queue, PlanTier tier, String state) {
        return queue.name() + ":" + tier.name() + ":" + state;
    }
}
