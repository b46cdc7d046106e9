package com.example.automationscheduler.service.scheduler;

import com.example.automationscheduler.client.AutomationRegistryClient;
import com.example.automationscheduler.client.MarketDataClient;
import com.example.automationscheduler.config.MetricsConfig;
import com.example.automationscheduler.domain.enums.AutomationType;
import com.example.automationscheduler.domain.model.MarketSnapshot;
import com.example.automationscheduler.domain.model.SchedulerJob;
import com.example.automationscheduler.exception.ChainBrokenException;
import com.example.automationscheduler.queue.JobQueue;
import com.example.automationscheduler.queue.QueueException;
import com.example.automationscheduler.service.alert.SlackAlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;

/**
 * Runs one firing of a self-rescheduling scheduler job.
 * <p>
 * A firing:
 * 1. Looks the automation up in the registry; missing, inactive or of an unsupported type ends the chain
 * 2. Captures a market snapshot, tolerating a partial or failed price read
 * 3. Enqueues the execution job at the plan tier's priority
 * 4. Enqueues its successor one interval later
 * <p>
 * Errors in steps 1-3 are logged and never stop step 4. Failing step 4 breaks the chain:
 * it is alerted and surfaced as {@link ChainBrokenException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecurringSchedulerService {

    static final String SYMBOLS_KEY = "symbols";

    private final AutomationRegistryClient registryClient;
    private final MarketDataClient marketDataClient;
    private final MarketFeedHeartbeat marketFeedHeartbeat;
    private final JobQueue jobQueue;
    private final JobFactory jobFactory;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public FireResult onSchedulerFire(SchedulerJob job) {
        var automationId = job.getAutomationId();
        log.debug("Scheduler job fired for automation {} (cycle {})", automationId, job.getCycle());

        UUID executionJobId = null;
        String cycleError = null;
        try {
            var record = registryClient.get(automationId);
            if (record.isEmpty() || !record.get().isActive()) {
                var reason = record.isEmpty() ? "not_found" : "inactive";
                log.info("Automation {} is {}, ending its scheduler chain at cycle {}", automationId, reason, job.getCycle());
                metricsConfig.recordChainTerminated(reason);
                return FireResult.terminated(automationId);
            }

            AutomationType type;
            try {
                type = AutomationType.fromRegistryCode(record.get().getType());
            } catch (IllegalArgumentException e) {
                log.error("Automation {} has unsupported type '{}', ending its scheduler chain at cycle {}",
                        automationId, record.get().getType(), job.getCycle());
                metricsConfig.recordChainTerminated("unsupported_type");
                return FireResult.terminated(automationId);
            }
            var snapshot = captureSnapshot(job, type);
            executionJobId = enqueueExecution(job, type, snapshot);
        } catch (RuntimeException e) {
            cycleError = e.getMessage();
            log.error("Cycle {} of automation {} produced no execution job: {}", job.getCycle(), automationId, e.getMessage());
        }

        var successorJobId = scheduleSuccessor(job);
        return FireResult.continued(automationId, executionJobId, successorJobId, cycleError);
    }

    /**
     * Prices for the automation's symbols. Never throws: a failed read yields an empty snapshot.
     */
    MarketSnapshot captureSnapshot(SchedulerJob job, AutomationType type) {
        var symbols = symbolsFor(job, type);
        var feedHealthy = marketFeedHeartbeat.isFeedHealthy();
        var now = clock.instant();

        try {
            var quoted = marketDataClient.getPrices(symbols);
            var prices = new LinkedHashMap<String, BigDecimal>();
            for (var symbol : symbols) {
                var price = quoted.get(symbol);
                if (price != null) {
                    prices.put(symbol, price);
                }
            }
            var missing = symbols.stream().filter(symbol -> !prices.containsKey(symbol)).toList();
            if (!missing.isEmpty()) {
                log.warn("Market data missing {} for automation {}, enqueueing partial snapshot", missing, job.getAutomationId());
            }
            return MarketSnapshot.builder()
                    .prices(prices)
                    .missingSymbols(missing)
                    .capturedAt(now)
                    .feedHealthy(feedHealthy)
                    .build();
        } catch (RuntimeException e) {
            log.warn("Market data unavailable for automation {}, enqueueing empty snapshot: {}", job.getAutomationId(), e.getMessage());
            return MarketSnapshot.empty(symbols, now, feedHealthy);
        }
    }

    private UUID enqueueExecution(SchedulerJob job, AutomationType type, MarketSnapshot snapshot) {
        try {
            var jobId = jobQueue.enqueue(jobFactory.executionJob(job, type, snapshot), Duration.ZERO);
            log.info("Enqueued {} execution job {} for automation {} (cycle {}, tier {})",
                    type, jobId, job.getAutomationId(), job.getCycle(), job.getPlanTier().getCode());
            return jobId;
        } catch (QueueException e) {
            if (e.isDuplicate()) {
                log.info("Execution job for automation {} cycle {} already enqueued", job.getAutomationId(), job.getCycle());
                return null;
            }
            throw e;
        }
    }

    private UUID scheduleSuccessor(SchedulerJob job) {
        var successor = job.next();
        try {
            var successorId = jobQueue.enqueue(jobFactory.schedulerJob(successor), Duration.ofSeconds(successor.delaySeconds()));
            log.debug("Scheduled cycle {} of automation {} in {}s", successor.getCycle(), job.getAutomationId(), successor.delaySeconds());
            return successorId;
        } catch (QueueException e) {
            if (e.isDuplicate()) {
                log.info("Successor cycle {} of automation {} already scheduled", successor.getCycle(), job.getAutomationId());
                return null;
            }
            throw chainBroken(job, e);
        } catch (RuntimeException e) {
            throw chainBroken(job, e);
        }
    }

    private ChainBrokenException chainBroken(SchedulerJob job, RuntimeException cause) {
        log.error("CHAIN BROKEN: could not schedule cycle {} of automation {}: {}",
                job.getCycle() + 1, job.getAutomationId(), cause.getMessage(), cause);
        metricsConfig.recordChainBroken();
        slackAlertService.sendChainBrokenAlert(job, cause);
        return new ChainBrokenException(job.getAutomationId(), job.getCycle(), cause);
    }

    private List<String> symbolsFor(SchedulerJob job, AutomationType type) {
        var configured = job.getConfig().get(SYMBOLS_KEY);
        if (configured instanceof List<?> list && !list.isEmpty()) {
            return list.stream().map(String::valueOf).toList();
        }
        return type.getDefaultSymbols();
    }
}
