package com.example.automationscheduler.service.scheduler;

import com.example.automationscheduler.client.AutomationRegistryClient;
import com.example.automationscheduler.client.ClientModels.AutomationRecord;
import com.example.automationscheduler.config.AutomationSchedulerProperties;
import com.example.automationscheduler.domain.enums.AutomationType;
import com.example.automationscheduler.domain.enums.PlanTier;
import com.example.automationscheduler.domain.model.SchedulerJob;
import com.example.automationscheduler.exception.AutomationNotFoundException;
import com.example.automationscheduler.queue.JobQueue;
import com.example.automationscheduler.queue.QueueException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Starts scheduler chains: on demand for one automation, and for every active automation
 * that has none (startup bootstrap and periodic supervision).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutomationScheduleService {

    private final AutomationRegistryClient registryClient;
    private final JobQueue jobQueue;
    private final JobFactory jobFactory;
    private final AutomationSchedulerProperties properties;

    /**
     * Start the chain for one automation. Idempotent: an existing live chain is left alone.
     *
     * @throws AutomationNotFoundException if the registry has no active automation with this id
     * @throws IllegalArgumentException if the automation has an unsupported type
     */
    public ScheduleResult scheduleAutomation(String automationId) {
        var record = registryClient.get(automationId)
                .filter(AutomationRecord::isActive)
                .orElseThrow(() -> new AutomationNotFoundException(automationId));
        return startChain(record);
    }

    ScheduleResult startChain(AutomationRecord record) {
        var automationId = record.getId();
        if (jobQueue.hasLiveChain(automationId)) {
            log.debug("Automation {} already has a live scheduler chain", automationId);
            return ScheduleResult.existing(automationId);
        }

        // fails fast on a type no handler will ever run
        AutomationType.fromRegistryCode(record.getType());

        var first = toSchedulerJob(record, jobQueue.nextCycle(automationId));
        try {
            var jobId = jobQueue.enqueue(jobFactory.schedulerJob(first), Duration.ZERO);
            log.info("Started scheduler chain for automation {} at cycle {} (tier {}, every {} min)",
                    automationId, first.getCycle(), first.getPlanTier().getCode(), first.getIntervalMinutes());
            return ScheduleResult.started(automationId, jobId, first.getCycle());
        } catch (QueueException e) {
            if (e.isDuplicate()) {
                log.info("Scheduler chain for automation {} was started concurrently", automationId);
                return ScheduleResult.existing(automationId);
            }
            throw e;
        }
    }

    /**
     * Start chains for all active automations that have none.
     *
     * @return number of chains started
     */
    public int scheduleAllActiveAutomations() {
        var records = registryClient.listActive();
        var started = 0;
        var failed = 0;

        for (var record : records) {
            try {
                if (!startChain(record).isAlreadyScheduled()) {
                    started++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Could not start scheduler chain for automation {}: {}", record.getId(), e.getMessage());
            }
        }

        if (started > 0 || failed > 0) {
            log.info("Chain scan over {} active automations: {} started, {} failed", records.size(), started, failed);
        }
        return started;
    }

    @EventListener(ApplicationReadyEvent.class)
    @SchedulerLock(name = "bootstrapSchedulerChains", lockAtMostFor = "5m", lockAtLeastFor = "30s")
    public void bootstrapOnStartup() {
        if (!properties.getScheduler().isBootstrapOnStartup()) {
            return;
        }
        try {
            var started = scheduleAllActiveAutomations();
            log.info("Startup bootstrap started {} scheduler chains", started);
        } catch (RuntimeException e) {
            log.error("Startup bootstrap of scheduler chains failed, supervision will retry: {}", e.getMessage());
        }
    }

    static SchedulerJob toSchedulerJob(AutomationRecord record, long cycle) {
        var tier = PlanTier.fromCodeOrFree(record.getPlanTier());
        var interval = record.getIntervalMinutes() != null && record.getIntervalMinutes() > 0
                ? record.getIntervalMinutes()
                : tier.getDefaultIntervalMinutes();
        Map<String, Object> config = record.getConfig() != null ? new HashMap<>(record.getConfig()) : Map.of();
        return SchedulerJob.builder()
                .automationId(record.getId())
                .cycle(cycle)
                .ownerId(record.getOwnerId())
                .exchangeAccountId(record.getExchangeAccountId())
                .config(config)
                .planTier(tier)
                .intervalMinutes(interval)
                .build();
    }
}
