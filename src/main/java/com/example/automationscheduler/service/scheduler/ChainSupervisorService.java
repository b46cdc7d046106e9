package com.example.automationscheduler.service.scheduler;

import com.example.automationscheduler.config.AutomationSchedulerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Resubmits chains that ended or broke while their automation is still active.
 * A broken chain is only recovered here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChainSupervisorService {

    private final AutomationScheduleService automationScheduleService;
    private final AutomationSchedulerProperties properties;

    @Scheduled(fixedDelayString = "${automation-scheduler.supervisor.interval-ms:300000}",
            initialDelayString = "${automation-scheduler.supervisor.interval-ms:300000}")
    @SchedulerLock(name = "superviseSchedulerChains", lockAtMostFor = "10m", lockAtLeastFor = "30s")
    public void superviseChains() {
        if (!properties.getSupervisor().isEnabled()) {
            return;
        }

        try {
            var resubmitted = automationScheduleService.scheduleAllActiveAutomations();
            if (resubmitted > 0) {
                log.warn("Chain supervisor resubmitted {} missing scheduler chains", resubmitted);
            }
        } catch (RuntimeException e) {
            log.error("Chain supervision failed: {}", e.getMessage());
        }
    }
}
