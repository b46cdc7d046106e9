package com.example.automationscheduler.service.executor;

import com.example.automationscheduler.config.AutomationSchedulerProperties;
import com.example.automationscheduler.domain.repository.JobExecutionLogRepository;
import com.example.automationscheduler.queue.JobQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Cluster-wide queue housekeeping, one instance at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueMaintenanceService {

    private final JobQueue jobQueue;
    private final JobExecutionLogRepository executionLogRepository;
    private final AutomationSchedulerProperties properties;
    private final Clock clock;

    /**
     * Release claims whose visibility timeout elapsed.
     * <p>
     * Claims can go stale if:
     * - An instance crashes while processing
     * - A handler hangs past the visibility timeout
     * - The worker cannot reach the queue to settle the job
     */
    @Scheduled(fixedDelayString = "${automation-scheduler.queue.stale-check-interval-ms:60000}")
    @SchedulerLock(name = "recoverStalledJobs", lockAtLeastFor = "10s", lockAtMostFor = "5m")
    public void recoverStalledJobs() {
        try {
            var recovered = jobQueue.recoverStalled();
            if (recovered > 0) {
                log.warn("Returned {} stalled jobs to the queue", recovered);
            }
        } catch (RuntimeException e) {
            log.error("Error recovering stalled jobs: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${automation-scheduler.retention-cron:0 30 3 * * *}")
    @SchedulerLock(name = "purgeFinishedJobs", lockAtLeastFor = "1m", lockAtMostFor = "30m")
    public void purgeFinishedJobs() {
        var cutoff = clock.instant().minus(Duration.ofDays(properties.getRetentionDays()));
        try {
            var jobs = jobQueue.purgeFinished(cutoff);
            var logs = executionLogRepository.deleteOlderThan(cutoff);
            log.info("Retention purge removed {} finished jobs and {} execution logs older than {}", jobs, logs, cutoff);
        } catch (RuntimeException e) {
            log.error("Retention purge failed: {}", e.getMessage(), e);
        }
    }
}
