package com.example.automationscheduler.service.executor;

import com.example.automationscheduler.config.MetricsConfig;
import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.domain.enums.QueueName;
import com.example.automationscheduler.domain.model.SchedulerJob;
import com.example.automationscheduler.exception.ChainBrokenException;
import com.example.automationscheduler.queue.JobQueue;
import com.example.automationscheduler.service.alert.SlackAlertService;
import com.example.automationscheduler.service.scheduler.FireResult;
import com.example.automationscheduler.service.scheduler.RecurringSchedulerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Fires one claimed scheduler job and settles it.
 * <p>
 * A firing that scheduled (or found) its successor is acked. A broken chain fails the job so
 * the whole firing is retried; the execution job and successor are de-duplicated by cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulerJobProcessor {

    private final JobQueue jobQueue;
    private final RecurringSchedulerService recurringSchedulerService;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;

    public Optional<FireResult> process(QueuedJob queuedJob) {
        var job = SchedulerJob.fromQueuedJob(queuedJob);
        try {
            var result = recurringSchedulerService.onSchedulerFire(job);
            if (!jobQueue.ack(queuedJob)) {
                log.warn("Claim on scheduler job {} lost before ack", queuedJob.getId());
            }
            return Optional.of(result);
        } catch (ChainBrokenException e) {
            var failure = jobQueue.fail(queuedJob, e.getMessage(), true);
            if (failure.isRetryScheduled()) {
                metricsConfig.recordRetry(QueueName.SCHEDULER, failure.getAttemptsRemaining());
                log.warn("Retrying scheduler job {} for automation {} in {}ms",
                        queuedJob.getId(), job.getAutomationId(), failure.getRetryDelay().toMillis());
            } else if (failure.isDeadLettered()) {
                metricsConfig.recordDeadLetter(QueueName.SCHEDULER);
                queuedJob.setLastError(e.getMessage());
                slackAlertService.sendDeadLetterAlert(queuedJob);
            }
            return Optional.empty();
        }
    }
}
