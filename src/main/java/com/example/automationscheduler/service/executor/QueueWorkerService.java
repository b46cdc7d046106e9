package com.example.automationscheduler.service.executor;

import com.example.automationscheduler.config.AutomationSchedulerProperties;
import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.domain.enums.QueueName;
import com.example.automationscheduler.queue.JobQueue;
import com.example.automationscheduler.queue.QueueException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;


import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Polls both queues and dispatches claimed jobs to their worker pools.
 * <p>
 * Every instance polls: claims are spread across instances by FOR UPDATE SKIP LOCKED,
 * so no cluster lock is taken here. Each poll claims at most as many jobs as its pool
 * has free threads, which keeps unstarted jobs in the queue where other instances can take them.
 * <p>
 * Flow:
 * 1. Poll runs on a fixed delay per queue
 * 2. Claims up to the pool's free capacity, highest priority first
 * 3. Dispatches each job with CompletableFuture.runAsync on the queue's pool
 */
@Slf4j
@Service
public class QueueWorkerService {

    private final JobQueue jobQueue;
    private final SchedulerJobProcessor schedulerJobProcessor;
    private final ExecutionJobProcessor executionJobProcessor;
    private final WorkerIdentity workerIdentity;
    private final AutomationSchedulerProperties properties;
    private final Executor schedulerExecutor;
    private final Executor executionExecutor;

    private final AtomicInteger schedulerInFlight = new AtomicInteger();
    private final AtomicInteger executionInFlight = new AtomicInteger();

    public QueueWorkerService(JobQueue jobQueue, SchedulerJobProcessor schedulerJobProcessor,
                              ExecutionJobProcessor executionJobProcessor, WorkerIdentity workerIdentity,
                              AutomationSchedulerProperties properties,
                              @Qualifier("schedulerExecutor") Executor schedulerExecutor,
                              @Qualifier("executionExecutor") Executor executionExecutor) {
        this.jobQueue = jobQueue;
        this.schedulerJobProcessor = schedulerJobProcessor;
        this.executionJobProcessor = executionJobProcessor;
        this.workerIdentity = workerIdentity;
        this.properties = properties;
        this.schedulerExecutor = schedulerExecutor;
        this.executionExecutor = executionExecutor;
    }

    @Scheduled(fixedDelayString = "${automation-scheduler.scheduler.poll-interval-ms:1000}")
    public void pollSchedulerQueue() {
        poll(QueueName.SCHEDULER, schedulerExecutor, schedulerInFlight,
                properties.getScheduler().getConcurrency(), schedulerJobProcessor::process);
    }

    @Scheduled(fixedDelayString = "${automation-scheduler.execution.poll-interval-ms:500}")
    public void pollExecutionQueue() {
        poll(QueueName.EXECUTION, executionExecutor, executionInFlight,
                properties.getExecution().getConcurrency(), executionJobProcessor::process);
    }

    /**
     * @return number of jobs dispatched
     */
    int poll(QueueName queue, Executor executor, AtomicInteger inFlight, int capacity, Consumer<QueuedJob> processor) {
        var free = capacity - inFlight.get();
        if (free <= 0) {
            log.debug("{} pool busy ({} in flight), not claiming", queue, inFlight.get());
            return 0;
        }

        var jobs = claim(queue, free);
        if (jobs.isEmpty()) {
            return 0;
        }
        log.debug("Claimed {} jobs from {}", jobs.size(), queue);

        var dispatched = 0;
        for (var job : jobs) {
            inFlight.incrementAndGet();
            try {
                CompletableFuture.runAsync(() -> processor.accept(job), executor)
                        .whenComplete((ignored, error) -> {
                            inFlight.decrementAndGet();
                            if (error != null) {
                                log.error("Error processing {} job {}: {}", queue, job.getId(), error.getMessage(), error);
                            }
                        });
                dispatched++;
            } catch (RejectedExecutionException e) {
                inFlight.decrementAndGet();
                log.warn("{} pool rejected job {}, it is delivered again after its visibility timeout", queue, job.getId());
            }
        }
        return dispatched;
    }

    int getInFlight(QueueName queue) {
        return queue == QueueName.SCHEDULER ? schedulerInFlight.get() : executionInFlight.get();
    }

    private List<QueuedJob> claim(QueueName queue, int limit) {
        try {
            return jobQueue.claim(queue, workerIdentity.getWorkerId(), limit);
        } catch (QueueException e) {
            log.warn("Could not claim from {}: {}", queue, e.getMessage());
            return List.of();
        }
    }
}
