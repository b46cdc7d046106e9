package com.example.automationscheduler.config;

import com.example.automationscheduler.domain.repository.QueuedJobRepository;
import com.example.automationscheduler.queue.DatabaseJobQueue;
import com.example.automationscheduler.queue.InMemoryJobQueue;
import com.example.automationscheduler.queue.JobQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Selects the queue backend. {@code database} (default) shares work across instances;
 * {@code memory} is for single-process local runs.
 */
@Slf4j
@Configuration
public class QueueConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "automation-scheduler.queue.backend", havingValue = "database", matchIfMissing = true)
    public JobQueue databaseJobQueue(QueuedJobRepository repository, PlatformTransactionManager transactionManager,
                                     Clock clock, AutomationSchedulerProperties properties) {
        var visibility = Duration.ofSeconds(properties.getQueue().getVisibilityTimeoutSeconds());
        log.info("Using database job queue (visibility timeout {})", visibility);
        return new DatabaseJobQueue(repository, new TransactionTemplate(transactionManager), clock, visibility);
    }

    @Bean
    @ConditionalOnProperty(name = "automation-scheduler.queue.backend", havingValue = "memory")
    public JobQueue inMemoryJobQueue(Clock clock, AutomationSchedulerProperties properties) {
        var visibility = Duration.ofSeconds(properties.getQueue().getVisibilityTimeoutSeconds());
        log.warn("Using in-memory job queue: jobs are lost on restart and not shared between instances");
        return new InMemoryJobQueue(clock, visibility);
    }
}
