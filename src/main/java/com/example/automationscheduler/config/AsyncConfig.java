package com.example.automationscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for job processing.
 * <p>
 * Scheduler firings and executions get separate bounded pools so that an execution
 * backlog can never starve the scheduling of the next cycle. The pollers only claim
 * as many jobs as a pool has idle threads, so the pools need no queue capacity beyond that.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    @Bean(name = "schedulerExecutor")
    public ThreadPoolTaskExecutor schedulerExecutor(AutomationSchedulerProperties properties) {
        var size = properties.getScheduler().getConcurrency();
        log.info("Creating scheduler executor with {} threads", size);
        return fixedPool("scheduler-fire-", size);
    }

    @Bean(name = "executionExecutor")
    public ThreadPoolTaskExecutor executionExecutor(AutomationSchedulerProperties properties) {
        var size = properties.getExecution().getConcurrency();
        log.info("Creating execution executor with {} threads", size);
        return fixedPool("execution-", size);
    }

    /**
     * Task executor for Spring's @Async annotation (alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("async-task-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    private ThreadPoolTaskExecutor fixedPool(String prefix, int size) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(size);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
