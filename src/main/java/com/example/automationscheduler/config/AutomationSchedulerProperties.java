package com.example.automationscheduler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the scheduler and execution queues.
 * Loaded from application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "automation-scheduler")
public class AutomationSchedulerProperties {

    @Valid
    private Queue queue = new Queue();

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Execution execution = new Execution();

    @Valid
    private Supervisor supervisor = new Supervisor();

    @Valid
    private Liveness liveness = new Liveness();

    /**
     * Days finished jobs and execution logs are kept before purge
     */
    @Min(1)
    private int retentionDays = 7;

    /**
     * When the retention purge runs
     */
    private String retentionCron = "0 30 3 * * *";

    @Min(1000)
    private long metricsUpdateIntervalMs = 30000;

    public enum Backend {
        DATABASE,
        MEMORY
    }

    @Data
    public static class Queue {

        @NotNull
        private Backend backend = Backend.DATABASE;

        /**
         * How long a claimed job stays invisible before it is considered stalled
         */
        @Min(1)
        private int visibilityTimeoutSeconds = 120;

        @Min(1000)
        private long staleCheckIntervalMs = 60000;
    }

    @Data
    public static class Scheduler {

        @Min(100)
        private long pollIntervalMs = 1000;

        /**
         * Size of the pool running scheduler firings
         */
        @Min(1)
        private int concurrency = 4;

        /**
         * Attempts for the scheduler job itself (transient registry/queue errors)
         */
        @Min(1)
        private int maxAttempts = 5;

        /**
         * Create a chain for every active automation at startup
         */
        private boolean bootstrapOnStartup = true;
    }

    @Data
    public static class Execution {

        @Min(100)
        private long pollIntervalMs = 500;

        /**
         * Size of the pool running execution jobs
         */
        @Min(1)
        private int concurrency = 16;

        @Min(1)
        private int maxAttempts = 3;

        @Min(1)
        private long backoffBaseMs = 2000;

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class Supervisor {

        private boolean enabled = true;

        @Min(1000)
        private long intervalMs = 300000;
    }

    @Data
    public static class Liveness {

        private boolean enabled = true;

        @Min(100)
        private long pingIntervalMs = 10000;

        /**
         * How long to wait for a pong before counting it as missed
         */
        @Min(50)
        private long pongTimeoutMs = 5000;

        @Min(1)
        private int maxMissedPongs = 3;
    }
}
