package com.example.automationscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Automation Scheduler Service Application
 * <p>
 * Keeps every active trading-safety automation (margin guard, take-profit/stop-loss)
 * on a self-perpetuating schedule and executes each cycle through a plan-tier
 * priority queue.
 * <p>
 * Features:
 * - Self-rescheduling scheduler chains over a delayed queue
 * - Priority execution queue with visibility timeout, backoff and dead-letter
 * - Redis fixed-window rate limiting that fails open
 * - Heartbeat liveness monitor for the market data feed
 * - Slack alerting for dead-letters and broken chains
 */
@EnableScheduling
@ConfigurationPropertiesScan
@SpringBootApplication
public class AutomationSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutomationSchedulerApplication.class, args);
    }
}
