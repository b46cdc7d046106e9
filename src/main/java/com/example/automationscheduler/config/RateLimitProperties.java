package com.example.automationscheduler.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-policy overrides of rate limits, keyed by policy code (e.g. {@code login}).
 * Policies without an entry keep their built-in defaults.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "automation-scheduler.rate-limits")
public class RateLimitProperties {

    public enum Store {
        REDIS,
        MEMORY
    }

    private Store store = Store.REDIS;

    /**
     * Key prefix for counters in the shared store
     */
    private String keyPrefix = "automation:ratelimit:";

    private Map<String, Limit> policies = new HashMap<>();

    @Data
    public static class Limit {
        @Min(1)
        private int limit;

        @Min(1)
        private long windowSeconds;
    }
}
