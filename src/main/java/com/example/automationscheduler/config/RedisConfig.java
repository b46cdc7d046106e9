package com.example.automationscheduler.config;

import com.example.automationscheduler.ratelimit.CounterStore;
import com.example.automationscheduler.ratelimit.InMemoryCounterStore;
import com.example.automationscheduler.ratelimit.RedisCounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Counter store for the rate limiter, on the auto-configured {@link StringRedisTemplate}.
 * <p>
 * Keys: {@code automation:ratelimit:{action}:{subject}} holding a plain integer with a TTL
 * equal to the remaining window.
 */
@Slf4j
@Configuration
public class RedisConfig {

    @Bean
    @ConditionalOnProperty(name = "automation-scheduler.rate-limits.store", havingValue = "redis", matchIfMissing = true)
    public CounterStore redisCounterStore(StringRedisTemplate stringRedisTemplate) {
        return new RedisCounterStore(stringRedisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "automation-scheduler.rate-limits.store", havingValue = "memory")
    public CounterStore inMemoryCounterStore(Clock clock) {
        log.warn("Using in-memory rate limit counters: limits are per instance");
        return new InMemoryCounterStore(clock);
    }
}
