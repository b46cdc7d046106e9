package com.example.automationscheduler.ratelimit;

import com.example.automationscheduler.config.MetricsConfig;
import com.example.automationscheduler.config.RateLimitProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Fixed-window rate limiter over a shared {@link CounterStore}.
 * <p>
 * The counter is incremented before the limit is checked and is not rolled back on denial,
 * so hammering a limited action never extends or resets the window. When the store is
 * unreachable the limiter fails open and logs a degraded-mode event.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimiterService {

    private final CounterStore counterStore;
    private final RateLimitProperties properties;
    private final MetricsConfig metricsConfig;

    /**
     * Count one occurrence of {@code action} for {@code subjectKey} and decide whether it is allowed.
     */
    public RateLimitDecision checkAndIncrement(String subjectKey, String action, int limit, long windowSeconds) {
        if (subjectKey == null || subjectKey.isBlank()) {
            throw new IllegalArgumentException("Rate limit subject key is required");
        }
        if (limit < 1 || windowSeconds < 1) {
            throw new IllegalArgumentException("Rate limit and window must be positive");
        }

        var key = buildKey(action, subjectKey);
        CounterStore.Counter counter;
        try {
            counter = counterStore.increment(key, windowSeconds);
        } catch (DataAccessException e) {
            log.warn("Rate limiter store unavailable, failing open for action {} subject {}: {}", action, subjectKey, e.getMessage());
            metricsConfig.recordRateLimiterDegraded(action);
            return RateLimitDecision.failOpen(limit);
        }

        if (counter.getCount() > limit) {
            var retryAfter = Math.max(1, Math.min(counter.getTtlSeconds(), windowSeconds));
            log.info("Rate limit exceeded for action {} subject {} ({}/{}), retry after {}s",
                    action, subjectKey, counter.getCount(), limit, retryAfter);
            metricsConfig.recordRateLimitDenied(action);
            return RateLimitDecision.denied(counter.getCount(), limit, retryAfter);
        }

        return RateLimitDecision.allowed(counter.getCount(), limit);
    }

    /**
     * Check a named policy. {@code subject} must match the policy's subject type
     * (network address or user id).
     */
    public RateLimitDecision check(RateLimitPolicy policy, String subject) {
        var override = properties.getPolicies().get(policy.getCode());
        var limit = override != null ? override.getLimit() : policy.getDefaultLimit();
        var window = override != null ? override.getWindowSeconds() : policy.getDefaultWindowSeconds();
        return checkAndIncrement(subject, policy.getCode(), limit, window);
    }

    /**
     * Reset the counter, e.g. after a successful login forgives earlier failures.
     */
    public void clear(String subjectKey, String action) {
        try {
            counterStore.delete(buildKey(action, subjectKey));
            log.debug("Cleared rate limit counter for action {} subject {}", action, subjectKey);
        } catch (DataAccessException e) {
            log.warn("Rate limiter store unavailable, could not clear action {} subject {}: {}", action, subjectKey, e.getMessage());
            metricsConfig.recordRateLimiterDegraded(action);
        }
    }

    public void clear(RateLimitPolicy policy, String subject) {
        clear(subject, policy.getCode());
    }

    String buildKey(String action, String subjectKey) {
        return properties.getKeyPrefix() + action + ":" + subjectKey;
    }
}
