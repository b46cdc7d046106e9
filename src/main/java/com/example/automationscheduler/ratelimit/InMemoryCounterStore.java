package com.example.automationscheduler.ratelimit;

import lombok.Value;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local counters with the same window semantics as the Redis store.
 */
public class InMemoryCounterStore implements CounterStore {

    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Counter increment(String key, long windowSeconds) {
        var now = clock.instant();
        var window = windows.compute(key, (k, current) -> {
            if (current == null || !current.getExpiresAt().isAfter(now)) {
                return new Window(1, now.plusSeconds(windowSeconds));
            }
            return new Window(current.getCount() + 1, current.getExpiresAt());
        });
        var ttl = (long) Math.ceil((window.getExpiresAt().toEpochMilli() - now.toEpochMilli()) / 1000.0);
        return new Counter(window.getCount(), ttl);
    }

    @Override
    public void delete(String key) {
        windows.remove(key);
    }

    @Value
    private static class Window {
        long count;
        Instant expiresAt;
    }
}
