package com.example.automationscheduler.ratelimit;

import lombok.Value;

/**
 * Shared counter store with atomic increment-with-expiry.
 * Implementations throw {@link org.springframework.dao.DataAccessException} when the store is unreachable.
 */
public interface CounterStore {

    /**
     * Atomically increment {@code key}, starting a window of {@code windowSeconds} if the key is new.
     *
     * @return the count after increment and the window's remaining time-to-live
     */
    Counter increment(String key, long windowSeconds);

    void delete(String key);

    @Value
    class Counter {
        long count;
        long ttlSeconds;
    }
}
