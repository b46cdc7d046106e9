package com.example.automationscheduler.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.util.List;

/**
 * Redis counters. Increment and expiry are applied by one Lua script, so a window
 * can never be left without a TTL and no read-then-write race exists.
 */
@Slf4j
public class RedisCounterStore implements CounterStore {

    /**
     * Replies {@code "<count>:<ttl>"}
     */
    static final RedisScript<String> INCREMENT_SCRIPT = RedisScript.of("""
            local count = redis.call('INCR', KEYS[1])
            local ttl = redis.call('TTL', KEYS[1])
            if count == 1 or ttl < 0 then
              redis.call('EXPIRE', KEYS[1], ARGV[1])
              ttl = tonumber(ARGV[1])
            end
            return count .. ':' .. ttl
            """, String.class);

    private final StringRedisTemplate redisTemplate;

    public RedisCounterStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Counter increment(String key, long windowSeconds) {
        var reply = redisTemplate.execute(INCREMENT_SCRIPT, List.of(key), String.valueOf(windowSeconds));
        return parseReply(key, reply);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    static Counter parseReply(String key, String reply) {
        var separator = reply == null ? -1 : reply.indexOf(':');
        if (separator < 1) {
            throw new DataRetrievalFailureException("Unexpected rate limit script result for key " + key + ": " + reply);
        }
        try {
            var count = Long.parseLong(reply.substring(0, separator));
            var ttl = Long.parseLong(reply.substring(separator + 1));
            return new Counter(count, ttl);
        } catch (NumberFormatException e) {
            throw new DataRetrievalFailureException("Unexpected rate limit script result for key " + key + ": " + reply, e);
        }
    }
}
