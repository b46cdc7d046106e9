package com.example.automationscheduler.liveness;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

/**
 * Ping/pong heartbeat state machine for one connection.
 * <p>
 * {@code start()} enters HEALTHY and pings on a fixed interval. Each ping waits up to the
 * pong timeout: an answer resets the missed counter and returns to HEALTHY, a timeout
 * increments it and moves to DEGRADED. Reaching the maximum moves to DEAD, which is terminal
 * until the next {@code start()}. {@code stop()} returns to STOPPED from any state.
 * <p>
 * Listeners are notified after each state change, outside the monitor's lock.
 */
@Slf4j
public class ConnectionLivenessMonitor {

    private final String connectionName;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration pingInterval;
    private final Duration pongTimeout;
    private final int maxMissedPongs;
    private final PingSender pingSender;
    private final List<LivenessListener> listeners = new CopyOnWriteArrayList<>();

    private final Map<Long, Instant> outstandingPings = new HashMap<>();
    private final Map<Long, ScheduledFuture<?>> pongTimeouts = new HashMap<>();

    private LivenessState state = LivenessState.STOPPED;
    private int missedPongs;
    private Duration lastLatency;
    private long pingSequence;
    private long generation;
    private ScheduledFuture<?> pingTask;

    public ConnectionLivenessMonitor(String connectionName, TaskScheduler taskScheduler, Clock clock,
                                     Duration pingInterval, Duration pongTimeout, int maxMissedPongs, PingSender pingSender) {
        if (maxMissedPongs < 1) {
            throw new IllegalArgumentException("maxMissedPongs must be at least 1");
        }
        this.connectionName = connectionName;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.pingInterval = pingInterval;
        this.pongTimeout = pongTimeout;
        this.maxMissedPongs = maxMissedPongs;
        this.pingSender = pingSender;
    }

    public void addListener(LivenessListener listener) {
        listeners.add(listener);
    }

    public void removeListener(LivenessListener listener) {
        listeners.remove(listener);
    }

    /**
     * Begin monitoring a (new) connection. No-op while already active.
     */
    public void start() {
        LivenessEvent event;
        synchronized (this) {
            if (state.isActive()) {
                log.debug("[{}] Liveness monitor already active", connectionName);
                return;
            }
            resetCounters();
            generation++;
            event = transition(LivenessState.HEALTHY);
            var startedGeneration = generation;
            pingTask = taskScheduler.scheduleAtFixedRate(() -> ping(startedGeneration), pingInterval);
        }
        log.info("[{}] Liveness monitor started (ping every {}, timeout {}, max missed {})",
                connectionName, pingInterval, pongTimeout, maxMissedPongs);
        publish(event);
    }

    /**
     * Stop monitoring and clear counters. Valid from any state.
     */
    public void stop() {
        LivenessEvent event;
        synchronized (this) {
            cancelTimers();
            resetCounters();
            event = state != LivenessState.STOPPED ? transition(LivenessState.STOPPED) : null;
        }
        if (event != null) {
            log.info("[{}] Liveness monitor stopped", connectionName);
            publish(event);
        }
    }

    /**
     * Record the answer to ping {@code pingId}. Late or unknown pongs are ignored.
     */
    public void onPong(long pingId) {
        LivenessEvent event = null;
        synchronized (this) {
            var sentAt = outstandingPings.remove(pingId);
            if (sentAt == null || !state.isActive()) {
                log.debug("[{}] Ignoring pong {} (unknown, late or monitor inactive)", connectionName, pingId);
                return;
            }
            var timeout = pongTimeouts.remove(pingId);
            if (timeout != null) {
                timeout.cancel(false);
            }
            lastLatency = Duration.between(sentAt, clock.instant());
            missedPongs = 0;
            if (state != LivenessState.HEALTHY) {
                event = transition(LivenessState.HEALTHY);
            }
        }
        if (event != null) {
            log.info("[{}] Connection recovered, latency {}ms", connectionName, lastLatency.toMillis());
            publish(event);
        }
    }

    void ping(long pingGeneration) {
        long pingId;
        synchronized (this) {
            if (pingGeneration != generation || !state.isActive()) {
                return;
            }
            pingId = ++pingSequence;
            outstandingPings.put(pingId, clock.instant());
            var timeout = taskScheduler.schedule(() -> onPongTimeout(pingId, pingGeneration), clock.instant().plus(pongTimeout));
            if (timeout != null) {
                pongTimeouts.put(pingId, timeout);
            }
        }
        try {
            pingSender.sendPing(pingId);
        } catch (RuntimeException e) {
            // an unsent ping is accounted for by its timeout
            log.warn("[{}] Failed to send ping {}: {}", connectionName, pingId, e.getMessage());
        }
    }

    void onPongTimeout(long pingId, long pingGeneration) {
        LivenessEvent event = null;
        synchronized (this) {
            pongTimeouts.remove(pingId);
            if (pingGeneration != generation || !state.isActive() || outstandingPings.remove(pingId) == null) {
                return;
            }
            missedPongs++;
            log.warn("[{}] Pong {} missed ({}/{})", connectionName, pingId, missedPongs, maxMissedPongs);

            if (missedPongs >= maxMissedPongs) {
                cancelTimers();
                event = transition(LivenessState.DEAD);
            } else if (state != LivenessState.DEGRADED) {
                event = transition(LivenessState.DEGRADED);
            }
        }
        if (event != null) {
            if (event.isConnectionDead()) {
                log.error("[{}] Connection dead after {} missed pongs", connectionName, event.getMissedPongs());
            }
            publish(event);
        }
    }

    public synchronized LivenessState getState() {
        return state;
    }

    public synchronized int getMissedPongs() {
        return missedPongs;
    }

    public synchronized Duration getLastLatency() {
        return lastLatency;
    }

    public synchronized boolean isHealthy() {
        return state == LivenessState.HEALTHY;
    }

    public String getConnectionName() {
        return connectionName;
    }

    private LivenessEvent transition(LivenessState next) {
        var previous = state;
        state = next;
        return new LivenessEvent(connectionName, previous, next, missedPongs, lastLatency, clock.instant());
    }

    private void resetCounters() {
        missedPongs = 0;
        lastLatency = null;
        outstandingPings.clear();
    }

    private void cancelTimers() {
        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }
        pongTimeouts.values().forEach(timeout -> timeout.cancel(false));
        pongTimeouts.clear();
        outstandingPings.clear();
    }

    private void publish(LivenessEvent event) {
        for (var listener : listeners) {
            try {
                listener.onTransition(event);
            } catch (RuntimeException e) {
                log.error("[{}] Liveness listener {} failed: {}", connectionName, listener, e.getMessage(), e);
            }
        }
    }
}
