package com.example.automationscheduler.liveness;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * A state transition of a {@link ConnectionLivenessMonitor}.
 */
@Value
public class LivenessEvent {
    String connectionName;
    LivenessState previous;
    LivenessState current;
    int missedPongs;

    /**
     * Latency of the last answered ping, null if none yet
     */
    Duration lastLatency;

    Instant occurredAt;

    public boolean isConnectionDead() {
        return current == LivenessState.DEAD;
    }
}
