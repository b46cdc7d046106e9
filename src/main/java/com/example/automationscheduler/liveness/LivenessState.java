package com.example.automationscheduler.liveness;

/**
 * States of a connection heartbeat. HEALTHY and DEGRADED are the two active states.
 */
public enum LivenessState {
    STOPPED,
    HEALTHY,
    DEGRADED,
    DEAD;

    public boolean isActive() {
        return this == HEALTHY || this == DEGRADED;
    }
}
