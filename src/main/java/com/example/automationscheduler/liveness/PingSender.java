package com.example.automationscheduler.liveness;

/**
 * Sends a ping over the monitored connection. The connection reports the answer
 * through {@link ConnectionLivenessMonitor#onPong(long)} with the same id.
 */
@FunctionalInterface
public interface PingSender {

    void sendPing(long pingId);
}
