package com.example.automationscheduler.liveness;

/**
 * Observer of liveness state transitions. Called on the thread that caused the transition.
 */
@FunctionalInterface
public interface LivenessListener {

    void onTransition(LivenessEvent event);
}
