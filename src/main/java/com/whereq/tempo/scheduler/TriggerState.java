package com.whereq.tempo.scheduler;

/**
 * Trigger states
 *
 * State transitions:
 * SCHEDULED → FIRING → {FIRED, ERRORED}
 * SCHEDULED → REMOVED
 */
public enum TriggerState {
    /**
     * Armed, waiting for its fire time
     */
    SCHEDULED,

    /**
     * Task running; transient
     */
    FIRING,

    /**
     * Task returned normally
     */
    FIRED,

    /**
     * Task raised an exception
     */
    ERRORED,

    /**
     * Removed before firing, or replaced by a newer trigger with the same id
     */
    REMOVED
}
