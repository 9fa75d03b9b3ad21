package com.whereq.tempo.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * PENDING → {COMPLETED, FAILED, CANCELLED}
 * No transition leaves a terminal state.
 */
public enum JobStatus {
    /**
     * Scheduled, not yet finished
     */
    PENDING,

    /**
     * Task returned normally
     */
    COMPLETED,

    /**
     * Task raised an exception
     */
    FAILED,

    /**
     * Caller-initiated cancellation
     */
    CANCELLED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Check if a transition to the given status is allowed
     */
    public boolean canTransitionTo(JobStatus target) {
        return this == PENDING && target != PENDING;
    }
}
