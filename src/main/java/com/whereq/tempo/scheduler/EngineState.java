package com.whereq.tempo.scheduler;

/**
 * Scheduler engine lifecycle.
 *
 * UNINITIALIZED → STARTING → RUNNING → STOPPED, and STOPPED → STARTING on restart.
 */
public enum EngineState {
    UNINITIALIZED,
    STARTING,
    RUNNING,
    STOPPED
}
