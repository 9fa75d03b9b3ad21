package com.whereq.tempo.scheduler;

/**
 * Lifecycle event published by the scheduler engine after a trigger fires.
 */
public interface JobEvent {

    String getJobId();
}
