package com.whereq.tempo.scheduler;

import lombok.Value;

/**
 * The task of a job raised an exception.
 */
@Value
public class JobErrorEvent implements JobEvent {

    String jobId;

    Throwable exception;
}
