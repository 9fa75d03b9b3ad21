package com.whereq.tempo.scheduler;

import lombok.Value;

/**
 * The task of a job returned normally.
 */
@Value
public class JobExecutedEvent implements JobEvent {

    String jobId;

    /**
     * Task return value, may be null
     */
    Object returnValue;
}
