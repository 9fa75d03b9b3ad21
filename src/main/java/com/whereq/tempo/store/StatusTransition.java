package com.whereq.tempo.store;

import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobStatus;
import lombok.Value;

/**
 * Outcome of {@link JobStore#transition}: the record as committed and whether
 * the requested status was actually applied.
 */
@Value
public class StatusTransition {

    Job job;

    JobStatus previousStatus;

    boolean applied;
}
