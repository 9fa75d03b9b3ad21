package com.whereq.tempo.model;

import com.whereq.tempo.task.JobTask;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Request to schedule a job. Exactly one of {@code task} and {@code taskName}
 * identifies the work; only named tasks can be recovered after a restart.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmission {

    /**
     * Task instance to run
     */
    private JobTask task;

    /**
     * Registered task name to run
     */
    private String taskName;

    /**
     * When to run; null runs immediately
     */
    private Instant runAt;

    /**
     * Human label, defaults to task_&lt;id&gt;
     */
    private String name;

    private List<Object> args;

    private Map<String, Object> kwargs;

    private String userId;

    private String flowId;
}
