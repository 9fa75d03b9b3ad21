package com.whereq.tempo.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Request to schedule a registered task.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCreateRequest {

    /**
     * Registered task name, e.g. "echo"
     */
    @NotBlank(message = "task is required")
    private String task;

    /**
     * ISO-8601 instant to run at. Omit to run immediately.
     */
    private Instant runAt;

    /**
     * Human label. Defaults to task_&lt;id&gt;.
     */
    @Size(max = 255)
    private String name;

    /**
     * Positional task arguments
     */
    private List<Object> args;

    /**
     * Keyword task arguments
     */
    private Map<String, Object> kwargs;

    /**
     * Flow this job belongs to, if any
     */
    private String flowId;
}
