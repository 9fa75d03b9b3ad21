package com.whereq.tempo.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Read view of a job record
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private String id;

    private String name;

    private JobStatus status;

    /**
     * Serialized task result (if completed)
     */
    private JsonNode result;

    /**
     * Error message (if failed)
     */
    private String error;

    private String flowId;

    private String userId;

    private boolean active;

    private Instant createdAt;

    private Instant updatedAt;

    public static JobResponse from(Job job) {
        return JobResponse.builder()
            .id(job.getId())
            .name(job.getName())
            .status(job.getStatus())
            .result(job.getResult())
            .error(job.getError())
            .flowId(job.getFlowId())
            .userId(job.getUserId())
            .active(job.isActive())
            .createdAt(job.getCreatedAt())
            .updatedAt(job.getUpdatedAt())
            .build();
    }
}
