package com.whereq.tempo.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Notification payload for a completed job. Built on demand, never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookJobData {

    private String id;

    private String status;

    private JsonNode result;

    private String name;

    @JsonProperty("flow_id")
    private String flowId;

    @JsonProperty("user_id")
    private String userId;

    public static WebhookJobData from(Job job) {
        return WebhookJobData.builder()
            .id(job.getId())
            .status(job.getStatus().name())
            .result(job.getResult())
            .name(job.getName())
            .flowId(job.getFlowId())
            .userId(job.getUserId())
            .build();
    }
}
