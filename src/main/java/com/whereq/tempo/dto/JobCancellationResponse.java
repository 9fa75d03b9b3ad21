package com.whereq.tempo.dto;

import com.whereq.tempo.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job cancellation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCancellationResponse {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * Whether the job is now cancelled
     */
    private boolean cancelled;

    /**
     * Status after the request
     */
    private JobStatus status;

    /**
     * When the request was handled
     */
    private Instant cancelledAt;

    /**
     * Cancellation message
     */
    private String message;
}
