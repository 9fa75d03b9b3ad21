package com.whereq.tempo.dto;

import com.whereq.tempo.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmitResponse {
    /**
     * Unique job identifier
     */
    private String jobId;

    /**
     * Status right after submission
     */
    private JobStatus status;

    /**
     * When the job was submitted
     */
    private Instant submittedAt;

    /**
     * Scheduled run time, null for immediate jobs
     */
    private Instant runAt;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    /**
     * Create error response
     */
    public static JobSubmitResponse error(String message) {
        return JobSubmitResponse.builder()
            .errorMessage(message)
            .submittedAt(Instant.now())
            .build();
    }
}
