package com.whereq.tempo.controller;

import com.whereq.tempo.dto.JobCancellationResponse;
import com.whereq.tempo.dto.JobCreateRequest;
import com.whereq.tempo.dto.JobResponse;
import com.whereq.tempo.dto.JobSubmitResponse;
import com.whereq.tempo.exception.SchedulerNotInitializedException;
import com.whereq.tempo.model.JobStatus;
import com.whereq.tempo.model.JobSubmission;
import com.whereq.tempo.service.JobsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Instant;
import java.util.List;

/**
 * Controller for scheduling and managing background jobs
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Jobs", description = "Schedule, inspect and cancel background jobs")
public class JobController {

    public static final String USER_HEADER = "X-User-Id";

    @Autowired
    private JobsService jobsService;

    @PostMapping
    @Operation(summary = "Schedule a job",
        description = "Schedule a registered task to run immediately or at the given instant")
    public Mono<ResponseEntity<JobSubmitResponse>> createJob(
            @Valid @RequestBody JobCreateRequest request,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {

        log.info("Received job submission from user {}: task={}, runAt={}",
            userId, request.getTask(), request.getRunAt());

        JobSubmission submission = JobSubmission.builder()
            .taskName(request.getTask())
            .runAt(request.getRunAt())
            .name(request.getName())
            .args(request.getArgs())
            .kwargs(request.getKwargs())
            .userId(userId)
            .flowId(request.getFlowId())
            .build();

        return jobsService.createJob(submission)
            .map(jobId -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/jobs/" + jobId))
                .body(JobSubmitResponse.builder()
                    .jobId(jobId)
                    .status(JobStatus.PENDING)
                    .submittedAt(Instant.now())
                    .runAt(request.getRunAt())
                    .build()))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(SchedulerNotInitializedException.class, e -> {
                log.error("Scheduler unavailable: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobSubmitResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job", description = "Get the stored state of a job")
    public Mono<ResponseEntity<JobResponse>> getJob(
            @PathVariable String jobId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {

        return jobsService.getJob(jobId, userId)
            .map(job -> ResponseEntity.ok(JobResponse.from(job)))
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .onErrorResume(SchedulerNotInitializedException.class, e ->
                Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build()));
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Cancel job", description = "Remove a pending trigger and mark the job cancelled")
    public Mono<ResponseEntity<JobCancellationResponse>> cancelJob(
            @PathVariable String jobId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {

        log.info("Job cancellation request for {} from user {}", jobId, userId);

        return jobsService.getJob(jobId, userId)
            .flatMap(job -> jobsService.cancelJob(jobId, userId)
                .map(cancelled -> ResponseEntity.ok(JobCancellationResponse.builder()
                    .jobId(jobId)
                    .cancelled(cancelled)
                    .status(cancelled ? JobStatus.CANCELLED : job.getStatus())
                    .cancelledAt(Instant.now())
                    .message(cancelled
                        ? "Job cancelled successfully"
                        : "Job already finished with status " + job.getStatus())
                    .build())))
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .onErrorResume(Exception.class, e -> {
                log.error("Error cancelling job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .build());
            });
    }

    @GetMapping
    @Operation(summary = "List jobs", description = "List the jobs of the calling user")
    public Mono<ResponseEntity<List<JobResponse>>> listJobs(
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @RequestParam(required = false) Boolean pending,
            @RequestParam(required = false) JobStatus status) {

        return jobsService.getJobs(userId, pending, status)
            .map(JobResponse::from)
            .collectList()
            .map(ResponseEntity::ok)
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Invalid job listing request: {}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            });
    }
}
