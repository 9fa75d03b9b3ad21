package com.whereq.tempo.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.exception.SchedulerNotInitializedException;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobStatus;
import com.whereq.tempo.model.JobSubmission;
import com.whereq.tempo.model.WebhookJobData;
import com.whereq.tempo.scheduler.JobErrorEvent;
import com.whereq.tempo.scheduler.JobEvent;
import com.whereq.tempo.scheduler.JobExecutedEvent;
import com.whereq.tempo.scheduler.JobSchedulerEngine;
import com.whereq.tempo.scheduler.ScheduledTrigger;
import com.whereq.tempo.store.JobStore;
import com.whereq.tempo.store.StatusTransition;
import com.whereq.tempo.task.JobTask;
import com.whereq.tempo.task.TaskRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service for scheduling background jobs and tracking their lifecycle.
 * <p>
 * Bridges the scheduler engine and the durable job store: registers
 * triggers for new jobs, turns engine events into committed status
 * transitions and sends a webhook when a job completes. Every public entry
 * point starts the engine first if it is not running yet.
 */
@Slf4j
@Service
public class JobsService {

    private static final int MAX_ERROR_LENGTH = 4000;

    @Autowired
    private JobSchedulerEngine engine;

    @Autowired
    private JobStore jobStore;

    @Autowired
    private TaskRegistry taskRegistry;

    @Autowired
    private WebhookNotifier webhookNotifier;

    @Autowired
    private TempoProperties properties;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter createdCounter;
    private Counter completedCounter;
    private Counter failedCounter;
    private Counter cancelledCounter;

    private Disposable eventSubscription;

    @PostConstruct
    public void initialize() {
        createdCounter = Counter.builder("tempo.jobs.created")
            .description("Number of scheduled jobs")
            .register(meterRegistry);
        completedCounter = Counter.builder("tempo.jobs.completed")
            .description("Number of successfully completed jobs")
            .register(meterRegistry);
        failedCounter = Counter.builder("tempo.jobs.failed")
            .description("Number of failed jobs")
            .register(meterRegistry);
        cancelledCounter = Counter.builder("tempo.jobs.cancelled")
            .description("Number of cancelled jobs")
            .register(meterRegistry);
    }

    @PostConstruct
    public void startEventProcessor() {
        log.info("Starting job event processor");

        eventSubscription = engine.events()
            // One event at a time, each committed before the next
            .concatMap(event -> handleEvent(event)
                .onErrorResume(e -> {
                    log.error("Error handling {} for job {}: {}",
                        event.getClass().getSimpleName(), event.getJobId(), e.getMessage(), e);
                    return Mono.empty();
                }))
            .subscribe();
    }

    /**
     * Schedule a registered task by name.
     * <p>
     * {@code user_id} and {@code flow_id} keyword arguments, when present,
     * become the owner and flow of the job record.
     */
    public Mono<String> createJob(String taskName, Instant runAt, String name,
                                  List<Object> args, Map<String, Object> kwargs) {
        return createJob(JobSubmission.builder()
            .taskName(taskName)
            .runAt(runAt)
            .name(name)
            .args(args)
            .kwargs(kwargs)
            .userId(stringArg(kwargs, "user_id"))
            .flowId(stringArg(kwargs, "flow_id"))
            .build());
    }

    /**
     * Schedule a task instance. Its trigger is not recoverable after a restart.
     */
    public Mono<String> createJob(JobTask task, Instant runAt, String name,
                                  List<Object> args, Map<String, Object> kwargs) {
        return createJob(JobSubmission.builder()
            .task(task)
            .runAt(runAt)
            .name(name)
            .args(args)
            .kwargs(kwargs)
            .userId(stringArg(kwargs, "user_id"))
            .flowId(stringArg(kwargs, "flow_id"))
            .build());
    }

    /**
     * Create and schedule a new job.
     * <p>
     * The PENDING record is committed before the trigger is registered. The
     * returned Mono completes once the trigger is registered; it never waits
     * for the task to run.
     *
     * @param submission job submission
     * @return Mono with the new job id
     */
    public Mono<String> createJob(JobSubmission submission) {
        return ensureStarted().then(Mono.defer(() -> {
            JobTask task = resolveTask(submission);
            String jobId = UUID.randomUUID().toString();
            String name = submission.getName() == null || submission.getName().isBlank()
                ? "task_" + jobId
                : submission.getName();

            Job job = Job.builder()
                .id(jobId)
                .name(name)
                .status(JobStatus.PENDING)
                .active(true)
                .userId(submission.getUserId())
                .flowId(submission.getFlowId())
                .build();

            ScheduledTrigger trigger = ScheduledTrigger.builder()
                .jobId(jobId)
                .name(name)
                .task(task)
                .taskName(submission.getTask() == null ? submission.getTaskName() : null)
                .fireTime(submission.getRunAt())
                .args(submission.getArgs())
                .kwargs(submission.getKwargs())
                .build();

            return jobStore.put(job)
                .then(engine.add(trigger)
                    .onErrorResume(e -> markUnschedulable(jobId, e).then(Mono.<ScheduledTrigger>error(e))))
                .doOnSuccess(t -> {
                    createdCounter.increment();
                    log.info("Job {} ({}) scheduled {}", jobId, name,
                        submission.getRunAt() == null ? "immediately" : "at " + submission.getRunAt());
                })
                .doOnError(e -> log.error("Error creating job {}: {}", jobId, e.getMessage()))
                .thenReturn(jobId);
        }));
    }

    /**
     * Get a job.
     *
     * @param jobId job identifier
     * @param ownerId optional owner filter
     * @return Mono with the job, empty if not found or owned by someone else
     */
    public Mono<Job> getJob(String jobId, String ownerId) {
        return ensureStarted()
            .then(engine.lookupJob(jobId, ownerId))
            .doOnError(e -> log.error("Error getting job {}: {}", jobId, e.getMessage()));
    }

    /**
     * Cancel a job.
     * <p>
     * A pending trigger is removed from the engine, then the record is marked
     * CANCELLED and deactivated. An execution that already started is not
     * interrupted; its outcome is ignored once the record is CANCELLED.
     *
     * @param jobId job identifier
     * @param ownerId optional owner filter
     * @return Mono with true if the job is now CANCELLED, false if not found or already finished
     */
    public Mono<Boolean> cancelJob(String jobId, String ownerId) {
        return ensureStarted()
            .then(engine.lookupJob(jobId, ownerId))
            .flatMap(job -> engine.remove(jobId)
                .then(jobStore.transition(jobId, JobStatus.CANCELLED, this::clearOutcome))
                .map(transition -> {
                    if (transition.isApplied()) {
                        cancelledCounter.increment();
                        log.info("Job {} cancelled", jobId);
                    }
                    return transition.getJob().getStatus() == JobStatus.CANCELLED;
                }))
            .defaultIfEmpty(false)
            .doOnError(e -> log.error("Error cancelling job {}: {}", jobId, e.getMessage()));
    }

    /**
     * List the jobs of an owner.
     *
     * @param ownerId owner identifier, required
     * @param pending optional filter on whether the job still waits for its trigger
     * @param status optional status filter
     * @return Flux of jobs, empty if the owner has none
     */
    public Flux<Job> getJobs(String ownerId, Boolean pending, JobStatus status) {
        if (ownerId == null) {
            log.error("User ID is required");
            return Flux.error(new IllegalArgumentException("User ID is required"));
        }
        return ensureStarted()
            .thenMany(Flux.defer(() -> jobStore.list(ownerId, pending, status, engine.pendingJobIds())))
            .doOnError(e -> log.error("Error getting jobs for user {}: {}", ownerId, e.getMessage()));
    }

    public Flux<Job> getUserJobs(String ownerId) {
        return getJobs(ownerId, null, null);
    }

    /**
     * Stop the scheduler engine if it is running.
     */
    public void stop() {
        if (engine.shutdown()) {
            log.info("Task scheduler stopped");
        }
    }

    @PreDestroy
    public void close() {
        stop();
        if (eventSubscription != null) {
            eventSubscription.dispose();
        }
    }

    Mono<Void> handleEvent(JobEvent event) {
        if (event instanceof JobExecutedEvent executed) {
            return handleJobExecuted(executed);
        }
        if (event instanceof JobErrorEvent error) {
            return handleJobError(error);
        }
        log.warn("Ignoring unknown event {}", event);
        return Mono.empty();
    }

    private Mono<Void> handleJobExecuted(JobExecutedEvent event) {
        String jobId = event.getJobId();
        JsonNode result = serializeResult(jobId, event.getReturnValue());

        return jobStore.transition(jobId, JobStatus.COMPLETED, job -> {
                job.setResult(result);
                job.setError(null);
            })
            .switchIfEmpty(Mono.fromRunnable(() -> log.warn("Job {} executed but has no record", jobId)))
            .filter(StatusTransition::isApplied)
            .doOnNext(transition -> {
                completedCounter.increment();
                if (properties.getWebhook().isEnabled()) {
                    // Delivery runs on its own; its outcome never touches the job
                    webhookNotifier.send(WebhookJobData.from(transition.getJob())).subscribe();
                }
            })
            .then();
    }

    private Mono<Void> handleJobError(JobErrorEvent event) {
        String jobId = event.getJobId();
        String error = truncate(errorMessage(event.getException()));

        return jobStore.transition(jobId, JobStatus.FAILED, job -> {
                job.setError(error);
                job.setResult(null);
            })
            .switchIfEmpty(Mono.fromRunnable(() -> log.warn("Job {} failed but has no record", jobId)))
            .filter(StatusTransition::isApplied)
            .doOnNext(transition -> failedCounter.increment())
            .then();
    }

    /**
     * Serialize a task result. Object-shaped values are kept as they are;
     * anything else, including values Jackson cannot serialize, is wrapped as
     * {@code {"output": "<string form>"}}.
     */
    JsonNode serializeResult(String jobId, Object value) {
        try {
            JsonNode node = objectMapper.valueToTree(value);
            if (node != null && node.isObject()) {
                return node;
            }
        } catch (IllegalArgumentException e) {
            log.error("Error serializing result of job {}: {}", jobId, e.getMessage());
        }
        ObjectNode wrapper = objectMapper.createObjectNode();
        wrapper.put("output", String.valueOf(value));
        return wrapper;
    }

    private Mono<Void> ensureStarted() {
        return engine.start()
            .onErrorMap(e -> !(e instanceof SchedulerNotInitializedException),
                e -> new SchedulerNotInitializedException("Scheduler engine could not be started", e));
    }

    private JobTask resolveTask(JobSubmission submission) {
        if (submission.getTask() != null) {
            return submission.getTask();
        }
        if (submission.getTaskName() == null || submission.getTaskName().isBlank()) {
            throw new IllegalArgumentException("Either a task or a task name must be specified");
        }
        return taskRegistry.resolve(submission.getTaskName())
            .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + submission.getTaskName()));
    }

    private Mono<Void> markUnschedulable(String jobId, Throwable error) {
        return jobStore.transition(jobId, JobStatus.FAILED,
                job -> job.setError(truncate("Scheduling failed: " + error.getMessage())))
            .then()
            .onErrorResume(e -> {
                log.error("Could not mark job {} as failed: {}", jobId, e.getMessage());
                return Mono.empty();
            });
    }

    private void clearOutcome(Job job) {
        job.setResult(null);
        job.setError(null);
    }

    private static String stringArg(Map<String, Object> kwargs, String key) {
        if (kwargs == null || kwargs.get(key) == null) {
            return null;
        }
        return String.valueOf(kwargs.get(key));
    }

    private static String errorMessage(Throwable exception) {
        String message = exception.getMessage();
        return message == null || message.isBlank() ? exception.getClass().getSimpleName() : message;
    }

    private static String truncate(String value) {
        return value.length() <= MAX_ERROR_LENGTH ? value : value.substring(0, MAX_ERROR_LENGTH);
    }
}
