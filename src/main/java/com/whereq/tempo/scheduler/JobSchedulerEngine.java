package com.whereq.tempo.scheduler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tempo.exception.SchedulerNotInitializedException;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobTrigger;
import com.whereq.tempo.store.JobStore;
import com.whereq.tempo.task.JobTask;
import com.whereq.tempo.task.TaskRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In-memory scheduler engine for one-shot job triggers.
 * <p>
 * Holds the triggers that have not fired yet, fires each at its time (or
 * immediately when it has none or the time has passed), runs at most one
 * instance per job id and publishes a {@link JobEvent} for every execution on
 * a single-consumer channel. Every registered trigger is mirrored in the job
 * store and re-armed on the next start, so pending jobs survive a restart.
 */
@Slf4j
@Component
public class JobSchedulerEngine {

    private static final TypeReference<List<Object>> ARGS_TYPE = new TypeReference<>() { };
    private static final TypeReference<Map<String, Object>> KWARGS_TYPE = new TypeReference<>() { };

    private final JobStore jobStore;
    private final TaskRegistry taskRegistry;
    private final ObjectMapper objectMapper;
    private final Scheduler timerScheduler;
    private final Scheduler taskScheduler;

    private final Map<String, ScheduledTrigger> triggers = new ConcurrentHashMap<>();
    private final Set<String> runningJobs = ConcurrentHashMap.newKeySet();
    private final Sinks.Many<JobEvent> events = Sinks.many().unicast().onBackpressureBuffer();
    private final Object emitLock = new Object();

    private final ReentrantLock startLock = new ReentrantLock();
    private volatile EngineState state = EngineState.UNINITIALIZED;
    private Mono<Void> startup;

    @Autowired
    public JobSchedulerEngine(JobStore jobStore, TaskRegistry taskRegistry, ObjectMapper objectMapper) {
        this(jobStore, taskRegistry, objectMapper, Schedulers.parallel(), Schedulers.boundedElastic());
    }

    public JobSchedulerEngine(JobStore jobStore, TaskRegistry taskRegistry, ObjectMapper objectMapper,
                              Scheduler timerScheduler, Scheduler taskScheduler) {
        this.jobStore = jobStore;
        this.taskRegistry = taskRegistry;
        this.objectMapper = objectMapper;
        this.timerScheduler = timerScheduler;
        this.taskScheduler = taskScheduler;
    }

    /**
     * Start the engine. Idempotent: while starting or running this is a no-op,
     * and concurrent callers share the same startup.
     *
     * @return Mono that completes once the engine is running
     */
    public Mono<Void> start() {
        return Mono.defer(() -> {
            startLock.lock();
            try {
                if (state == EngineState.RUNNING) {
                    return Mono.empty();
                }
                if (state != EngineState.STARTING) {
                    EngineState previous = state;
                    state = EngineState.STARTING;
                    log.info("Starting scheduler engine (was {})", previous);
                    startup = recoverTriggers()
                        .doOnSuccess(this::markRunning)
                        .doOnError(e -> markStartFailed(previous, e))
                        .then()
                        .cache();
                }
                return startup;
            } finally {
                startLock.unlock();
            }
        });
    }

    /**
     * Stop the engine if it is running. Armed timers are disposed; their
     * mirrors stay in the store and are re-armed on the next start. Tasks
     * already executing are not interrupted.
     *
     * @return true if the engine was running
     */
    public boolean shutdown() {
        startLock.lock();
        try {
            if (state != EngineState.RUNNING) {
                return false;
            }
            state = EngineState.STOPPED;
            triggers.values().forEach(ScheduledTrigger::disarm);
            int dropped = triggers.size();
            triggers.clear();
            log.info("Scheduler engine stopped, {} pending triggers kept for recovery", dropped);
            return true;
        } finally {
            startLock.unlock();
        }
    }

    public EngineState getState() {
        return state;
    }

    public boolean isRunning() {
        return state == EngineState.RUNNING;
    }

    /**
     * Register a trigger. An existing trigger with the same job id is replaced.
     *
     * @param trigger trigger to register
     * @return Mono with the registered trigger, once its mirror is committed
     */
    public Mono<ScheduledTrigger> add(ScheduledTrigger trigger) {
        return Mono.defer(() -> {
            if (!isRunning()) {
                return Mono.error(new SchedulerNotInitializedException(
                    "Scheduler engine is not running (state " + state + ")"));
            }
            return Mono.fromCallable(() -> toMirror(trigger))
                .flatMap(jobStore::saveTrigger)
                .then(Mono.fromRunnable(() -> register(trigger)))
                .thenReturn(trigger);
        });
    }

    /**
     * Get the trigger of a job if it has not fired or been removed yet.
     */
    public Optional<ScheduledTrigger> get(String jobId) {
        return Optional.ofNullable(triggers.get(jobId))
            .filter(trigger -> trigger.getState() == TriggerState.SCHEDULED);
    }

    /**
     * Remove a pending trigger. No-op if it already fired or does not exist.
     *
     * @param jobId job identifier
     * @return Mono with true if a pending trigger was removed
     */
    public Mono<Boolean> remove(String jobId) {
        return Mono.defer(() -> {
            ScheduledTrigger trigger = triggers.get(jobId);
            if (trigger == null || !trigger.transition(TriggerState.SCHEDULED, TriggerState.REMOVED)) {
                return Mono.just(false);
            }
            trigger.disarm();
            triggers.remove(jobId, trigger);
            log.info("Removed pending trigger for job {}", jobId);
            return jobStore.deleteTrigger(jobId, trigger.getCreatedAt()).thenReturn(true);
        });
    }

    /**
     * Ownership-scoped lookup. The durable record is authoritative for status.
     */
    public Mono<Job> lookupJob(String jobId, String ownerFilter) {
        return jobStore.lookup(jobId, ownerFilter);
    }

    /**
     * Ids of jobs whose trigger is still waiting to fire.
     */
    public Set<String> pendingJobIds() {
        return triggers.values().stream()
            .filter(trigger -> trigger.getState() == TriggerState.SCHEDULED)
            .map(ScheduledTrigger::getJobId)
            .collect(Collectors.toUnmodifiableSet());
    }

    public int pendingCount() {
        return pendingJobIds().size();
    }

    /**
     * Lifecycle events in emission order. Single subscriber only.
     */
    public Flux<JobEvent> events() {
        return events.asFlux();
    }

    private Mono<Long> recoverTriggers() {
        return jobStore.loadTriggers()
            .map(this::restore)
            .doOnNext(this::register)
            .count()
            .doOnSuccess(count -> {
                if (count > 0) {
                    log.info("Recovered {} pending triggers from the job store", count);
                }
            });
    }

    private void markRunning(Long recovered) {
        startLock.lock();
        try {
            state = EngineState.RUNNING;
            log.info("Scheduler engine running");
        } finally {
            startLock.unlock();
        }
    }

    private void markStartFailed(EngineState previous, Throwable error) {
        startLock.lock();
        try {
            state = previous;
            startup = null;
            log.error("Failed to start scheduler engine: {}", error.getMessage(), error);
        } finally {
            startLock.unlock();
        }
    }

    private void register(ScheduledTrigger trigger) {
        ScheduledTrigger previous = triggers.put(trigger.getJobId(), trigger);
        if (previous != null && previous != trigger
            && previous.transition(TriggerState.SCHEDULED, TriggerState.REMOVED)) {
            previous.disarm();
            log.info("Replaced existing trigger for job {}", trigger.getJobId());
        }
        trigger.arm(Mono.delay(trigger.delayFrom(Instant.now()), timerScheduler)
            .subscribe(tick -> fire(trigger),
                e -> log.error("Timer failed for job {}: {}", trigger.getJobId(), e.getMessage(), e)));
        log.debug("Armed {}", trigger);
    }

    private void fire(ScheduledTrigger trigger) {
        String jobId = trigger.getJobId();
        if (!trigger.transition(TriggerState.SCHEDULED, TriggerState.FIRING)) {
            log.debug("Trigger for job {} is no longer scheduled, not firing", jobId);
            return;
        }

        // A replacement registered meanwhile owns the mirror row from now on
        Mono<Void> dropMirror = triggers.remove(jobId, trigger)
            ? jobStore.deleteTrigger(jobId, trigger.getCreatedAt()).onErrorResume(e -> {
                log.warn("Failed to delete trigger mirror for job {}: {}", jobId, e.getMessage());
                return Mono.empty();
            })
            : Mono.empty();

        if (!runningJobs.add(jobId)) {
            log.warn("Job {} is still running, coalescing overlapping fire", jobId);
            trigger.transition(TriggerState.FIRING, TriggerState.REMOVED);
            dropMirror.subscribe();
            return;
        }

        dropMirror
            .then(execute(trigger))
            .doFinally(signal -> runningJobs.remove(jobId))
            .subscribe(this::publish,
                e -> log.error("Unexpected error while firing job {}", jobId, e));
    }

    private Mono<JobEvent> execute(ScheduledTrigger trigger) {
        String jobId = trigger.getJobId();
        return Mono.fromCallable(() -> {
                JobTask task = trigger.getTask();
                if (task == null) {
                    throw new IllegalStateException(
                        "Task reference '" + trigger.getTaskName() + "' cannot be resolved");
                }
                log.info("Executing job {} ({})", jobId, trigger.getName());
                return Optional.ofNullable(task.execute(trigger.getArgs(), trigger.getKwargs()));
            })
            .subscribeOn(taskScheduler)
            .<JobEvent>map(result -> {
                trigger.transition(TriggerState.FIRING, TriggerState.FIRED);
                return new JobExecutedEvent(jobId, result.orElse(null));
            })
            .onErrorResume(e -> {
                trigger.transition(TriggerState.FIRING, TriggerState.ERRORED);
                log.error("Job {} raised an exception: {}", jobId, e.getMessage());
                return Mono.just(new JobErrorEvent(jobId, e));
            });
    }

    private void publish(JobEvent event) {
        synchronized (emitLock) {
            Sinks.EmitResult result = events.tryEmitNext(event);
            if (result.isFailure()) {
                log.error("Dropped {} for job {}: {}", event.getClass().getSimpleName(), event.getJobId(), result);
            }
        }
    }

    private JobTrigger toMirror(ScheduledTrigger trigger) {
        JsonNode args;
        JsonNode kwargs;
        try {
            args = objectMapper.valueToTree(trigger.getArgs());
            kwargs = objectMapper.valueToTree(trigger.getKwargs());
        } catch (IllegalArgumentException e) {
            if (trigger.isRecoverable()) {
                throw new IllegalArgumentException(
                    "Arguments of job " + trigger.getJobId() + " are not JSON-serializable", e);
            }
            log.warn("Arguments of job {} are not JSON-serializable, mirroring without them", trigger.getJobId());
            args = null;
            kwargs = null;
        }
        return JobTrigger.builder()
            .jobId(trigger.getJobId())
            .name(trigger.getName())
            .taskName(trigger.getTaskName())
            .fireTime(trigger.getFireTime())
            .args(args)
            .kwargs(kwargs)
            .createdAt(trigger.getCreatedAt())
            .build();
    }

    private ScheduledTrigger restore(JobTrigger mirror) {
        JobTask task = taskRegistry.resolve(mirror.getTaskName()).orElse(null);
        if (task == null) {
            log.warn("Recovered trigger for job {} references unknown task '{}'", mirror.getJobId(), mirror.getTaskName());
        }
        return ScheduledTrigger.builder()
            .jobId(mirror.getJobId())
            .name(mirror.getName())
            .task(task)
            .taskName(mirror.getTaskName())
            .fireTime(mirror.getFireTime())
            .args(mirror.getArgs() == null ? List.of() : objectMapper.convertValue(mirror.getArgs(), ARGS_TYPE))
            .kwargs(mirror.getKwargs() == null ? Map.of() : objectMapper.convertValue(mirror.getKwargs(), KWARGS_TYPE))
            .createdAt(mirror.getCreatedAt())
            .build();
    }
}
