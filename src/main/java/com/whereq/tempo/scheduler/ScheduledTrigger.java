package com.whereq.tempo.scheduler;

import com.whereq.tempo.task.JobTask;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import reactor.core.Disposable;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registration of when and how to run a job.
 * <p>
 * The execution constraints are fixed for every trigger: a missed fire time
 * runs immediately, duplicate due firings coalesce into one, at most one
 * instance per job id runs at a time, and registering an existing id replaces
 * the previous trigger.
 */
@Getter
@ToString(of = {"jobId", "name", "taskName", "fireTime", "state"})
public class ScheduledTrigger {

    private final String jobId;

    private final String name;

    /**
     * Resolved task; null when a persisted reference could not be resolved
     */
    private final JobTask task;

    /**
     * Registered task name, null for tasks supplied as instances
     */
    private final String taskName;

    /**
     * Null means run immediately
     */
    private final Instant fireTime;

    private final List<Object> args;

    private final Map<String, Object> kwargs;

    /**
     * Registration time, also stored on the mirror row to tell a trigger's
     * mirror apart from the one of a later replacement
     */
    private final Instant createdAt;

    private final AtomicReference<TriggerState> state = new AtomicReference<>(TriggerState.SCHEDULED);

    private volatile Disposable timer;

    @Builder
    private ScheduledTrigger(String jobId, String name, JobTask task, String taskName, Instant fireTime,
                             List<Object> args, Map<String, Object> kwargs, Instant createdAt) {
        this.jobId = jobId;
        this.name = name;
        this.task = task;
        this.taskName = taskName;
        this.fireTime = fireTime;
        this.args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        this.kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
        this.createdAt = createdAt == null ? Instant.now().truncatedTo(ChronoUnit.MILLIS) : createdAt;
    }

    public TriggerState getState() {
        return state.get();
    }

    /**
     * Delay until the fire time, zero when immediate or already missed.
     */
    public Duration delayFrom(Instant now) {
        if (fireTime == null || !fireTime.isAfter(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, fireTime);
    }

    public boolean isRecoverable() {
        return taskName != null;
    }

    boolean transition(TriggerState expected, TriggerState target) {
        return state.compareAndSet(expected, target);
    }

    void arm(Disposable timer) {
        this.timer = timer;
    }

    void disarm() {
        Disposable current = timer;
        if (current != null) {
            current.dispose();
        }
    }
}
