package com.whereq.tempo.task;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves string task references to {@link JobTask} instances.
 * Every {@code JobTask} bean is registered under its bean name.
 */
@Slf4j
@Component
public class TaskRegistry {

    private final Map<String, JobTask> tasks = new ConcurrentHashMap<>();

    public TaskRegistry(Map<String, JobTask> taskBeans) {
        tasks.putAll(taskBeans);
        log.info("Registered {} job tasks: {}", tasks.size(), tasks.keySet());
    }

    public Optional<JobTask> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(name));
    }

    public void register(String name, JobTask task) {
        JobTask previous = tasks.put(name, task);
        if (previous != null) {
            log.warn("Task {} was already registered, replaced", name);
        }
    }

    public Set<String> names() {
        return Set.copyOf(tasks.keySet());
    }
}
