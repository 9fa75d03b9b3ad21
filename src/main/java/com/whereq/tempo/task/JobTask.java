package com.whereq.tempo.task;

import java.util.List;
import java.util.Map;

/**
 * Unit of work executed by the scheduler engine.
 * <p>
 * Tasks registered as Spring beans can be referenced by bean name, which is
 * what allows their triggers to survive a restart.
 */
@FunctionalInterface
public interface JobTask {

    /**
     * Execute the task.
     *
     * @param args positional arguments, never null
     * @param kwargs keyword arguments, never null
     * @return result value, serialized into the job record on completion
     * @throws Exception any failure; recorded as the job error
     */
    Object execute(List<Object> args, Map<String, Object> kwargs) throws Exception;
}
