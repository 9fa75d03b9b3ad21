package com.whereq.tempo.task;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Always throws. Used to verify failure handling end to end.
 */
@Component("fail")
public class FailTask implements JobTask {

    @Override
    public Object execute(List<Object> args, Map<String, Object> kwargs) {
        String message = args.isEmpty() ? "Task failed" : String.valueOf(args.get(0));
        throw new IllegalStateException(message);
    }
}
