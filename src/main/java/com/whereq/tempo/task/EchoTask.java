package com.whereq.tempo.task;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Returns its arguments as text. A single argument is returned as-is in
 * string form, several are joined with spaces.
 */
@Component("echo")
public class EchoTask implements JobTask {

    @Override
    public Object execute(List<Object> args, Map<String, Object> kwargs) {
        if (args.isEmpty()) {
            return kwargs.isEmpty() ? null : new LinkedHashMap<>(kwargs);
        }
        if (args.size() == 1) {
            return String.valueOf(args.get(0));
        }
        return args.stream()
            .map(String::valueOf)
            .collect(Collectors.joining(" "));
    }
}
