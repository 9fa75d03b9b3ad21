package com.whereq.tempo.task;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TaskRegistryTest {

    @Test
    void resolvesBeansByName() {
        EchoTask echo = new EchoTask();
        TaskRegistry registry = new TaskRegistry(Map.of("echo", echo, "fail", new FailTask()));

        assertThat(registry.resolve("echo")).containsSame(echo);
        assertThat(registry.names()).containsExactlyInAnyOrder("echo", "fail");
    }

    @Test
    void unknownOrMissingNameResolvesToNothing() {
        TaskRegistry registry = new TaskRegistry(Map.of());

        assertThat(registry.resolve("nope")).isEmpty();
        assertThat(registry.resolve(null)).isEmpty();
    }

    @Test
    void registerReplacesExistingTask() throws Exception {
        TaskRegistry registry = new TaskRegistry(Map.of("echo", new EchoTask()));
        JobTask constant = (args, kwargs) -> "constant";

        registry.register("echo", constant);

        assertThat(registry.resolve("echo").orElseThrow().execute(List.of("x"), Map.of())).isEqualTo("constant");
    }
}
