package com.whereq.tempo.task;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EchoTaskTest {

    private final EchoTask echo = new EchoTask();

    @Test
    void singleArgumentIsReturnedAsText() {
        assertThat(echo.execute(List.of(42), Map.of())).isEqualTo("42");
    }

    @Test
    void severalArgumentsAreJoined() {
        assertThat(echo.execute(List.of("a", 1, true), Map.of())).isEqualTo("a 1 true");
    }

    @Test
    void keywordArgumentsAreReturnedWhenNoPositionalOnes() {
        assertThat(echo.execute(List.of(), Map.of("k", "v"))).isEqualTo(Map.of("k", "v"));
        assertThat(echo.execute(List.of(), Map.of())).isNull();
    }

    @Test
    void failTaskThrowsItsFirstArgument() {
        FailTask fail = new FailTask();

        assertThatThrownBy(() -> fail.execute(List.of("boom"), Map.of()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("boom");
        assertThatThrownBy(() -> fail.execute(List.of(), Map.of()))
            .hasMessage("Task failed");
    }
}
