package com.ryuqq.fixture.core.routine;

import com.ryuqq.fixture.core.model.RoutineDescriptor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SetupRoutine / TeardownRoutine 팩토리 테스트.
 *
 * @author Fixture Team
 * @since 1.0.0
 */
class SetupRoutineTest {

    private static final RoutineDescriptor DESCRIPTOR = RoutineDescriptor.of("com.example.Suite", "init");

    @Test
    void of_액션에_context를_그대로_전달() throws Exception {
        // given
        List<String> received = new ArrayList<>();
        SetupRoutine<String> routine = SetupRoutine.of(DESCRIPTOR, received::add);

        // when
        routine.invoke("run-1");

        // then
        assertThat(received).containsExactly("run-1");
        assertThat(routine.descriptor()).isEqualTo(DESCRIPTOR);
        assertThat(routine).hasToString("SetupRoutine{com.example.Suite.init}");
    }

    @Test
    void of_액션의_예외를_그대로_전파() {
        SetupRoutine<String> routine = SetupRoutine.of(DESCRIPTOR, ctx -> {
            throw new java.io.IOException("no space");
        });

        assertThatThrownBy(() -> routine.invoke("ctx"))
            .isInstanceOf(java.io.IOException.class)
            .hasMessage("no space");
    }

    @Test
    void of_null_인자는_예외() {
        assertThatThrownBy(() -> SetupRoutine.of(null, ctx -> { }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("descriptor cannot be null");
        assertThatThrownBy(() -> SetupRoutine.<String>of(DESCRIPTOR, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("action cannot be null");
    }

    @Test
    void teardown_of_액션_실행() throws Exception {
        // given
        List<String> calls = new ArrayList<>();
        TeardownRoutine routine = TeardownRoutine.of(DESCRIPTOR, () -> calls.add("cleanup"));

        // when
        routine.invoke();
        routine.invoke();

        // then
        assertThat(calls).containsExactly("cleanup", "cleanup");
        assertThat(routine).hasToString("TeardownRoutine{com.example.Suite.init}");
    }

    @Test
    void teardown_of_null_인자는_예외() {
        assertThatThrownBy(() -> TeardownRoutine.of(DESCRIPTOR, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("action cannot be null");
    }
}
