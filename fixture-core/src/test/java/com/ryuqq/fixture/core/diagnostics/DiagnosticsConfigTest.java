package com.ryuqq.fixture.core.diagnostics;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DiagnosticsConfig 테스트.
 *
 * @author Fixture Team
 * @since 1.0.0
 */
class DiagnosticsConfigTest {

    @Test
    void 기본값() {
        DiagnosticsConfig config = new DiagnosticsConfig();

        assertThat(config.maxStackFrames()).isEqualTo(50);
        assertThat(config.excludedFrames()).isEqualTo(DiagnosticsConfig.DEFAULT_EXCLUDED_FRAMES);
    }

    @Test
    void maxStackFrames가_양수가_아니면_예외() {
        assertThatThrownBy(() -> new DiagnosticsConfig(0, List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxStackFrames must be positive");
    }

    @Test
    void excludedFrames_null이면_예외() {
        assertThatThrownBy(() -> new DiagnosticsConfig(10, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("excludedFrames cannot be null");
    }

    @Test
    void excludedFrames는_방어적_복사() {
        List<String> frames = new ArrayList<>(List.of("java.lang.reflect."));
        DiagnosticsConfig config = new DiagnosticsConfig(10, frames);

        frames.add("com.example.");

        assertThat(config.excludedFrames()).containsExactly("java.lang.reflect.");
    }

    @Test
    void isExcluded_패키지_접두사와_클래스_이름_규칙() {
        DiagnosticsConfig config = new DiagnosticsConfig(10, List.of("java.lang.reflect.", "com.example.Runner"));

        assertThat(config.isExcluded("java.lang.reflect.Method")).isTrue();
        assertThat(config.isExcluded("com.example.Runner")).isTrue();
        assertThat(config.isExcluded("com.example.Runner$1")).isTrue();
        assertThat(config.isExcluded("com.example.RunnerTest")).isFalse();
        assertThat(config.isExcluded("com.example.Other")).isFalse();
    }

    @Test
    void with_메서드는_새_인스턴스_반환() {
        DiagnosticsConfig original = new DiagnosticsConfig();

        DiagnosticsConfig changed = original.withMaxStackFrames(5).withExcludedFrames(List.of());

        assertThat(changed.maxStackFrames()).isEqualTo(5);
        assertThat(changed.excludedFrames()).isEmpty();
        assertThat(original.maxStackFrames()).isEqualTo(50);
    }
}
