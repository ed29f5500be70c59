package com.ryuqq.fixture.core.diagnostics;

import java.util.List;

/**
 * 실패 진단 정보 추출 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxStackFrames: 스택 트레이스에 포함할 최대 프레임 수 (기본 50)</li>
 *   <li>excludedFrames: 스택 트레이스에서 제외할 프레임 (리플렉션, Coordinator 내부 프레임)</li>
 * </ul>
 *
 * <p><strong>excludedFrames 매칭 규칙:</strong></p>
 * <ul>
 *   <li>{@code .}으로 끝나는 항목: 패키지 접두사 (예: {@code java.lang.reflect.})</li>
 *   <li>그 외: 클래스 이름 (해당 클래스와 그 중첩/익명 클래스 {@code Name$...})</li>
 * </ul>
 *
 * @author Fixture Team
 * @since 1.0.0
 * @param maxStackFrames 최대 프레임 수 (1 이상이어야 함)
 * @param excludedFrames 제외할 프레임 패턴 목록 (null 불가)
 */
public record DiagnosticsConfig(int maxStackFrames, List<String> excludedFrames) {

    /**
     * 기본 제외 프레임.
     */
    public static final List<String> DEFAULT_EXCLUDED_FRAMES = List.of(
        "java.lang.reflect.",
        "jdk.internal.reflect.",
        "com.ryuqq.fixture.core.coordinator.FixtureLifecycleCoordinator",
        "com.ryuqq.fixture.core.routine.SetupRoutine",
        "com.ryuqq.fixture.core.routine.TeardownRoutine"
    );

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxStackFrames=50, excludedFrames={@link #DEFAULT_EXCLUDED_FRAMES}</p>
     */
    public DiagnosticsConfig() {
        this(50, DEFAULT_EXCLUDED_FRAMES);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DiagnosticsConfig {
        if (maxStackFrames <= 0) {
            throw new IllegalArgumentException(
                "maxStackFrames must be positive (current: " + maxStackFrames + ")"
            );
        }
        if (excludedFrames == null) {
            throw new IllegalArgumentException("excludedFrames cannot be null");
        }
        excludedFrames = List.copyOf(excludedFrames);
    }

    /**
     * maxStackFrames만 변경한 새 인스턴스 생성.
     *
     * @param maxStackFrames 새로운 최대 프레임 수
     * @return 새 DiagnosticsConfig 인스턴스
     */
    public DiagnosticsConfig withMaxStackFrames(int maxStackFrames) {
        return new DiagnosticsConfig(maxStackFrames, this.excludedFrames);
    }

    /**
     * excludedFrames만 변경한 새 인스턴스 생성.
     *
     * @param excludedFrames 새로운 제외 프레임 목록
     * @return 새 DiagnosticsConfig 인스턴스
     */
    public DiagnosticsConfig withExcludedFrames(List<String> excludedFrames) {
        return new DiagnosticsConfig(this.maxStackFrames, excludedFrames);
    }

    /**
     * 프레임이 제외 대상인지 확인.
     *
     * @param className 프레임의 클래스 이름
     * @return 제외 대상이면 true
     */
    public boolean isExcluded(String className) {
        for (String pattern : excludedFrames) {
            if (pattern.endsWith(".")) {
                if (className.startsWith(pattern)) {
                    return true;
                }
            } else if (className.equals(pattern) || className.startsWith(pattern + "$")) {
                return true;
            }
        }
        return false;
    }
}
