package com.ryuqq.fixture.core.coordinator;

import com.ryuqq.fixture.core.diagnostics.DiagnosticsConfig;
import com.ryuqq.fixture.core.diagnostics.FailureClassifier;

/**
 * FixtureLifecycleCoordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>diagnostics: 스택 트레이스 추출 설정 (기본 {@link DiagnosticsConfig#DiagnosticsConfig()})</li>
 *   <li>classifier: setup 실패 분류기 (기본 {@link FailureClassifier#defaults()})</li>
 * </ul>
 *
 * @author Fixture Team
 * @since 1.0.0
 * @param diagnostics 진단 설정 (null 불가)
 * @param classifier 실패 분류기 (null 불가)
 */
public record CoordinatorConfig(DiagnosticsConfig diagnostics, FailureClassifier classifier) {

    /**
     * 기본 설정 생성자.
     */
    public CoordinatorConfig() {
        this(new DiagnosticsConfig(), FailureClassifier.defaults());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CoordinatorConfig {
        if (diagnostics == null) {
            throw new IllegalArgumentException("diagnostics cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
    }

    /**
     * diagnostics만 변경한 새 인스턴스 생성.
     *
     * @param diagnostics 새로운 진단 설정
     * @return 새 CoordinatorConfig 인스턴스
     */
    public CoordinatorConfig withDiagnostics(DiagnosticsConfig diagnostics) {
        return new CoordinatorConfig(diagnostics, this.classifier);
    }

    /**
     * classifier만 변경한 새 인스턴스 생성.
     *
     * @param classifier 새로운 분류기
     * @return 새 CoordinatorConfig 인스턴스
     */
    public CoordinatorConfig withClassifier(FailureClassifier classifier) {
        return new CoordinatorConfig(this.diagnostics, classifier);
    }
}
