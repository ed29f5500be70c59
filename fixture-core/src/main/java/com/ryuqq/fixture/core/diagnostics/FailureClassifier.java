package com.ryuqq.fixture.core.diagnostics;

import com.ryuqq.fixture.core.failure.FixtureOutcome;
import com.ryuqq.fixture.core.failure.InconclusiveException;

/**
 * Setup 루틴이 던진 예외를 {@link FixtureOutcome}으로 분류합니다.
 *
 * <p>Coordinator는 원래 예외를 한 단계 unwrap한 "실제 예외"를 전달합니다.</p>
 *
 * @author Fixture Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * 예외 분류.
     *
     * @param realError unwrap된 실제 예외 (null 아님)
     * @return 분류 결과
     */
    FixtureOutcome classify(Throwable realError);

    /**
     * 기본 분류기.
     *
     * <p>{@link InconclusiveException}은 INCONCLUSIVE, 그 외 모든 예외는 FAILED.</p>
     *
     * @return 기본 FailureClassifier
     */
    static FailureClassifier defaults() {
        return realError -> realError instanceof InconclusiveException
            ? FixtureOutcome.INCONCLUSIVE
            : FixtureOutcome.FAILED;
    }
}
