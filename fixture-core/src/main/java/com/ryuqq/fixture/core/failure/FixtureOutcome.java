package com.ryuqq.fixture.core.failure;

/**
 * Fixture 루틴 실패의 분류 결과.
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public enum FixtureOutcome {

    /**
     * 실패. Scope의 모든 테스트가 실패로 보고됩니다.
     */
    FAILED,

    /**
     * 결론 없음. 루틴이 {@link InconclusiveException}으로 실행을 중단한 경우입니다.
     */
    INCONCLUSIVE
}
