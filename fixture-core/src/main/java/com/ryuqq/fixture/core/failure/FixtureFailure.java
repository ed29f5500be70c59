package com.ryuqq.fixture.core.failure;

import java.util.Optional;

/**
 * 분류된 Fixture 루틴 실패.
 *
 * <p>Setup 루틴 또는 strict teardown이 실패했을 때 사용자 코드의 예외를 감싸서
 * 호출자에게 전달하는 구조화된 실패입니다. 생성 후 변경되지 않습니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>outcome: {@link FixtureOutcome#FAILED} 또는 {@link FixtureOutcome#INCONCLUSIVE}</li>
 *   <li>message: Scope 타입 이름, 루틴 이름, 원래 예외 타입과 메시지를 포함</li>
 *   <li>stackTraceInfo: 원래 예외에서 추출한 스택 트레이스 (선택)</li>
 *   <li>cause: 원래 예외 (진단용)</li>
 * </ul>
 *
 * <p>Setup 실패는 Coordinator에 캐시되며, 이후 모든 호출자에게 <strong>같은 인스턴스</strong>가
 * 다시 던져집니다.</p>
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public class FixtureFailure extends RuntimeException {

    private final FixtureOutcome outcome;
    private final StackTraceInfo stackTraceInfo;

    /**
     * 생성자.
     *
     * @param outcome 분류 결과
     * @param message 실패 메시지
     * @param stackTraceInfo 스택 트레이스 정보 (null 가능)
     * @param cause 원래 예외 (null 가능)
     * @throws IllegalArgumentException outcome 또는 message가 null인 경우
     */
    public FixtureFailure(FixtureOutcome outcome, String message, StackTraceInfo stackTraceInfo, Throwable cause) {
        super(message, cause);
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        this.outcome = outcome;
        this.stackTraceInfo = stackTraceInfo;
    }

    /**
     * 분류 결과 조회.
     *
     * @return FAILED 또는 INCONCLUSIVE
     */
    public FixtureOutcome getOutcome() {
        return outcome;
    }

    /**
     * 원래 예외에서 추출한 스택 트레이스 조회.
     *
     * @return 스택 트레이스 정보 (없으면 empty)
     */
    public Optional<StackTraceInfo> getStackTraceInfo() {
        return Optional.ofNullable(stackTraceInfo);
    }

    /**
     * 결론 없음으로 분류되었는지 확인.
     *
     * @return INCONCLUSIVE인 경우 true
     */
    public boolean isInconclusive() {
        return outcome == FixtureOutcome.INCONCLUSIVE;
    }
}
