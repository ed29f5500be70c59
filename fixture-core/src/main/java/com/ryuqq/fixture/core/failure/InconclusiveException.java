package com.ryuqq.fixture.core.failure;

/**
 * 결론 없음(inconclusive)을 알리는 예외.
 *
 * <p>Setup 루틴이 이 예외를 던지면 Scope는 실패가 아닌
 * {@link FixtureOutcome#INCONCLUSIVE}로 분류됩니다
 * (예: 필요한 외부 리소스가 없는 환경).</p>
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public class InconclusiveException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 사유
     */
    public InconclusiveException(String message) {
        super(message);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 사유
     * @param cause 원인
     */
    public InconclusiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
