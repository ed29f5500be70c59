package com.ryuqq.fixture.core.failure;

/**
 * 실패 보고용 스택 트레이스 정보.
 *
 * <p>원래 예외에서 한 번만 추출하여 보관합니다. 캐시된 실패가 여러 번 재전파되어도
 * 보고되는 트레이스는 최초(유일한) 실행 시점의 것입니다.</p>
 *
 * @param stackTrace 포맷된 스택 프레임 (줄바꿈 구분, 내부 원인 포함)
 * @param fileName 최상위 프레임의 소스 파일 이름 (선택, null 가능)
 * @param lineNumber 최상위 프레임의 줄 번호 (알 수 없으면 -1)
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public record StackTraceInfo(
    String stackTrace,
    String fileName,
    int lineNumber
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException stackTrace가 null인 경우
     */
    public StackTraceInfo {
        if (stackTrace == null) {
            throw new IllegalArgumentException("stackTrace cannot be null");
        }
        // fileName은 null 허용
        if (lineNumber < -1) {
            lineNumber = -1;
        }
    }

    /**
     * 소스 위치(파일, 줄 번호)를 알고 있는지 확인.
     *
     * @return 파일 이름과 줄 번호가 모두 있으면 true
     */
    public boolean hasLocation() {
        return fileName != null && lineNumber > 0;
    }
}
