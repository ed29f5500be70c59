package com.ryuqq.fixture.core.failure;

/**
 * Scope 구성 오류.
 *
 * <p>하나의 Scope에 setup 또는 teardown 루틴을 두 번 등록하려 할 때 발생합니다.
 * 재시도 대상이 아니며 등록 시점에서 즉시 실패합니다.</p>
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public class FixtureConfigurationException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public FixtureConfigurationException(String message) {
        super(message);
    }
}
