package com.ryuqq.fixture.core.routine;

import com.ryuqq.fixture.core.model.RoutineDescriptor;

/**
 * Scope 단위 Teardown 루틴 SPI.
 *
 * <p>Scope의 마지막 테스트가 끝난 뒤 외부 실행 엔진이 Coordinator를 통해 호출합니다.
 * 인자를 받지 않으며 값을 반환하지 않습니다.</p>
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public interface TeardownRoutine {

    /**
     * 루틴 선언 정보 조회.
     *
     * @return 선언 정보
     */
    RoutineDescriptor descriptor();

    /**
     * 루틴 실행.
     *
     * @throws Exception 루틴이 실패한 경우
     */
    void invoke() throws Exception;

    /**
     * 함수형 액션을 TeardownRoutine으로 감싸기.
     *
     * @param descriptor 선언 정보
     * @param action 실행할 액션
     * @return TeardownRoutine 인스턴스
     * @throws IllegalArgumentException descriptor 또는 action이 null인 경우
     */
    static TeardownRoutine of(RoutineDescriptor descriptor, Action action) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return new TeardownRoutine() {
            @Override
            public RoutineDescriptor descriptor() {
                return descriptor;
            }

            @Override
            public void invoke() throws Exception {
                action.run();
            }

            @Override
            public String toString() {
                return "TeardownRoutine{" + descriptor + '}';
            }
        };
    }

    /**
     * Teardown 액션.
     */
    @FunctionalInterface
    interface Action {

        /**
         * 액션 실행.
         *
         * @throws Exception 실패 시
         */
        void run() throws Exception;
    }
}
