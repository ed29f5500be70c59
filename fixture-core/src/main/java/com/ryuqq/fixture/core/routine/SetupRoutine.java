package com.ryuqq.fixture.core.routine;

import com.ryuqq.fixture.core.model.RoutineDescriptor;

/**
 * Scope 단위 Setup 루틴 SPI.
 *
 * <p>외부 Discovery 단계(리플렉션, 어노테이션 스캔 등)가 찾아낸 setup 루틴을 표현합니다.
 * Coordinator는 루틴을 어떻게 찾았는지 알 필요가 없으며, 실행 컨텍스트를 그대로 전달하여
 * 호출할 뿐입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * SetupRoutine<TestRunContext> setup = SetupRoutine.of(
 *     RoutineDescriptor.of(OrderServiceTests.class, "startDatabase"),
 *     context -> database.start(context.workDir())
 * );
 * coordinator.setSetupRoutine(setup);
 * }</pre>
 *
 * @param <C> 실행 컨텍스트 타입 (Coordinator에게는 불투명)
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public interface SetupRoutine<C> {

    /**
     * 루틴 선언 정보 조회.
     *
     * @return 선언 정보
     */
    RoutineDescriptor descriptor();

    /**
     * 루틴 실행.
     *
     * @param context 실행 컨텍스트 (null 아님)
     * @throws Exception 루틴이 실패한 경우 (어떤 예외든 Coordinator가 분류합니다)
     */
    void invoke(C context) throws Exception;

    /**
     * 함수형 액션을 SetupRoutine으로 감싸기.
     *
     * @param descriptor 선언 정보
     * @param action 실행할 액션
     * @param <C> 실행 컨텍스트 타입
     * @return SetupRoutine 인스턴스
     * @throws IllegalArgumentException descriptor 또는 action이 null인 경우
     */
    static <C> SetupRoutine<C> of(RoutineDescriptor descriptor, Action<C> action) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return new SetupRoutine<>() {
            @Override
            public RoutineDescriptor descriptor() {
                return descriptor;
            }

            @Override
            public void invoke(C context) throws Exception {
                action.run(context);
            }

            @Override
            public String toString() {
                return "SetupRoutine{" + descriptor + '}';
            }
        };
    }

    /**
     * Setup 액션.
     *
     * @param <C> 실행 컨텍스트 타입
     */
    @FunctionalInterface
    interface Action<C> {

        /**
         * 액션 실행.
         *
         * @param context 실행 컨텍스트
         * @throws Exception 실패 시
         */
        void run(C context) throws Exception;
    }
}
