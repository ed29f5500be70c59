package com.ryuqq.fixture.testkit.contract;

import com.ryuqq.fixture.core.model.RoutineDescriptor;
import com.ryuqq.fixture.core.routine.TeardownRoutine;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 호출을 기록하는 테스트용 TeardownRoutine.
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public class RecordingTeardownRoutine implements TeardownRoutine {

    private final RoutineDescriptor descriptor;
    private final AtomicInteger invocationCount = new AtomicInteger();

    private volatile Throwable failure;

    /**
     * 생성자.
     *
     * @param descriptor 선언 정보
     */
    public RecordingTeardownRoutine(RoutineDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    /**
     * 호출 시 예외를 던지도록 설정.
     *
     * <p>{@link AssertionError} 같은 Error도 지정할 수 있습니다.</p>
     *
     * @param failure 던질 예외
     * @return this
     */
    public RecordingTeardownRoutine failingWith(Throwable failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public RoutineDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public void invoke() throws Exception {
        invocationCount.incrementAndGet();

        Throwable toThrow = this.failure;
        if (toThrow instanceof Exception) {
            throw (Exception) toThrow;
        }
        if (toThrow instanceof Error) {
            throw (Error) toThrow;
        }
    }

    /**
     * 호출 횟수 조회.
     *
     * @return 호출 횟수
     */
    public int invocationCount() {
        return invocationCount.get();
    }
}
