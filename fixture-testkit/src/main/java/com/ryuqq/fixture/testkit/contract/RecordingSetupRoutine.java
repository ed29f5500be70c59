package com.ryuqq.fixture.testkit.contract;

import com.ryuqq.fixture.core.model.RoutineDescriptor;
import com.ryuqq.fixture.core.routine.SetupRoutine;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 호출을 기록하는 테스트용 SetupRoutine.
 *
 * <p><strong>기능:</strong></p>
 * <ul>
 *   <li>호출 횟수와 전달받은 컨텍스트 기록</li>
 *   <li>{@link #failingWith(Exception)}: 호출 시 지정한 예외 발생</li>
 *   <li>{@link #blockUntilReleased()}: {@link #release()} 전까지 실행을 붙잡아 경합 구간 재현</li>
 * </ul>
 *
 * @param <C> 실행 컨텍스트 타입
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public class RecordingSetupRoutine<C> implements SetupRoutine<C> {

    private static final long MAX_BLOCK_SECONDS = 10;

    private final RoutineDescriptor descriptor;
    private final AtomicInteger invocationCount = new AtomicInteger();
    private final List<C> contexts = new CopyOnWriteArrayList<>();
    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch released = new CountDownLatch(1);

    private volatile Exception failure;
    private volatile boolean blocking;

    /**
     * 생성자.
     *
     * @param descriptor 선언 정보
     */
    public RecordingSetupRoutine(RoutineDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    /**
     * 호출 시 예외를 던지도록 설정.
     *
     * @param failure 던질 예외
     * @return this
     */
    public RecordingSetupRoutine<C> failingWith(Exception failure) {
        this.failure = failure;
        return this;
    }

    /**
     * {@link #release()}가 호출될 때까지 실행을 붙잡도록 설정.
     *
     * @return this
     */
    public RecordingSetupRoutine<C> blockUntilReleased() {
        this.blocking = true;
        return this;
    }

    /**
     * 붙잡힌 실행 해제.
     */
    public void release() {
        released.countDown();
    }

    /**
     * 루틴 실행이 시작될 때까지 대기.
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 시간 내에 시작되었으면 true
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public boolean awaitEntered(long timeout, TimeUnit unit) throws InterruptedException {
        return entered.await(timeout, unit);
    }

    @Override
    public RoutineDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public void invoke(C context) throws Exception {
        invocationCount.incrementAndGet();
        contexts.add(context);
        entered.countDown();

        if (blocking && !released.await(MAX_BLOCK_SECONDS, TimeUnit.SECONDS)) {
            throw new IllegalStateException("Setup routine was never released");
        }

        Exception toThrow = this.failure;
        if (toThrow != null) {
            throw toThrow;
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

    /**
     * 전달받은 컨텍스트 목록 조회.
     *
     * @return 호출 순서대로의 컨텍스트
     */
    public List<C> contexts() {
        return List.copyOf(contexts);
    }
}
