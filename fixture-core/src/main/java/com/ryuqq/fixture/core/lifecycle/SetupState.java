package com.ryuqq.fixture.core.lifecycle;

/**
 * Scope setup의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>NOT_RUN → RUNNING (첫 번째 호출자가 lock 획득)</li>
 *   <li>RUNNING → SUCCEEDED (루틴 정상 종료)</li>
 *   <li>RUNNING → FAILED (루틴 예외, 실패 캐시)</li>
 *   <li><strong>종료 상태에서 재실행 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * NOT_RUN
 *    │
 *    ▼ (lock 획득)
 * RUNNING
 *    │
 *    ├─► SUCCEEDED (성공)
 *    │
 *    └─► FAILED (실패)
 *
 * 금지된 전이:
 * - SUCCEEDED → RUNNING ❌
 * - FAILED → RUNNING ❌
 * - SUCCEEDED ↔ FAILED ❌
 * - * → NOT_RUN ❌
 * </pre>
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public enum SetupState {

    /**
     * 아직 실행되지 않음.
     */
    NOT_RUN,

    /**
     * 실행 중 (lock 보유).
     */
    RUNNING,

    /**
     * 성공.
     */
    SUCCEEDED,

    /**
     * 실패 (캐시됨).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태는 "setup이 실행되었음"을 의미하며 이후 모든 호출은 lock 없이 진행합니다.</p>
     *
     * @return SUCCEEDED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    /**
     * 이 상태에서 next로 넘어갈 수 있는지 확인.
     *
     * @param next 다음 상태
     * @return 허용된 전이면 true (next가 null이면 false)
     */
    public boolean canAdvanceTo(SetupState next) {
        switch (this) {
            case NOT_RUN:
                return next == RUNNING;
            case RUNNING:
                return next == SUCCEEDED || next == FAILED;
            default:
                return false;
        }
    }

    /**
     * 다음 상태로 전이.
     *
     * @param next 다음 상태
     * @return next
     * @throws IllegalArgumentException next가 null인 경우
     * @throws IllegalStateException 허용되지 않은 전이인 경우 (종료 상태에서의 전이 포함)
     */
    public SetupState advanceTo(SetupState next) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        if (!canAdvanceTo(next)) {
            throw new IllegalStateException(String.format(
                "Setup cannot move from %s to %s%s", this, next, isTerminal() ? " (setup already ran)" : ""));
        }
        return next;
    }
}
