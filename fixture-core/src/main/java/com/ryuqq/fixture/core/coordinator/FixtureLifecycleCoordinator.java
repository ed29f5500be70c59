package com.ryuqq.fixture.core.coordinator;

import com.ryuqq.fixture.core.diagnostics.FailureClassifier;
import com.ryuqq.fixture.core.diagnostics.StackTraces;
import com.ryuqq.fixture.core.failure.FixtureConfigurationException;
import com.ryuqq.fixture.core.failure.FixtureFailure;
import com.ryuqq.fixture.core.failure.FixtureOutcome;
import com.ryuqq.fixture.core.failure.InconclusiveException;
import com.ryuqq.fixture.core.failure.StackTraceInfo;
import com.ryuqq.fixture.core.lifecycle.SetupState;
import com.ryuqq.fixture.core.model.RoutineDescriptor;
import com.ryuqq.fixture.core.model.ScopeId;
import com.ryuqq.fixture.core.routine.SetupRoutine;
import com.ryuqq.fixture.core.routine.TeardownRoutine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Scope 단위 Fixture 생명주기 Coordinator.
 *
 * <p>Scope(어셈블리, 스위트)당 하나씩 생성되며, 병렬로 실행되는 테스트들이 동시에
 * setup을 요청하더라도 setup 루틴이 <strong>정확히 한 번</strong> 실행되도록 보장합니다.</p>
 *
 * <p><strong>Setup 동작 방식 (double-checked):</strong></p>
 * <ol>
 *   <li>setup 루틴 없음 → 즉시 반환</li>
 *   <li>Fast path: 상태가 종료 상태면 lock 없이 4단계로</li>
 *   <li>Slow path: lock 획득 후 재확인, 아직 실행 전이면 루틴 실행
 *       (예외는 {@link FixtureFailure}로 분류하여 캐시, finally에서 종료 상태로 전이)</li>
 *   <li>캐시된 실패가 없으면 반환, 있으면 <strong>같은 인스턴스</strong>를 던짐</li>
 * </ol>
 *
 * <p><strong>Teardown 계약:</strong></p>
 * <ul>
 *   <li>{@link #runTeardown()}: lenient. 실패 시 진단 문자열 반환, 예외를 던지지 않음</li>
 *   <li>{@link #runTeardownStrict()}: strict. 실패 시 {@link FixtureFailure}(FAILED) 던짐</li>
 *   <li>teardown은 상태가 없으므로 호출할 때마다 루틴을 다시 실행합니다</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>setup slow path, teardown, 루틴 등록은 같은 lock으로 상호 배제</li>
 *   <li>setup 완료 후의 호출은 volatile 읽기만으로 진행 (블로킹 없음)</li>
 *   <li>타임아웃/취소 없음: 루틴이 멈추면 대기 중인 호출자도 함께 대기</li>
 * </ul>
 *
 * @param <C> 실행 컨텍스트 타입 (setup 루틴에 그대로 전달)
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public final class FixtureLifecycleCoordinator<C> {

    private static final Logger log = LoggerFactory.getLogger(FixtureLifecycleCoordinator.class);

    private static final String SETUP_FAILED_FORMAT =
        "Setup routine %s.%s threw exception. %s: %s. Aborting test execution.";
    private static final String TEARDOWN_FAILED_FORMAT =
        "Teardown routine %s.%s failed. Error Message: %s. StackTrace: %s";

    private final ScopeId scopeId;
    private final StackTraces stackTraces;
    private final FailureClassifier classifier;
    private final Object lock = new Object();

    private volatile SetupRoutine<C> setupRoutine;
    private volatile TeardownRoutine teardownRoutine;
    private volatile SetupState setupState = SetupState.NOT_RUN;
    private volatile FixtureFailure setupFailure;

    /**
     * 생성자 (기본 설정).
     *
     * @param scopeId Scope 식별자
     * @throws IllegalArgumentException scopeId가 null인 경우
     */
    public FixtureLifecycleCoordinator(ScopeId scopeId) {
        this(scopeId, new CoordinatorConfig());
    }

    /**
     * 생성자.
     *
     * @param scopeId Scope 식별자
     * @param config 설정
     * @throws IllegalArgumentException scopeId 또는 config가 null인 경우
     */
    public FixtureLifecycleCoordinator(ScopeId scopeId, CoordinatorConfig config) {
        if (scopeId == null) {
            throw new IllegalArgumentException("scopeId cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.scopeId = scopeId;
        this.stackTraces = new StackTraces(config.diagnostics());
        this.classifier = config.classifier();
    }

    // ========== 루틴 등록 ==========

    /**
     * Setup 루틴 등록.
     *
     * @param routine setup 루틴
     * @throws IllegalArgumentException routine이 null인 경우
     * @throws FixtureConfigurationException 이미 setup 루틴이 등록된 경우 (기존 루틴 유지)
     */
    public void setSetupRoutine(SetupRoutine<C> routine) {
        if (routine == null) {
            throw new IllegalArgumentException("routine cannot be null");
        }
        synchronized (lock) {
            SetupRoutine<C> existing = this.setupRoutine;
            if (existing != null) {
                throw new FixtureConfigurationException(String.format(Locale.ROOT,
                    "Scope %s declares more than one setup routine. Only one is allowed per scope (already registered in %s).",
                    scopeId.getValue(), existing.descriptor().declaringTypeName()));
            }
            this.setupRoutine = routine;
        }
    }

    /**
     * Teardown 루틴 등록.
     *
     * @param routine teardown 루틴
     * @throws IllegalArgumentException routine이 null인 경우
     * @throws FixtureConfigurationException 이미 teardown 루틴이 등록된 경우 (기존 루틴 유지)
     */
    public void setTeardownRoutine(TeardownRoutine routine) {
        if (routine == null) {
            throw new IllegalArgumentException("routine cannot be null");
        }
        synchronized (lock) {
            TeardownRoutine existing = this.teardownRoutine;
            if (existing != null) {
                throw new FixtureConfigurationException(String.format(Locale.ROOT,
                    "Scope %s declares more than one teardown routine. Only one is allowed per scope (already registered in %s).",
                    scopeId.getValue(), existing.descriptor().declaringTypeName()));
            }
            this.teardownRoutine = routine;
        }
    }

    // ========== Setup ==========

    /**
     * Setup 루틴이 실행되었음을 보장.
     *
     * <p>첫 번째 호출자만 루틴을 실행하고, 동시에 들어온 다른 호출자는 실행이 끝날 때까지
     * 대기합니다. 실행 이후의 호출은 캐시된 결과를 그대로 반환하거나 던집니다.</p>
     *
     * @param context 실행 컨텍스트 (루틴에 그대로 전달)
     * @throws IllegalArgumentException setup 루틴이 있는데 context가 null인 경우
     * @throws FixtureFailure setup 루틴이 실패한 경우 (모든 호출자에게 같은 인스턴스)
     */
    public void ensureSetupRan(C context) {
        SetupRoutine<C> routine = this.setupRoutine;
        if (routine == null) {
            return;
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        // Fast path: 종료 상태 이후에는 lock 불필요
        if (!setupState.isTerminal()) {
            synchronized (lock) {
                if (!setupState.isTerminal()) {
                    runSetup(routine, context);
                }
            }
        }

        FixtureFailure failure = this.setupFailure;
        if (failure != null) {
            throw failure;
        }
    }

    private void runSetup(SetupRoutine<C> routine, C context) {
        setupState = setupState.advanceTo(SetupState.RUNNING);
        log.debug("Running setup routine {} for {}", routine.descriptor(), scopeId);
        boolean failed = false;
        try {
            routine.invoke(context);
            log.info("Setup routine {} completed for {}", routine.descriptor(), scopeId);
        } catch (Throwable t) {
            failed = true;
            restoreInterrupt(t);
            FixtureFailure failure = buildSetupFailure(routine.descriptor(), t);
            // setupState(volatile)보다 먼저 기록해야 fast path에서 항상 보임
            this.setupFailure = failure;
            warn(t, "Setup routine {} failed for {} ({})", routine.descriptor(), scopeId, failure.getOutcome());
        } finally {
            setupState = setupState.advanceTo(failed ? SetupState.FAILED : SetupState.SUCCEEDED);
        }
    }

    private FixtureFailure buildSetupFailure(RoutineDescriptor descriptor, Throwable error) {
        try {
            return toSetupFailure(descriptor, error);
        } catch (Throwable e) {
            log.warn("Could not describe setup failure for {}, caching it as {}", scopeId, FixtureOutcome.FAILED, e);
            Throwable realError = error instanceof FixtureFailure ? error : unwrap(error);
            String message = String.format(Locale.ROOT, SETUP_FAILED_FORMAT,
                descriptor.declaringTypeName(), descriptor.routineName(), realError.getClass().getName(), "");
            return new FixtureFailure(FixtureOutcome.FAILED, message, null, realError);
        }
    }

    private FixtureFailure toSetupFailure(RoutineDescriptor descriptor, Throwable error) {
        if (error instanceof FixtureFailure) {
            return (FixtureFailure) error;
        }

        Throwable realError = unwrap(error);
        FixtureOutcome outcome = classify(realError);
        String message = String.format(Locale.ROOT, SETUP_FAILED_FORMAT,
            descriptor.declaringTypeName(),
            descriptor.routineName(),
            realError.getClass().getName(),
            StackTraces.rawMessage(realError));
        StackTraceInfo stackTraceInfo = stackTraces.extract(realError);

        return new FixtureFailure(outcome, message, stackTraceInfo, realError);
    }

    private FixtureOutcome classify(Throwable realError) {
        try {
            FixtureOutcome outcome = classifier.classify(realError);
            return outcome == null ? FixtureOutcome.FAILED : outcome;
        } catch (RuntimeException e) {
            log.warn("Failure classifier threw for {}, classifying as {}", scopeId, FixtureOutcome.FAILED, e);
            return FixtureOutcome.FAILED;
        }
    }

    // ========== Teardown ==========

    /**
     * Teardown 루틴 실행 (lenient).
     *
     * <p>실패해도 예외를 던지지 않고 진단 문자열을 반환합니다.
     * 호출할 때마다 루틴을 다시 실행합니다.</p>
     *
     * @return 실패 시 진단 문자열, 성공했거나 teardown 루틴이 없으면 empty
     */
    public Optional<String> runTeardown() {
        TeardownRoutine routine = this.teardownRoutine;
        if (routine == null) {
            return Optional.empty();
        }

        synchronized (lock) {
            try {
                routine.invoke();
                log.info("Teardown routine {} completed for {}", routine.descriptor(), scopeId);
                return Optional.empty();
            } catch (Throwable t) {
                restoreInterrupt(t);
                TeardownDiagnostic diagnostic = describeTeardownFailure(routine.descriptor(), t);
                warn(diagnostic.realError(), "Teardown routine {} failed for {}", routine.descriptor(), scopeId);
                return Optional.of(diagnostic.message());
            }
        }
    }

    /**
     * Teardown 루틴 실행 (strict).
     *
     * @throws FixtureFailure teardown 루틴이 실패한 경우 (outcome은 항상 FAILED)
     */
    public void runTeardownStrict() {
        TeardownRoutine routine = this.teardownRoutine;
        if (routine == null) {
            return;
        }

        synchronized (lock) {
            try {
                routine.invoke();
                log.info("Teardown routine {} completed for {}", routine.descriptor(), scopeId);
            } catch (Throwable t) {
                restoreInterrupt(t);
                TeardownDiagnostic diagnostic = describeTeardownFailure(routine.descriptor(), t);
                warn(diagnostic.realError(), "Teardown routine {} failed for {}", routine.descriptor(), scopeId);
                throw new FixtureFailure(
                    FixtureOutcome.FAILED,
                    diagnostic.message(),
                    diagnostic.stackTraceInfo(),
                    diagnostic.realError());
            }
        }
    }

    private TeardownDiagnostic describeTeardownFailure(RoutineDescriptor descriptor, Throwable error) {
        Throwable realError = unwrap(error);
        try {
            return formatTeardownFailure(descriptor, realError, stackTraces.extract(realError));
        } catch (RuntimeException e) {
            log.warn("Could not describe teardown failure for {}", scopeId, e);
            String message = String.format(Locale.ROOT, TEARDOWN_FAILED_FORMAT,
                descriptor.simpleTypeName(), descriptor.routineName(), realError.getClass().getName(), "");
            return new TeardownDiagnostic(message, null, realError);
        }
    }

    private TeardownDiagnostic formatTeardownFailure(RoutineDescriptor descriptor, Throwable realError,
                                                     StackTraceInfo stackTraceInfo) {
        // assertion 계열은 메시지만 사용 (타입/원인 체인 생략)
        String errorMessage = isAssertion(realError)
            ? StackTraces.rawMessage(realError)
            : stackTraces.describe(realError);

        String message = String.format(Locale.ROOT, TEARDOWN_FAILED_FORMAT,
            descriptor.simpleTypeName(),
            descriptor.routineName(),
            errorMessage,
            stackTraceInfo == null ? "" : stackTraceInfo.stackTrace());

        return new TeardownDiagnostic(message, stackTraceInfo, realError);
    }

    private static boolean isAssertion(Throwable error) {
        return error instanceof AssertionError || error instanceof InconclusiveException;
    }

    private static void restoreInterrupt(Throwable error) {
        if (error instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = StackTraces.causeOf(error);
        return cause != null ? cause : error;
    }

    /**
     * 사용자 예외와 함께 warn 로그 기록.
     *
     * <p>로깅 백엔드가 예외를 렌더링하다 실패하면 예외 타입 이름만 남깁니다.</p>
     */
    private static void warn(Throwable error, String format, Object... arguments) {
        Object[] withError = Arrays.copyOf(arguments, arguments.length + 1);
        withError[arguments.length] = error;
        try {
            log.warn(format, withError);
        } catch (RuntimeException e) {
            withError[arguments.length] = error.getClass().getName();
            log.warn(format + " [{}]", withError);
        }
    }

    // ========== 조회 ==========

    /**
     * Scope 식별자 조회.
     *
     * @return Scope 식별자
     */
    public ScopeId getScopeId() {
        return scopeId;
    }

    /**
     * Setup 루틴 등록 여부.
     *
     * @return 등록되어 있으면 true
     */
    public boolean hasSetupRoutine() {
        return setupRoutine != null;
    }

    /**
     * 실행 가능한 teardown 루틴 등록 여부.
     *
     * @return 등록되어 있으면 true
     */
    public boolean hasTeardownRoutine() {
        return teardownRoutine != null;
    }

    /**
     * Setup 실행 완료 여부 (성공 또는 실패).
     *
     * @return setup 루틴이 실행되었으면 true
     */
    public boolean isSetupExecuted() {
        return setupState.isTerminal();
    }

    /**
     * 현재 setup 상태 조회.
     *
     * @return setup 상태
     */
    public SetupState getSetupState() {
        return setupState;
    }

    /**
     * 캐시된 setup 실패 조회.
     *
     * @return setup 실패 (없으면 empty)
     */
    public Optional<FixtureFailure> getSetupFailure() {
        return Optional.ofNullable(setupFailure);
    }

    @Override
    public String toString() {
        return "FixtureLifecycleCoordinator{" + scopeId.getValue() + ", setupState=" + setupState + '}';
    }

    private record TeardownDiagnostic(String message, StackTraceInfo stackTraceInfo, Throwable realError) {
    }
}
