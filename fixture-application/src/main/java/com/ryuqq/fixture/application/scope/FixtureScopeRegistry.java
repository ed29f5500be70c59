package com.ryuqq.fixture.application.scope;

import com.ryuqq.fixture.core.coordinator.CoordinatorConfig;
import com.ryuqq.fixture.core.coordinator.FixtureLifecycleCoordinator;
import com.ryuqq.fixture.core.failure.FixtureFailure;
import com.ryuqq.fixture.core.model.ScopeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 테스트 실행(run) 단위의 Scope 레지스트리.
 *
 * <p>Scope당 하나의 {@link FixtureLifecycleCoordinator}를 생성하고, Scope 실행이 끝나면
 * teardown을 실행한 뒤 폐기합니다. 프로세스 전역 상태가 아니므로 같은 프로세스에서
 * 여러 번 실행(run)하더라도 Scope 상태가 새어 나가지 않습니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * open(scopeId)        → Coordinator 생성 (이미 열려 있으면 기존 인스턴스)
 *   ... Discovery 단계가 루틴 등록, 테스트들이 ensureSetupRan() 호출 ...
 * close(scopeId)       → lenient teardown 후 제거 (진단 문자열 반환)
 * closeStrict(scopeId) → strict teardown 후 제거 (실패 시 FixtureFailure)
 * closeAll()           → 남은 모든 Scope를 lenient 방식으로 정리
 * </pre>
 *
 * <p><strong>동시성:</strong> ConcurrentHashMap 기반으로 여러 워커 스레드에서 안전하게
 * 호출할 수 있습니다. 같은 Scope에 대한 동시 open은 같은 Coordinator를 반환합니다.</p>
 *
 * @param <C> 실행 컨텍스트 타입
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public final class FixtureScopeRegistry<C> {

    private static final Logger log = LoggerFactory.getLogger(FixtureScopeRegistry.class);

    private final CoordinatorConfig config;
    private final ConcurrentHashMap<ScopeId, FixtureLifecycleCoordinator<C>> coordinators;

    /**
     * 생성자 (기본 Coordinator 설정).
     */
    public FixtureScopeRegistry() {
        this(new CoordinatorConfig());
    }

    /**
     * 생성자.
     *
     * @param config 새로 생성되는 Coordinator에 적용할 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public FixtureScopeRegistry(CoordinatorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.coordinators = new ConcurrentHashMap<>();
    }

    /**
     * Scope 열기.
     *
     * <p>Scope가 처음 로드될 때 Coordinator를 생성합니다. 이미 열려 있으면 기존 Coordinator를 반환합니다.</p>
     *
     * @param scopeId Scope 식별자
     * @return Scope의 Coordinator
     * @throws IllegalArgumentException scopeId가 null인 경우
     */
    public FixtureLifecycleCoordinator<C> open(ScopeId scopeId) {
        validateScopeId(scopeId);
        return coordinators.computeIfAbsent(scopeId, id -> {
            log.debug("Opening fixture scope {}", id);
            return new FixtureLifecycleCoordinator<>(id, config);
        });
    }

    /**
     * 열린 Scope의 Coordinator 조회.
     *
     * @param scopeId Scope 식별자
     * @return Coordinator (열려 있지 않으면 empty)
     * @throws IllegalArgumentException scopeId가 null인 경우
     */
    public Optional<FixtureLifecycleCoordinator<C>> find(ScopeId scopeId) {
        validateScopeId(scopeId);
        return Optional.ofNullable(coordinators.get(scopeId));
    }

    /**
     * Scope 닫기 (lenient teardown).
     *
     * <p>Coordinator를 레지스트리에서 제거한 뒤 teardown을 실행합니다.
     * 제거가 먼저 일어나므로 같은 Scope에 대한 중복 close는 teardown을 다시 실행하지 않습니다.</p>
     *
     * @param scopeId Scope 식별자
     * @return teardown 실패 진단 문자열 (성공, teardown 없음, 열리지 않은 Scope면 empty)
     * @throws IllegalArgumentException scopeId가 null인 경우
     */
    public Optional<String> close(ScopeId scopeId) {
        validateScopeId(scopeId);
        FixtureLifecycleCoordinator<C> coordinator = coordinators.remove(scopeId);
        if (coordinator == null) {
            log.debug("Fixture scope {} is not open, nothing to close", scopeId);
            return Optional.empty();
        }
        Optional<String> diagnostic = coordinator.runTeardown();
        log.debug("Closed fixture scope {}", scopeId);
        return diagnostic;
    }

    /**
     * Scope 닫기 (strict teardown).
     *
     * @param scopeId Scope 식별자
     * @throws IllegalArgumentException scopeId가 null인 경우
     * @throws FixtureFailure teardown 루틴이 실패한 경우 (Scope는 이미 제거된 상태)
     */
    public void closeStrict(ScopeId scopeId) {
        validateScopeId(scopeId);
        FixtureLifecycleCoordinator<C> coordinator = coordinators.remove(scopeId);
        if (coordinator == null) {
            log.debug("Fixture scope {} is not open, nothing to close", scopeId);
            return;
        }
        coordinator.runTeardownStrict();
        log.debug("Closed fixture scope {}", scopeId);
    }

    /**
     * 열린 모든 Scope 닫기 (lenient teardown).
     *
     * <p>하나의 teardown 실패가 다른 Scope의 teardown을 방해하지 않습니다.</p>
     *
     * @return 실패한 Scope별 진단 문자열 (닫은 순서 유지)
     */
    public Map<ScopeId, String> closeAll() {
        List<ScopeId> scopeIds = new ArrayList<>(coordinators.keySet());
        Map<ScopeId, String> diagnostics = new LinkedHashMap<>();

        for (ScopeId scopeId : scopeIds) {
            close(scopeId).ifPresent(diagnostic -> diagnostics.put(scopeId, diagnostic));
        }

        if (!diagnostics.isEmpty()) {
            log.warn("{} of {} fixture scopes reported teardown failures", diagnostics.size(), scopeIds.size());
        }
        return diagnostics;
    }

    /**
     * 열린 Scope 수.
     *
     * @return 열린 Scope 수
     */
    public int openScopeCount() {
        return coordinators.size();
    }

    private void validateScopeId(ScopeId scopeId) {
        if (scopeId == null) {
            throw new IllegalArgumentException("scopeId cannot be null");
        }
    }
}
