package com.ryuqq.fixture.application.scope;

import com.ryuqq.fixture.core.coordinator.CoordinatorConfig;
import com.ryuqq.fixture.core.coordinator.FixtureLifecycleCoordinator;
import com.ryuqq.fixture.core.failure.FixtureFailure;
import com.ryuqq.fixture.core.failure.FixtureOutcome;
import com.ryuqq.fixture.core.model.RoutineDescriptor;
import com.ryuqq.fixture.core.model.ScopeId;
import com.ryuqq.fixture.core.routine.SetupRoutine;
import com.ryuqq.fixture.core.routine.TeardownRoutine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * FixtureScopeRegistry 유닛 테스트.
 *
 * @author Fixture Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class FixtureScopeRegistryTest {

    private static final ScopeId ORDERS = ScopeId.of("com.example.OrderServiceTests");
    private static final ScopeId PAYMENTS = ScopeId.of("com.example.PaymentServiceTests");

    @Mock
    private TeardownRoutine teardownRoutine;

    private FixtureScopeRegistry<String> registry;

    @BeforeEach
    void setUp() {
        registry = new FixtureScopeRegistry<>();
    }

    @Test
    void 생성자_config_null이면_예외() {
        assertThatThrownBy(() -> new FixtureScopeRegistry<String>(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
    }

    @Test
    void open_같은_Scope는_같은_Coordinator_반환() {
        // when
        FixtureLifecycleCoordinator<String> first = registry.open(ORDERS);
        FixtureLifecycleCoordinator<String> second = registry.open(ORDERS);

        // then
        assertThat(second).isSameAs(first);
        assertThat(first.getScopeId()).isEqualTo(ORDERS);
        assertThat(registry.openScopeCount()).isEqualTo(1);
        assertThat(registry.find(ORDERS)).containsSame(first);
    }

    @Test
    void open_다른_Scope는_독립된_Coordinator() {
        // when
        FixtureLifecycleCoordinator<String> orders = registry.open(ORDERS);
        FixtureLifecycleCoordinator<String> payments = registry.open(PAYMENTS);

        // then
        assertThat(orders).isNotSameAs(payments);
        assertThat(registry.openScopeCount()).isEqualTo(2);
    }

    @Test
    void null_scopeId는_예외() {
        assertThatThrownBy(() -> registry.open(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("scopeId cannot be null");
        assertThatThrownBy(() -> registry.find(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.close(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.closeStrict(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void close_teardown_실행_후_Scope_제거() throws Exception {
        // given
        when(teardownRoutine.descriptor()).thenReturn(RoutineDescriptor.of("com.example.OrderServiceTests", "cleanup"));
        registry.open(ORDERS).setTeardownRoutine(teardownRoutine);

        // when
        Optional<String> diagnostic = registry.close(ORDERS);

        // then
        assertThat(diagnostic).isEmpty();
        assertThat(registry.find(ORDERS)).isEmpty();
        verify(teardownRoutine).invoke();
    }

    @Test
    void close_두번_호출해도_teardown은_한번만_실행() throws Exception {
        // given
        when(teardownRoutine.descriptor()).thenReturn(RoutineDescriptor.of("com.example.OrderServiceTests", "cleanup"));
        registry.open(ORDERS).setTeardownRoutine(teardownRoutine);

        // when
        registry.close(ORDERS);
        Optional<String> second = registry.close(ORDERS);

        // then
        assertThat(second).isEmpty();
        verify(teardownRoutine, times(1)).invoke();
    }

    @Test
    void close_teardown_실패는_진단_문자열로_반환() throws Exception {
        // given
        when(teardownRoutine.descriptor()).thenReturn(RoutineDescriptor.of("com.example.OrderServiceTests", "cleanup"));
        doThrow(new IllegalStateException("disk full")).when(teardownRoutine).invoke();
        registry.open(ORDERS).setTeardownRoutine(teardownRoutine);

        // when
        Optional<String> diagnostic = registry.close(ORDERS);

        // then
        assertThat(diagnostic).hasValueSatisfying(message -> assertThat(message).contains("disk full"));
        assertThat(registry.openScopeCount()).isZero();
    }

    @Test
    void closeStrict_teardown_실패는_FixtureFailure이고_Scope는_제거됨() throws Exception {
        // given
        when(teardownRoutine.descriptor()).thenReturn(RoutineDescriptor.of("com.example.OrderServiceTests", "cleanup"));
        doThrow(new IllegalStateException("disk full")).when(teardownRoutine).invoke();
        registry.open(ORDERS).setTeardownRoutine(teardownRoutine);

        // when & then
        assertThatThrownBy(() -> registry.closeStrict(ORDERS))
            .isInstanceOf(FixtureFailure.class)
            .hasMessageContaining("disk full")
            .satisfies(e -> assertThat(((FixtureFailure) e).getOutcome()).isEqualTo(FixtureOutcome.FAILED));
        assertThat(registry.find(ORDERS)).isEmpty();
    }

    @Test
    void closeStrict_열리지_않은_Scope는_무시() {
        registry.closeStrict(ORDERS);

        assertThat(registry.openScopeCount()).isZero();
    }

    @Test
    void closeAll_하나의_실패가_다른_Scope_정리를_막지_않음() throws Exception {
        // given
        TeardownRoutine failing = TeardownRoutine.of(
            RoutineDescriptor.of("com.example.OrderServiceTests", "cleanup"),
            () -> {
                throw new IllegalStateException("port still bound");
            });
        List<String> cleaned = new ArrayList<>();
        TeardownRoutine succeeding = TeardownRoutine.of(
            RoutineDescriptor.of("com.example.PaymentServiceTests", "cleanup"),
            () -> cleaned.add("payments"));
        registry.open(ORDERS).setTeardownRoutine(failing);
        registry.open(PAYMENTS).setTeardownRoutine(succeeding);

        // when
        Map<ScopeId, String> diagnostics = registry.closeAll();

        // then
        assertThat(diagnostics).containsOnlyKeys(ORDERS);
        assertThat(diagnostics.get(ORDERS)).contains("port still bound");
        assertThat(cleaned).containsExactly("payments");
        assertThat(registry.openScopeCount()).isZero();
    }

    @Test
    void 새로_열린_Scope는_이전_실행의_setup_상태를_물려받지_않음() throws Exception {
        // given
        List<String> runs = new ArrayList<>();
        SetupRoutine<String> setup = SetupRoutine.of(RoutineDescriptor.of("com.example.OrderServiceTests", "init"), runs::add);

        FixtureLifecycleCoordinator<String> firstRun = registry.open(ORDERS);
        firstRun.setSetupRoutine(setup);
        firstRun.ensureSetupRan("run-1");
        registry.close(ORDERS);

        // when
        FixtureLifecycleCoordinator<String> secondRun = registry.open(ORDERS);
        secondRun.setSetupRoutine(setup);
        secondRun.ensureSetupRan("run-2");

        // then
        assertThat(secondRun).isNotSameAs(firstRun);
        assertThat(runs).containsExactly("run-1", "run-2");
    }

    @Test
    void 설정이_새로_생성되는_Coordinator에_적용됨() {
        // given
        FixtureScopeRegistry<String> custom = new FixtureScopeRegistry<>(
            new CoordinatorConfig().withClassifier(error -> FixtureOutcome.INCONCLUSIVE));
        FixtureLifecycleCoordinator<String> coordinator = custom.open(ORDERS);
        coordinator.setSetupRoutine(SetupRoutine.of(RoutineDescriptor.of("com.example.OrderServiceTests", "init"), ctx -> {
            throw new IllegalStateException("boom");
        }));

        // when & then
        assertThatThrownBy(() -> coordinator.ensureSetupRan("ctx"))
            .isInstanceOf(FixtureFailure.class)
            .satisfies(e -> assertThat(((FixtureFailure) e).getOutcome()).isEqualTo(FixtureOutcome.INCONCLUSIVE));
    }

    @Test
    void 동시_open은_Scope당_하나의_Coordinator만_생성() throws Exception {
        // given
        int threadCount = 10;
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<FixtureLifecycleCoordinator<String>>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < threadCount; i++) {
            futures.add(executorService.submit(() -> {
                startGate.await();
                return registry.open(ORDERS);
            }));
        }
        startGate.countDown();

        Set<FixtureLifecycleCoordinator<String>> distinct = new HashSet<>();
        for (Future<FixtureLifecycleCoordinator<String>> future : futures) {
            distinct.add(future.get(5, TimeUnit.SECONDS));
        }
        executorService.shutdown();

        // then
        assertThat(distinct).hasSize(1);
        assertThat(registry.openScopeCount()).isEqualTo(1);
    }
}
