/**
 * Fixture lifecycle coordination package.
 *
 * <p>{@link com.ryuqq.fixture.core.coordinator.FixtureLifecycleCoordinator} guarantees
 * that a scope's setup routine runs exactly once across concurrent callers, that every
 * caller observes the same outcome, and reports teardown failures under a lenient or a
 * strict contract.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * FixtureLifecycleCoordinator&lt;RunContext&gt; coordinator =
 *     new FixtureLifecycleCoordinator&lt;&gt;(ScopeId.of("com.example.OrderTests"));
 * coordinator.setSetupRoutine(setup);
 * coordinator.setTeardownRoutine(teardown);
 *
 * // every worker, before each test of the scope
 * coordinator.ensureSetupRan(context);
 *
 * // after the last test
 * coordinator.runTeardown().ifPresent(warnings::add);
 * </pre>
 *
 * @since 1.0.0
 * @author Fixture Team
 */
package com.ryuqq.fixture.core.coordinator;
