/**
 * Fixture failure types.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fixture.core.failure.FixtureFailure} - Classified, immutable failure of a setup or strict teardown</li>
 *   <li>{@link com.ryuqq.fixture.core.failure.FixtureOutcome} - FAILED or INCONCLUSIVE</li>
 *   <li>{@link com.ryuqq.fixture.core.failure.StackTraceInfo} - Stack trace captured once from the underlying error</li>
 *   <li>{@link com.ryuqq.fixture.core.failure.InconclusiveException} - Error kind that classifies a setup as INCONCLUSIVE</li>
 *   <li>{@link com.ryuqq.fixture.core.failure.FixtureConfigurationException} - Second setup/teardown routine registered for a scope</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fixture Team
 */
package com.ryuqq.fixture.core.failure;
