/**
 * Contract test support for fixture coordinators.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fixture.testkit.contract.AbstractCoordinatorContractTest} - Base class with a fresh registry and scope per test</li>
 *   <li>{@link com.ryuqq.fixture.testkit.contract.RecordingSetupRoutine} - Counting, optionally failing or blocking setup routine</li>
 *   <li>{@link com.ryuqq.fixture.testkit.contract.RecordingTeardownRoutine} - Counting, optionally failing teardown routine</li>
 *   <li>{@link com.ryuqq.fixture.testkit.contract.ContractContext} - Execution context handed to setup routines</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fixture Team
 */
package com.ryuqq.fixture.testkit.contract;
