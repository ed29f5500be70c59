/**
 * Setup/Teardown routine SPI package.
 *
 * <p>Routines are resolved by an external discovery step and handed to the coordinator
 * as small functional handles. The coordinator never uses reflection.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fixture.core.routine.SetupRoutine} - One-argument setup routine (receives the execution context)</li>
 *   <li>{@link com.ryuqq.fixture.core.routine.TeardownRoutine} - No-argument teardown routine</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fixture Team
 */
package com.ryuqq.fixture.core.routine;
