/**
 * Setup state machine package.
 *
 * <pre>
 * NOT_RUN → RUNNING (first caller takes the lock)
 * RUNNING → SUCCEEDED (routine returned)
 * RUNNING → FAILED (routine threw, failure cached)
 * </pre>
 *
 * <p>{@link com.ryuqq.fixture.core.lifecycle.SetupState#advanceTo} rejects every other move.
 * Teardown has no persistent state and is not modelled here.</p>
 *
 * @since 1.0.0
 * @author Fixture Team
 */
package com.ryuqq.fixture.core.lifecycle;
