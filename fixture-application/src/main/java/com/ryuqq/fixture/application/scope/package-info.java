/**
 * Fixture scope lifecycle package.
 *
 * <p>{@link com.ryuqq.fixture.application.scope.FixtureScopeRegistry} owns one
 * coordinator per scope for the duration of a single test run: created when the scope
 * is first loaded, torn down and discarded when the scope's run completes.</p>
 *
 * @since 1.0.0
 * @author Fixture Team
 */
package com.ryuqq.fixture.application.scope;
