/**
 * Fixture value object package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fixture.core.model.ScopeId} - Identifier of a fixture scope (assembly, suite)</li>
 *   <li>{@link com.ryuqq.fixture.core.model.RoutineDescriptor} - Declaring type and name of a setup/teardown routine</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fixture Team
 */
package com.ryuqq.fixture.core.model;
