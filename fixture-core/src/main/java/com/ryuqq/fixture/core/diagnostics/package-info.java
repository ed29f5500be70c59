/**
 * Failure diagnostics package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fixture.core.diagnostics.StackTraces} - Message and stack trace extraction shared by setup and teardown</li>
 *   <li>{@link com.ryuqq.fixture.core.diagnostics.FailureClassifier} - Maps the underlying error to FAILED or INCONCLUSIVE</li>
 *   <li>{@link com.ryuqq.fixture.core.diagnostics.DiagnosticsConfig} - Frame budget and excluded frames</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fixture Team
 */
package com.ryuqq.fixture.core.diagnostics;
