/**
 * Synchronous caller-input errors.
 *
 * <p>{@link com.ryuqq.toolbox.core.error.CatalogException} subclasses are thrown before any
 * request reaches the worker. Process failures are never thrown; they travel inside
 * {@link com.ryuqq.toolbox.core.outcome.ExecutionResult}.</p>
 *
 * @since 1.0.0
 * @author Toolbox Team
 */
package com.ryuqq.toolbox.core.error;
