/**
 * Execution coordinator port.
 *
 * <p>{@link com.ryuqq.toolbox.application.coordinator.ExecutionCoordinator} is implemented in
 * {@code toolbox-adapter-runner} by a single-worker, FIFO coordinator.</p>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (SingleWorkerCoordinator, ProcessCommandRunner)
 *   ↓ implements
 * application (ExecutionCoordinator, CatalogSession)
 *   ↓ depends on
 * core (model, navigation, cache, contract, spi)
 * </pre>
 *
 * @since 1.0.0
 * @author Toolbox Team
 */
package com.ryuqq.toolbox.application.coordinator;
