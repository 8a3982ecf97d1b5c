/**
 * In-memory catalog adapter.
 *
 * <p>This package contains in-memory implementations of the catalog SPI for testing and
 * embedding purposes.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.toolbox.adapter.inmemory.catalog.InMemoryCatalogProvider} - fixed snapshot provider with call log</li>
 *   <li>{@link com.ryuqq.toolbox.adapter.inmemory.catalog.CategoryTreeBuilder} - fluent tree construction</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li>No compatibility checks of its own: the validated snapshot is supplied by the caller</li>
 *   <li>Not a catalog source for production use</li>
 * </ul>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
package com.ryuqq.toolbox.adapter.inmemory.catalog;
