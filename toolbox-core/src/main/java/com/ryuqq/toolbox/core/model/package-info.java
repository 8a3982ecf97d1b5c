/**
 * Catalog model package.
 *
 * <p>Immutable value objects describing one loaded catalog.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.toolbox.core.model.NodeId} - node identity, unique within a snapshot</li>
 *   <li>{@link com.ryuqq.toolbox.core.model.CatalogNode} - one entry, holding child ids only</li>
 *   <li>{@link com.ryuqq.toolbox.core.model.CategoryTree} - arena of nodes for one category</li>
 *   <li>{@link com.ryuqq.toolbox.core.model.CatalogSnapshot} - ordered set of categories</li>
 *   <li>{@link com.ryuqq.toolbox.core.model.RequestId} - execution request sequence number</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Arena:</strong> nodes are stored once and referenced by id, never copied per level</li>
 *   <li><strong>Immutability:</strong> a snapshot is replaced wholesale, never patched</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Toolbox Team
 */
package com.ryuqq.toolbox.core.model;
