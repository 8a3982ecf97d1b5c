/**
 * Single-slot catalog cache.
 *
 * <p>{@link com.ryuqq.toolbox.core.cache.CatalogCache} memoizes the latest snapshot and is
 * invalidated explicitly. It is the only shared mutable resource of the navigation core.</p>
 *
 * @since 1.0.0
 * @author Toolbox Team
 */
package com.ryuqq.toolbox.core.cache;
