package com.ryuqq.toolbox.core.spi;

import com.ryuqq.toolbox.core.model.CatalogSnapshot;

/**
 * Catalog source SPI.
 *
 * <p>The provider owns construction of the catalog. The core never interprets the
 * {@code validate} flag; it passes it through and accepts whatever snapshot comes back.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Return a fully built, immutable snapshot (no partial results)</li>
 *   <li>May perform I/O; callers never hold a lock while calling it</li>
 *   <li>Failures are reported by throwing an unchecked exception</li>
 * </ul>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CatalogProvider {

    /**
     * Builds a catalog snapshot.
     *
     * @param validate {@code true} to apply the provider's compatibility filter,
     *                 {@code false} to return every node
     * @return the loaded snapshot (never null)
     */
    CatalogSnapshot getCatalog(boolean validate);
}
