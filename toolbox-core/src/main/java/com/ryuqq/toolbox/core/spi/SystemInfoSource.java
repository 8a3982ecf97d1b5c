package com.ryuqq.toolbox.core.spi;

import java.util.Map;

/**
 * Host information SPI shown alongside the catalog.
 *
 * <p>Well-known keys: {@code system}, {@code distribution}, {@code architecture}.
 * Keys whose probe fails are omitted rather than reported as errors.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SystemInfoSource {

    /**
     * Collects host information.
     *
     * @return key/value pairs (never null, possibly empty)
     */
    Map<String, String> describe();
}
