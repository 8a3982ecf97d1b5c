/**
 * Service Provider Interfaces of the toolbox core.
 *
 * <ul>
 *   <li>{@link com.ryuqq.toolbox.core.spi.CatalogProvider} - builds catalog snapshots</li>
 *   <li>{@link com.ryuqq.toolbox.core.spi.CommandRunner} - runs one command to completion</li>
 *   <li>{@link com.ryuqq.toolbox.core.spi.SystemInfoSource} - describes the host</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Toolbox Team
 */
package com.ryuqq.toolbox.core.spi;
