/**
 * Session API exposed to the interactive/presentation layer.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.toolbox.application.session.CatalogSession} - operation contract</li>
 *   <li>{@link com.ryuqq.toolbox.application.session.DefaultCatalogSession} - cache + navigation + selection + coordinator</li>
 *   <li>{@link com.ryuqq.toolbox.application.session.ItemView} - read-only row for rendering</li>
 *   <li>{@link com.ryuqq.toolbox.application.session.PreviewRenderer} - command/script preview text</li>
 *   <li>{@link com.ryuqq.toolbox.application.session.SessionConfig} - validation override</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Toolbox Team
 */
package com.ryuqq.toolbox.application.session;
