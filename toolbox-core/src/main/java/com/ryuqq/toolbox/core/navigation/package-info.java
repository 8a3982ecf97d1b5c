/**
 * Navigation, search and selection state for one interactive session.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.toolbox.core.navigation.NavigationStack} - frames from category root to current location</li>
 *   <li>{@link com.ryuqq.toolbox.core.navigation.NavigationFrame} - (node id, selected index) pair</li>
 *   <li>{@link com.ryuqq.toolbox.core.navigation.SearchFilter} - pure visible-items derivation</li>
 *   <li>{@link com.ryuqq.toolbox.core.navigation.SelectionSet} - id-keyed batch selection</li>
 * </ul>
 *
 * <p>None of these types are thread-safe; they belong to the interactive thread.</p>
 *
 * @since 1.0.0
 * @author Toolbox Team
 */
package com.ryuqq.toolbox.core.navigation;
