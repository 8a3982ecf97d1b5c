/**
 * Command variants package.
 *
 * <p>Defines the sealed hierarchy describing what a catalog node runs.</p>
 *
 * <h2>Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.toolbox.core.command.RawCommand} - shell text passed to {@code sh -c}</li>
 *   <li>{@link com.ryuqq.toolbox.core.command.LocalFileCommand} - executable + args, run next to its script</li>
 *   <li>{@link com.ryuqq.toolbox.core.command.NoCommand} - grouping node, never executable</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Toolbox Team
 */
package com.ryuqq.toolbox.core.command;
