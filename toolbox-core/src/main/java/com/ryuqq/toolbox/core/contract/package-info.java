/**
 * Request/result contract between the interactive layer and the execution worker.
 *
 * <ul>
 *   <li>{@link com.ryuqq.toolbox.core.contract.ExecutionRequest} - what the worker runs</li>
 *   <li>{@link com.ryuqq.toolbox.core.contract.Completion} - what the result channel carries</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Toolbox Team
 */
package com.ryuqq.toolbox.core.contract;
