/**
 * Execution outcome package.
 *
 * <p>{@link com.ryuqq.toolbox.core.outcome.ExecutionResult} is the only value the worker
 * publishes. Process-level failures (spawn failure, non-zero exit) are data, not exceptions.</p>
 *
 * <h2>Output Selection</h2>
 * <pre>
 * stdout non-empty  → stdout
 * else stderr non-empty → stderr
 * else              → fixed "executed successfully" placeholder
 * </pre>
 *
 * @since 1.0.0
 * @author Toolbox Team
 */
package com.ryuqq.toolbox.core.outcome;
