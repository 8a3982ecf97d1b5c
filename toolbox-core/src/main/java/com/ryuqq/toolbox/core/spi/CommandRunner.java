package com.ryuqq.toolbox.core.spi;

import com.ryuqq.toolbox.core.command.CommandSpec;
import com.ryuqq.toolbox.core.outcome.ExecutionResult;

/**
 * Command execution SPI used by the execution worker.
 *
 * <p>Implementations block until the command finishes. They are invoked from exactly one
 * worker thread, so they do not need to be thread-safe with respect to themselves.</p>
 *
 * <p><strong>Error Contract:</strong></p>
 * <ul>
 *   <li>Spawn failures and non-zero exits are returned as failed {@link ExecutionResult}s</li>
 *   <li>Only programming errors (e.g., a non-executable command) may be thrown</li>
 * </ul>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * Runs a command to completion.
     *
     * @param command an executable command
     * @return the execution result (never null)
     * @throws IllegalArgumentException if the command is not executable
     */
    ExecutionResult run(CommandSpec command);
}
