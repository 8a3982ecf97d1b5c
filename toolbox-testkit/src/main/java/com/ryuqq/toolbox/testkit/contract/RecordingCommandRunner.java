package com.ryuqq.toolbox.testkit.contract;

import com.ryuqq.toolbox.core.command.CommandSpec;
import com.ryuqq.toolbox.core.command.RawCommand;
import com.ryuqq.toolbox.core.outcome.ExecutionResult;
import com.ryuqq.toolbox.core.spi.CommandRunner;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link CommandRunner} test double that records every command it receives.
 *
 * <p>By default each raw command succeeds with its shell text as output. A gate can be
 * held to keep the worker inside {@link #run(CommandSpec)} until the test releases it,
 * which makes "submission does not block" and "strictly one at a time" observable.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class RecordingCommandRunner implements CommandRunner {

    private final List<CommandSpec> received = new CopyOnWriteArrayList<>();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxConcurrent = new AtomicInteger();
    private volatile CountDownLatch gate = new CountDownLatch(0);

    @Override
    public ExecutionResult run(CommandSpec command) {
        received.add(command);
        int now = running.incrementAndGet();
        maxConcurrent.accumulateAndGet(now, Math::max);
        try {
            if (!gate.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate was never released");
            }
            String output = command instanceof RawCommand raw ? raw.shellText() : command.toString();
            return ExecutionResult.succeeded(output, 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while gated", e);
        } finally {
            running.decrementAndGet();
        }
    }

    /**
     * Holds every subsequent run until {@link #release()} is called.
     */
    public void hold() {
        gate = new CountDownLatch(1);
    }

    public void release() {
        gate.countDown();
    }

    public List<CommandSpec> received() {
        return new ArrayList<>(received);
    }

    /**
     * Highest number of commands observed running at the same time.
     */
    public int maxConcurrent() {
        return maxConcurrent.get();
    }
}
