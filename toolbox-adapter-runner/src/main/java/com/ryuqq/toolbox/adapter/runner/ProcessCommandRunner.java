package com.ryuqq.toolbox.adapter.runner;

import com.ryuqq.toolbox.core.command.CommandSpec;
import com.ryuqq.toolbox.core.command.LocalFileCommand;
import com.ryuqq.toolbox.core.command.RawCommand;
import com.ryuqq.toolbox.core.outcome.ExecutionResult;
import com.ryuqq.toolbox.core.spi.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 외부 프로세스로 명령을 실행하는 {@link CommandRunner} 구현체.
 *
 * <p><strong>실행 방식:</strong></p>
 * <ul>
 *   <li>RawCommand: {@code sh -c <text>}</li>
 *   <li>LocalFileCommand: {@code <executable> <args...>}, 작업 디렉터리 = 스크립트의 상위 디렉터리</li>
 *   <li>공통: 비대화형 환경 변수 덮어쓰기, PATH 상속, stdin 닫음, stdout/stderr 분리 캡처</li>
 * </ul>
 *
 * <p><strong>결과 구성:</strong></p>
 * <pre>
 * success = (exitCode == 0)
 * output  = stdout (비어 있지 않으면)
 *         → stderr (비어 있지 않으면)
 *         → placeholder
 * error   = 실패 시에만 stderr
 * </pre>
 *
 * <p>프로세스를 시작하지 못하면 (실행 파일 없음, 권한 없음, 작업 디렉터리 없음 등)
 * 예외를 던지지 않고 SPAWN_FAILURE 결과를 반환합니다.</p>
 *
 * <p>stderr는 Runner가 소유한 데몬 스레드 풀에서 읽어 stdout과의 교착을 피합니다.
 * 타임아웃이 없으므로 멈춘 프로세스는 호출 스레드를 계속 점유합니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private final ProcessRunnerConfig config;
    private final ExecutorService stderrDrainers;

    /**
     * 생성자 (기본 설정).
     */
    public ProcessCommandRunner() {
        this(new ProcessRunnerConfig());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ProcessCommandRunner(ProcessRunnerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        AtomicInteger drainerCount = new AtomicInteger();
        this.stderrDrainers = Executors.newCachedThreadPool(task -> {
            Thread thread = new Thread(task, "toolbox-stderr-" + drainerCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public ExecutionResult run(CommandSpec command) {
        if (command instanceof RawCommand raw) {
            List<String> argv = List.of(config.shell(), config.shellFlag(), raw.shellText());
            return execute(argv, null, config.rawPlaceholder(), "Failed to execute command: ");
        }
        if (command instanceof LocalFileCommand file) {
            List<String> argv = new ArrayList<>(file.args().size() + 1);
            argv.add(file.executable());
            argv.addAll(file.args());
            return execute(argv, file.workingDirectory(), config.scriptPlaceholder(), "Failed to execute script: ");
        }
        throw new IllegalArgumentException("command is not executable: " + command);
    }

    private ExecutionResult execute(List<String> argv, Path workingDirectory, String placeholder, String spawnPrefix) {
        ProcessBuilder builder = new ProcessBuilder(argv);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        builder.environment().putAll(config.environment());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("Could not start {}: {}", argv.get(0), e.getMessage());
            return ExecutionResult.spawnFailure(spawnPrefix + e.getMessage());
        }
        log.debug("Started pid {} for {}", process.pid(), argv.get(0));

        try {
            process.getOutputStream().close();

            Future<String> stderrTask = stderrDrainers.submit(() -> readFully(process.getErrorStream()));

            String stdout = readFully(process.getInputStream());
            int exitCode = process.waitFor();
            String stderr = stderrTask.get();

            String output = !stdout.isEmpty() ? stdout : !stderr.isEmpty() ? stderr : placeholder;
            if (exitCode == 0) {
                return ExecutionResult.succeeded(output, exitCode);
            }
            log.warn("{} exited with code {}", argv.get(0), exitCode);
            return ExecutionResult.nonZeroExit(output, stderr, exitCode);

        } catch (IOException e) {
            process.destroyForcibly();
            throw new UncheckedIOException("Failed to read output of " + argv.get(0), e);
        } catch (ExecutionException e) {
            process.destroyForcibly();
            throw new UncheckedIOException("Failed to read error output of " + argv.get(0),
                e.getCause() instanceof IOException io ? io : new IOException(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IllegalStateException("Interrupted while waiting for " + argv.get(0), e);
        }
    }

    private static String readFully(InputStream stream) throws IOException {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
