package com.ryuqq.toolbox.adapter.runner;

import com.ryuqq.toolbox.core.command.LocalFileCommand;
import com.ryuqq.toolbox.core.command.NoCommand;
import com.ryuqq.toolbox.core.command.RawCommand;
import com.ryuqq.toolbox.core.error.ErrorKind;
import com.ryuqq.toolbox.core.outcome.ExecutionResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProcessCommandRunner 테스트 (실제 프로세스 실행).
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>출력 합성: stdout → stderr → placeholder 순</li>
 *   <li>종료 코드 0이 아니면 NON_ZERO_EXIT, 시작 실패는 SPAWN_FAILURE (예외 아님)</li>
 *   <li>비대화형 환경 변수, stdin 닫힘, 스크립트 작업 디렉토리</li>
 * </ul>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
class ProcessCommandRunnerTest {

    private final ProcessCommandRunner runner = new ProcessCommandRunner();

    @TempDir
    Path workDir;

    @Test
    void raw_명령은_stdout을_출력으로_반환() {
        // when
        ExecutionResult result = runner.run(RawCommand.of("echo ok"));

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo("ok\n");
        assertThat(result.exitCodeValue()).contains(0);
        assertThat(result.errorText()).isEmpty();
    }

    @Test
    void stdout이_비어_있으면_stderr를_출력으로_사용() {
        // when
        ExecutionResult result = runner.run(RawCommand.of("echo warning 1>&2"));

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo("warning\n");
    }

    @Test
    void 출력이_없으면_raw_placeholder() {
        // when
        ExecutionResult result = runner.run(RawCommand.of("true"));

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo("Command executed successfully");
    }

    @Test
    void 종료_코드가_0이_아니면_NON_ZERO_EXIT() {
        // when
        ExecutionResult result = runner.run(RawCommand.of("echo partial; echo broken 1>&2; exit 4"));

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.failureKind()).isEqualTo(ErrorKind.NON_ZERO_EXIT);
        assertThat(result.exitCodeValue()).contains(4);
        assertThat(result.output()).isEqualTo("partial\n");
        assertThat(result.errorText()).contains("broken\n");
    }

    @Test
    void 시그널로_종료되면_128_더하기_시그널_번호를_종료_코드로_보고() {
        // when
        ExecutionResult result = runner.run(RawCommand.of("kill -9 $$"));

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.failureKind()).isEqualTo(ErrorKind.NON_ZERO_EXIT);
        assertThat(result.exitCodeValue()).contains(137);
        assertThat(result.output()).isEqualTo("Command executed successfully");
    }

    @Test
    void stderr는_Runner가_소유한_데몬_스레드에서_읽음() {
        // when
        ExecutionResult result = runner.run(RawCommand.of("echo drained 1>&2"));

        // then
        assertThat(result.output()).isEqualTo("drained\n");
        assertThat(Thread.getAllStackTraces().keySet())
            .filteredOn(thread -> thread.getName().startsWith("toolbox-stderr-"))
            .isNotEmpty()
            .allMatch(Thread::isDaemon);
    }

    @Test
    void 비대화형_환경_변수가_설정됨() {
        // when
        ExecutionResult result = runner.run(RawCommand.of("echo \"$DEBIAN_FRONTEND:$NEEDRESTART_MODE\""));

        // then
        assertThat(result.output()).isEqualTo("noninteractive:a\n");
    }

    @Test
    void PATH는_상속됨() {
        // when
        ExecutionResult result = runner.run(RawCommand.of("test -n \"$PATH\" && echo inherited"));

        // then
        assertThat(result.output()).isEqualTo("inherited\n");
    }

    @Test
    void stdin은_닫혀_있어_입력_대기_없이_종료() {
        // when
        ExecutionResult result = runner.run(RawCommand.of("cat"));

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo("Command executed successfully");
    }

    @Test
    void 큰_stderr도_교착_없이_수집() {
        // when
        ExecutionResult result = runner.run(RawCommand.of(
            "i=0; while [ $i -lt 5000 ]; do echo line-$i 1>&2; echo out-$i; i=$((i+1)); done"));

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.output()).startsWith("out-0\n").contains("out-4999\n");
    }

    @Test
    void 스크립트는_소스_파일의_디렉토리에서_실행() throws IOException {
        // given
        Path script = workDir.resolve("where.sh");
        Files.writeString(script, "pwd\n");
        LocalFileCommand command = LocalFileCommand.of("sh", script, script.toString());

        // when
        ExecutionResult result = runner.run(command);

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.output().trim()).isEqualTo(workDir.toRealPath().toString());
    }

    @Test
    void 출력이_없는_스크립트는_script_placeholder() throws IOException {
        // given
        Path script = workDir.resolve("quiet.sh");
        Files.writeString(script, "exit 0\n");

        // when
        ExecutionResult result = runner.run(LocalFileCommand.of("sh", script, script.toString()));

        // then
        assertThat(result.output()).isEqualTo("Script executed successfully");
    }

    @Test
    void 스크립트_인자가_순서대로_전달됨() throws IOException {
        // given
        Path script = workDir.resolve("args.sh");
        Files.writeString(script, "echo \"$1-$2\"\n");

        // when
        ExecutionResult result = runner.run(LocalFileCommand.of("sh", script, script.toString(), "first", "second"));

        // then
        assertThat(result.output()).isEqualTo("first-second\n");
    }

    @Test
    void 실행_파일이_없으면_SPAWN_FAILURE_결과() {
        // given
        LocalFileCommand command = LocalFileCommand.of("no-such-executable-xyz", workDir.resolve("x.sh"));

        // when
        ExecutionResult result = runner.run(command);

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.failureKind()).isEqualTo(ErrorKind.SPAWN_FAILURE);
        assertThat(result.exitCodeValue()).isEmpty();
        assertThat(result.output()).startsWith("Failed to execute script: ");
    }

    @Test
    void 셸이_없으면_raw_SPAWN_FAILURE_결과() {
        // given
        ProcessCommandRunner broken = new ProcessCommandRunner(new ProcessRunnerConfig().withShell("no-such-shell-xyz"));

        // when
        ExecutionResult result = broken.run(RawCommand.of("echo ok"));

        // then
        assertThat(result.failureKind()).isEqualTo(ErrorKind.SPAWN_FAILURE);
        assertThat(result.output()).startsWith("Failed to execute command: ");
    }

    @Test
    void 설정된_환경_변수와_placeholder를_사용() {
        // given
        ProcessCommandRunner custom = new ProcessCommandRunner(new ProcessRunnerConfig()
            .withEnvironment(Map.of("TOOLBOX_MARKER", "42"))
            .withRawPlaceholder("done"));

        // when & then
        assertThat(custom.run(RawCommand.of("echo $TOOLBOX_MARKER")).output()).isEqualTo("42\n");
        assertThat(custom.run(RawCommand.of("true")).output()).isEqualTo("done");
    }

    @Test
    void NoCommand는_거부() {
        // when & then
        assertThatThrownBy(() -> runner.run(NoCommand.INSTANCE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not executable");
    }

    @Test
    void 생성자_null_설정은_거부() {
        // when & then
        assertThatThrownBy(() -> new ProcessCommandRunner(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
