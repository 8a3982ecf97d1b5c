package com.ryuqq.toolbox.core.command;

import java.nio.file.Path;
import java.util.List;

/**
 * 로컬 스크립트 파일 실행 명세.
 *
 * <p>{@code executable}을 {@code args}와 함께 실행하며, 작업 디렉터리는
 * {@code sourcePath}의 상위 디렉터리로 설정됩니다. 스크립트 경로는 보통 {@code args}에
 * 이미 포함되어 있습니다.</p>
 *
 * @param executable 실행 파일 이름 또는 경로 (PATH로 탐색)
 * @param args 인자 목록 (불변 복사본, null이면 빈 목록)
 * @param sourcePath 스크립트 원본 파일 경로
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public record LocalFileCommand(
    String executable,
    List<String> args,
    Path sourcePath
) implements CommandSpec {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException executable이 비었거나 sourcePath가 null인 경우
     */
    public LocalFileCommand {
        if (executable == null || executable.isBlank()) {
            throw new IllegalArgumentException("executable cannot be null or blank");
        }
        if (sourcePath == null) {
            throw new IllegalArgumentException("sourcePath cannot be null");
        }
        args = args == null ? List.of() : List.copyOf(args);
    }

    /**
     * 스크립트 실행 명세 생성.
     *
     * @param executable 실행 파일 (예: sh, bash)
     * @param sourcePath 스크립트 경로
     * @param args 인자
     * @return LocalFileCommand 인스턴스
     */
    public static LocalFileCommand of(String executable, Path sourcePath, String... args) {
        return new LocalFileCommand(executable, List.of(args), sourcePath);
    }

    /**
     * 작업 디렉터리 (sourcePath의 상위 디렉터리).
     *
     * @return 상위 디렉터리, 상위가 없으면 null
     */
    public Path workingDirectory() {
        Path absolute = sourcePath.toAbsolutePath();
        return absolute.getParent();
    }
}
