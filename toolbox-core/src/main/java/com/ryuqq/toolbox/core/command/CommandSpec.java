package com.ryuqq.toolbox.core.command;

/**
 * 카탈로그 노드가 가진 명령 명세.
 *
 * <p>CommandSpec은 세 가지 형태 중 하나입니다:</p>
 * <ul>
 *   <li>{@link RawCommand}: 셸에 그대로 전달되는 명령 문자열</li>
 *   <li>{@link LocalFileCommand}: 로컬 스크립트 파일 실행 (실행 파일 + 인자 + 원본 경로)</li>
 *   <li>{@link NoCommand}: 그룹(디렉터리) 노드, 실행 불가</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (spec instanceof RawCommand raw) {
 *     runShell(raw.shellText());
 * } else if (spec instanceof LocalFileCommand file) {
 *     runScript(file.executable(), file.args(), file.sourcePath());
 * } else {
 *     throw new NotExecutableException(nodeId);
 * }
 * </pre>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public sealed interface CommandSpec permits RawCommand, LocalFileCommand, NoCommand {

    /**
     * 실행 가능한 명령인지 확인.
     *
     * @return NoCommand가 아니면 true
     */
    default boolean isExecutable() {
        return !(this instanceof NoCommand);
    }
}
