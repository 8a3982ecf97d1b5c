package com.ryuqq.toolbox.core.outcome;

import com.ryuqq.toolbox.core.error.ErrorKind;

import java.util.Optional;

/**
 * 명령 실행 결과.
 *
 * <p>프로세스 실패(시작 실패, 비정상 종료)는 예외가 아니라 이 결과로 전달됩니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>success:</strong> 종료 코드 0이면 true</li>
 *   <li><strong>output:</strong> 표시용 출력 (stdout → stderr → placeholder 순으로 선택)</li>
 *   <li><strong>error:</strong> 실패 시에만 stderr 또는 시작 실패 사유 (성공 시 null)</li>
 *   <li><strong>exitCode:</strong> 종료 코드 (프로세스가 시작되지 못하면 null)
 *       시그널로 종료된 경우 셸 관례에 따라 {@code 128 + 시그널 번호} (예: SIGKILL → 137)</li>
 *   <li><strong>failureKind:</strong> SPAWN_FAILURE 또는 NON_ZERO_EXIT (성공 시 null)</li>
 * </ul>
 *
 * @param success 성공 여부
 * @param output 표시용 출력
 * @param error 오류 텍스트 (null 가능)
 * @param exitCode 종료 코드 (null 가능)
 * @param failureKind 실패 종류 (null 가능)
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public record ExecutionResult(
    boolean success,
    String output,
    String error,
    Integer exitCode,
    ErrorKind failureKind
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException output이 null이거나, 성공/실패 필드 조합이 맞지 않는 경우
     */
    public ExecutionResult {
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
        if (success && failureKind != null) {
            throw new IllegalArgumentException("successful result cannot carry failureKind " + failureKind);
        }
        if (!success && failureKind == null) {
            throw new IllegalArgumentException("failed result must carry a failureKind");
        }
        if (failureKind != null && failureKind.isCallerError()) {
            throw new IllegalArgumentException("failureKind must be SPAWN_FAILURE or NON_ZERO_EXIT (current: " + failureKind + ")");
        }
    }

    /**
     * 성공 결과 생성.
     *
     * @param output 표시용 출력
     * @param exitCode 종료 코드
     * @return ExecutionResult
     */
    public static ExecutionResult succeeded(String output, int exitCode) {
        return new ExecutionResult(true, output, null, exitCode, null);
    }

    /**
     * 비정상 종료 결과 생성.
     *
     * @param output 표시용 출력
     * @param stderr 표준 에러 텍스트
     * @param exitCode 종료 코드 (시그널 종료는 128 + 시그널 번호, 알 수 없으면 null)
     * @return ExecutionResult
     */
    public static ExecutionResult nonZeroExit(String output, String stderr, Integer exitCode) {
        return new ExecutionResult(false, output, stderr == null ? "" : stderr, exitCode, ErrorKind.NON_ZERO_EXIT);
    }

    /**
     * 프로세스 시작 실패 결과 생성.
     *
     * @param description 시작 실패 사유
     * @return ExecutionResult
     */
    public static ExecutionResult spawnFailure(String description) {
        return new ExecutionResult(false, description, description, null, ErrorKind.SPAWN_FAILURE);
    }

    public Optional<String> errorText() {
        return Optional.ofNullable(error);
    }

    public Optional<Integer> exitCodeValue() {
        return Optional.ofNullable(exitCode);
    }
}
