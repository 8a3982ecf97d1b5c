package com.ryuqq.toolbox.adapter.runner;

import java.util.Map;

/**
 * ProcessCommandRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>shell / shellFlag: Raw 명령 실행 셸 (기본 {@code sh -c})</li>
 *   <li>environment: 모든 프로세스에 덮어쓸 환경 변수 (기본: 비대화형 모드 강제)</li>
 *   <li>rawPlaceholder: Raw 명령이 아무 출력도 없을 때 표시할 문구</li>
 *   <li>scriptPlaceholder: 스크립트가 아무 출력도 없을 때 표시할 문구</li>
 * </ul>
 *
 * <p>기본 환경 변수:</p>
 * <ul>
 *   <li>{@code DEBIAN_FRONTEND=noninteractive} - 패키지 관리자 프롬프트 방지</li>
 *   <li>{@code NEEDRESTART_MODE=a} - 서비스 재시작 프롬프트 자동 처리</li>
 * </ul>
 *
 * @author Toolbox Team
 * @since 1.0.0
 * @param shell 셸 실행 파일
 * @param shellFlag 명령 문자열 앞에 붙는 셸 플래그
 * @param environment 덮어쓸 환경 변수 (불변 복사본)
 * @param rawPlaceholder Raw 명령 무출력 문구
 * @param scriptPlaceholder 스크립트 무출력 문구
 */
public record ProcessRunnerConfig(
    String shell,
    String shellFlag,
    Map<String, String> environment,
    String rawPlaceholder,
    String scriptPlaceholder
) {

    /**
     * 기본 비대화형 환경 변수.
     */
    public static final Map<String, String> NON_INTERACTIVE_ENVIRONMENT = defaultEnvironment();

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: shell=sh, shellFlag=-c, environment=NON_INTERACTIVE_ENVIRONMENT,
     * rawPlaceholder="Command executed successfully", scriptPlaceholder="Script executed successfully"</p>
     */
    public ProcessRunnerConfig() {
        this("sh", "-c", NON_INTERACTIVE_ENVIRONMENT,
            "Command executed successfully", "Script executed successfully");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ProcessRunnerConfig {
        if (shell == null || shell.isBlank()) {
            throw new IllegalArgumentException("shell cannot be null or blank");
        }
        if (shellFlag == null || shellFlag.isBlank()) {
            throw new IllegalArgumentException("shellFlag cannot be null or blank");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (rawPlaceholder == null || rawPlaceholder.isBlank()) {
            throw new IllegalArgumentException("rawPlaceholder cannot be null or blank");
        }
        if (scriptPlaceholder == null || scriptPlaceholder.isBlank()) {
            throw new IllegalArgumentException("scriptPlaceholder cannot be null or blank");
        }
        environment = Map.copyOf(environment);
    }

    private static Map<String, String> defaultEnvironment() {
        return Map.of(
            "DEBIAN_FRONTEND", "noninteractive",
            "NEEDRESTART_MODE", "a"
        );
    }

    /**
     * shell만 변경한 새 인스턴스 생성.
     */
    public ProcessRunnerConfig withShell(String shell) {
        return new ProcessRunnerConfig(shell, shellFlag, environment, rawPlaceholder, scriptPlaceholder);
    }

    /**
     * environment만 변경한 새 인스턴스 생성.
     */
    public ProcessRunnerConfig withEnvironment(Map<String, String> environment) {
        return new ProcessRunnerConfig(shell, shellFlag, environment, rawPlaceholder, scriptPlaceholder);
    }

    /**
     * rawPlaceholder만 변경한 새 인스턴스 생성.
     */
    public ProcessRunnerConfig withRawPlaceholder(String rawPlaceholder) {
        return new ProcessRunnerConfig(shell, shellFlag, environment, rawPlaceholder, scriptPlaceholder);
    }

    /**
     * scriptPlaceholder만 변경한 새 인스턴스 생성.
     */
    public ProcessRunnerConfig withScriptPlaceholder(String scriptPlaceholder) {
        return new ProcessRunnerConfig(shell, shellFlag, environment, rawPlaceholder, scriptPlaceholder);
    }
}
