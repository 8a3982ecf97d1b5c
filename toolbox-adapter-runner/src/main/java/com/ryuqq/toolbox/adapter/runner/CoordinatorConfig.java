package com.ryuqq.toolbox.adapter.runner;

/**
 * SingleWorkerCoordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workerThreadName: Worker 스레드 이름 (기본 toolbox-execution-worker)</li>
 *   <li>shutdownTimeoutMs: shutdown() 시 대기 중인 요청 완료를 기다리는 최대 시간 (기본 60000ms)</li>
 *   <li>resetIndicatorOnFirstResult: 결과 하나만 가져가도 실행 중 표시를 내림 (기본 false)</li>
 * </ul>
 *
 * <p>resetIndicatorOnFirstResult=false이면 가져가지 않은 요청 수로 실행 중 여부를 판단합니다.
 * true는 여러 요청이 대기 중이어도 첫 결과에서 표시가 꺼지던 이전 UI 동작을 재현합니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 * @param workerThreadName Worker 스레드 이름
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 * @param resetIndicatorOnFirstResult 첫 결과에서 실행 중 표시 해제 여부
 */
public record CoordinatorConfig(
    String workerThreadName,
    long shutdownTimeoutMs,
    boolean resetIndicatorOnFirstResult
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: workerThreadName=toolbox-execution-worker, shutdownTimeoutMs=60000ms,
     * resetIndicatorOnFirstResult=false</p>
     */
    public CoordinatorConfig() {
        this("toolbox-execution-worker", 60_000, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CoordinatorConfig {
        if (workerThreadName == null || workerThreadName.isBlank()) {
            throw new IllegalArgumentException("workerThreadName cannot be null or blank");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * workerThreadName만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withWorkerThreadName(String workerThreadName) {
        return new CoordinatorConfig(workerThreadName, shutdownTimeoutMs, resetIndicatorOnFirstResult);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new CoordinatorConfig(workerThreadName, shutdownTimeoutMs, resetIndicatorOnFirstResult);
    }

    /**
     * resetIndicatorOnFirstResult만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withResetIndicatorOnFirstResult(boolean resetIndicatorOnFirstResult) {
        return new CoordinatorConfig(workerThreadName, shutdownTimeoutMs, resetIndicatorOnFirstResult);
    }
}
