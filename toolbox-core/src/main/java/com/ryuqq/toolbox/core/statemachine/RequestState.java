package com.ryuqq.toolbox.core.statemachine;

/**
 * 실행 요청의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>IDLE → DISPATCHED (Worker 큐에 적재)</li>
 *   <li>DISPATCHED → COMPLETED (결과 채널에 게시)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <pre>
 * IDLE
 *    │
 *    ▼ (submit)
 * DISPATCHED
 *    │
 *    ▼ (worker 완료, 성공/실패 무관)
 * COMPLETED
 * </pre>
 *
 * <p>프로세스 실패도 COMPLETED로 끝나며, 실패 여부는 ExecutionResult가 표현합니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public enum RequestState {

    /**
     * 생성됨, 아직 큐에 들어가지 않음.
     */
    IDLE,

    /**
     * Worker 큐에 적재됨 (대기 또는 실행 중).
     */
    DISPATCHED,

    /**
     * 결과가 결과 채널에 게시됨.
     */
    COMPLETED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
