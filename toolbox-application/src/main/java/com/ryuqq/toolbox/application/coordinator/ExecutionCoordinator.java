package com.ryuqq.toolbox.application.coordinator;

import com.ryuqq.toolbox.core.contract.Completion;
import com.ryuqq.toolbox.core.contract.ExecutionRequest;
import com.ryuqq.toolbox.core.model.RequestId;
import com.ryuqq.toolbox.core.statemachine.RequestState;

import java.util.Optional;

/**
 * 실행 요청 조정자.
 *
 * <p>인터랙티브 레이어의 실행 요청을 받아 단일 Worker에 순서대로 넘기고,
 * 결과를 결과 채널을 통해 돌려줍니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>submit()은 큐에 넣고 즉시 반환 (블로킹 없음)</li>
 *   <li>poll()은 준비된 결과가 없으면 즉시 empty 반환 (오류 아님, "아직"일 뿐)</li>
 *   <li>Worker는 정확히 하나, 요청은 제출 순서대로 하나씩 실행</li>
 *   <li>실행 중인 요청은 취소할 수 없고 타임아웃도 없음</li>
 * </ul>
 *
 * <p><strong>사용 예시 (인터랙션 tick마다):</strong></p>
 * <pre>
 * coordinator.poll().ifPresent(completion -&gt; render(completion.result()));
 * if (coordinator.isExecuting()) {
 *     requestRepaint(); // 결과를 기다리는 동안 다음 tick을 직접 요청
 * }
 * </pre>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public interface ExecutionCoordinator {

    /**
     * 실행 요청 제출.
     *
     * @param request 실행 요청 (실행 가능한 명령만 담을 수 있음)
     * @return 요청 식별자
     * @throws IllegalArgumentException request가 null인 경우
     * @throws IllegalStateException 이미 종료된 경우
     */
    RequestId submit(ExecutionRequest request);

    /**
     * 완료된 결과 하나를 가져옴 (비블로킹).
     *
     * @return 가장 먼저 완료된 결과, 없으면 empty
     */
    Optional<Completion> poll();

    /**
     * 실행 중 표시 여부.
     *
     * @return 아직 가져가지 않은 요청이 남아 있으면 true
     */
    boolean isExecuting();

    /**
     * 요청 상태 조회.
     *
     * @param requestId 요청 식별자
     * @return 상태, 결과를 이미 가져갔거나 모르는 요청이면 empty
     */
    Optional<RequestState> state(RequestId requestId);

    /**
     * Worker 종료 (대기 중인 요청은 끝까지 실행).
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    void shutdown() throws InterruptedException;
}
