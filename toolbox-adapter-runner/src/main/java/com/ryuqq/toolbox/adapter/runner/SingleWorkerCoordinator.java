package com.ryuqq.toolbox.adapter.runner;

import com.ryuqq.toolbox.application.coordinator.ExecutionCoordinator;
import com.ryuqq.toolbox.core.contract.Completion;
import com.ryuqq.toolbox.core.contract.ExecutionRequest;
import com.ryuqq.toolbox.core.model.RequestId;
import com.ryuqq.toolbox.core.outcome.ExecutionResult;
import com.ryuqq.toolbox.core.spi.CommandRunner;
import com.ryuqq.toolbox.core.statemachine.RequestState;
import com.ryuqq.toolbox.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 단일 Worker 기반 {@link ExecutionCoordinator} 구현체.
 *
 * <p>요청 채널(단일 스레드 Executor의 FIFO 큐)과 결과 채널(비블로킹 큐)로 구성됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(request)                      [인터랙티브 스레드]
 *   ↓ IDLE → DISPATCHED, 미수령 건수 +1
 * worker 큐 적재 → 즉시 반환
 *   ↓
 * process(request)                     [Worker 스레드, 한 번에 하나]
 *   1. runner.run(command) → ExecutionResult
 *   2. 예상치 못한 예외/Error → SPAWN_FAILURE 결과로 변환
 *   3. DISPATCHED → COMPLETED
 *   4. 결과 채널에 Completion 게시
 *   ↓
 * poll()                               [인터랙티브 스레드, tick마다]
 *   → 결과가 있으면 꺼내고 미수령 건수 -1, 없으면 empty
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>Worker는 정확히 하나이므로 모든 요청(일괄 실행 포함)이 제출 순서대로 하나씩 실행됨</li>
 *   <li>결과도 같은 순서로 결과 채널에 들어감</li>
 *   <li>취소/타임아웃 없음: 멈춘 프로세스는 뒤의 요청을 모두 지연시킴</li>
 * </ul>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class SingleWorkerCoordinator implements ExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SingleWorkerCoordinator.class);

    private final CommandRunner runner;
    private final CoordinatorConfig config;
    private final ExecutorService worker;
    private final Queue<Completion> results = new ConcurrentLinkedQueue<>();
    private final ConcurrentHashMap<RequestId, RequestState> states = new ConcurrentHashMap<>();
    private final AtomicInteger unclaimed = new AtomicInteger();

    private volatile boolean executingFlag;

    /**
     * 생성자 (기본 설정).
     *
     * @param runner 명령 실행기
     * @throws IllegalArgumentException runner가 null인 경우
     */
    public SingleWorkerCoordinator(CommandRunner runner) {
        this(runner, new CoordinatorConfig());
    }

    /**
     * 생성자.
     *
     * @param runner 명령 실행기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SingleWorkerCoordinator(CommandRunner runner, CoordinatorConfig config) {
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.runner = runner;
        this.config = config;
        this.worker = Executors.newSingleThreadExecutor(task -> {
            Thread thread = new Thread(task, config.workerThreadName());
            thread.setDaemon(true);
            return thread;
        });
        log.info("Execution worker {} started", config.workerThreadName());
    }

    @Override
    public RequestId submit(ExecutionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        RequestId requestId = request.requestId();
        if (states.putIfAbsent(requestId, RequestState.IDLE) != null) {
            throw new IllegalArgumentException("request already submitted: " + requestId);
        }
        states.put(requestId, StateTransition.transition(RequestState.IDLE, RequestState.DISPATCHED));
        unclaimed.incrementAndGet();
        executingFlag = true;

        try {
            worker.execute(() -> process(request));
        } catch (RejectedExecutionException e) {
            states.remove(requestId);
            unclaimed.decrementAndGet();
            throw new IllegalStateException("Coordinator is shut down, cannot accept " + requestId, e);
        }
        log.debug("Dispatched {} ({} / {})", requestId, request.categoryName(), request.nodeName());
        return requestId;
    }

    @Override
    public Optional<Completion> poll() {
        Completion completion = results.poll();
        if (completion == null) {
            return Optional.empty();
        }
        states.remove(completion.request().requestId());
        unclaimed.decrementAndGet();
        if (config.resetIndicatorOnFirstResult()) {
            executingFlag = false;
        }
        return Optional.of(completion);
    }

    @Override
    public boolean isExecuting() {
        if (config.resetIndicatorOnFirstResult()) {
            return executingFlag;
        }
        return unclaimed.get() > 0;
    }

    @Override
    public Optional<RequestState> state(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        return Optional.ofNullable(states.get(requestId));
    }

    /**
     * 아직 가져가지 않은 요청 수 (대기 + 실행 중 + 완료 후 미수령).
     */
    public int pendingCount() {
        return unclaimed.get();
    }

    @Override
    public void shutdown() throws InterruptedException {
        worker.shutdown();
        if (!worker.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Execution worker did not finish within {}ms, forcing shutdown", config.shutdownTimeoutMs());
            worker.shutdownNow();
        }
        log.info("Execution worker {} stopped", config.workerThreadName());
    }

    /**
     * 요청 하나 실행 (Worker 스레드).
     *
     * <p>어떤 경우에도 결과를 하나 게시하므로, 결과 순서와 미수령 건수가 어긋나지 않습니다.
     * {@link Error}는 실패 결과를 게시한 뒤 다시 던지며, Executor가 Worker 스레드를 새로 만듭니다.</p>
     */
    private void process(ExecutionRequest request) {
        RequestId requestId = request.requestId();
        ExecutionResult result;
        try {
            result = runner.run(request.command());
            if (result == null) {
                throw new IllegalStateException("CommandRunner returned null result");
            }
        } catch (RuntimeException e) {
            log.error("Unexpected failure while executing {} ({})", requestId, request.nodeName(), e);
            result = ExecutionResult.spawnFailure("Execution failed: " + e.getMessage());
        } catch (Error e) {
            log.error("Fatal error while executing {} ({})", requestId, request.nodeName(), e);
            complete(request, ExecutionResult.spawnFailure("Execution failed: " + e));
            throw e;
        }
        complete(request, result);
    }

    private void complete(ExecutionRequest request, ExecutionResult result) {
        RequestId requestId = request.requestId();
        states.computeIfPresent(requestId, (id, current) -> StateTransition.transition(current, RequestState.COMPLETED));
        results.add(new Completion(request, result));
        log.debug("Completed {} success={}", requestId, result.success());
    }
}
