/**
 * Runner Adapter Layer - 프로세스 실행 및 단일 Worker 조정자 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.toolbox.adapter.runner.SingleWorkerCoordinator} - FIFO 단일 Worker ExecutionCoordinator</li>
 *   <li>{@link com.ryuqq.toolbox.adapter.runner.ProcessCommandRunner} - ProcessBuilder 기반 CommandRunner</li>
 *   <li>{@link com.ryuqq.toolbox.adapter.runner.ProcessSystemInfoSource} - uname/lsb_release 기반 호스트 정보</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (SingleWorkerCoordinator, ProcessCommandRunner)
 *   ↓ implements
 * application (ExecutionCoordinator)
 *   ↓ depends on
 * core (ExecutionRequest, ExecutionResult, RequestState, CommandRunner SPI)
 * </pre>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
package com.ryuqq.toolbox.adapter.runner;
