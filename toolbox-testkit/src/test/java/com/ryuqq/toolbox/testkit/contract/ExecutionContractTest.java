package com.ryuqq.toolbox.testkit.contract;

import com.ryuqq.toolbox.core.contract.Completion;
import com.ryuqq.toolbox.core.error.ErrorKind;
import com.ryuqq.toolbox.core.error.NotExecutableException;
import com.ryuqq.toolbox.core.model.RequestId;
import com.ryuqq.toolbox.core.outcome.ExecutionResult;
import com.ryuqq.toolbox.core.statemachine.RequestState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ryuqq.toolbox.testkit.contract.CatalogFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test: 실제 프로세스를 통한 비동기 실행.
 *
 * <p><strong>검증 항목:</strong></p>
 * <ul>
 *   <li>System/Update 시나리오: enter → goBack → "upd" 검색 → echo ok 실행</li>
 *   <li>그룹 노드 실행은 동기적으로 거부되고 Worker에 도달하지 않음</li>
 *   <li>executeSelected 결과는 제출 순서대로 도착</li>
 *   <li>0이 아닌 종료 코드, 실행 파일 없음은 실패 결과로 전달</li>
 * </ul>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
class ExecutionContractTest extends AbstractSessionContractTest {

    @Test
    void System_Update_시나리오() {
        // Given
        assertItemNames("System", "Update");

        // When: System으로 진입했다가 돌아옴
        session.enter(SYSTEM);
        assertItemNames("Kernel Version", "Disk Usage");
        session.goBack();

        // When: "upd" 검색
        session.setSearch("upd");

        // Then
        assertItemNames("Update");

        // When: Update 실행
        RequestId requestId = session.execute(session.currentItems().get(0).id());
        Completion completion = awaitCompletion();

        // Then
        assertThat(completion.request().requestId()).isEqualTo(requestId);
        ExecutionResult result = completion.result();
        assertThat(result.success()).isTrue();
        assertThat(result.output()).contains("ok");
        assertThat(result.exitCodeValue()).contains(0);
        assertThat(result.errorText()).isEmpty();
    }

    @Test
    void 그룹_노드_실행은_NotExecutableException이며_Worker에_도달하지_않음() {
        // When & Then
        assertThatThrownBy(() -> session.execute(SYSTEM))
            .isInstanceOf(NotExecutableException.class)
            .satisfies(e -> assertThat(((NotExecutableException) e).kind()).isEqualTo(ErrorKind.NOT_EXECUTABLE));

        assertThat(coordinator.pendingCount()).isZero();
        assertThat(session.isExecuting()).isFalse();
        assertThat(session.pollResult()).isEmpty();
    }

    @Test
    void executeSelected_결과는_제출_순서대로_도착() {
        // Given
        session.switchCategory(APPLICATIONS);
        session.toggleSelection(INSTALL_BETA);
        session.toggleSelection(INSTALL_ALPHA);

        // When
        List<RequestId> requestIds = session.executeSelected();
        List<Completion> completions = awaitCompletions(2);

        // Then
        assertThat(requestIds).hasSize(2);
        assertThat(completions).extracting(c -> c.request().requestId()).containsExactlyElementsOf(requestIds);
        assertThat(completions.get(0).request().nodeId()).isEqualTo(INSTALL_BETA);
        assertThat(completions.get(0).result().output()).contains("beta");
        assertThat(completions.get(1).request().nodeId()).isEqualTo(INSTALL_ALPHA);
        assertThat(completions.get(1).result().output()).contains("alpha");
        assertThat(session.selectedNodeIds()).isEmpty();
    }

    @Test
    void 실행_불가능한_멤버가_있으면_executeSelected는_아무것도_제출하지_않음() {
        // Given
        session.switchCategory(APPLICATIONS);
        session.toggleSelection(INSTALL_ALPHA);
        session.toggleSelection(EDITORS);

        // When & Then
        assertThatThrownBy(() -> session.executeSelected())
            .isInstanceOf(NotExecutableException.class);
        assertThat(coordinator.pendingCount()).isZero();
        assertThat(session.selectedNodeIds()).containsExactly(INSTALL_ALPHA, EDITORS);
    }

    @Test
    void 종료_코드가_0이_아니면_실패_결과로_전달() {
        // Given
        session.switchCategory(APPLICATIONS);

        // When
        session.execute(BROKEN_INSTALLER);
        ExecutionResult result = awaitCompletion().result();

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.failureKind()).isEqualTo(ErrorKind.NON_ZERO_EXIT);
        assertThat(result.exitCodeValue()).contains(3);
        assertThat(result.errorText()).hasValueSatisfying(err -> assertThat(err).contains("boom"));
        assertThat(result.output()).contains("boom");
    }

    @Test
    void 실행_파일이_없으면_SPAWN_FAILURE_결과로_전달() {
        // Given
        session.switchCategory(APPLICATIONS);

        // When
        session.execute(MISSING_TOOL);
        ExecutionResult result = awaitCompletion().result();

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.failureKind()).isEqualTo(ErrorKind.SPAWN_FAILURE);
        assertThat(result.exitCodeValue()).isEmpty();
        assertThat(result.output()).startsWith("Failed to execute script:");
    }

    @Test
    void 결과를_가져가면_요청_추적과_실행_표시가_해제됨() {
        // When
        RequestId requestId = session.execute(UPDATE);

        // Then
        assertThat(session.isExecuting()).isTrue();
        assertThat(coordinator.state(requestId)).isPresent();

        // When
        awaitCompletion();

        // Then
        assertThat(session.isExecuting()).isFalse();
        assertThat(coordinator.state(requestId)).isEmpty();
    }

    @Test
    void 완료된_요청의_상태는_COMPLETED() {
        // Given
        RequestId requestId = session.execute(UPDATE);

        // When: 결과를 가져가지 않고 완료만 기다림
        long deadline = System.nanoTime() + DEFAULT_TIMEOUT.toNanos();
        while (coordinator.state(requestId).filter(RequestState::isTerminal).isEmpty()
            && System.nanoTime() < deadline) {
            pause(10);
        }

        // Then
        assertThat(coordinator.state(requestId)).contains(RequestState.COMPLETED);
        assertThat(session.isExecuting()).isTrue();
    }
}
