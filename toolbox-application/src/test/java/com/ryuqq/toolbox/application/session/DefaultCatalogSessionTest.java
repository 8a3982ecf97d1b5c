package com.ryuqq.toolbox.application.session;

import com.ryuqq.toolbox.application.coordinator.ExecutionCoordinator;
import com.ryuqq.toolbox.core.cache.CatalogCache;
import com.ryuqq.toolbox.core.command.RawCommand;
import com.ryuqq.toolbox.core.contract.Completion;
import com.ryuqq.toolbox.core.contract.ExecutionRequest;
import com.ryuqq.toolbox.core.error.NodeNotFoundException;
import com.ryuqq.toolbox.core.error.NotExecutableException;
import com.ryuqq.toolbox.core.model.CatalogNode;
import com.ryuqq.toolbox.core.model.CatalogSnapshot;
import com.ryuqq.toolbox.core.model.CategoryTree;
import com.ryuqq.toolbox.core.model.NodeId;
import com.ryuqq.toolbox.core.model.RequestId;
import com.ryuqq.toolbox.core.outcome.ExecutionResult;
import com.ryuqq.toolbox.core.spi.CatalogProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.*;

/**
 * DefaultCatalogSession 유닛 테스트.
 *
 * <p>ExecutionCoordinator와 CatalogProvider를 mock으로 두고 세션의 조합 로직을 검증합니다:</p>
 * <ul>
 *   <li>실행 요청 구성 및 동기 거부</li>
 *   <li>executeSelected의 사전 검증과 제출 순서</li>
 *   <li>검증 플래그 전달, 재로드 시 초기화</li>
 * </ul>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultCatalogSessionTest {

    private static final NodeId SYSTEM = NodeId.of("system");
    private static final NodeId UPDATE = NodeId.of("update");
    private static final NodeId UPGRADE = NodeId.of("upgrade");

    @Mock
    private CatalogProvider provider;

    @Mock
    private ExecutionCoordinator coordinator;

    private DefaultCatalogSession session;

    private static CatalogSnapshot catalog() {
        CategoryTree tools = CategoryTree.of("System Tools", NodeId.of("tools-root"), List.of(
            CatalogNode.directory("tools-root", "root", "", "system", "update", "upgrade"),
            CatalogNode.directory("system", "System", "System utilities", "kernel").withMultiSelect(true),
            CatalogNode.raw("kernel", "Kernel Version", "", "uname -r"),
            CatalogNode.raw("update", "Update", "Refresh package lists", "echo ok").withMultiSelect(true),
            CatalogNode.raw("upgrade", "Upgrade", "Upgrade packages", "echo upgraded").withMultiSelect(true)
        ));
        CategoryTree apps = CategoryTree.of("Applications", NodeId.of("apps-root"), List.of(
            CatalogNode.directory("apps-root", "root", "", "vim"),
            CatalogNode.raw("vim", "Vim", "", "echo vim")
        ));
        return CatalogSnapshot.of(tools, apps);
    }

    @BeforeEach
    void setUp() {
        session = new DefaultCatalogSession(new CatalogCache(provider), coordinator, new SessionConfig(),
            () -> Map.of("architecture", "x86_64"));
    }

    private void givenCatalog() {
        when(provider.getCatalog(anyBoolean())).thenReturn(catalog());
    }

    @Test
    void execute_요청은_카테고리와_노드_정보를_담아_제출() {
        // given
        givenCatalog();
        when(coordinator.submit(any())).thenAnswer(invocation ->
            ((ExecutionRequest) invocation.getArgument(0)).requestId());

        // when
        RequestId requestId = session.execute(UPDATE);

        // then
        ArgumentCaptor<ExecutionRequest> captor = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(coordinator).submit(captor.capture());
        ExecutionRequest request = captor.getValue();
        assertThat(request.requestId()).isEqualTo(requestId);
        assertThat(request.categoryName()).isEqualTo("System Tools");
        assertThat(request.nodeId()).isEqualTo(UPDATE);
        assertThat(request.nodeName()).isEqualTo("Update");
        assertThat(request.command()).isEqualTo(RawCommand.of("echo ok"));
    }

    @Test
    void 그룹_노드_execute는_coordinator에_전달되지_않음() {
        // given
        givenCatalog();

        // when & then
        assertThatThrownBy(() -> session.execute(SYSTEM))
            .isInstanceOf(NotExecutableException.class);
        verifyNoInteractions(coordinator);
    }

    @Test
    void 다른_카테고리의_노드는_NodeNotFoundException() {
        // given
        givenCatalog();

        // when & then
        assertThatThrownBy(() -> session.execute(NodeId.of("vim")))
            .isInstanceOf(NodeNotFoundException.class);
        verifyNoInteractions(coordinator);
    }

    @Test
    void executeSelected는_선택_순서대로_제출하고_선택을_비움() {
        // given
        givenCatalog();
        when(coordinator.submit(any())).thenAnswer(invocation ->
            ((ExecutionRequest) invocation.getArgument(0)).requestId());
        session.toggleSelection(UPGRADE);
        session.toggleSelection(UPDATE);

        // when
        List<RequestId> requestIds = session.executeSelected();

        // then
        ArgumentCaptor<ExecutionRequest> captor = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(coordinator, times(2)).submit(captor.capture());
        assertThat(captor.getAllValues()).extracting(ExecutionRequest::nodeId).containsExactly(UPGRADE, UPDATE);
        assertThat(requestIds).containsExactlyElementsOf(
            captor.getAllValues().stream().map(ExecutionRequest::requestId).toList());
        assertThat(session.selectedNodeIds()).isEmpty();
    }

    @Test
    void executeSelected에_그룹_노드가_있으면_아무것도_제출하지_않음() {
        // given
        givenCatalog();
        session.toggleSelection(UPDATE);
        session.toggleSelection(SYSTEM);

        // when & then
        assertThatThrownBy(() -> session.executeSelected())
            .isInstanceOf(NotExecutableException.class);
        verifyNoInteractions(coordinator);
        assertThat(session.selectedNodeIds()).containsExactly(UPDATE, SYSTEM);
    }

    @Test
    void 선택이_비어_있으면_executeSelected는_빈_목록() {
        // given
        givenCatalog();

        // when
        List<RequestId> requestIds = session.executeSelected();

        // then
        assertThat(requestIds).isEmpty();
        verifyNoInteractions(coordinator);
    }

    @Test
    void pollResult는_coordinator의_완료_결과를_전달() {
        // given
        ExecutionRequest request = ExecutionRequest.of("System Tools",
            CatalogNode.raw("update", "Update", "", "echo ok"));
        ExecutionResult result = ExecutionResult.succeeded("ok\n", 0);
        when(coordinator.poll()).thenReturn(Optional.of(new Completion(request, result)), Optional.empty());

        // when & then
        assertThat(session.pollResult()).contains(result);
        assertThat(session.pollResult()).isEmpty();
    }

    @Test
    void 기본_설정은_validate_false로_요청() {
        // given
        givenCatalog();

        // when
        session.listCategories();

        // then
        verify(provider).getCatalog(false);
    }

    @Test
    void overrideValidation이_false면_validate_true로_요청() {
        // given
        givenCatalog();
        DefaultCatalogSession validating = new DefaultCatalogSession(new CatalogCache(provider), coordinator,
            new SessionConfig().withOverrideValidation(false));

        // when
        validating.listCategories();

        // then
        verify(provider).getCatalog(true);
    }

    @Test
    void refreshCatalog는_캐시를_비우고_한_번_다시_로드() {
        // given
        givenCatalog();
        session.listCategories();
        session.enter(SYSTEM);

        // when
        session.refreshCatalog();
        session.listCategories();

        // then
        verify(provider, times(2)).getCatalog(false);
        assertThat(session.atRoot()).isTrue();
    }

    @Test
    void 빈_카탈로그에서는_내비게이션_연산이_IllegalStateException() {
        // given
        when(provider.getCatalog(anyBoolean())).thenReturn(CatalogSnapshot.of(List.of()));

        // when & then
        assertThat(session.listCategories()).isEmpty();
        assertThat(session.currentCategory()).isEmpty();
        assertThat(session.currentItems()).isEmpty();
        assertThat(session.selectedIndex()).isEqualTo(-1);
        assertThatThrownBy(() -> session.enter(SYSTEM))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("no categories");
    }

    @Test
    void preview는_현재_카테고리_노드를_렌더링() {
        // given
        givenCatalog();

        // when
        String preview = session.preview(UPDATE);

        // then
        assertThat(preview).isEqualTo("Raw Command:\necho ok\n\nDescription:\nRefresh package lists");
    }

    @Test
    void systemInfo는_제공자_결과를_복사해_반환() {
        // when & then
        assertThat(session.systemInfo()).containsExactly(Map.entry("architecture", "x86_64"));
        verifyNoInteractions(provider);
    }

    @Test
    void isExecuting과_close는_coordinator에_위임() throws InterruptedException {
        // given
        when(coordinator.isExecuting()).thenReturn(true);

        // when
        boolean executing = session.isExecuting();
        session.close();

        // then
        assertThat(executing).isTrue();
        InOrder inOrder = inOrder(coordinator);
        inOrder.verify(coordinator).isExecuting();
        inOrder.verify(coordinator).shutdown();
    }

    @Test
    void close_중_인터럽트되면_인터럽트_플래그를_복원() throws InterruptedException {
        // given
        doThrow(new InterruptedException("stop")).when(coordinator).shutdown();

        // when
        session.close();

        // then
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void 생성자_null_의존성은_거부() {
        // when & then
        CatalogCache cache = new CatalogCache(provider);
        assertThatThrownBy(() -> new DefaultCatalogSession(null, coordinator, new SessionConfig()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DefaultCatalogSession(cache, null, new SessionConfig()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DefaultCatalogSession(cache, coordinator, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DefaultCatalogSession(cache, coordinator, new SessionConfig(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
