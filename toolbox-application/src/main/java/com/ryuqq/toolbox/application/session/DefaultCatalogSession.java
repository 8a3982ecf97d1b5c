package com.ryuqq.toolbox.application.session;

import com.ryuqq.toolbox.application.coordinator.ExecutionCoordinator;
import com.ryuqq.toolbox.core.cache.CatalogCache;
import com.ryuqq.toolbox.core.contract.Completion;
import com.ryuqq.toolbox.core.contract.ExecutionRequest;
import com.ryuqq.toolbox.core.error.NotExecutableException;
import com.ryuqq.toolbox.core.model.CatalogNode;
import com.ryuqq.toolbox.core.model.CatalogSnapshot;
import com.ryuqq.toolbox.core.model.NodeId;
import com.ryuqq.toolbox.core.model.RequestId;
import com.ryuqq.toolbox.core.navigation.NavigationFrame;
import com.ryuqq.toolbox.core.navigation.NavigationStack;
import com.ryuqq.toolbox.core.navigation.SelectionSet;
import com.ryuqq.toolbox.core.outcome.ExecutionResult;
import com.ryuqq.toolbox.core.spi.SystemInfoSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 기본 {@link CatalogSession} 구현체.
 *
 * <p>CatalogCache, NavigationStack, SelectionSet, ExecutionCoordinator를 묶어
 * 인터랙티브 레이어용 연산을 제공합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 모든 연산 시작 시 currentSnapshot()
 *   ↓
 * cache.load(validate) → 캐시된 스냅샷과 동일 객체인지 확인
 *   ↓
 * 다른 스냅샷이면 (최초 로드 / 재로드):
 *   - 이전 카테고리가 남아 있으면 유지, 없으면 첫 카테고리
 *   - NavigationStack을 root 프레임으로, SelectionSet 비움
 * </pre>
 *
 * <p><strong>실행 요청:</strong></p>
 * <ul>
 *   <li>그룹 노드 → NotExecutableException (Coordinator에 전달되지 않음)</li>
 *   <li>executeSelected()는 모든 멤버를 먼저 검증한 뒤 하나라도 실행 불가면 아무것도 제출하지 않음</li>
 * </ul>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class DefaultCatalogSession implements CatalogSession {

    private static final Logger log = LoggerFactory.getLogger(DefaultCatalogSession.class);

    private final CatalogCache cache;
    private final ExecutionCoordinator coordinator;
    private final SessionConfig config;
    private final SystemInfoSource systemInfoSource;
    private final PreviewRenderer previewRenderer;
    private final SelectionSet selection = new SelectionSet();

    private CatalogSnapshot snapshot;
    private NavigationStack navigation;

    /**
     * 생성자 (호스트 정보 없음).
     *
     * @param cache 카탈로그 캐시
     * @param coordinator 실행 조정자
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultCatalogSession(CatalogCache cache, ExecutionCoordinator coordinator, SessionConfig config) {
        this(cache, coordinator, config, Map::of);
    }

    /**
     * 생성자.
     *
     * @param cache 카탈로그 캐시
     * @param coordinator 실행 조정자
     * @param config 설정
     * @param systemInfoSource 호스트 정보 제공자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultCatalogSession(CatalogCache cache, ExecutionCoordinator coordinator, SessionConfig config,
                                 SystemInfoSource systemInfoSource) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (systemInfoSource == null) {
            throw new IllegalArgumentException("systemInfoSource cannot be null");
        }
        this.cache = cache;
        this.coordinator = coordinator;
        this.config = config;
        this.systemInfoSource = systemInfoSource;
        this.previewRenderer = new PreviewRenderer();
    }

    @Override
    public List<String> listCategories() {
        return currentSnapshot().categoryNames();
    }

    @Override
    public Optional<String> currentCategory() {
        currentSnapshot();
        return navigation == null ? Optional.empty() : Optional.of(navigation.categoryName());
    }

    @Override
    public void switchCategory(String name) {
        CatalogSnapshot current = currentSnapshot();
        navigation = new NavigationStack(current.category(name));
        selection.clear();
        log.debug("Switched to category {}", name);
    }

    @Override
    public List<ItemView> currentItems() {
        currentSnapshot();
        if (navigation == null) {
            return List.of();
        }
        List<ItemView> items = new ArrayList<>();
        for (CatalogNode node : navigation.visibleChildren()) {
            items.add(ItemView.of(node, selection.contains(node.id())));
        }
        return List.copyOf(items);
    }

    @Override
    public boolean enter(NodeId nodeId) {
        return requireNavigation().enter(nodeId);
    }

    @Override
    public boolean goBack() {
        return requireNavigation().goBack();
    }

    @Override
    public boolean atRoot() {
        return requireNavigation().atRoot();
    }

    @Override
    public List<String> breadcrumb() {
        return requireNavigation().breadcrumb();
    }

    @Override
    public void select(int index) {
        requireNavigation().select(index);
    }

    @Override
    public int selectedIndex() {
        currentSnapshot();
        return navigation == null ? NavigationFrame.NO_SELECTION : navigation.selectedIndex();
    }

    @Override
    public void setSearch(String text) {
        requireNavigation().setSearch(text);
    }

    @Override
    public boolean toggleSelection(NodeId nodeId) {
        CatalogNode node = requireNavigation().tree().require(nodeId);
        return selection.toggle(node);
    }

    @Override
    public List<NodeId> selectedNodeIds() {
        currentSnapshot();
        return selection.members();
    }

    @Override
    public RequestId execute(NodeId nodeId) {
        NavigationStack nav = requireNavigation();
        CatalogNode node = requireExecutable(nav, nodeId);
        return coordinator.submit(ExecutionRequest.of(nav.categoryName(), node));
    }

    @Override
    public List<RequestId> executeSelected() {
        NavigationStack nav = requireNavigation();
        for (NodeId member : selection.members()) {
            requireExecutable(nav, member);
        }
        List<RequestId> requestIds = new ArrayList<>(selection.size());
        selection.executeAll(member ->
            requestIds.add(coordinator.submit(ExecutionRequest.of(nav.categoryName(), nav.tree().require(member)))));
        log.debug("Submitted {} selected node(s) in category {}", requestIds.size(), nav.categoryName());
        return List.copyOf(requestIds);
    }

    @Override
    public Optional<ExecutionResult> pollResult() {
        return pollCompletion().map(Completion::result);
    }

    @Override
    public Optional<Completion> pollCompletion() {
        return coordinator.poll();
    }

    @Override
    public boolean isExecuting() {
        return coordinator.isExecuting();
    }

    @Override
    public String preview(NodeId nodeId) {
        return previewRenderer.render(requireNavigation().tree().require(nodeId));
    }

    @Override
    public void refreshCatalog() {
        cache.invalidate();
        resetTo(cache.load(config.validate()));
    }

    @Override
    public Map<String, String> systemInfo() {
        return Map.copyOf(systemInfoSource.describe());
    }

    @Override
    public void close() {
        try {
            coordinator.shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down the execution coordinator");
        }
    }

    private CatalogSnapshot currentSnapshot() {
        CatalogSnapshot loaded = cache.load(config.validate());
        if (loaded != snapshot) {
            resetTo(loaded);
        }
        return loaded;
    }

    private void resetTo(CatalogSnapshot loaded) {
        String previousCategory = navigation == null ? null : navigation.categoryName();
        snapshot = loaded;
        selection.clear();

        if (previousCategory != null && loaded.hasCategory(previousCategory)) {
            navigation = new NavigationStack(loaded.category(previousCategory));
        } else if (!loaded.isEmpty()) {
            navigation = new NavigationStack(loaded.category(loaded.categoryNames().get(0)));
        } else {
            navigation = null;
        }
        log.info("Session reset to category {}", navigation == null ? "<none>" : navigation.categoryName());
    }

    private NavigationStack requireNavigation() {
        currentSnapshot();
        if (navigation == null) {
            throw new IllegalStateException("Catalog has no categories");
        }
        return navigation;
    }

    private CatalogNode requireExecutable(NavigationStack nav, NodeId nodeId) {
        CatalogNode node = nav.tree().require(nodeId);
        if (!node.isExecutable()) {
            throw new NotExecutableException(nodeId);
        }
        return node;
    }
}
