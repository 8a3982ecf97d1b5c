package com.ryuqq.toolbox.core.navigation;

import com.ryuqq.toolbox.core.error.NodeNotFoundException;
import com.ryuqq.toolbox.core.model.CatalogNode;
import com.ryuqq.toolbox.core.model.CategoryTree;
import com.ryuqq.toolbox.core.model.NodeId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * 한 카테고리 트리 안에서의 현재 위치와 경로.
 *
 * <p>프레임 스택, 검색어, 선택 인덱스를 함께 관리하며, 보이는 항목은 변경이 있을 때마다
 * {@link SearchFilter}로 다시 계산합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>스택은 비어 있지 않음, 맨 아래 프레임은 항상 카테고리 root</li>
 *   <li>root에서의 goBack()은 아무 동작도 하지 않음</li>
 *   <li>enter 후 goBack 하면 진입 직전 선택 인덱스가 복원됨</li>
 *   <li>선택 인덱스는 보이는 항목 범위 안이거나, 목록이 비었으면 NO_SELECTION</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * NavigationStack stack = new NavigationStack(tree);
 * stack.enter(NodeId.of("system"));   // 자식이 있으면 진입
 * stack.setSearch("upd");             // 보이는 항목 재계산
 * stack.goBack();                     // 검색어 초기화 + 선택 인덱스 복원
 * </pre>
 *
 * <p>스레드 안전하지 않습니다. 인터랙티브 스레드에서만 사용합니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class NavigationStack {

    private final CategoryTree tree;
    private final Deque<NavigationFrame> frames = new ArrayDeque<>();

    private String searchQuery = "";
    private int selectedIndex;
    private List<CatalogNode> visible = List.of();

    /**
     * root 프레임 하나로 시작하는 스택 생성.
     *
     * @param tree 카테고리 트리
     * @throws IllegalArgumentException tree가 null인 경우
     */
    public NavigationStack(CategoryTree tree) {
        if (tree == null) {
            throw new IllegalArgumentException("tree cannot be null");
        }
        this.tree = tree;
        frames.push(NavigationFrame.root(tree.rootId()));
        recompute(0);
    }

    /**
     * 자식 노드로 진입.
     *
     * <p>대상이 자식을 가지지 않으면 아무 동작도 하지 않습니다. 진입 시 현재 선택 인덱스를
     * 프레임에 기록하고, 선택 인덱스를 0으로, 검색어를 빈 문자열로 초기화합니다.</p>
     *
     * @param nodeId 진입할 노드 (현재 위치의 자식이어야 함)
     * @return 진입했으면 true, 대상이 leaf라서 무시되었으면 false
     * @throws NodeNotFoundException 트리에 없거나 현재 위치의 자식이 아닌 경우
     */
    public boolean enter(NodeId nodeId) {
        CatalogNode target = tree.require(nodeId);
        if (!currentNode().childIds().contains(nodeId)) {
            throw new NodeNotFoundException(nodeId,
                "Node " + nodeId + " is not a child of " + currentNodeId() + " in category " + tree.name());
        }
        if (!target.hasChildren()) {
            return false;
        }
        frames.push(new NavigationFrame(nodeId, selectedIndex));
        searchQuery = "";
        recompute(0);
        return true;
    }

    /**
     * 상위 위치로 이동.
     *
     * <p>root 프레임만 남은 경우 아무 동작도 하지 않습니다. 꺼낸 프레임에 기록된 선택 인덱스를
     * 복원하고 검색어를 초기화합니다.</p>
     *
     * @return 이동했으면 true, 이미 root였으면 false
     */
    public boolean goBack() {
        if (atRoot()) {
            return false;
        }
        NavigationFrame popped = frames.pop();
        searchQuery = "";
        recompute(popped.selectedIndex());
        return true;
    }

    /**
     * 검색어 변경 (보이는 항목 재계산, 선택 인덱스 보정).
     *
     * @param query 검색어 (null은 빈 검색어)
     */
    public void setSearch(String query) {
        searchQuery = query == null ? "" : query;
        recompute(selectedIndex);
    }

    /**
     * 보이는 항목 중 하나를 선택.
     *
     * @param index 보이는 항목 기준 인덱스
     * @throws IllegalArgumentException 범위를 벗어난 경우
     */
    public void select(int index) {
        if (index < 0 || index >= visible.size()) {
            throw new IllegalArgumentException(
                "index out of range (current: " + index + ", visible: " + visible.size() + ")");
        }
        selectedIndex = index;
    }

    public boolean atRoot() {
        return frames.size() == 1;
    }

    public int depth() {
        return frames.size();
    }

    /**
     * 경로 표시: 카테고리 이름 + root 위 프레임 노드 이름들 (스택 순서).
     *
     * @return breadcrumb 이름 목록
     */
    public List<String> breadcrumb() {
        List<String> names = new ArrayList<>(frames.size());
        names.add(tree.name());
        Iterator<NavigationFrame> bottomUp = frames.descendingIterator();
        bottomUp.next(); // root
        while (bottomUp.hasNext()) {
            names.add(tree.require(bottomUp.next().nodeId()).name());
        }
        return List.copyOf(names);
    }

    /**
     * 프레임 목록 (root부터 현재 위치까지).
     */
    public List<NavigationFrame> frames() {
        List<NavigationFrame> bottomUp = new ArrayList<>(frames);
        Collections.reverse(bottomUp);
        return List.copyOf(bottomUp);
    }

    public NodeId currentNodeId() {
        return frames.peek().nodeId();
    }

    public CatalogNode currentNode() {
        return tree.require(currentNodeId());
    }

    /**
     * 현재 위치의 보이는 자식 목록 (검색어 적용).
     */
    public List<CatalogNode> visibleChildren() {
        return visible;
    }

    /**
     * 현재 선택 인덱스.
     *
     * @return 선택 인덱스, 보이는 항목이 없으면 {@link NavigationFrame#NO_SELECTION}
     */
    public int selectedIndex() {
        return selectedIndex;
    }

    public Optional<CatalogNode> selectedNode() {
        if (selectedIndex == NavigationFrame.NO_SELECTION) {
            return Optional.empty();
        }
        return Optional.of(visible.get(selectedIndex));
    }

    public String searchQuery() {
        return searchQuery;
    }

    public CategoryTree tree() {
        return tree;
    }

    public String categoryName() {
        return tree.name();
    }

    private void recompute(int desiredIndex) {
        visible = SearchFilter.apply(tree.children(currentNodeId()), searchQuery);
        selectedIndex = SearchFilter.clamp(desiredIndex, visible.size());
    }
}
