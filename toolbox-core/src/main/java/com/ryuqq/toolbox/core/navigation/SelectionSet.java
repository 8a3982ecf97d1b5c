package com.ryuqq.toolbox.core.navigation;

import com.ryuqq.toolbox.core.model.CatalogNode;
import com.ryuqq.toolbox.core.model.NodeId;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 일괄 실행을 위해 표시된 노드 집합.
 *
 * <p>노드 식별자 기준으로 관리하므로 디렉터리 진입/이탈 후에도 선택이 유지됩니다.
 * {@code multiSelect}가 true인 노드만 담을 수 있으며, 선택 순서를 보존합니다.</p>
 *
 * <p>스레드 안전하지 않습니다. 인터랙티브 스레드에서만 사용합니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class SelectionSet {

    private final Set<NodeId> members = new LinkedHashSet<>();

    /**
     * 선택 토글.
     *
     * <p>{@code multiSelect}가 false인 노드는 무시합니다. 이미 있으면 제거하고,
     * 없으면 추가합니다.</p>
     *
     * @param node 대상 노드
     * @return 멤버십이 바뀌었으면 true
     * @throws IllegalArgumentException node가 null인 경우
     */
    public boolean toggle(CatalogNode node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        if (!node.multiSelect()) {
            return false;
        }
        if (!members.remove(node.id())) {
            members.add(node.id());
        }
        return true;
    }

    public boolean contains(NodeId nodeId) {
        return members.contains(nodeId);
    }

    /**
     * 선택된 노드 식별자 (선택 순서).
     */
    public List<NodeId> members() {
        return List.copyOf(members);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public void clear() {
        members.clear();
    }

    /**
     * 멤버마다 한 번씩 제출한 뒤 집합을 비움.
     *
     * <p>제출 순서는 선택 순서와 같습니다. submitter가 예외를 던지면 집합은 비워지지 않습니다.</p>
     *
     * @param submitter 멤버 하나를 제출하는 콜백
     * @return 제출한 멤버 수
     */
    public int executeAll(Consumer<NodeId> submitter) {
        if (submitter == null) {
            throw new IllegalArgumentException("submitter cannot be null");
        }
        List<NodeId> batch = members();
        batch.forEach(submitter);
        members.clear();
        return batch.size();
    }
}
