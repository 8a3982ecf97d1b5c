package com.ryuqq.toolbox.core.navigation;

import com.ryuqq.toolbox.core.model.NodeId;

/**
 * 내비게이션 스택의 한 프레임.
 *
 * <p>진입한 노드의 식별자와, 진입 직전 부모 목록에서 선택되어 있던 인덱스를 기록합니다.
 * 뒤로 가기 시 이 인덱스로 선택이 복원됩니다.</p>
 *
 * @param nodeId 프레임이 가리키는 노드
 * @param selectedIndex 진입 직전 선택 인덱스 ({@link #NO_SELECTION} 가능)
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public record NavigationFrame(
    NodeId nodeId,
    int selectedIndex
) {

    /**
     * 선택 항목 없음 (보이는 목록이 비어 있음).
     */
    public static final int NO_SELECTION = -1;

    public NavigationFrame {
        if (nodeId == null) {
            throw new IllegalArgumentException("nodeId cannot be null");
        }
        if (selectedIndex < NO_SELECTION) {
            throw new IllegalArgumentException("selectedIndex must be >= -1 (current: " + selectedIndex + ")");
        }
    }

    /**
     * 카테고리 root 프레임 생성.
     */
    public static NavigationFrame root(NodeId rootId) {
        return new NavigationFrame(rootId, 0);
    }
}
