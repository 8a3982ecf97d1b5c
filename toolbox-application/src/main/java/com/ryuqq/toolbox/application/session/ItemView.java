package com.ryuqq.toolbox.application.session;

import com.ryuqq.toolbox.core.model.CatalogNode;
import com.ryuqq.toolbox.core.model.NodeId;

import java.util.List;

/**
 * 현재 위치에서 보이는 항목 하나 (표시용 읽기 전용 뷰).
 *
 * @param id 노드 식별자
 * @param name 이름
 * @param description 설명
 * @param tags 태그
 * @param hasChildren 자식 존재 여부 (진입 가능)
 * @param multiSelectable 일괄 선택 가능 여부
 * @param multiSelected 현재 선택 집합에 포함되어 있는지
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public record ItemView(
    NodeId id,
    String name,
    String description,
    List<String> tags,
    boolean hasChildren,
    boolean multiSelectable,
    boolean multiSelected
) {

    public ItemView {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    static ItemView of(CatalogNode node, boolean multiSelected) {
        return new ItemView(node.id(), node.name(), node.description(), node.tags(),
            node.hasChildren(), node.multiSelect(), multiSelected);
    }
}
