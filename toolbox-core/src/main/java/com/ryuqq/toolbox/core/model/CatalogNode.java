package com.ryuqq.toolbox.core.model;

import com.ryuqq.toolbox.core.command.CommandSpec;
import com.ryuqq.toolbox.core.command.LocalFileCommand;
import com.ryuqq.toolbox.core.command.NoCommand;
import com.ryuqq.toolbox.core.command.RawCommand;

import java.util.Arrays;
import java.util.List;

/**
 * 카탈로그 트리의 한 노드.
 *
 * <p>노드는 자식 노드를 직접 소유하지 않고 자식 식별자 목록만 가집니다.
 * 실제 노드는 {@link CategoryTree}가 식별자 기준으로 보관합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>id:</strong> 스냅샷 내 유일한 식별자</li>
 *   <li><strong>name / description:</strong> 표시 이름과 설명</li>
 *   <li><strong>tags:</strong> 자유 형식 태그 (task list)</li>
 *   <li><strong>multiSelect:</strong> 일괄 실행 선택 가능 여부</li>
 *   <li><strong>childIds:</strong> 순서 있는 자식 식별자 목록 (비어 있으면 leaf)</li>
 *   <li><strong>command:</strong> 명령 명세</li>
 * </ul>
 *
 * @param id 노드 식별자
 * @param name 표시 이름
 * @param description 설명 (null이면 빈 문자열)
 * @param tags 태그 목록 (null이면 빈 목록)
 * @param multiSelect 일괄 선택 가능 여부
 * @param childIds 자식 식별자 목록 (null이면 빈 목록)
 * @param command 명령 명세 (null이면 NoCommand)
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public record CatalogNode(
    NodeId id,
    String name,
    String description,
    List<String> tags,
    boolean multiSelect,
    List<NodeId> childIds,
    CommandSpec command
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null이거나 name이 비어 있는 경우
     */
    public CatalogNode {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        description = description == null ? "" : description;
        tags = tags == null ? List.of() : List.copyOf(tags);
        childIds = childIds == null ? List.of() : List.copyOf(childIds);
        command = command == null ? NoCommand.INSTANCE : command;
    }

    /**
     * 그룹(디렉터리) 노드 생성.
     *
     * @param id 식별자
     * @param name 이름
     * @param description 설명
     * @param children 자식 식별자
     * @return CatalogNode
     */
    public static CatalogNode directory(String id, String name, String description, String... children) {
        List<NodeId> childIds = Arrays.stream(children).map(NodeId::of).toList();
        return new CatalogNode(NodeId.of(id), name, description, List.of(), false, childIds, NoCommand.INSTANCE);
    }

    /**
     * 셸 명령 leaf 노드 생성.
     */
    public static CatalogNode raw(String id, String name, String description, String shellText) {
        return new CatalogNode(NodeId.of(id), name, description, List.of(), false, List.of(), RawCommand.of(shellText));
    }

    /**
     * 스크립트 leaf 노드 생성.
     */
    public static CatalogNode script(String id, String name, String description, LocalFileCommand command) {
        return new CatalogNode(NodeId.of(id), name, description, List.of(), false, List.of(), command);
    }

    /**
     * multiSelect만 변경한 새 인스턴스 생성.
     */
    public CatalogNode withMultiSelect(boolean multiSelect) {
        return new CatalogNode(id, name, description, tags, multiSelect, childIds, command);
    }

    /**
     * tags만 변경한 새 인스턴스 생성.
     */
    public CatalogNode withTags(String... tags) {
        return new CatalogNode(id, name, description, List.of(tags), multiSelect, childIds, command);
    }

    /**
     * 자식 노드가 있는지 확인.
     *
     * @return 자식이 하나 이상이면 true
     */
    public boolean hasChildren() {
        return !childIds.isEmpty();
    }

    /**
     * 실행 가능한 명령을 가졌는지 확인.
     *
     * @return command가 NoCommand가 아니면 true
     */
    public boolean isExecutable() {
        return command.isExecutable();
    }
}
