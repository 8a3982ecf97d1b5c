package com.ryuqq.toolbox.core.model;

import com.ryuqq.toolbox.core.error.CategoryNotFoundException;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 완전히 로드된 카탈로그 한 벌.
 *
 * <p>카테고리 이름 → {@link CategoryTree} 매핑이며, 카테고리 순서는 제공자가 넘겨준 순서를
 * 유지합니다. 생성 후 불변이며, 재로드 시 부분 갱신 없이 통째로 교체됩니다.</p>
 *
 * <p><strong>불변식:</strong> 노드 식별자는 스냅샷 전체에서 유일합니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class CatalogSnapshot {

    private final Map<String, CategoryTree> categories;
    private final Map<NodeId, String> categoryByNode;

    private CatalogSnapshot(Map<String, CategoryTree> categories) {
        Map<NodeId, String> index = new HashMap<>();
        for (CategoryTree tree : categories.values()) {
            for (CatalogNode node : tree.nodes()) {
                String previous = index.putIfAbsent(node.id(), tree.name());
                if (previous != null) {
                    throw new IllegalArgumentException(
                        "node id " + node.id() + " is used by both " + previous + " and " + tree.name());
                }
            }
        }
        this.categories = Collections.unmodifiableMap(categories);
        this.categoryByNode = Collections.unmodifiableMap(index);
    }

    /**
     * 스냅샷 생성.
     *
     * @param trees 카테고리 트리 목록 (표시 순서)
     * @return CatalogSnapshot
     * @throws IllegalArgumentException 카테고리 이름 또는 노드 식별자가 중복된 경우
     */
    public static CatalogSnapshot of(List<CategoryTree> trees) {
        if (trees == null) {
            throw new IllegalArgumentException("trees cannot be null");
        }
        Map<String, CategoryTree> categories = new LinkedHashMap<>();
        for (CategoryTree tree : trees) {
            if (categories.putIfAbsent(tree.name(), tree) != null) {
                throw new IllegalArgumentException("duplicate category name: " + tree.name());
            }
        }
        return new CatalogSnapshot(categories);
    }

    public static CatalogSnapshot of(CategoryTree... trees) {
        return of(List.of(trees));
    }

    /**
     * 카테고리 이름 목록 (표시 순서).
     */
    public List<String> categoryNames() {
        return List.copyOf(categories.keySet());
    }

    /**
     * 카테고리 조회.
     *
     * @param name 카테고리 이름
     * @return CategoryTree
     * @throws CategoryNotFoundException 없는 카테고리인 경우
     */
    public CategoryTree category(String name) {
        CategoryTree tree = categories.get(name);
        if (tree == null) {
            throw new CategoryNotFoundException(name);
        }
        return tree;
    }

    public boolean hasCategory(String name) {
        return categories.containsKey(name);
    }

    /**
     * 노드가 속한 카테고리 이름 조회.
     *
     * @param id 노드 식별자
     * @return 카테고리 이름 (없으면 empty)
     */
    public Optional<String> categoryOf(NodeId id) {
        return Optional.ofNullable(categoryByNode.get(id));
    }

    public boolean isEmpty() {
        return categories.isEmpty();
    }

    public int nodeCount() {
        return categoryByNode.size();
    }

    @Override
    public String toString() {
        return "CatalogSnapshot{categories=" + categories.keySet() + ", nodes=" + categoryByNode.size() + "}";
    }
}
