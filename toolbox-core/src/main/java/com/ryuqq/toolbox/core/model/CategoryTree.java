package com.ryuqq.toolbox.core.model;

import com.ryuqq.toolbox.core.error.NodeNotFoundException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 하나의 카테고리(탭)에 속한 노드 트리.
 *
 * <p>노드를 식별자 기준 arena로 보관하고, 각 노드는 자식 식별자 목록만 가집니다.
 * 생성 후에는 읽기 전용입니다.</p>
 *
 * <p><strong>생성 시 검증:</strong></p>
 * <ul>
 *   <li>root 노드 존재</li>
 *   <li>모든 자식 식별자가 트리 안의 노드를 가리킴</li>
 *   <li>어떤 노드도 부모를 두 개 이상 가지지 않음 (root는 부모 없음)</li>
 *   <li>모든 노드가 root에서 도달 가능</li>
 * </ul>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class CategoryTree {

    private final String name;
    private final NodeId rootId;
    private final Map<NodeId, CatalogNode> nodes;
    private final Map<NodeId, NodeId> parents;

    private CategoryTree(String name, NodeId rootId, Map<NodeId, CatalogNode> nodes) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (rootId == null) {
            throw new IllegalArgumentException("rootId cannot be null");
        }
        if (!nodes.containsKey(rootId)) {
            throw new IllegalArgumentException("root node " + rootId + " is missing from category " + name);
        }
        this.name = name;
        this.rootId = rootId;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.parents = Collections.unmodifiableMap(indexParents(name, rootId, nodes));
    }

    /**
     * CategoryTree 생성.
     *
     * @param name 카테고리 이름
     * @param rootId root 노드 식별자
     * @param nodes 트리에 속한 모든 노드 (root 포함)
     * @return CategoryTree
     * @throws IllegalArgumentException 트리 구조가 유효하지 않은 경우
     */
    public static CategoryTree of(String name, NodeId rootId, Collection<CatalogNode> nodes) {
        if (nodes == null) {
            throw new IllegalArgumentException("nodes cannot be null");
        }
        Map<NodeId, CatalogNode> arena = new LinkedHashMap<>();
        for (CatalogNode node : nodes) {
            if (arena.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("duplicate node id " + node.id() + " in category " + name);
            }
        }
        return new CategoryTree(name, rootId, arena);
    }

    private static Map<NodeId, NodeId> indexParents(String name, NodeId rootId, Map<NodeId, CatalogNode> nodes) {
        Map<NodeId, NodeId> parents = new HashMap<>();
        for (CatalogNode node : nodes.values()) {
            for (NodeId childId : node.childIds()) {
                if (!nodes.containsKey(childId)) {
                    throw new IllegalArgumentException(
                        "node " + node.id() + " references unknown child " + childId + " in category " + name);
                }
                if (childId.equals(rootId)) {
                    throw new IllegalArgumentException("root node " + rootId + " cannot be a child");
                }
                NodeId previous = parents.putIfAbsent(childId, node.id());
                if (previous != null) {
                    throw new IllegalArgumentException(
                        "node " + childId + " has two parents: " + previous + ", " + node.id());
                }
            }
        }

        Set<NodeId> reached = new HashSet<>();
        Deque<NodeId> pending = new ArrayDeque<>();
        pending.push(rootId);
        while (!pending.isEmpty()) {
            NodeId current = pending.pop();
            if (reached.add(current)) {
                nodes.get(current).childIds().forEach(pending::push);
            }
        }
        if (reached.size() != nodes.size()) {
            throw new IllegalArgumentException(
                (nodes.size() - reached.size()) + " node(s) unreachable from root in category " + name);
        }
        return parents;
    }

    public String name() {
        return name;
    }

    public NodeId rootId() {
        return rootId;
    }

    public CatalogNode root() {
        return nodes.get(rootId);
    }

    /**
     * 노드 조회.
     *
     * @param id 노드 식별자
     * @return 노드 (없으면 empty)
     */
    public Optional<CatalogNode> find(NodeId id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * 노드 조회 (없으면 예외).
     *
     * @param id 노드 식별자
     * @return 노드
     * @throws NodeNotFoundException 트리에 없는 경우
     */
    public CatalogNode require(NodeId id) {
        CatalogNode node = nodes.get(id);
        if (node == null) {
            throw new NodeNotFoundException(id, "Node " + id + " not found in category " + name);
        }
        return node;
    }

    public boolean contains(NodeId id) {
        return nodes.containsKey(id);
    }

    /**
     * 자식 노드 목록 (선언 순서).
     *
     * @param id 부모 노드 식별자
     * @return 자식 노드 목록
     * @throws NodeNotFoundException 트리에 없는 경우
     */
    public List<CatalogNode> children(NodeId id) {
        CatalogNode parent = require(id);
        List<CatalogNode> children = new ArrayList<>(parent.childIds().size());
        for (NodeId childId : parent.childIds()) {
            children.add(nodes.get(childId));
        }
        return Collections.unmodifiableList(children);
    }

    /**
     * 부모 노드 식별자 조회.
     *
     * @param id 노드 식별자
     * @return 부모 식별자 (root인 경우 empty)
     */
    public Optional<NodeId> parentOf(NodeId id) {
        return Optional.ofNullable(parents.get(id));
    }

    /**
     * root를 포함한 모든 노드 (삽입 순서).
     */
    public Collection<CatalogNode> nodes() {
        return nodes.values();
    }

    public int size() {
        return nodes.size();
    }

    @Override
    public String toString() {
        return "CategoryTree{name=" + name + ", root=" + rootId + ", size=" + nodes.size() + "}";
    }
}
