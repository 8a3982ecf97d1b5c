package com.ryuqq.toolbox.adapter.inmemory.catalog;

import com.ryuqq.toolbox.core.command.NoCommand;
import com.ryuqq.toolbox.core.command.RawCommand;
import com.ryuqq.toolbox.core.model.CatalogNode;
import com.ryuqq.toolbox.core.model.CategoryTree;
import com.ryuqq.toolbox.core.model.NodeId;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Fluent builder for {@link CategoryTree} instances.
 *
 * <p>The builder hides the arena layout: callers describe the tree top-down, and the
 * builder records each node once together with its ordered child ids. The root node is
 * generated automatically with the id {@code <category>/root} and the name {@code root}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CategoryTree tree = CategoryTreeBuilder.category("System Tools")
 *     .directory("system", "System", "System utilities", dir -&gt; dir
 *         .raw("kernel", "Kernel", "Show kernel version", "uname -r"))
 *     .node(CatalogNode.raw("update", "Update", "Update packages", "echo ok").withMultiSelect(true))
 *     .build();
 * </pre>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class CategoryTreeBuilder {

    private final String categoryName;
    private final List<CatalogNode> nodes = new ArrayList<>();
    private final Scope root = new Scope();

    private CategoryTreeBuilder(String categoryName) {
        if (categoryName == null || categoryName.isBlank()) {
            throw new IllegalArgumentException("categoryName cannot be null or blank");
        }
        this.categoryName = categoryName;
    }

    /**
     * Starts a new category.
     *
     * @param name the category name
     * @return a builder positioned at the category root
     */
    public static CategoryTreeBuilder category(String name) {
        return new CategoryTreeBuilder(name);
    }

    /**
     * Returns the id generated for the root node of a category.
     *
     * @param categoryName the category name
     * @return the root node id
     */
    public static NodeId rootIdOf(String categoryName) {
        return NodeId.of(categoryName + "/root");
    }

    public CategoryTreeBuilder directory(String id, String name, String description, Consumer<Scope> children) {
        root.directory(id, name, description, false, children);
        return this;
    }

    public CategoryTreeBuilder directory(String id, String name, String description, boolean multiSelect,
                                         Consumer<Scope> children) {
        root.directory(id, name, description, multiSelect, children);
        return this;
    }

    public CategoryTreeBuilder raw(String id, String name, String description, String shellText) {
        root.raw(id, name, description, shellText);
        return this;
    }

    public CategoryTreeBuilder node(CatalogNode leaf) {
        root.node(leaf);
        return this;
    }

    /**
     * Builds the immutable tree.
     *
     * @return the category tree
     * @throws IllegalArgumentException if ids collide or the structure is invalid
     */
    public CategoryTree build() {
        NodeId rootId = rootIdOf(categoryName);
        List<CatalogNode> all = new ArrayList<>(nodes.size() + 1);
        all.add(new CatalogNode(rootId, "root", "", List.of(), false, root.childIds, NoCommand.INSTANCE));
        all.addAll(nodes);
        return CategoryTree.of(categoryName, rootId, all);
    }

    /**
     * Collects the children of one directory level.
     */
    public final class Scope {

        private final List<NodeId> childIds = new ArrayList<>();

        private Scope() {
        }

        /**
         * Adds a grouping node whose children are described by {@code children}.
         */
        public Scope directory(String id, String name, String description, Consumer<Scope> children) {
            return directory(id, name, description, false, children);
        }

        /**
         * Adds a grouping node that can also be marked for batch execution.
         */
        public Scope directory(String id, String name, String description, boolean multiSelect,
                               Consumer<Scope> children) {
            Scope nested = new Scope();
            if (children != null) {
                children.accept(nested);
            }
            NodeId nodeId = NodeId.of(id);
            nodes.add(new CatalogNode(nodeId, name, description, List.of(), multiSelect, nested.childIds,
                NoCommand.INSTANCE));
            childIds.add(nodeId);
            return this;
        }

        /**
         * Adds a raw shell command leaf.
         */
        public Scope raw(String id, String name, String description, String shellText) {
            return node(new CatalogNode(NodeId.of(id), name, description, List.of(), false, List.of(), RawCommand.of(shellText)));
        }

        /**
         * Adds a prebuilt leaf node. Its child list must be empty.
         *
         * @throws IllegalArgumentException if the node declares children
         */
        public Scope node(CatalogNode leaf) {
            if (leaf == null) {
                throw new IllegalArgumentException("leaf cannot be null");
            }
            if (leaf.hasChildren()) {
                throw new IllegalArgumentException("use directory(...) for nodes with children: " + leaf.id());
            }
            nodes.add(leaf);
            childIds.add(leaf.id());
            return this;
        }
    }
}
