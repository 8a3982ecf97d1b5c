package com.ryuqq.toolbox.core.model;

import com.ryuqq.toolbox.core.error.NodeNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CategoryTree 구조 검증 테스트.
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
class CategoryTreeTest {

    private static final NodeId ROOT = NodeId.of("root");

    private static CategoryTree sampleTree() {
        return CategoryTree.of("System Tools", ROOT, List.of(
            CatalogNode.directory("root", "root", "", "system", "update"),
            CatalogNode.directory("system", "System", "System utilities", "kernel", "disk"),
            CatalogNode.raw("kernel", "Kernel Version", "", "uname -r"),
            CatalogNode.raw("disk", "Disk Usage", "", "df -h"),
            CatalogNode.raw("update", "Update", "", "echo ok")
        ));
    }

    @Test
    void of_ValidTree_ResolvesChildrenInOrder() {
        // When
        CategoryTree tree = sampleTree();

        // Then
        assertEquals("System Tools", tree.name());
        assertEquals(ROOT, tree.rootId());
        assertEquals(5, tree.size());
        assertEquals(List.of("System", "Update"),
            tree.children(ROOT).stream().map(CatalogNode::name).toList());
        assertEquals(List.of("Kernel Version", "Disk Usage"),
            tree.children(NodeId.of("system")).stream().map(CatalogNode::name).toList());
    }

    @Test
    void parentOf_ReturnsParent_AndEmptyForRoot() {
        // Given
        CategoryTree tree = sampleTree();

        // When & Then
        assertEquals(NodeId.of("system"), tree.parentOf(NodeId.of("disk")).orElseThrow());
        assertTrue(tree.parentOf(ROOT).isEmpty());
    }

    @Test
    void require_UnknownNode_ThrowsNodeNotFound() {
        // Given
        CategoryTree tree = sampleTree();

        // When & Then
        NodeNotFoundException exception = assertThrows(
            NodeNotFoundException.class,
            () -> tree.require(NodeId.of("missing"))
        );
        assertEquals(NodeId.of("missing"), exception.nodeId());
        assertTrue(tree.find(NodeId.of("missing")).isEmpty());
        assertFalse(tree.contains(NodeId.of("missing")));
    }

    @Test
    void of_MissingRoot_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> CategoryTree.of("Broken", ROOT, List.of(CatalogNode.raw("update", "Update", "", "echo ok")))
        );
        assertTrue(exception.getMessage().contains("missing"));
    }

    @Test
    void of_DuplicateId_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> CategoryTree.of("Broken", ROOT, List.of(
                CatalogNode.directory("root", "root", "", "update"),
                CatalogNode.raw("update", "Update", "", "echo ok"),
                CatalogNode.raw("update", "Update again", "", "echo again")
            ))
        );
        assertTrue(exception.getMessage().contains("duplicate"));
    }

    @Test
    void of_UnknownChild_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> CategoryTree.of("Broken", ROOT, List.of(
                CatalogNode.directory("root", "root", "", "ghost")
            ))
        );
        assertTrue(exception.getMessage().contains("unknown child"));
    }

    @Test
    void of_NodeWithTwoParents_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> CategoryTree.of("Broken", ROOT, List.of(
                CatalogNode.directory("root", "root", "", "a", "b"),
                CatalogNode.directory("a", "A", "", "shared"),
                CatalogNode.directory("b", "B", "", "shared"),
                CatalogNode.raw("shared", "Shared", "", "echo shared")
            ))
        );
        assertTrue(exception.getMessage().contains("two parents"));
    }

    @Test
    void of_RootListedAsChild_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalArgumentException.class,
            () -> CategoryTree.of("Broken", ROOT, List.of(
                CatalogNode.directory("root", "root", "", "loop"),
                CatalogNode.directory("loop", "Loop", "", "root")
            ))
        );
    }

    @Test
    void of_UnreachableNode_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> CategoryTree.of("Broken", ROOT, List.of(
                CatalogNode.directory("root", "root", "", "update"),
                CatalogNode.raw("update", "Update", "", "echo ok"),
                CatalogNode.raw("orphan", "Orphan", "", "echo orphan")
            ))
        );
        assertTrue(exception.getMessage().contains("unreachable"));
    }
}
