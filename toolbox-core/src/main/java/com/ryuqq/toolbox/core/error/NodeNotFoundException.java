package com.ryuqq.toolbox.core.error;

import com.ryuqq.toolbox.core.model.NodeId;

/**
 * 노드를 찾을 수 없음.
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public class NodeNotFoundException extends CatalogException {

    private final NodeId nodeId;

    public NodeNotFoundException(NodeId nodeId) {
        this(nodeId, "Node not found: " + nodeId);
    }

    public NodeNotFoundException(NodeId nodeId, String message) {
        super(ErrorKind.NOT_FOUND, message);
        this.nodeId = nodeId;
    }

    public NodeId nodeId() {
        return nodeId;
    }
}
