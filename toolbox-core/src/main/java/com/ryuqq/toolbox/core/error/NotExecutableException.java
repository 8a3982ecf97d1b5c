package com.ryuqq.toolbox.core.error;

import com.ryuqq.toolbox.core.model.NodeId;

/**
 * 그룹(디렉터리) 노드 실행 시도.
 *
 * <p>요청은 Worker에 전달되지 않으며 프로세스도 생성되지 않습니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public class NotExecutableException extends CatalogException {

    private final NodeId nodeId;

    public NotExecutableException(NodeId nodeId) {
        super(ErrorKind.NOT_EXECUTABLE, "Cannot execute directory: " + nodeId);
        this.nodeId = nodeId;
    }

    public NodeId nodeId() {
        return nodeId;
    }
}
