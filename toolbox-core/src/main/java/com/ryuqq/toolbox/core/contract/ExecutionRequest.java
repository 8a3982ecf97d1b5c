package com.ryuqq.toolbox.core.contract;

import com.ryuqq.toolbox.core.command.CommandSpec;
import com.ryuqq.toolbox.core.model.CatalogNode;
import com.ryuqq.toolbox.core.model.NodeId;
import com.ryuqq.toolbox.core.model.RequestId;

/**
 * Worker에게 전달되는 실행 요청.
 *
 * <p>요청 시점의 명령 명세를 함께 담기 때문에, 이후 카탈로그가 재로드되어도
 * Worker는 제출된 명령 그대로 실행합니다.</p>
 *
 * @param requestId 요청 식별자
 * @param categoryName 카테고리 이름
 * @param nodeId 대상 노드 식별자
 * @param nodeName 대상 노드 이름 (로그/표시용)
 * @param command 실행할 명령 명세 (실행 가능해야 함)
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public record ExecutionRequest(
    RequestId requestId,
    String categoryName,
    NodeId nodeId,
    String nodeName,
    CommandSpec command
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 command가 실행 불가능한 경우
     */
    public ExecutionRequest {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (categoryName == null || categoryName.isBlank()) {
            throw new IllegalArgumentException("categoryName cannot be null or blank");
        }
        if (nodeId == null) {
            throw new IllegalArgumentException("nodeId cannot be null");
        }
        if (nodeName == null) {
            throw new IllegalArgumentException("nodeName cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (!command.isExecutable()) {
            throw new IllegalArgumentException("command must be executable for node " + nodeId);
        }
    }

    /**
     * 노드로부터 새 요청 생성 (RequestId 자동 발급).
     *
     * @param categoryName 카테고리 이름
     * @param node 대상 노드
     * @return ExecutionRequest
     */
    public static ExecutionRequest of(String categoryName, CatalogNode node) {
        return new ExecutionRequest(RequestId.next(), categoryName, node.id(), node.name(), node.command());
    }
}
