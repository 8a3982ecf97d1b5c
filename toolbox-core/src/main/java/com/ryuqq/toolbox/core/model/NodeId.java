package com.ryuqq.toolbox.core.model;

/**
 * 카탈로그 노드의 식별자.
 *
 * <p>하나의 {@link CatalogSnapshot} 안에서 유일하며, 선택(Selection)과 내비게이션 프레임은
 * 노드의 구조적 동등성이 아니라 이 식별자를 기준으로 동작합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class NodeId {

    private final String value;

    private NodeId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("NodeId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("NodeId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * NodeId 생성.
     *
     * @param value NodeId 값
     * @return NodeId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static NodeId of(String value) {
        return new NodeId(value);
    }

    /**
     * NodeId 값 조회.
     *
     * @return NodeId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeId nodeId = (NodeId) o;
        return value.equals(nodeId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "NodeId{" + value + '}';
    }
}
