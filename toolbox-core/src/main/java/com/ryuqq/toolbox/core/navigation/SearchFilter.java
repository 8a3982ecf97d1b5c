package com.ryuqq.toolbox.core.navigation;

import com.ryuqq.toolbox.core.model.CatalogNode;

import java.util.List;
import java.util.Locale;

/**
 * 현재 위치의 자식 목록에서 검색어로 보이는 항목을 계산합니다.
 *
 * <p>순수 함수이며, 내비게이션 변경이나 검색어 편집 때마다 처음부터 다시 계산합니다
 * (증분 갱신 없음).</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>이름 또는 설명에 검색어가 대소문자 구분 없이 포함되면 일치</li>
 *   <li>빈 검색어는 원본 목록을 그대로 반환</li>
 *   <li>결과는 원본 순서를 유지하는 부분 수열</li>
 * </ul>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class SearchFilter {

    // Utility class - prevent instantiation
    private SearchFilter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 검색어로 자식 목록 필터링.
     *
     * @param children 현재 위치의 자식 목록
     * @param query 검색어 (null은 빈 검색어로 취급)
     * @return 일치하는 항목 (원본 순서)
     */
    public static List<CatalogNode> apply(List<CatalogNode> children, String query) {
        if (children == null) {
            throw new IllegalArgumentException("children cannot be null");
        }
        if (query == null || query.isEmpty()) {
            return List.copyOf(children);
        }
        String needle = query.toLowerCase(Locale.ROOT);
        return children.stream()
            .filter(child -> contains(child.name(), needle) || contains(child.description(), needle))
            .toList();
    }

    /**
     * 단일 노드가 검색어와 일치하는지 확인.
     */
    public static boolean matches(CatalogNode node, String query) {
        if (query == null || query.isEmpty()) {
            return true;
        }
        String needle = query.toLowerCase(Locale.ROOT);
        return contains(node.name(), needle) || contains(node.description(), needle);
    }

    /**
     * 필터링된 목록 크기에 맞춰 선택 인덱스 보정.
     *
     * @param index 이전 선택 인덱스
     * @param size 필터링된 목록 크기
     * @return 범위 안이면 index, 범위 밖이면 0, 목록이 비었으면 {@link NavigationFrame#NO_SELECTION}
     */
    public static int clamp(int index, int size) {
        if (size == 0) {
            return NavigationFrame.NO_SELECTION;
        }
        return index >= 0 && index < size ? index : 0;
    }

    private static boolean contains(String text, String lowerNeedle) {
        return text.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }
}
