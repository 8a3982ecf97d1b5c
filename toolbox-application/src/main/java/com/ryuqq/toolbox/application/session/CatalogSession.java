package com.ryuqq.toolbox.application.session;

import com.ryuqq.toolbox.core.contract.Completion;
import com.ryuqq.toolbox.core.model.NodeId;
import com.ryuqq.toolbox.core.model.RequestId;
import com.ryuqq.toolbox.core.outcome.ExecutionResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 인터랙티브/프레젠테이션 레이어에 노출되는 세션 API.
 *
 * <p>전송 방식과 무관한 연산 계약이며, in-process 호출이나 RPC 어느 쪽으로 노출해도 됩니다.
 * 노드 식별자는 현재 카테고리 안에서 해석됩니다.</p>
 *
 * <p><strong>오류:</strong></p>
 * <ul>
 *   <li>없는 카테고리/노드 → {@code CategoryNotFoundException} / {@code NodeNotFoundException} (동기)</li>
 *   <li>그룹 노드 실행 → {@code NotExecutableException} (동기, Worker에 전달되지 않음)</li>
 *   <li>프로세스 실패 → pollResult()의 실패 결과로 전달</li>
 * </ul>
 *
 * <p>구현체는 스레드 안전하지 않습니다. 인터랙티브 스레드 하나에서만 호출합니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public interface CatalogSession extends AutoCloseable {

    /**
     * 카테고리 이름 목록 (표시 순서).
     */
    List<String> listCategories();

    /**
     * 현재 카테고리.
     *
     * @return 카테고리 이름, 카탈로그가 비어 있으면 empty
     */
    Optional<String> currentCategory();

    /**
     * 카테고리 전환 (내비게이션 root로, 선택 집합 초기화).
     *
     * @param name 카테고리 이름
     */
    void switchCategory(String name);

    /**
     * 현재 위치에서 보이는 항목 (검색어 적용, 순서 유지).
     */
    List<ItemView> currentItems();

    /**
     * 자식이 있는 노드로 진입.
     *
     * @return 진입했으면 true, leaf라서 무시되었으면 false
     */
    boolean enter(NodeId nodeId);

    /**
     * 상위로 이동.
     *
     * @return 이동했으면 true, root였으면 false
     */
    boolean goBack();

    boolean atRoot();

    List<String> breadcrumb();

    /**
     * 보이는 항목 중 하나를 선택 (커서 이동).
     */
    void select(int index);

    /**
     * 현재 선택 인덱스 (보이는 항목이 없으면 -1).
     */
    int selectedIndex();

    void setSearch(String text);

    /**
     * 일괄 실행 선택 토글.
     *
     * @return 멤버십이 바뀌었으면 true (multiSelect가 아닌 노드는 false)
     */
    boolean toggleSelection(NodeId nodeId);

    List<NodeId> selectedNodeIds();

    /**
     * 노드 실행 요청 (비동기, 즉시 반환).
     */
    RequestId execute(NodeId nodeId);

    /**
     * 선택된 모든 노드 실행 요청 후 선택 집합 초기화 (비동기, 즉시 반환).
     *
     * @return 선택 순서대로 발급된 요청 식별자
     */
    List<RequestId> executeSelected();

    /**
     * 완료된 결과 하나 (비블로킹).
     */
    Optional<ExecutionResult> pollResult();

    /**
     * 완료된 결과를 원본 요청과 함께 가져옴 (비블로킹).
     */
    Optional<Completion> pollCompletion();

    boolean isExecuting();

    /**
     * 노드 미리보기 텍스트 (부작용 없음).
     */
    String preview(NodeId nodeId);

    /**
     * 캐시를 무효화하고 카탈로그를 다시 로드 (내비게이션/선택 초기화).
     */
    void refreshCatalog();

    /**
     * 호스트 정보 (system, distribution, architecture).
     */
    Map<String, String> systemInfo();

    /**
     * 대기 중인 요청이 끝날 때까지 기다린 뒤 Worker를 종료.
     */
    @Override
    void close();
}
