package com.ryuqq.toolbox.core.cache;

import com.ryuqq.toolbox.core.model.CatalogSnapshot;
import com.ryuqq.toolbox.core.spi.CatalogProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 가장 최근에 로드한 카탈로그 스냅샷을 보관하는 단일 슬롯 캐시.
 *
 * <p>세션/컨텍스트를 통해 명시적으로 전달되는 객체이며, 전역 상태를 두지 않습니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>load(validate): 슬롯이 차 있으면 그대로 반환, 비어 있으면 제공자를 한 번 호출해 저장 후 반환</li>
 *   <li>invalidate(): 슬롯을 무조건 비움, 다음 load는 제공자를 정확히 한 번 호출</li>
 *   <li>시간 기반 만료 없음, 부분 무효화 없음 (스냅샷 통째로 교체)</li>
 * </ul>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>락은 슬롯 읽기/교체 구간에서만 잡으며, 제공자 호출(I/O) 동안에는 잡지 않음</li>
 *   <li>제공자 호출 중 invalidate()가 일어나면 그 결과는 호출자에게만 반환되고 저장되지 않음</li>
 * </ul>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class CatalogCache {

    private static final Logger log = LoggerFactory.getLogger(CatalogCache.class);

    private final CatalogProvider provider;
    private final Object lock = new Object();

    private CatalogSnapshot slot;
    private long generation;

    /**
     * 생성자.
     *
     * @param provider 카탈로그 제공자
     * @throws IllegalArgumentException provider가 null인 경우
     */
    public CatalogCache(CatalogProvider provider) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        this.provider = provider;
    }

    /**
     * 스냅샷 조회 (없으면 제공자에서 로드).
     *
     * @param validate 제공자에게 그대로 전달되는 호환성 필터 플래그
     * @return 스냅샷
     * @throws IllegalStateException 제공자가 null을 반환한 경우
     */
    public CatalogSnapshot load(boolean validate) {
        long observedGeneration;
        synchronized (lock) {
            if (slot != null) {
                return slot;
            }
            observedGeneration = generation;
        }

        CatalogSnapshot loaded = provider.getCatalog(validate);
        if (loaded == null) {
            throw new IllegalStateException("CatalogProvider returned null snapshot");
        }

        synchronized (lock) {
            if (slot != null) {
                return slot;
            }
            if (generation == observedGeneration) {
                slot = loaded;
                log.info("Catalog loaded: {} categories, {} nodes (validate={})",
                    loaded.categoryNames().size(), loaded.nodeCount(), validate);
            } else {
                log.debug("Catalog invalidated during load, result not cached");
            }
            return loaded;
        }
    }

    /**
     * 슬롯 비우기.
     */
    public void invalidate() {
        synchronized (lock) {
            slot = null;
            generation++;
        }
        log.debug("Catalog cache invalidated");
    }

    /**
     * 캐시된 스냅샷 (로드하지 않음).
     *
     * @return 슬롯 내용, 비어 있으면 empty
     */
    public Optional<CatalogSnapshot> peek() {
        synchronized (lock) {
            return Optional.ofNullable(slot);
        }
    }
}
