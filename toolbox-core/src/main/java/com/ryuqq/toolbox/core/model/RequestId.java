package com.ryuqq.toolbox.core.model;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 실행 요청 식별자.
 *
 * <p>ExecutionCoordinator가 요청을 수락할 때 발급하며, 제출 순서대로 증가하는
 * 시퀀스 값을 가집니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class RequestId implements Comparable<RequestId> {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long value;

    private RequestId(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("RequestId must be positive (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * 지정한 값으로 RequestId 생성.
     *
     * @param value 양수 시퀀스 값
     * @return RequestId 인스턴스
     * @throws IllegalArgumentException value가 양수가 아닌 경우
     */
    public static RequestId of(long value) {
        return new RequestId(value);
    }

    /**
     * 프로세스 전역 시퀀스에서 다음 RequestId 발급.
     *
     * @return 새 RequestId
     */
    public static RequestId next() {
        return new RequestId(SEQUENCE.incrementAndGet());
    }

    public long getValue() {
        return value;
    }

    @Override
    public int compareTo(RequestId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value == ((RequestId) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "RequestId{" + value + '}';
    }
}
