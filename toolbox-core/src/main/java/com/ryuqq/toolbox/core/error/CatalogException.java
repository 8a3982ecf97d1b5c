package com.ryuqq.toolbox.core.error;

/**
 * 카탈로그 조회/실행 요청 단계에서 동기적으로 발생하는 오류의 상위 타입.
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public abstract class CatalogException extends RuntimeException {

    private final ErrorKind kind;

    protected CatalogException(ErrorKind kind, String message) {
        super(message);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    /**
     * 오류 종류 조회.
     *
     * @return ErrorKind
     */
    public ErrorKind kind() {
        return kind;
    }
}
