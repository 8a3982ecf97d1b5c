package com.ryuqq.toolbox.application.session;

/**
 * CatalogSession 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>overrideValidation: 호환성 검사를 무시하고 모든 노드 표시 (기본 true)</li>
 * </ul>
 *
 * <p>overrideValidation=true이면 제공자에게 {@code validate=false}가 전달됩니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 * @param overrideValidation 호환성 검사 무시 여부
 */
public record SessionConfig(
    boolean overrideValidation
) {

    /**
     * 기본 설정 생성자 (overrideValidation=true).
     */
    public SessionConfig() {
        this(true);
    }

    /**
     * 제공자에게 전달할 validate 플래그.
     *
     * @return overrideValidation의 반대 값
     */
    public boolean validate() {
        return !overrideValidation;
    }

    /**
     * overrideValidation만 변경한 새 인스턴스 생성.
     */
    public SessionConfig withOverrideValidation(boolean overrideValidation) {
        return new SessionConfig(overrideValidation);
    }
}
