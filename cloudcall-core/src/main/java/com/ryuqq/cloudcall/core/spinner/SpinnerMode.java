package com.ryuqq.cloudcall.core.spinner;

/**
 * 로딩 인디케이터 표시 방식.
 *
 * <p>선언 순서가 우선순위입니다. 아래쪽 값이 위쪽 값을 덮어씁니다.
 * 예를 들어 첫 호출이 INVISIBLE을 원하고 두 번째 호출이 AFTER_TIMEOUT을 원하면
 * 유효 모드는 AFTER_TIMEOUT이 됩니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public enum SpinnerMode {

    /**
     * 표시하지 않음 (다른 호출이 원하지 않는 한).
     */
    INVISIBLE,

    /**
     * 스피너 타임아웃 경과 후 표시.
     */
    AFTER_TIMEOUT,

    /**
     * 즉시 표시.
     */
    INSTANT;

    /**
     * 두 모드 중 우선순위가 높은 쪽.
     *
     * @param other 비교 대상
     * @return 우선순위가 높은 모드
     * @throws IllegalArgumentException other가 null인 경우
     */
    public SpinnerMode max(SpinnerMode other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return other.ordinal() > ordinal() ? other : this;
    }
}
