package com.ryuqq.cloudcall.core.timeout;

import java.time.Duration;

/**
 * 타임아웃 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>spinnerDeadline: 스피너 표시까지의 시간 (기본 3초)</li>
 *   <li>popupDeadline: 스피너 표시 후 타임아웃 선언까지의 시간 (기본 7초)</li>
 * </ul>
 *
 * <p>두 값은 사이클 시작 시, 그리고 사이클 도중 새 호출이 들어올 때마다
 * {@link com.ryuqq.cloudcall.core.spi.TimeoutSettingsSource}에서 새로 읽힙니다.</p>
 *
 * @param spinnerDeadline 스피너 단계 기간 (양수)
 * @param popupDeadline 팝업 단계 기간 (양수)
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public record TimeoutSettings(
    Duration spinnerDeadline,
    Duration popupDeadline
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: spinnerDeadline=3s, popupDeadline=7s</p>
     */
    public TimeoutSettings() {
        this(Duration.ofSeconds(3), Duration.ofSeconds(7));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 값이 null이거나 양수가 아닌 경우
     */
    public TimeoutSettings {
        if (spinnerDeadline == null || spinnerDeadline.isNegative() || spinnerDeadline.isZero()) {
            throw new IllegalArgumentException(
                "spinnerDeadline must be positive (current: " + spinnerDeadline + ")"
            );
        }
        if (popupDeadline == null || popupDeadline.isNegative() || popupDeadline.isZero()) {
            throw new IllegalArgumentException(
                "popupDeadline must be positive (current: " + popupDeadline + ")"
            );
        }
    }

    /**
     * 밀리초 단위로 생성.
     *
     * @param spinnerDeadlineMs 스피너 단계 (밀리초)
     * @param popupDeadlineMs 팝업 단계 (밀리초)
     * @return TimeoutSettings 인스턴스
     */
    public static TimeoutSettings ofMillis(long spinnerDeadlineMs, long popupDeadlineMs) {
        return new TimeoutSettings(Duration.ofMillis(spinnerDeadlineMs), Duration.ofMillis(popupDeadlineMs));
    }

    /**
     * spinnerDeadline만 변경한 새 인스턴스 생성.
     */
    public TimeoutSettings withSpinnerDeadline(Duration spinnerDeadline) {
        return new TimeoutSettings(spinnerDeadline, popupDeadline);
    }

    /**
     * popupDeadline만 변경한 새 인스턴스 생성.
     */
    public TimeoutSettings withPopupDeadline(Duration popupDeadline) {
        return new TimeoutSettings(spinnerDeadline, popupDeadline);
    }
}
