package com.ryuqq.cloudcall.core.timeout;

import java.time.Duration;

/**
 * 타임아웃 에스컬레이션 단계.
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public enum TimeoutPhase {

    /**
     * 사이클 시작부터 스피너 표시까지.
     */
    TO_SPINNER,

    /**
     * 스피너 표시부터 타임아웃 선언(팝업)까지.
     */
    TO_POPUP;

    /**
     * 설정에서 이 단계의 기간을 선택.
     *
     * @param settings 타임아웃 설정
     * @return 단계 기간
     */
    public Duration durationIn(TimeoutSettings settings) {
        return this == TO_SPINNER ? settings.spinnerDeadline() : settings.popupDeadline();
    }
}
