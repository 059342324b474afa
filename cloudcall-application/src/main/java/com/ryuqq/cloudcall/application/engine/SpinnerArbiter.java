package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.core.spi.LoadingIndicator;
import com.ryuqq.cloudcall.core.spinner.SpinnerMode;

/**
 * 호출별 스피너 요청을 하나의 유효 모드로 병합.
 *
 * <p>유효 모드는 사이클 안에서 단조 증가하며, 엔진이 IDLE로 돌아갈 때만
 * INVISIBLE로 초기화됩니다. 인디케이터는 유효 모드가 INSTANT이거나,
 * AFTER_TIMEOUT이고 스피너 단계가 경과했을 때 표시됩니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class SpinnerArbiter {

    private final LoadingIndicator indicator;
    private final Object claimOwner;
    private SpinnerMode effectiveMode = SpinnerMode.INVISIBLE;
    private boolean spinnerPhaseElapsed;
    private boolean visible;

    /**
     * 생성자.
     *
     * @param indicator 로딩 인디케이터
     * @param claimOwner 인디케이터 claim 소유자 (엔진 인스턴스)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public SpinnerArbiter(LoadingIndicator indicator, Object claimOwner) {
        if (indicator == null) {
            throw new IllegalArgumentException("indicator cannot be null");
        }
        if (claimOwner == null) {
            throw new IllegalArgumentException("claimOwner cannot be null");
        }
        this.indicator = indicator;
        this.claimOwner = claimOwner;
    }

    /**
     * 호출 하나의 스피너 요청 반영.
     *
     * @param requested 요청된 모드
     */
    public void request(SpinnerMode requested) {
        effectiveMode = effectiveMode.max(requested);
        if (shouldBeVisible()) {
            show();
        }
    }

    /**
     * 새 에스컬레이션 사이클 시작.
     */
    public void beginCycle() {
        spinnerPhaseElapsed = false;
    }

    /**
     * 스피너 단계 경과.
     */
    public void onSpinnerPhaseElapsed() {
        spinnerPhaseElapsed = true;
        if (shouldBeVisible()) {
            show();
        }
    }

    /**
     * 재시도 시작 시 즉시 표시.
     */
    public void forceInstant() {
        effectiveMode = SpinnerMode.INSTANT;
        show();
    }

    /**
     * 모드는 유지하고 인디케이터만 숨김 (오류, 타임아웃 선언 시).
     */
    public void hide() {
        if (visible) {
            indicator.hide(claimOwner);
            visible = false;
        }
    }

    /**
     * IDLE 복귀 시 초기화.
     */
    public void reset() {
        effectiveMode = SpinnerMode.INVISIBLE;
        spinnerPhaseElapsed = false;
        hide();
    }

    public SpinnerMode effectiveMode() {
        return effectiveMode;
    }

    public boolean isVisible() {
        return visible;
    }

    private boolean shouldBeVisible() {
        return effectiveMode == SpinnerMode.INSTANT
            || (effectiveMode == SpinnerMode.AFTER_TIMEOUT && spinnerPhaseElapsed);
    }

    private void show() {
        if (!visible) {
            indicator.show(claimOwner);
            visible = true;
        }
    }
}
