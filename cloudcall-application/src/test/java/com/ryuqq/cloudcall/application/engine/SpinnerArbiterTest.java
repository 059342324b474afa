package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.core.spi.LoadingIndicator;
import com.ryuqq.cloudcall.core.spinner.SpinnerMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * SpinnerArbiter 유닛 테스트.
 *
 * <p>요청된 모드 중 가장 강한 모드를 유지하고, 인디케이터 show/hide가
 * 중복 호출되지 않는지 검증합니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SpinnerArbiterTest {

    private static final Object OWNER = new Object();

    @Mock
    private LoadingIndicator indicator;

    private SpinnerArbiter arbiter;

    @BeforeEach
    void setUp() {
        arbiter = new SpinnerArbiter(indicator, OWNER);
    }

    // ============================================================
    // 1. 모드 병합
    // ============================================================

    @Test
    void request_INSTANT면_즉시_표시하고_중복_표시하지_않음() {
        // when
        arbiter.request(SpinnerMode.INSTANT);
        arbiter.request(SpinnerMode.INSTANT);

        // then
        verify(indicator, times(1)).show(OWNER);
        assertThat(arbiter.isVisible()).isTrue();
    }

    @Test
    void request_약한_모드는_강한_모드를_낮추지_않음() {
        // given
        arbiter.request(SpinnerMode.INSTANT);

        // when
        arbiter.request(SpinnerMode.INVISIBLE);

        // then
        assertThat(arbiter.effectiveMode()).isEqualTo(SpinnerMode.INSTANT);
    }

    @Test
    void request_INVISIBLE이면_스피너_단계가_지나도_표시하지_않음() {
        // when
        arbiter.request(SpinnerMode.INVISIBLE);
        arbiter.onSpinnerPhaseElapsed();

        // then
        verifyNoInteractions(indicator);
        assertThat(arbiter.isVisible()).isFalse();
    }

    // ============================================================
    // 2. AFTER_TIMEOUT
    // ============================================================

    @Test
    void AFTER_TIMEOUT은_스피너_단계_경과_후에만_표시() {
        // given
        arbiter.request(SpinnerMode.AFTER_TIMEOUT);
        verifyNoInteractions(indicator);

        // when
        arbiter.onSpinnerPhaseElapsed();

        // then
        verify(indicator).show(OWNER);
    }

    @Test
    void AFTER_TIMEOUT_요청이_단계_경과_이후에_오면_즉시_표시() {
        // given
        arbiter.onSpinnerPhaseElapsed();

        // when
        arbiter.request(SpinnerMode.AFTER_TIMEOUT);

        // then
        verify(indicator).show(OWNER);
    }

    @Test
    void beginCycle_새_사이클은_단계_경과_표시를_초기화() {
        // given
        arbiter.request(SpinnerMode.AFTER_TIMEOUT);
        arbiter.onSpinnerPhaseElapsed();
        arbiter.hide();

        // when
        arbiter.beginCycle();
        arbiter.request(SpinnerMode.AFTER_TIMEOUT);

        // then
        verify(indicator, times(1)).show(OWNER);
        assertThat(arbiter.isVisible()).isFalse();
    }

    // ============================================================
    // 3. 강제 표시 / 숨김 / 초기화
    // ============================================================

    @Test
    void forceInstant_모드를_INSTANT로_올리고_표시() {
        // when
        arbiter.forceInstant();

        // then
        assertThat(arbiter.effectiveMode()).isEqualTo(SpinnerMode.INSTANT);
        verify(indicator).show(OWNER);
    }

    @Test
    void hide_표시_중이_아니면_인디케이터를_호출하지_않음() {
        arbiter.hide();

        verify(indicator, never()).hide(any());
    }

    @Test
    void reset_모드를_초기화하고_숨김() {
        // given
        arbiter.request(SpinnerMode.INSTANT);

        // when
        arbiter.reset();

        // then
        verify(indicator).hide(OWNER);
        assertThat(arbiter.effectiveMode()).isEqualTo(SpinnerMode.INVISIBLE);
        assertThat(arbiter.isVisible()).isFalse();
    }
}
