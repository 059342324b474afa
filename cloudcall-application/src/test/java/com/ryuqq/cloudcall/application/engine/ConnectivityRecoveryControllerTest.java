package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.core.model.CallFamily;
import com.ryuqq.cloudcall.core.model.CallId;
import com.ryuqq.cloudcall.core.model.CallRequest;
import com.ryuqq.cloudcall.core.model.CallType;
import com.ryuqq.cloudcall.core.model.CancellationHandle;
import com.ryuqq.cloudcall.core.scheduler.DrivenTickScheduler;
import com.ryuqq.cloudcall.core.spi.ConnectivityListener;
import com.ryuqq.cloudcall.core.spi.ConnectivityRecovery;
import com.ryuqq.cloudcall.core.spi.ConnectivityState;
import com.ryuqq.cloudcall.core.spi.LoadingIndicator;
import com.ryuqq.cloudcall.core.spinner.SpinnerMode;
import com.ryuqq.cloudcall.core.statemachine.ManagerState;
import com.ryuqq.cloudcall.core.timeout.TimeoutSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * ConnectivityRecoveryController 유닛 테스트.
 *
 * <p>타임아웃 이후 복구 흐름과 연결 이벤트 처리를 검증합니다:</p>
 * <ul>
 *   <li>복구 성공 시 등록 순서대로 재시도</li>
 *   <li>복구 실패 시 ERROR 전이</li>
 *   <li>연결 끊김 이벤트로 시계 취소</li>
 *   <li>서버 오류 시 ERROR 전이</li>
 * </ul>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ConnectivityRecoveryControllerTest {

    private static final CallType<String> PROFILE = CallType.of(CallFamily.of("PROFILE"), String.class);

    @Mock
    private LoadingIndicator indicator;

    @Mock
    private ConnectivityRecovery recovery;

    private DrivenTickScheduler scheduler;
    private EngineStatus status;
    private CallRegistry registry;
    private SpinnerArbiter spinner;
    private AtomicBoolean running;
    private TimeoutEscalation escalation;
    private ConnectivityRecoveryController controller;
    private List<CallId> replayed;

    @BeforeEach
    void setUp() {
        scheduler = new DrivenTickScheduler();
        status = new EngineStatus();
        registry = new CallRegistry();
        spinner = new SpinnerArbiter(indicator, this);
        running = new AtomicBoolean(true);
        replayed = new ArrayList<>();
        controller = new ConnectivityRecoveryController(scheduler, status, registry, spinner, recovery, running::get);
        escalation = new TimeoutEscalation(scheduler, status, registry, spinner,
            () -> TimeoutSettings.ofMillis(300, 300), controller::handleTimeout);
        controller.attach(escalation);
    }

    // ============================================================
    // 1. 타임아웃 이후 복구
    // ============================================================

    @Test
    void handleTimeout_복구_성공이면_등록_순서대로_재시도() {
        // given
        CallId first = registerCall();
        CallId second = registerCall();
        CancellationHandle attempt = new CancellationHandle();
        registry.addCancellation(attempt);
        status.transitionTo(ManagerState.PROCESSING);
        when(recovery.resolve(true)).thenReturn(CompletableFuture.completedFuture(null));

        // when
        controller.handleTimeout(new EscalationCycle(1));

        // then
        assertThat(attempt.isCancellationRequested()).isTrue();
        assertThat(replayed).containsExactly(first, second);
        assertThat(status.current()).isEqualTo(ManagerState.PROCESSING);
        assertThat(spinner.effectiveMode()).isEqualTo(SpinnerMode.INSTANT);
        assertThat(escalation.activeCycle()).isNotNull();
        verify(indicator).show(this);
    }

    @Test
    void handleTimeout_복구를_기다리는_동안_TIMED_OUT_유지() {
        // given
        registerCall();
        status.transitionTo(ManagerState.PROCESSING);
        CompletableFuture<Void> pending = new CompletableFuture<>();
        when(recovery.resolve(true)).thenReturn(pending);

        // when
        controller.handleTimeout(new EscalationCycle(1));

        // then
        assertThat(status.current()).isEqualTo(ManagerState.TIMED_OUT);
        assertThat(replayed).isEmpty();

        pending.complete(null);
        assertThat(replayed).hasSize(1);
    }

    @Test
    void handleTimeout_복구_실패면_ERROR로_전이하고_호출은_유지() {
        // given
        registerCall();
        status.transitionTo(ManagerState.PROCESSING);
        when(recovery.resolve(true))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("user declined")));

        // when
        controller.handleTimeout(new EscalationCycle(1));

        // then
        assertThat(status.current()).isEqualTo(ManagerState.ERROR);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(replayed).isEmpty();
    }

    @Test
    void handleTimeout_복구가_동기_예외를_던지면_실패로_처리() {
        // given
        registerCall();
        status.transitionTo(ManagerState.PROCESSING);
        when(recovery.resolve(true)).thenThrow(new IllegalStateException("dialog unavailable"));

        // when
        controller.handleTimeout(new EscalationCycle(1));

        // then
        assertThat(status.current()).isEqualTo(ManagerState.ERROR);
    }

    @Test
    void reattempt_엔진이_멈췄으면_재시도하지_않음() {
        // given
        registerCall();
        status.transitionTo(ManagerState.PROCESSING);
        CompletableFuture<Void> pending = new CompletableFuture<>();
        when(recovery.resolve(true)).thenReturn(pending);
        controller.handleTimeout(new EscalationCycle(1));

        // when
        running.set(false);
        pending.complete(null);

        // then
        assertThat(replayed).isEmpty();
        assertThat(status.current()).isEqualTo(ManagerState.TIMED_OUT);
    }

    // ============================================================
    // 2. 연결 이벤트
    // ============================================================

    @Test
    void connectivityListener_도달_불가면_시계를_취소하고_이벤트는_소비하지_않음() {
        // given
        registerCall();
        escalation.start();
        EscalationCycle cycle = escalation.activeCycle();
        ConnectivityListener listener = controller.connectivityListener();

        // when
        boolean consumedReachable = listener.onConnectivityChanged(ConnectivityState.REACHABLE);
        boolean interruptedByReachable = cycle.isInterrupted();
        boolean consumedDegraded = listener.onConnectivityChanged(ConnectivityState.DEGRADED);

        // then
        assertThat(consumedReachable).isFalse();
        assertThat(consumedDegraded).isFalse();
        assertThat(interruptedByReachable).isFalse();
        assertThat(cycle.isInterrupted()).isTrue();
        assertThat(controller.connectivityListener()).isSameAs(listener);
    }

    // ============================================================
    // 3. 서버 오류
    // ============================================================

    @Test
    void onServerFault_처리_중이면_ERROR로_전이하고_스피너를_숨김() {
        // given
        registerCall();
        spinner.request(SpinnerMode.INSTANT);
        escalation.start();
        EscalationCycle cycle = escalation.activeCycle();
        CallEnvelope<?> envelope = registry.envelopes().get(0);

        // when
        controller.onServerFault(envelope, new IllegalStateException("500"));

        // then
        assertThat(status.current()).isEqualTo(ManagerState.ERROR);
        assertThat(cycle.isInterrupted()).isTrue();
        verify(indicator).show(this);
        verify(indicator).hide(this);
    }

    private CallId registerCall() {
        CallId id = registry.nextCallId();
        registry.register(new CallEnvelope<String>(
            id, CallRequest.of(PROFILE), new CompletableFuture<>(), e -> replayed.add(e.id())));
        return id;
    }
}
