package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.core.scheduler.TickScheduler;
import com.ryuqq.cloudcall.core.spi.ConnectivityListener;
import com.ryuqq.cloudcall.core.spi.ConnectivityRecovery;
import com.ryuqq.cloudcall.core.spi.ConnectivityState;
import com.ryuqq.cloudcall.core.statemachine.ManagerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * 타임아웃 이후 연결 복구와 재시도, 그리고 즉시 실패 경로를 담당.
 *
 * <p><strong>타임아웃 경로:</strong></p>
 * <ol>
 *   <li>TIMED_OUT 전이, 스피너 숨김, 모든 취소 핸들 취소</li>
 *   <li>{@link ConnectivityRecovery#resolve(boolean)} 완료 대기</li>
 *   <li>IDLE 복귀, 스피너 INSTANT 표시, 새 사이클 시작, 등록된 모든 Envelope 재실행 (등록 순)</li>
 * </ol>
 *
 * <p><strong>즉시 경로:</strong> 서버 오류는 ERROR로 전이하고 시계를 취소합니다.
 * 연결 문제로 인한 취소와 외부 연결 이벤트는 시계만 취소하여 사이클이 곧바로
 * 타임아웃 선언 경로를 타게 합니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class ConnectivityRecoveryController {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityRecoveryController.class);

    private final TickScheduler scheduler;
    private final EngineStatus status;
    private final CallRegistry registry;
    private final SpinnerArbiter spinner;
    private final ConnectivityRecovery recovery;
    private final BooleanSupplier running;
    private final ConnectivityListener connectivityListener = this::onConnectivityChanged;
    private TimeoutEscalation escalation;

    /**
     * 생성자.
     *
     * @param scheduler 스케줄러
     * @param status 엔진 상태
     * @param registry 호출 Registry
     * @param spinner 스피너 중재자
     * @param recovery 연결 복구 collaborator
     * @param running 엔진 실행 여부
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ConnectivityRecoveryController(TickScheduler scheduler, EngineStatus status, CallRegistry registry,
                                          SpinnerArbiter spinner, ConnectivityRecovery recovery,
                                          BooleanSupplier running) {
        if (scheduler == null || status == null || registry == null || spinner == null
            || recovery == null || running == null) {
            throw new IllegalArgumentException("ConnectivityRecoveryController collaborators cannot be null");
        }
        this.scheduler = scheduler;
        this.status = status;
        this.registry = registry;
        this.spinner = spinner;
        this.recovery = recovery;
        this.running = running;
    }

    /**
     * 에스컬레이션 연결. 에스컬레이션이 이 컨트롤러를 타임아웃 핸들러로 참조하므로 생성 후 연결합니다.
     *
     * @param escalation 타임아웃 에스컬레이션
     */
    void attach(TimeoutEscalation escalation) {
        this.escalation = escalation;
    }

    /**
     * 타임아웃 선언 처리.
     *
     * @param cycle 타임아웃된 사이클
     */
    public void handleTimeout(EscalationCycle cycle) {
        status.transitionTo(ManagerState.TIMED_OUT);
        spinner.hide();
        int aborted = registry.cancelAll();
        log.warn("Cycle {} timed out: aborted {} attempts, {} calls awaiting recovery",
            cycle.number(), aborted, registry.size());

        CompletableFuture<Void> resolution;
        try {
            resolution = recovery.resolve(true);
        } catch (RuntimeException e) {
            resolution = CompletableFuture.failedFuture(e);
        }
        if (resolution == null) {
            resolution = CompletableFuture.failedFuture(
                new IllegalStateException("ConnectivityRecovery returned no future"));
        }
        resolution.whenComplete((ignored, error) -> scheduler.execute(() -> {
            if (error != null) {
                onRecoveryFailed(TransportGateway.unwrap(error));
            } else {
                reattempt();
            }
        }));
    }

    /**
     * 연결 복구 후 재시도.
     */
    void reattempt() {
        if (!running.getAsBoolean() || !status.is(ManagerState.TIMED_OUT)) {
            log.debug("Reattempt skipped in state {}", status.current());
            return;
        }
        status.transitionTo(ManagerState.IDLE);
        spinner.forceInstant();
        escalation.start();

        List<CallEnvelope<?>> pending = registry.envelopes();
        log.info("Connectivity recovered, reattempting {} calls", pending.size());
        for (CallEnvelope<?> envelope : pending) {
            envelope.replay();
        }
    }

    /**
     * 서버 오류로 시도가 실패함.
     *
     * @param envelope 실패한 호출
     * @param cause 원인
     */
    void onServerFault(CallEnvelope<?> envelope, Throwable cause) {
        spinner.hide();
        if (status.is(ManagerState.PROCESSING) || status.is(ManagerState.TIMED_OUT)) {
            status.transitionTo(ManagerState.ERROR);
        }
        escalation.interrupt();
        log.error("Remote call {} failed after {} attempts", envelope, envelope.attempts(), cause);
    }

    /**
     * 연결 문제로 시도가 취소됨. Envelope은 재시도를 위해 Registry에 남습니다.
     *
     * @param envelope 취소된 호출
     * @param cycle 시도를 시작할 때의 사이클 (null 허용)
     */
    void onConnectivityCancellation(CallEnvelope<?> envelope, EscalationCycle cycle) {
        log.warn("Remote call {} cancelled by connectivity issue, kept for retry", envelope);
        if (cycle != null) {
            escalation.interrupt(cycle);
        } else {
            escalation.interrupt();
        }
    }

    /**
     * 연결 이벤트 리스너. 이벤트를 소비하지 않습니다.
     */
    public ConnectivityListener connectivityListener() {
        return connectivityListener;
    }

    private boolean onConnectivityChanged(ConnectivityState state) {
        if (state != null && !state.isServerReachable()) {
            scheduler.execute(() -> {
                if (escalation.interrupt()) {
                    log.warn("Connectivity changed to {}, escalation clock cancelled", state);
                }
            });
        }
        return false;
    }

    private void onRecoveryFailed(Throwable error) {
        if (!status.is(ManagerState.TIMED_OUT)) {
            log.debug("Recovery failure ignored in state {}", status.current(), error);
            return;
        }
        status.transitionTo(ManagerState.ERROR);
        log.error("Connectivity recovery failed, {} calls stay registered", registry.size(), error);
    }
}
