package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.core.scheduler.TickScheduler;
import com.ryuqq.cloudcall.core.spi.TimeoutSettingsSource;
import com.ryuqq.cloudcall.core.statemachine.ManagerState;
import com.ryuqq.cloudcall.core.timeout.TimeoutPhase;
import com.ryuqq.cloudcall.core.timeout.TimeoutSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * 2단계 타임아웃 에스컬레이션 상태 머신.
 *
 * <p><strong>사이클 흐름:</strong></p>
 * <pre>
 * IDLE ─start()─→ PROCESSING ─(1 tick 대기)─→ TO_SPINNER ─→ 스피너 단계 경과 ─→ TO_POPUP ─→ 타임아웃 선언
 *                     │                            │                               │
 *                     └──── Registry가 비면 IDLE ────┴──── 상태가 IDLE/ERROR면 종료 ────┘
 * </pre>
 *
 * <p><strong>연장 규칙:</strong> 사이클 진행 중 {@link #start()}가 다시 호출되면 설정을 새로 읽어
 * 두 단계의 요청 기간으로 기록합니다. 진행 중인 단계는 다음 tick에 남은 시간에
 * 요청 기간을 더하고 요청 기간을 소비합니다. 남은 시간은 늘어날 뿐 재시작되지 않으며,
 * 더 짧은 설정도 그만큼 연장합니다. 아직 시작하지 않은 단계는 시작 시점의 최신 요청 기간을 사용합니다.</p>
 *
 * <p>첫 tick 대기는 같은 tick에 들어온 호출들이 하나의 시계를 공유하도록 하기 위함입니다.
 * 모든 메서드는 스케줄러 스레드에서만 호출됩니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class TimeoutEscalation {

    private static final Logger log = LoggerFactory.getLogger(TimeoutEscalation.class);

    private final TickScheduler scheduler;
    private final EngineStatus status;
    private final CallRegistry registry;
    private final SpinnerArbiter spinner;
    private final TimeoutSettingsSource settingsSource;
    private final Consumer<EscalationCycle> timeoutHandler;
    private final Map<TimeoutPhase, Duration> requested = new EnumMap<>(TimeoutPhase.class);
    private EscalationCycle activeCycle;
    private long cycleSequence;

    /**
     * 생성자.
     *
     * @param scheduler tick 공급자
     * @param status 엔진 상태
     * @param registry 호출 Registry
     * @param spinner 스피너 중재자
     * @param settingsSource 타임아웃 설정 공급자
     * @param timeoutHandler 타임아웃 선언 시 호출되는 핸들러
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TimeoutEscalation(TickScheduler scheduler, EngineStatus status, CallRegistry registry,
                             SpinnerArbiter spinner, TimeoutSettingsSource settingsSource,
                             Consumer<EscalationCycle> timeoutHandler) {
        if (scheduler == null || status == null || registry == null || spinner == null
            || settingsSource == null || timeoutHandler == null) {
            throw new IllegalArgumentException("TimeoutEscalation collaborators cannot be null");
        }
        this.scheduler = scheduler;
        this.status = status;
        this.registry = registry;
        this.spinner = spinner;
        this.settingsSource = settingsSource;
        this.timeoutHandler = timeoutHandler;
        for (TimeoutPhase phase : TimeoutPhase.values()) {
            requested.put(phase, Duration.ZERO);
        }
    }

    /**
     * 사이클 시작 또는 진행 중인 사이클 연장 요청.
     *
     * <p>IDLE이 아니면 요청 기간만 갱신하고 반환합니다.</p>
     */
    public void start() {
        TimeoutSettings settings = settingsSource.current();
        for (TimeoutPhase phase : TimeoutPhase.values()) {
            requested.put(phase, phase.durationIn(settings));
        }

        if (!status.is(ManagerState.IDLE)) {
            log.debug("Escalation already running in {}, phase deadlines refreshed", status.current());
            return;
        }

        status.transitionTo(ManagerState.PROCESSING);
        EscalationCycle cycle = new EscalationCycle(++cycleSequence);
        activeCycle = cycle;
        spinner.beginCycle();
        log.debug("Escalation cycle {} started (spinner={}ms, popup={}ms)",
            cycle.number(), settings.spinnerDeadline().toMillis(), settings.popupDeadline().toMillis());

        scheduler.nextTick()
            .thenCompose(firstDelta -> runPhase(cycle, TimeoutPhase.TO_SPINNER))
            .thenCompose(result -> {
                if (halted(cycle, result)) {
                    return CompletableFuture.completedFuture(PhaseResult.FINISHED);
                }
                spinner.onSpinnerPhaseElapsed();
                log.debug("Cycle {} passed spinner deadline", cycle.number());
                return runPhase(cycle, TimeoutPhase.TO_POPUP);
            })
            .thenAccept(result -> {
                if (!halted(cycle, result)) {
                    declareTimeout(cycle);
                }
            })
            .exceptionally(e -> {
                log.error("Escalation cycle {} failed", cycle.number(), e);
                return null;
            });
    }

    /**
     * 진행 중인 사이클의 시계 취소.
     *
     * @return 취소한 경우 true, 진행 중인 사이클이 없거나 이미 취소된 경우 false
     */
    public boolean interrupt() {
        return interrupt(activeCycle);
    }

    /**
     * 특정 사이클의 시계 취소.
     *
     * @param cycle 대상 사이클 (null 허용)
     * @return 취소한 경우 true
     */
    public boolean interrupt(EscalationCycle cycle) {
        if (cycle == null || !cycle.interrupt()) {
            return false;
        }
        log.debug("Escalation clock of cycle {} cancelled", cycle.number());
        return true;
    }

    /**
     * 진행 중인 사이클.
     *
     * @return 사이클, 없으면 null
     */
    public EscalationCycle activeCycle() {
        return activeCycle;
    }

    /**
     * 사이클 참조 해제 (종료, 오류 리셋 시).
     */
    public void detach() {
        activeCycle = null;
    }

    Duration requestedFor(TimeoutPhase phase) {
        return requested.get(phase);
    }

    private CompletableFuture<PhaseResult> runPhase(EscalationCycle cycle, TimeoutPhase phase) {
        if (cycle.isInterrupted()) {
            return CompletableFuture.completedFuture(PhaseResult.INTERRUPTED);
        }
        Duration initial = requested.put(phase, Duration.ZERO);
        cycle.enterPhase(phase, initial);
        CompletableFuture<PhaseResult> result = new CompletableFuture<>();
        countDown(cycle, phase, initial, result);
        return result;
    }

    private void countDown(EscalationCycle cycle, TimeoutPhase phase, Duration remaining,
                           CompletableFuture<PhaseResult> result) {
        if (remaining.isNegative() || remaining.isZero()) {
            result.complete(PhaseResult.EXPIRED);
            return;
        }
        scheduler.nextTick().thenAccept(delta -> {
            try {
                Duration next = extend(phase, remaining).minus(delta);

                if (cycle.isInterrupted() || status.current().haltsEscalation() || cycle != activeCycle) {
                    result.complete(PhaseResult.INTERRUPTED);
                    return;
                }
                if (registry.isEmpty()) {
                    finish(cycle);
                    result.complete(PhaseResult.FINISHED);
                    return;
                }
                cycle.recordRemaining(next);
                countDown(cycle, phase, next, result);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
    }

    private Duration extend(TimeoutPhase phase, Duration remaining) {
        Duration pending = requested.get(phase);
        if (pending.isZero()) {
            return remaining;
        }
        requested.put(phase, Duration.ZERO);
        return remaining.plus(pending);
    }

    private void finish(EscalationCycle cycle) {
        status.transitionTo(ManagerState.IDLE);
        spinner.reset();
        registry.clearCancellations();
        activeCycle = null;
        log.debug("Escalation cycle {} finished, all calls concluded", cycle.number());
    }

    private boolean halted(EscalationCycle cycle, PhaseResult result) {
        return result == PhaseResult.FINISHED
            || cycle != activeCycle
            || status.current().haltsEscalation();
    }

    private void declareTimeout(EscalationCycle cycle) {
        activeCycle = null;
        log.info("Escalation cycle {} timed out with {} calls registered", cycle.number(), registry.size());
        timeoutHandler.accept(cycle);
    }
}
