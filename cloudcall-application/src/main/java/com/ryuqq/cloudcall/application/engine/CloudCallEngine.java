package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.application.dispatcher.CallDispatcher;
import com.ryuqq.cloudcall.core.model.CallFamily;
import com.ryuqq.cloudcall.core.model.CallRequest;
import com.ryuqq.cloudcall.core.model.CancellationHandle;
import com.ryuqq.cloudcall.core.outcome.CallOutcome;
import com.ryuqq.cloudcall.core.outcome.Fail;
import com.ryuqq.cloudcall.core.outcome.Ok;
import com.ryuqq.cloudcall.core.scheduler.TickScheduler;
import com.ryuqq.cloudcall.core.spi.AppStateSink;
import com.ryuqq.cloudcall.core.spi.ConnectivityEvents;
import com.ryuqq.cloudcall.core.spi.ConnectivityRecovery;
import com.ryuqq.cloudcall.core.spi.LoadingIndicator;
import com.ryuqq.cloudcall.core.spi.RemoteCallException;
import com.ryuqq.cloudcall.core.spi.TimeoutSettingsSource;
import com.ryuqq.cloudcall.core.spi.Transport;
import com.ryuqq.cloudcall.core.spinner.SpinnerMode;
import com.ryuqq.cloudcall.core.statemachine.ManagerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 복원력 있는 원격 호출 오케스트레이션 엔진.
 *
 * <p>독립적으로 생성 가능한 인스턴스 하나가 Registry, 상태, 트랜잭션 락, 스피너 모드,
 * 취소 핸들 목록을 모두 소유합니다. 모든 가변 상태는 {@link TickScheduler}의 스레드에서만
 * 변경되며, public 메서드는 어느 스레드에서든 호출할 수 있습니다.</p>
 *
 * <p><strong>호출 흐름 (callResilient):</strong></p>
 * <pre>
 * callResilient()
 *   ↓ (스케줄러 스레드)
 * [트랜잭션이면] TransactionLock.acquire(family) ─ tick마다 재확인
 *   ↓
 * SpinnerArbiter.request(mode) → Registry.register(envelope)
 *   ↓
 * [TIMED_OUT이 아니면] TimeoutEscalation.start() → envelope.replay()
 *   ↓
 * Transport 완료
 *   ├─ 성공 → payload 반영 → Ok, Registry에서 제거, 락 해제
 *   ├─ 취소 → Registry에 유지, 시계 취소 (복구 후 재시도)
 *   └─ 오류 → ERROR 전이, 시계 취소 → Fail, Registry에서 제거, 락 해제
 * </pre>
 *
 * <p><strong>생명주기:</strong> {@link #start()} 이후에만 호출을 받으며, {@link #shutdown()}은
 * 대기 중인 모든 호출을 {@code ENGINE_SHUTDOWN} Fail로 완료합니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class CloudCallEngine implements CallDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CloudCallEngine.class);

    private final TickScheduler scheduler;
    private final ConnectivityEvents events;
    private final TransportGateway gateway;
    private final BasePayloadReactor payloadReactor;
    private final EngineStatus status = new EngineStatus();
    private final CallRegistry registry = new CallRegistry();
    private final TransactionLock transactionLock;
    private final SpinnerArbiter spinner;
    private final TimeoutEscalation escalation;
    private final ConnectivityRecoveryController recoveryController;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ConnectivityEvents.Subscription subscription;

    /**
     * 생성자.
     *
     * @param scheduler 단일 논리 스케줄러
     * @param transport 원격 호출 Transport
     * @param events 연결 상태 이벤트
     * @param recovery 연결 복구 collaborator
     * @param indicator 로딩 인디케이터
     * @param appStateSink 앱 상태 갱신 collaborator
     * @param settingsSource 타임아웃 설정 공급자
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CloudCallEngine(TickScheduler scheduler, Transport transport, ConnectivityEvents events,
                           ConnectivityRecovery recovery, LoadingIndicator indicator,
                           AppStateSink appStateSink, TimeoutSettingsSource settingsSource) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (recovery == null) {
            throw new IllegalArgumentException("recovery cannot be null");
        }
        if (indicator == null) {
            throw new IllegalArgumentException("indicator cannot be null");
        }
        if (appStateSink == null) {
            throw new IllegalArgumentException("appStateSink cannot be null");
        }
        if (settingsSource == null) {
            throw new IllegalArgumentException("settingsSource cannot be null");
        }
        this.scheduler = scheduler;
        this.events = events;
        this.gateway = new TransportGateway(transport);
        this.payloadReactor = new BasePayloadReactor(appStateSink);
        this.transactionLock = new TransactionLock(scheduler);
        this.spinner = new SpinnerArbiter(indicator, this);
        this.recoveryController = new ConnectivityRecoveryController(
            scheduler, status, registry, spinner, recovery, running::get);
        this.escalation = new TimeoutEscalation(
            scheduler, status, registry, spinner, settingsSource, recoveryController::handleTimeout);
        this.recoveryController.attach(escalation);
    }

    // ============================================================
    // Lifecycle
    // ============================================================

    /**
     * 엔진 시작. ID 순번을 초기화하고 연결 이벤트를 구독합니다.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("CloudCallEngine is already running");
        }
        scheduler.execute(() -> {
            registry.resetSequence();
            subscription = events.subscribe(recoveryController.connectivityListener());
            log.info("CloudCallEngine started");
        });
    }

    /**
     * 엔진 종료.
     *
     * <p>구독 해제, 모든 취소 핸들 취소, 대기 중인 호출을 {@code ENGINE_SHUTDOWN}으로 완료,
     * 인디케이터 숨김 후 IDLE로 복귀합니다.</p>
     *
     * @return 종료 처리가 끝나면 완료되는 future (이미 종료된 경우 즉시 완료)
     */
    public CompletableFuture<Void> shutdown() {
        if (!running.compareAndSet(true, false)) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> terminated = new CompletableFuture<>();
        scheduler.execute(() -> {
            try {
                if (subscription != null) {
                    subscription.unsubscribe();
                    subscription = null;
                }
                escalation.interrupt();
                escalation.detach();
                int aborted = registry.cancelAll();
                List<CallEnvelope<?>> pending = registry.envelopes();
                for (CallEnvelope<?> envelope : pending) {
                    failOnShutdown(envelope);
                }
                spinner.reset();
                status.resetToIdle();
                log.info("CloudCallEngine shut down (aborted {} attempts, failed {} pending calls)",
                    aborted, pending.size());
                terminated.complete(null);
            } catch (RuntimeException e) {
                terminated.completeExceptionally(e);
                throw e;
            }
        });
        return terminated;
    }

    /**
     * ERROR 상태에서 벗어나 IDLE로 복귀.
     *
     * <p>호출이 남아 있으면 새 사이클을 시작하고, 진행 중인 시도가 없는 호출
     * (복구 실패로 중단된 호출)을 재실행합니다. ERROR가 아니면 아무것도 하지 않습니다.</p>
     */
    public void resetAfterError() {
        scheduler.execute(() -> {
            if (!status.is(ManagerState.ERROR)) {
                log.debug("resetAfterError ignored in state {}", status.current());
                return;
            }
            escalation.detach();
            spinner.reset();
            status.transitionTo(ManagerState.IDLE);
            log.info("CloudCallEngine reset after error, {} calls still registered", registry.size());

            if (registry.isEmpty()) {
                return;
            }
            escalation.start();
            for (CallEnvelope<?> envelope : registry.envelopes()) {
                CancellationHandle attempt = envelope.currentAttempt();
                if (attempt == null || attempt.isCancellationRequested()) {
                    envelope.replay();
                }
            }
        });
    }

    // ============================================================
    // CallDispatcher
    // ============================================================

    @Override
    public <T> CompletableFuture<CallOutcome<T>> callResilient(CallRequest<T> request, SpinnerMode spinnerMode) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (spinnerMode == null) {
            throw new IllegalArgumentException("spinnerMode cannot be null");
        }
        ensureRunning();

        CompletableFuture<CallOutcome<T>> completion = new CompletableFuture<>();
        scheduler.execute(() -> dispatch(request, spinnerMode, completion));
        return completion;
    }

    @Override
    public <T> void callFireAndForget(CallRequest<T> request) {
        callIgnoreIssues(request).whenComplete((result, error) -> {
            if (error != null) {
                log.warn("Fire-and-forget call {} failed", request.family().getValue(), error);
            }
        });
    }

    @Override
    public <T> CompletableFuture<Optional<T>> callIgnoreIssues(CallRequest<T> request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (request.isTransactional()) {
            throw new IllegalArgumentException(
                "Transactional calls cannot ignore issues: " + request.family().getValue());
        }
        ensureRunning();

        CompletableFuture<Optional<T>> result = new CompletableFuture<>();
        scheduler.execute(() -> {
            log.debug("Calling {} without issue handling", request.family().getValue());
            CancellationHandle handle = new CancellationHandle();
            gateway.invoke(request, handle).whenComplete((response, error) ->
                scheduler.execute(() -> concludeIgnoringIssues(request, response, error, result)));
        });
        return result;
    }

    // ============================================================
    // Introspection
    // ============================================================

    public boolean isRunning() {
        return running.get();
    }

    public ManagerState state() {
        return status.current();
    }

    /**
     * 등록된 호출 스냅샷 (등록 순).
     */
    public List<CallEnvelope<?>> registeredCalls() {
        return registry.envelopes();
    }

    public int activeCancellationCount() {
        return registry.cancellationCount();
    }

    public SpinnerMode effectiveSpinnerMode() {
        return spinner.effectiveMode();
    }

    public boolean isIndicatorVisible() {
        return spinner.isVisible();
    }

    /**
     * 진행 중인 에스컬레이션 사이클.
     *
     * @return 사이클, 없으면 Optional.empty()
     */
    public Optional<EscalationCycle> activeCycle() {
        return Optional.ofNullable(escalation.activeCycle());
    }

    public boolean isTransactionHeld(CallFamily family) {
        return transactionLock.isHeld(family);
    }

    // ============================================================
    // Scheduler-thread internals
    // ============================================================

    private <T> void dispatch(CallRequest<T> request, SpinnerMode spinnerMode,
                              CompletableFuture<CallOutcome<T>> completion) {
        if (!request.isTransactional()) {
            register(request, spinnerMode, completion);
            return;
        }
        transactionLock.acquire(request.family())
            .thenRun(() -> register(request, spinnerMode, completion))
            .exceptionally(e -> {
                log.error("Dispatch of {} failed", request.family().getValue(), e);
                return null;
            });
    }

    private <T> void register(CallRequest<T> request, SpinnerMode spinnerMode,
                              CompletableFuture<CallOutcome<T>> completion) {
        CallEnvelope<T> envelope = new CallEnvelope<>(registry.nextCallId(), request, completion, this::launch);
        if (!running.get()) {
            failOnShutdown(envelope);
            return;
        }

        spinner.request(spinnerMode);
        registry.register(envelope);
        log.debug("Registered {} (spinner={}, state={})", envelope, spinnerMode, status.current());

        if (!status.is(ManagerState.TIMED_OUT)) {
            escalation.start();
            envelope.replay();
        }
    }

    private <T> void launch(CallEnvelope<T> envelope) {
        CancellationHandle handle = new CancellationHandle();
        EscalationCycle cycle = escalation.activeCycle();
        registry.addCancellation(handle);
        int attempt = envelope.beginAttempt(handle);
        log.debug("Launching {} attempt {}", envelope, attempt);

        gateway.invoke(envelope.request(), handle).whenComplete((response, error) ->
            scheduler.execute(() -> onAttemptCompleted(envelope, handle, cycle, response, error)));
    }

    private <T> void onAttemptCompleted(CallEnvelope<T> envelope, CancellationHandle handle,
                                        EscalationCycle cycle, T response, Throwable error) {
        registry.removeCancellation(handle);
        if (envelope.isConcluded() || envelope.currentAttempt() != handle) {
            log.debug("Stale attempt result ignored for {}", envelope);
            return;
        }

        if (error == null) {
            payloadReactor.react(response);
            conclude(envelope, new Ok<>(envelope.id(), response, envelope.attempts()));
            return;
        }
        if (TransportGateway.isCancellation(error)) {
            recoveryController.onConnectivityCancellation(envelope, cycle);
            return;
        }

        Throwable cause = TransportGateway.unwrap(error);
        recoveryController.onServerFault(envelope, cause);
        conclude(envelope, toFail(envelope, cause));
    }

    private <T> void conclude(CallEnvelope<T> envelope, CallOutcome<T> outcome) {
        registry.remove(envelope.id());
        if (envelope.request().isTransactional()) {
            transactionLock.release(envelope.request().family());
        }
        if (envelope.conclude(outcome)) {
            log.debug("Concluded {} with {}", envelope, outcome.isOk() ? "Ok" : "Fail");
        }
    }

    private <T> void failOnShutdown(CallEnvelope<T> envelope) {
        conclude(envelope, Fail.of(envelope.id(), Fail.ENGINE_SHUTDOWN,
            "Engine shut down before the call concluded"));
    }

    private <T> void concludeIgnoringIssues(CallRequest<T> request, T response, Throwable error,
                                            CompletableFuture<Optional<T>> result) {
        if (error == null) {
            payloadReactor.react(response);
            result.complete(Optional.ofNullable(response));
            return;
        }
        if (TransportGateway.isCancellation(error)) {
            log.warn("Call {} cancelled by connectivity issue", request.family().getValue());
            escalation.interrupt();
        } else {
            log.warn("Silent fault on {}", request.family().getValue(), TransportGateway.unwrap(error));
        }
        result.complete(Optional.empty());
    }

    private static <T> Fail<T> toFail(CallEnvelope<T> envelope, Throwable cause) {
        String errorCode = cause instanceof RemoteCallException remote
            ? remote.getErrorCode()
            : Fail.REMOTE_CALL_FAILED;
        String message = cause.getMessage() == null || cause.getMessage().isBlank()
            ? cause.getClass().getSimpleName()
            : cause.getMessage();
        return new Fail<>(envelope.id(), errorCode, message, cause.getClass().getName());
    }

    private void ensureRunning() {
        if (!running.get()) {
            throw new IllegalStateException("CloudCallEngine is not running");
        }
    }
}
