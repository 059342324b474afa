package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.core.model.CallId;
import com.ryuqq.cloudcall.core.model.CallRequest;
import com.ryuqq.cloudcall.core.model.CancellationHandle;
import com.ryuqq.cloudcall.core.outcome.CallOutcome;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * 진행 중인 논리적 호출 하나의 재시도 가능한 기록.
 *
 * <p>Envelope은 원래의 요청(유형과 파라미터)과 재실행 동작을 함께 보관합니다.
 * 호출이 성공하거나 실패로 확정되면 Registry에서 제거되고, 연결 문제로 취소되면
 * Registry에 남아 복구 후 {@link #replay()}로 다시 실행됩니다 (재생성하지 않음).</p>
 *
 * @param <T> 응답 타입
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class CallEnvelope<T> {

    private final CallId id;
    private final CallRequest<T> request;
    private final CompletableFuture<CallOutcome<T>> completion;
    private final Consumer<CallEnvelope<T>> launcher;
    private int attempts;
    private CancellationHandle currentAttempt;

    /**
     * 생성자.
     *
     * @param id 호출 ID
     * @param request 원래 요청
     * @param completion 호출자가 기다리는 결과 future
     * @param launcher 시도 하나를 시작하는 동작
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    CallEnvelope(CallId id, CallRequest<T> request, CompletableFuture<CallOutcome<T>> completion,
                 Consumer<CallEnvelope<T>> launcher) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (completion == null) {
            throw new IllegalArgumentException("completion cannot be null");
        }
        if (launcher == null) {
            throw new IllegalArgumentException("launcher cannot be null");
        }
        this.id = id;
        this.request = request;
        this.completion = completion;
        this.launcher = launcher;
    }

    /**
     * 원래 파라미터로 원격 호출을 (다시) 시작.
     */
    public void replay() {
        launcher.accept(this);
    }

    public CallId id() {
        return id;
    }

    public CallRequest<T> request() {
        return request;
    }

    public int attempts() {
        return attempts;
    }

    public boolean isConcluded() {
        return completion.isDone();
    }

    CancellationHandle currentAttempt() {
        return currentAttempt;
    }

    int beginAttempt(CancellationHandle handle) {
        currentAttempt = handle;
        return ++attempts;
    }

    boolean conclude(CallOutcome<T> outcome) {
        return completion.complete(outcome);
    }

    @Override
    public String toString() {
        return "CallEnvelope{id=" + id.getValue()
            + ", family=" + request.family().getValue()
            + ", attempts=" + attempts + '}';
    }
}
