package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.core.model.CallRequest;
import com.ryuqq.cloudcall.core.model.CancellationHandle;
import com.ryuqq.cloudcall.core.spi.Transport;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Transport 호출을 취소 가능한 시도 future로 감싸는 게이트웨이.
 *
 * <p>취소 핸들이 취소되면 Transport가 응답하지 않더라도 시도 future는 즉시
 * {@link CancellationException}으로 완료됩니다. 이후 도착하는 Transport 결과는 무시됩니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class TransportGateway {

    private final Transport transport;

    /**
     * 생성자.
     *
     * @param transport 원격 호출 Transport
     * @throws IllegalArgumentException transport가 null인 경우
     */
    public TransportGateway(Transport transport) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        this.transport = transport;
    }

    /**
     * 시도 하나 시작.
     *
     * @param request 호출 요청
     * @param handle 이 시도의 취소 핸들
     * @param <T> 응답 타입
     * @return 응답, 오류, 취소 중 하나로 완료되는 future
     */
    public <T> CompletableFuture<T> invoke(CallRequest<T> request, CancellationHandle handle) {
        CompletableFuture<T> attempt = new CompletableFuture<>();
        handle.onCancel(() -> attempt.cancel(false));
        if (attempt.isDone()) {
            return attempt;
        }

        CompletableFuture<T> remote;
        try {
            remote = transport.invoke(request, handle);
        } catch (RuntimeException e) {
            attempt.completeExceptionally(e);
            return attempt;
        }
        if (remote == null) {
            attempt.completeExceptionally(
                new IllegalStateException("Transport returned no future for " + request.family().getValue()));
            return attempt;
        }

        remote.whenComplete((response, error) -> {
            if (error != null) {
                attempt.completeExceptionally(unwrap(error));
            } else {
                attempt.complete(response);
            }
        });
        return attempt;
    }

    /**
     * 연결 문제로 인한 취소인지 판별.
     *
     * @param error 시도 future의 예외
     * @return 취소인 경우 true
     */
    public static boolean isCancellation(Throwable error) {
        return unwrap(error) instanceof CancellationException;
    }

    /**
     * CompletableFuture 래핑 예외 해제.
     *
     * @param error 예외
     * @return 원인 예외
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
