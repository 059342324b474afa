package com.ryuqq.cloudcall.application.dispatcher;

import com.ryuqq.cloudcall.core.model.CallRequest;
import com.ryuqq.cloudcall.core.outcome.CallOutcome;
import com.ryuqq.cloudcall.core.spinner.SpinnerMode;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 원격 호출 API.
 *
 * <p>세 가지 진입점을 제공합니다:</p>
 * <ul>
 *   <li><strong>callResilient:</strong> 타임아웃 에스컬레이션에 참여하며, 연결 문제로 취소되면
 *       연결 복구 후 자동으로 재시도됩니다. 트랜잭션 호출은 family 단위로 직렬화됩니다.</li>
 *   <li><strong>callFireAndForget:</strong> 결과를 기다리지 않는 호출. 실패는 로그로만 남습니다.</li>
 *   <li><strong>callIgnoreIssues:</strong> 타임아웃 처리와 스피너 없이 한 번만 시도합니다.
 *       오류나 취소 시 빈 결과를 반환합니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CallRequest&lt;Profile&gt; request = CallRequest.of(GET_PROFILE, Map.of("userId", 42));
 *
 * dispatcher.callResilient(request, SpinnerMode.AFTER_TIMEOUT)
 *     .thenAccept(outcome -&gt; outcome.value().ifPresent(this::render));
 *
 * dispatcher.callFireAndForget(CallRequest.of(TRACK_EVENT, Map.of("name", "opened_shop")));
 * </pre>
 *
 * <p>반환되는 future는 엔진의 스케줄러 스레드에서 완료됩니다. 예상 가능한 실패 유형에 대해
 * future가 예외로 완료되는 일은 없습니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public interface CallDispatcher {

    /**
     * 복원력 있는 호출.
     *
     * @param request 호출 요청
     * @param spinnerMode 이 호출이 원하는 스피너 표시 방식
     * @param <T> 응답 타입
     * @return 서버 응답(Ok) 또는 서버 오류(Fail)로 완료되는 future
     * @throws IllegalArgumentException request 또는 spinnerMode가 null인 경우
     * @throws IllegalStateException 엔진이 시작되지 않았거나 종료된 경우
     */
    <T> CompletableFuture<CallOutcome<T>> callResilient(CallRequest<T> request, SpinnerMode spinnerMode);

    /**
     * 복원력 있는 호출 (스피너 모드 AFTER_TIMEOUT).
     *
     * @param request 호출 요청
     * @param <T> 응답 타입
     * @return 서버 응답(Ok) 또는 서버 오류(Fail)로 완료되는 future
     */
    default <T> CompletableFuture<CallOutcome<T>> callResilient(CallRequest<T> request) {
        return callResilient(request, SpinnerMode.AFTER_TIMEOUT);
    }

    /**
     * 결과를 기다리지 않는 호출.
     *
     * @param request 호출 요청
     * @param <T> 응답 타입
     * @throws IllegalArgumentException request가 null이거나 트랜잭션 호출인 경우
     * @throws IllegalStateException 엔진이 시작되지 않았거나 종료된 경우
     */
    <T> void callFireAndForget(CallRequest<T> request);

    /**
     * 문제를 무시하는 호출.
     *
     * <p>Registry와 타임아웃 에스컬레이션 밖에서, 독립적인 취소 핸들로 한 번만 시도합니다.</p>
     *
     * @param request 호출 요청
     * @param <T> 응답 타입
     * @return 성공 시 응답, 오류나 취소 시 Optional.empty()로 완료되는 future
     * @throws IllegalArgumentException request가 null이거나 트랜잭션 호출인 경우
     * @throws IllegalStateException 엔진이 시작되지 않았거나 종료된 경우
     */
    <T> CompletableFuture<Optional<T>> callIgnoreIssues(CallRequest<T> request);
}
