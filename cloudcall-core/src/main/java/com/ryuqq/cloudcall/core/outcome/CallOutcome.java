package com.ryuqq.cloudcall.core.outcome;

import java.util.Optional;

/**
 * 복원력 있는 호출(resilient call)의 최종 결과.
 *
 * <p>CallOutcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 서버가 응답을 돌려줌</li>
 *   <li>{@link Fail}: 서버가 애플리케이션 수준 오류를 보고함 (재시도 불가)</li>
 * </ul>
 *
 * <p>연결 문제로 인한 취소는 결과가 아닙니다. 취소된 호출은 Registry에 남아
 * 연결 복구 후 자동으로 재시도되므로 호출자에게는 보이지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CallOutcome&lt;Profile&gt; outcome = dispatcher.callResilient(request, SpinnerMode.INSTANT).join();
 * if (outcome.isOk()) {
 *     Profile profile = ((Ok&lt;Profile&gt;) outcome).value();
 * } else {
 *     Fail&lt;Profile&gt; fail = (Fail&lt;Profile&gt;) outcome;
 *     log.warn("call failed: {}", fail.errorCode());
 * }
 * </pre>
 *
 * @param <T> 응답 타입
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public sealed interface CallOutcome<T> permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 성공 값 조회.
     *
     * @return 성공인 경우 응답 값, 실패인 경우 Optional.empty()
     */
    default Optional<T> value() {
        if (this instanceof Ok<T> ok) {
            return Optional.ofNullable(ok.response());
        }
        return Optional.empty();
    }
}
