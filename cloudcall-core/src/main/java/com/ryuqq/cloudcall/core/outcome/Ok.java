package com.ryuqq.cloudcall.core.outcome;

import com.ryuqq.cloudcall.core.model.CallId;

/**
 * 성공 결과.
 *
 * @param callId 호출 ID
 * @param response 파싱된 서버 응답 (null 가능)
 * @param attempts 응답을 받기까지의 시도 횟수 (1 이상)
 * @param <T> 응답 타입
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public record Ok<T>(
    CallId callId,
    T response,
    int attempts
) implements CallOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException callId가 null이거나 attempts가 1 미만인 경우
     */
    public Ok {
        if (callId == null) {
            throw new IllegalArgumentException("callId cannot be null");
        }
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
    }

    /**
     * 첫 시도에 성공한 결과 생성.
     *
     * @param callId 호출 ID
     * @param response 서버 응답
     * @param <T> 응답 타입
     * @return Ok 인스턴스
     */
    public static <T> Ok<T> of(CallId callId, T response) {
        return new Ok<>(callId, response, 1);
    }
}
