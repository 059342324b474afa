package com.ryuqq.cloudcall.core.outcome;

import com.ryuqq.cloudcall.core.model.CallId;

/**
 * 실패 결과 (재시도 불가).
 *
 * <p>서버가 애플리케이션 수준 오류를 보고했거나, 엔진이 종료되어
 * 더 이상 결과를 받을 수 없는 경우를 나타냅니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>REMOTE_CALL_FAILED - 분류되지 않은 원격 호출 오류</li>
 *   <li>INSUFFICIENT_FUNDS 등 - 서버가 보고한 비즈니스 오류 코드</li>
 *   <li>ENGINE_SHUTDOWN - 엔진 종료로 인한 중단</li>
 * </ul>
 *
 * @param callId 호출 ID
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 * @param cause 원인 메시지 (선택, null 가능)
 * @param <T> 응답 타입
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public record Fail<T>(
    CallId callId,
    String errorCode,
    String message,
    String cause
) implements CallOutcome<T> {

    public static final String REMOTE_CALL_FAILED = "REMOTE_CALL_FAILED";
    public static final String ENGINE_SHUTDOWN = "ENGINE_SHUTDOWN";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException callId가 null이거나 errorCode 또는 message가 비어 있는 경우
     */
    public Fail {
        if (callId == null) {
            throw new IllegalArgumentException("callId cannot be null");
        }
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * cause 없이 Fail 생성.
     *
     * @param callId 호출 ID
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param <T> 응답 타입
     * @return Fail 인스턴스
     */
    public static <T> Fail<T> of(CallId callId, String errorCode, String message) {
        return new Fail<>(callId, errorCode, message, null);
    }
}
