package com.ryuqq.cloudcall.core.spi;

/**
 * 서버가 보고한 애플리케이션 수준 오류.
 *
 * <p>Transport가 이 예외로 future를 완료하면 엔진은 errorCode를 그대로
 * {@link com.ryuqq.cloudcall.core.outcome.Fail}에 담아 호출자에게 전달합니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public class RemoteCallException extends RuntimeException {

    private final String errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @throws IllegalArgumentException errorCode가 null이거나 빈 문자열인 경우
     */
    public RemoteCallException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param cause 원인
     * @throws IllegalArgumentException errorCode가 null이거나 빈 문자열인 경우
     */
    public RemoteCallException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
