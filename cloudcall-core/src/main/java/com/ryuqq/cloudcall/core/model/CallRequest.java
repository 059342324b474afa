package com.ryuqq.cloudcall.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 원격 호출 요청 (호출 유형 + 파라미터).
 *
 * <p>재시도 시에도 같은 CallRequest가 그대로 재사용되므로,
 * 파라미터는 생성 시점에 방어적으로 복사되어 불변으로 유지됩니다.</p>
 *
 * @param type 호출 유형
 * @param parameters 서버 파라미터 (null이면 빈 맵)
 * @param <T> 응답 타입
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public record CallRequest<T>(
    CallType<T> type,
    Map<String, Object> parameters
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type이 null인 경우
     */
    public CallRequest {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * CallRequest 생성.
     *
     * @param type 호출 유형
     * @param parameters 서버 파라미터
     * @param <T> 응답 타입
     * @return CallRequest 인스턴스
     */
    public static <T> CallRequest<T> of(CallType<T> type, Map<String, Object> parameters) {
        return new CallRequest<>(type, parameters);
    }

    /**
     * 파라미터 없는 CallRequest 생성.
     *
     * @param type 호출 유형
     * @param <T> 응답 타입
     * @return CallRequest 인스턴스
     */
    public static <T> CallRequest<T> of(CallType<T> type) {
        return new CallRequest<>(type, null);
    }

    public CallFamily family() {
        return type.family();
    }

    public boolean isTransactional() {
        return type.transactional();
    }
}
