package com.ryuqq.cloudcall.core.model;

/**
 * 원격 호출 유형의 정적 기술.
 *
 * <p>어떤 백엔드 함수를 호출하는지(family), 응답을 어떤 타입으로 파싱하는지(responseType),
 * 그리고 같은 family 안에서 직렬화가 필요한지(transactional)를 함께 정의합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * CallType&lt;PurchaseResult&gt; PURCHASE =
 *     CallType.transactional(CallFamily.of("PURCHASE_ITEM"), PurchaseResult.class);
 *
 * CallType&lt;Profile&gt; GET_PROFILE =
 *     CallType.of(CallFamily.of("GET_PROFILE"), Profile.class);
 * </pre>
 *
 * @param family 호출 family
 * @param responseType 응답 타입
 * @param transactional 트랜잭션 직렬화 여부
 * @param <T> 응답 타입
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public record CallType<T>(
    CallFamily family,
    Class<T> responseType,
    boolean transactional
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException family 또는 responseType이 null인 경우
     */
    public CallType {
        if (family == null) {
            throw new IllegalArgumentException("family cannot be null");
        }
        if (responseType == null) {
            throw new IllegalArgumentException("responseType cannot be null");
        }
    }

    /**
     * 일반(비 트랜잭션) 호출 유형 생성.
     *
     * @param family 호출 family
     * @param responseType 응답 타입
     * @param <T> 응답 타입
     * @return CallType 인스턴스
     */
    public static <T> CallType<T> of(CallFamily family, Class<T> responseType) {
        return new CallType<>(family, responseType, false);
    }

    /**
     * 트랜잭션 호출 유형 생성.
     *
     * <p>같은 family의 트랜잭션 호출은 한 번에 하나만 실행됩니다.</p>
     *
     * @param family 호출 family
     * @param responseType 응답 타입
     * @param <T> 응답 타입
     * @return CallType 인스턴스
     */
    public static <T> CallType<T> transactional(CallFamily family, Class<T> responseType) {
        return new CallType<>(family, responseType, true);
    }
}
