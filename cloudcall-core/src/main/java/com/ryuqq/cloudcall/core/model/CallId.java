package com.ryuqq.cloudcall.core.model;

/**
 * 논리적 호출(logical call)의 고유 식별자.
 *
 * <p>CallId는 엔진 인스턴스 안에서 단조 증가하는 정수 값이며,
 * Call Registry에서 성공한 호출이 스스로를 제거할 때 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong> 음수 불가</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class CallId implements Comparable<CallId> {

    private final long value;

    private CallId(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("CallId must be non-negative (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * CallId 생성.
     *
     * @param value 식별자 값 (0 이상)
     * @return CallId 인스턴스
     * @throws IllegalArgumentException 음수인 경우
     */
    public static CallId of(long value) {
        return new CallId(value);
    }

    /**
     * 다음 순번의 CallId.
     *
     * @return value + 1 을 가진 CallId
     */
    public CallId next() {
        return new CallId(value + 1);
    }

    public long getValue() {
        return value;
    }

    @Override
    public int compareTo(CallId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CallId callId = (CallId) o;
        return value == callId.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "CallId{" + value + '}';
    }
}
