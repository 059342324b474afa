package com.ryuqq.cloudcall.core.model;

import java.util.regex.Pattern;

/**
 * 원격 호출의 논리적 분류 (Call Family).
 *
 * <p>CallFamily는 호출의 정적 기술(static description)이 제공하는 태그이며,
 * 트랜잭션 직렬화 대상 호출을 묶는 키로 사용됩니다. 리플렉션 기반 타입 조회 대신
 * 명시적인 식별자를 사용합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>CallFamily.of("PURCHASE_ITEM") - 아이템 구매</li>
 *   <li>CallFamily.of("CLAIM_REWARD") - 보상 수령</li>
 *   <li>CallFamily.of("GET_PROFILE") - 프로필 조회</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 대문자, 숫자, 언더스코어만 허용</li>
 * </ul>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class CallFamily {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[A-Z][A-Z0-9_]*$");

    private final String value;

    private CallFamily(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CallFamily cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("CallFamily length cannot exceed 64 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "CallFamily must start with an uppercase letter and contain only uppercase letters, digits and underscores");
        }
        this.value = value;
    }

    /**
     * CallFamily 생성.
     *
     * @param value Family 값 (예: PURCHASE_ITEM)
     * @return CallFamily 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static CallFamily of(String value) {
        return new CallFamily(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CallFamily that = (CallFamily) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CallFamily{" + value + '}';
    }
}
