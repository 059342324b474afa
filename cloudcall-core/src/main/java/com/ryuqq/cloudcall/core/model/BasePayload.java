package com.ryuqq.cloudcall.core.model;

/**
 * 서버 응답에 실려 오는 부가 정보(base payload).
 *
 * <p>응답 타입이 이 인터페이스를 구현하면, 엔진은 결과를 호출자에게 돌려주기 전에
 * 사용자 데이터와 리소스 변경분을 앱 상태 협력자에게 전달합니다.
 * 서버 왕복 횟수를 줄이기 위한 훅입니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public interface BasePayload {

    /**
     * 갱신된 사용자 데이터.
     *
     * @return 사용자 데이터 (없으면 null 또는 빈 문자열)
     */
    String userData();

    /**
     * 리소스 변경분.
     *
     * @return 리소스 델타 (없으면 null 또는 빈 문자열)
     */
    String resources();
}
