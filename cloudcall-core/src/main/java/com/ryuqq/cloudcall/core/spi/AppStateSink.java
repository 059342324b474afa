package com.ryuqq.cloudcall.core.spi;

import com.ryuqq.cloudcall.core.model.BasePayload;

/**
 * 앱 상태 갱신 SPI.
 *
 * <p>서버 응답의 base payload에 해당 필드가 존재하고 비어 있지 않을 때만 호출됩니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public interface AppStateSink {

    /**
     * 사용자 데이터 갱신.
     *
     * @param payload userData 필드를 가진 응답
     */
    void applyUserDataUpdate(BasePayload payload);

    /**
     * 리소스 갱신.
     *
     * @param payload resources 필드를 가진 응답
     */
    void applyResourceUpdate(BasePayload payload);
}
