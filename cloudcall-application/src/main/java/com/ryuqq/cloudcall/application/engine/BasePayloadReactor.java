package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.core.model.BasePayload;
import com.ryuqq.cloudcall.core.spi.AppStateSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 성공 응답에 실려 온 앱 상태 갱신을 AppStateSink로 전달.
 *
 * <p>응답이 {@link BasePayload}이고 해당 필드가 비어 있지 않을 때만 전달합니다.
 * Sink의 실패는 호출 결과에 영향을 주지 않습니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class BasePayloadReactor {

    private static final Logger log = LoggerFactory.getLogger(BasePayloadReactor.class);

    private final AppStateSink sink;

    public BasePayloadReactor(AppStateSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.sink = sink;
    }

    /**
     * 응답 검사 후 갱신 전달.
     *
     * @param response 서버 응답 (null 허용)
     */
    public void react(Object response) {
        if (!(response instanceof BasePayload payload)) {
            return;
        }
        if (hasText(payload.userData())) {
            try {
                sink.applyUserDataUpdate(payload);
            } catch (RuntimeException e) {
                log.error("User data update failed for {}", payload.getClass().getSimpleName(), e);
            }
        }
        if (hasText(payload.resources())) {
            try {
                sink.applyResourceUpdate(payload);
            } catch (RuntimeException e) {
                log.error("Resource update failed for {}", payload.getClass().getSimpleName(), e);
            }
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
