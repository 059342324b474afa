package com.ryuqq.cloudcall.core.spi;

import com.ryuqq.cloudcall.core.timeout.TimeoutSettings;

/**
 * 타임아웃 설정 공급자 SPI.
 *
 * <p>값은 캐시되지 않고, 사이클 시작과 새 호출 도착 시마다 다시 조회됩니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TimeoutSettingsSource {

    /**
     * 현재 타임아웃 설정 조회.
     *
     * @return 현재 설정 (non-null)
     */
    TimeoutSettings current();
}
