package com.ryuqq.cloudcall.core.spi;

/**
 * 연결 상태.
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public enum ConnectivityState {

    /**
     * 서버 도달 가능.
     */
    REACHABLE,

    /**
     * 네트워크는 있으나 서버에 도달할 수 없음.
     */
    DEGRADED,

    /**
     * 네트워크 없음.
     */
    UNREACHABLE;

    public boolean isServerReachable() {
        return this == REACHABLE;
    }
}
