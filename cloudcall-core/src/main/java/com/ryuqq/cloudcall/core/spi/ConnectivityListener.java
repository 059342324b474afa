package com.ryuqq.cloudcall.core.spi;

/**
 * 연결 상태 변경 리스너.
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConnectivityListener {

    /**
     * 연결 상태 변경 통지.
     *
     * @param state 새 연결 상태
     * @return 이벤트를 소비(consume)하여 이후 리스너에게 전달하지 않으려면 true
     */
    boolean onConnectivityChanged(ConnectivityState state);
}
