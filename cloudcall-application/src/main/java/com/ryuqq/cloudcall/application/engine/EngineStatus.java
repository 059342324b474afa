package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.core.statemachine.ManagerState;
import com.ryuqq.cloudcall.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 엔진 인스턴스 하나의 상태 보관자.
 *
 * <p>스케줄러 스레드에서만 변경됩니다. 모든 전이는 {@link StateTransition}으로 검증됩니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class EngineStatus {

    private static final Logger log = LoggerFactory.getLogger(EngineStatus.class);

    private ManagerState current = ManagerState.IDLE;

    public ManagerState current() {
        return current;
    }

    public boolean is(ManagerState state) {
        return current == state;
    }

    /**
     * 상태 전이.
     *
     * @param next 다음 상태
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public void transitionTo(ManagerState next) {
        ManagerState previous = current;
        current = StateTransition.transition(previous, next);
        log.debug("Engine state {} → {}", previous, next);
    }

    /**
     * 현재 상태와 무관하게 IDLE로 복귀 (종료 처리용).
     */
    void resetToIdle() {
        if (current != ManagerState.IDLE) {
            transitionTo(ManagerState.IDLE);
        }
    }
}
