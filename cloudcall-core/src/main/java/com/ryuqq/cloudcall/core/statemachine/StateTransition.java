package com.ryuqq.cloudcall.core.statemachine;

/**
 * 엔진 상태 전이 검증 및 실행.
 *
 * <p>허용되지 않은 전이는 엔진 내부 로직의 결함이므로
 * {@link IllegalStateException}으로 즉시 실패합니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ManagerState from, ManagerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case IDLE -> to == ManagerState.PROCESSING;
            case PROCESSING -> to == ManagerState.IDLE
                || to == ManagerState.TIMED_OUT
                || to == ManagerState.ERROR;
            case TIMED_OUT -> to == ManagerState.IDLE || to == ManagerState.ERROR;
            case ERROR -> to == ManagerState.IDLE;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static ManagerState transition(ManagerState current, ManagerState next) {
        validate(current, next);
        return next;
    }
}
