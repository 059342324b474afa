package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.core.timeout.TimeoutPhase;

import java.time.Duration;

/**
 * 에스컬레이션 사이클 하나 (PROCESSING 진입부터 IDLE, ERROR, TIMED_OUT 중 하나로 끝날 때까지).
 *
 * <p>사이클마다 고유한 시계를 가집니다. {@link #interrupt()}로 시계를 취소하면 남은 단계는
 * 기다리지 않고 곧바로 타임아웃 선언 경로로 넘어갑니다 (상태가 ERROR나 IDLE이면 종료).</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class EscalationCycle {

    private final long number;
    private TimeoutPhase currentPhase;
    private Duration remaining = Duration.ZERO;
    private boolean interrupted;

    EscalationCycle(long number) {
        this.number = number;
    }

    public long number() {
        return number;
    }

    /**
     * 진행 중인 단계.
     *
     * @return 단계, 첫 tick 대기 중이면 null
     */
    public TimeoutPhase currentPhase() {
        return currentPhase;
    }

    /**
     * 직전 tick 기준 진행 중인 단계의 남은 시간.
     */
    public Duration remaining() {
        return remaining;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    void enterPhase(TimeoutPhase phase, Duration initial) {
        this.currentPhase = phase;
        this.remaining = initial;
    }

    void recordRemaining(Duration remaining) {
        this.remaining = remaining;
    }

    /**
     * 시계 취소. 이미 취소된 경우 false.
     */
    boolean interrupt() {
        if (interrupted) {
            return false;
        }
        interrupted = true;
        return true;
    }

    @Override
    public String toString() {
        return "EscalationCycle{number=" + number
            + ", phase=" + currentPhase
            + ", remaining=" + remaining.toMillis() + "ms"
            + ", interrupted=" + interrupted + '}';
    }
}
