package com.ryuqq.cloudcall.application.engine;

/**
 * 타임아웃 단계 하나의 종료 사유.
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
enum PhaseResult {

    /**
     * 남은 시간이 0 이하가 됨.
     */
    EXPIRED,

    /**
     * Registry가 비어 사이클이 IDLE로 종료됨.
     */
    FINISHED,

    /**
     * 시계가 취소되었거나 상태가 에스컬레이션을 멈춤.
     */
    INTERRUPTED
}
