package com.ryuqq.cloudcall.core.statemachine;

/**
 * 호출 엔진의 전역 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>IDLE → PROCESSING (에스컬레이션 사이클 시작)</li>
 *   <li>PROCESSING → IDLE (모든 호출이 시간 안에 종료)</li>
 *   <li>PROCESSING → TIMED_OUT (두 단계 타임아웃 모두 만료)</li>
 *   <li>PROCESSING → ERROR (서버 오류)</li>
 *   <li>TIMED_OUT → IDLE (연결 복구 후 재시도)</li>
 *   <li>TIMED_OUT → ERROR (연결 복구 실패)</li>
 *   <li>ERROR → IDLE (호스트의 명시적 리셋)</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 *            ┌──────────────┐
 *            ▼              │ (완료)
 * IDLE ──► PROCESSING ──────┘
 *  ▲  ▲        │
 *  │  │        ├─► TIMED_OUT ──► IDLE (재시도)
 *  │  │        │       │
 *  │  │        └─► ERROR ◄┘
 *  │  └────────────┘ (resetAfterError)
 * </pre>
 *
 * <p><strong>불변식:</strong> IDLE ⇔ Call Registry와 Cancellation Set이 모두 비어 있음
 * (suspension 경계에서 성립)</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public enum ManagerState {

    /**
     * 진행 중인 호출 없음.
     */
    IDLE,

    /**
     * 에스컬레이션 사이클 진행 중.
     */
    PROCESSING,

    /**
     * 타임아웃 선언됨, 연결 복구 대기 중.
     */
    TIMED_OUT,

    /**
     * 서버 오류 발생 (흡수 상태, 명시적 리셋 필요).
     */
    ERROR;

    /**
     * 에스컬레이션 사이클이 더 진행되면 안 되는 상태인지 확인.
     *
     * @return IDLE 또는 ERROR인 경우 true
     */
    public boolean haltsEscalation() {
        return this == IDLE || this == ERROR;
    }
}
