package com.ryuqq.cloudcall.core.scheduler;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 단일 논리 스케줄러 스레드 추상화.
 *
 * <p>엔진의 모든 가변 상태(Registry, 상태, 트랜잭션 락, 취소 핸들 목록)는
 * 이 스케줄러의 스레드에서만 변경됩니다. 따라서 락 없이 협조적 suspension만으로
 * 동작합니다.</p>
 *
 * <p><strong>Suspension 지점:</strong></p>
 * <ul>
 *   <li>원격 호출 완료 대기 → Transport future 완료 후 {@link #execute(Runnable)}로 복귀</li>
 *   <li>트랜잭션 락 해제 대기 → {@link #nextTick()}마다 재확인</li>
 *   <li>타임아웃 단계 카운트다운 → {@link #nextTick()}마다 경과 시간 차감</li>
 * </ul>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public interface TickScheduler {

    /**
     * 스케줄러 스레드에서 작업 실행.
     *
     * <p>어느 스레드에서든 호출할 수 있습니다. 작업은 제출 순서대로,
     * 서로 끼어들지 않고 끝까지 실행됩니다.</p>
     *
     * @param task 실행할 작업
     * @throws IllegalArgumentException task가 null인 경우
     */
    void execute(Runnable task);

    /**
     * 다음 tick 대기.
     *
     * <p>반환된 future는 다음 tick에 스케줄러 스레드에서 완료되며,
     * 값은 직전 tick 이후 경과한 시간입니다.</p>
     *
     * @return 다음 tick의 경과 시간 future
     */
    CompletableFuture<Duration> nextTick();
}
