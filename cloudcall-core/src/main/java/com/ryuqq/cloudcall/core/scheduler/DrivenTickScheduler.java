package com.ryuqq.cloudcall.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 호스트 루프가 구동하는 TickScheduler.
 *
 * <p>프레임 루프를 직접 소유한 애플리케이션(게임 클라이언트 등)을 위한 구현체입니다.
 * 호스트는 매 프레임 {@link #tick(Duration)}에 프레임 경과 시간을 넘깁니다.
 * 테스트에서는 시간을 명시적으로 진행시키는 결정적 스케줄러로 사용됩니다.</p>
 *
 * <p><strong>스레드 모델:</strong></p>
 * <ul>
 *   <li>생성한 스레드가 스케줄러 스레드(owner)가 됩니다</li>
 *   <li>owner 스레드의 {@code execute()}는 즉시 실행됩니다 (실행 중이면 큐잉 후 이어서 실행)</li>
 *   <li>다른 스레드의 {@code execute()}는 큐에만 쌓이고, 다음 {@code tick()}에서 실행됩니다</li>
 * </ul>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class DrivenTickScheduler implements TickScheduler {

    private static final Logger log = LoggerFactory.getLogger(DrivenTickScheduler.class);

    private final Thread owner;
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private List<CompletableFuture<Duration>> tickWaiters = new ArrayList<>();
    private boolean draining;
    private long tickCount;

    /**
     * 현재 스레드를 owner로 하는 스케줄러 생성.
     */
    public DrivenTickScheduler() {
        this.owner = Thread.currentThread();
    }

    @Override
    public void execute(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        tasks.add(task);
        if (Thread.currentThread() == owner) {
            drain();
        }
    }

    @Override
    public CompletableFuture<Duration> nextTick() {
        assertOwner();
        CompletableFuture<Duration> waiter = new CompletableFuture<>();
        tickWaiters.add(waiter);
        return waiter;
    }

    /**
     * tick 하나 진행.
     *
     * <p>이 tick 이전에 등록된 대기자만 완료됩니다. 완료 콜백 안에서 다시
     * {@link #nextTick()}을 호출하면 다음 tick에 완료됩니다.</p>
     *
     * @param delta 직전 tick 이후 경과 시간
     * @throws IllegalArgumentException delta가 null이거나 음수인 경우
     * @throws IllegalStateException owner 스레드가 아닌 곳에서 호출한 경우
     */
    public void tick(Duration delta) {
        if (delta == null || delta.isNegative()) {
            throw new IllegalArgumentException("delta must be non-negative (current: " + delta + ")");
        }
        assertOwner();
        List<CompletableFuture<Duration>> due = tickWaiters;
        tickWaiters = new ArrayList<>();
        tickCount++;
        execute(() -> due.forEach(waiter -> waiter.complete(delta)));
    }

    /**
     * 일정 간격의 tick을 반복하여 시간 진행.
     *
     * @param total 진행할 전체 시간
     * @param step tick 간격 (양수)
     * @throws IllegalArgumentException 값이 유효하지 않은 경우
     */
    public void advance(Duration total, Duration step) {
        if (total == null || total.isNegative()) {
            throw new IllegalArgumentException("total must be non-negative (current: " + total + ")");
        }
        if (step == null || step.isNegative() || step.isZero()) {
            throw new IllegalArgumentException("step must be positive (current: " + step + ")");
        }
        Duration elapsed = Duration.ZERO;
        while (elapsed.compareTo(total) < 0) {
            tick(step);
            elapsed = elapsed.plus(step);
        }
    }

    public long getTickCount() {
        return tickCount;
    }

    public int getPendingTickWaiters() {
        return tickWaiters.size();
    }

    private void drain() {
        if (draining) {
            return;
        }
        draining = true;
        try {
            Runnable task;
            while ((task = tasks.poll()) != null) {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    // 한 작업의 실패가 스케줄러 루프를 멈추지 않도록 기록 후 계속 진행
                    log.error("Scheduled task failed", e);
                }
            }
        } finally {
            draining = false;
        }
    }

    private void assertOwner() {
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException(
                "DrivenTickScheduler must be driven from its owner thread: " + owner.getName());
        }
    }
}
