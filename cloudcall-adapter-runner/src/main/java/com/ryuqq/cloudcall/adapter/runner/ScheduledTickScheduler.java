package com.ryuqq.cloudcall.adapter.runner;

import com.ryuqq.cloudcall.core.scheduler.TickScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 스스로 tick을 생성하는 단일 스레드 TickScheduler.
 *
 * <p>프레임 루프가 없는 서버나 헤드리스 환경용입니다. 단일 스레드
 * {@link ScheduledExecutorService}가 작업 실행과 tick 생성을 모두 담당하므로
 * 엔진 상태는 항상 같은 스레드에서만 변경됩니다.</p>
 *
 * <p><strong>tick 처리:</strong></p>
 * <pre>
 * 1. tickIntervalMs 주기로 tick 실행 (fixed rate)
 * 2. 직전 tick 이후 실제 경과 시간(nanoTime) 계산
 * 3. 이전 tick까지 등록된 대기자에게 경과 시간 전달
 *    (완료 콜백 안에서 등록한 대기자는 다음 tick에 완료)
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ScheduledTickScheduler scheduler = new ScheduledTickScheduler(new TickSchedulerConfig());
 * scheduler.start();
 * CloudCallEngine engine = new CloudCallEngine(scheduler, transport, events, recovery,
 *     indicator, appStateSink, settingsSource);
 * engine.start();
 * ...
 * engine.shutdown().join();
 * scheduler.shutdown();
 * </pre>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class ScheduledTickScheduler implements TickScheduler {

    private static final Logger log = LoggerFactory.getLogger(ScheduledTickScheduler.class);

    private final TickSchedulerConfig config;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Thread schedulerThread;
    private List<CompletableFuture<Duration>> tickWaiters = new ArrayList<>();
    private long lastTickNanos;
    private long tickCount;

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ScheduledTickScheduler(TickSchedulerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, config.threadName());
            thread.setDaemon(config.daemon());
            schedulerThread = thread;
            return thread;
        });
    }

    /**
     * tick 생성 시작.
     *
     * @throws IllegalStateException 이미 시작했거나 종료된 경우
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("ScheduledTickScheduler already started");
        }
        executor.execute(() -> lastTickNanos = System.nanoTime());
        executor.scheduleAtFixedRate(this::tick,
            config.tickIntervalMs(), config.tickIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("ScheduledTickScheduler started (thread={}, interval={}ms)",
            config.threadName(), config.tickIntervalMs());
    }

    @Override
    public void execute(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        try {
            executor.execute(() -> runSafely(task));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("ScheduledTickScheduler is shut down", e);
        }
    }

    @Override
    public CompletableFuture<Duration> nextTick() {
        CompletableFuture<Duration> waiter = new CompletableFuture<>();
        if (isSchedulerThread()) {
            tickWaiters.add(waiter);
        } else {
            execute(() -> tickWaiters.add(waiter));
        }
        return waiter;
    }

    /**
     * 스케줄러 종료.
     *
     * <p>shutdownTimeoutMs 동안 남은 작업을 기다린 뒤 강제 종료합니다.
     * 완료되지 않은 tick 대기자는 취소됩니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        try {
            executor.execute(this::cancelWaiters);
        } catch (RejectedExecutionException e) {
            log.debug("ScheduledTickScheduler already shut down");
            return;
        }
        executor.shutdown();
        if (!executor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("ScheduledTickScheduler did not terminate in {}ms, forcing shutdown",
                config.shutdownTimeoutMs());
            executor.shutdownNow();
        }
        log.info("ScheduledTickScheduler stopped after {} ticks", tickCount);
    }

    public boolean isSchedulerThread() {
        return Thread.currentThread() == schedulerThread;
    }

    /**
     * 지금까지 실행된 tick 수. 스케줄러 스레드 밖에서는 근사값입니다.
     */
    public long getTickCount() {
        return tickCount;
    }

    private void tick() {
        long now = System.nanoTime();
        Duration delta = Duration.ofNanos(now - lastTickNanos);
        lastTickNanos = now;
        tickCount++;

        List<CompletableFuture<Duration>> due = tickWaiters;
        tickWaiters = new ArrayList<>();
        for (CompletableFuture<Duration> waiter : due) {
            runSafely(() -> waiter.complete(delta));
        }
    }

    private void cancelWaiters() {
        List<CompletableFuture<Duration>> pending = tickWaiters;
        tickWaiters = new ArrayList<>();
        pending.forEach(waiter -> waiter.cancel(false));
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            // 예외가 전파되면 fixed-rate tick 자체가 중단되므로 기록 후 계속 진행
            log.error("Scheduled task failed", e);
        }
    }
}
