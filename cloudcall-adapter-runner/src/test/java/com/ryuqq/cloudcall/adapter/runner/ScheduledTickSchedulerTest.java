package com.ryuqq.cloudcall.adapter.runner;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScheduledTickScheduler 테스트.
 *
 * <p>실제 스케줄러 스레드 위에서 작업 실행, 틱 대기, 종료 동작을 검증합니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
class ScheduledTickSchedulerTest {

    private static final long TIMEOUT_SECONDS = 5;

    private ScheduledTickScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ScheduledTickScheduler(
            new TickSchedulerConfig().withTickIntervalMs(10).withThreadName("tick-test"));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        scheduler.shutdown();
    }

    @Test
    void execute_스케줄러_스레드에서_실행() throws Exception {
        // given
        CompletableFuture<String> threadName = new CompletableFuture<>();
        CompletableFuture<Boolean> onSchedulerThread = new CompletableFuture<>();

        // when
        scheduler.execute(() -> {
            threadName.complete(Thread.currentThread().getName());
            onSchedulerThread.complete(scheduler.isSchedulerThread());
        });

        // then
        assertThat(threadName.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isEqualTo("tick-test");
        assertThat(onSchedulerThread.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.isSchedulerThread()).isFalse();
    }

    @Test
    void nextTick_시작_후_경과_시간과_함께_완료() throws Exception {
        // given
        scheduler.start();

        // when
        Duration delta = scheduler.nextTick().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        assertThat(delta).isPositive();
    }

    @Test
    void nextTick_스케줄러_스레드에서_연속으로_대기() throws Exception {
        // given
        scheduler.start();
        CompletableFuture<Integer> ticks = new CompletableFuture<>();

        // when
        scheduler.execute(() -> scheduler.nextTick()
            .thenCompose(first -> scheduler.nextTick())
            .thenCompose(second -> scheduler.nextTick())
            .thenRun(() -> ticks.complete(3)));

        // then
        assertThat(ticks.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isEqualTo(3);
    }

    @Test
    void execute_작업이_실패해도_틱은_계속() throws Exception {
        // given
        scheduler.start();

        // when
        scheduler.execute(() -> {
            throw new IllegalStateException("boom");
        });

        // then
        assertThat(scheduler.nextTick().get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isNotNull();
    }

    @Test
    void start_두_번_호출하면_예외() {
        scheduler.start();

        assertThatThrownBy(() -> scheduler.start())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already started");
    }

    @Test
    void shutdown_대기_중인_틱을_취소하고_이후_실행을_거부() throws Exception {
        // given
        CompletableFuture<Duration> waiter = scheduler.nextTick();

        // when
        scheduler.shutdown();

        // then
        assertThat(waiter).isCancelled();
        assertThatThrownBy(() -> scheduler.execute(() -> { }))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("shut down");
    }

    @Test
    void shutdown_두_번_호출해도_안전() throws Exception {
        scheduler.shutdown();
        scheduler.shutdown();
    }

    @Test
    void constructor_null_설정이면_예외() {
        assertThatThrownBy(() -> new ScheduledTickScheduler(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
