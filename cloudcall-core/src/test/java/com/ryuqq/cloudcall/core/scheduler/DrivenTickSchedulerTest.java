package com.ryuqq.cloudcall.core.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DrivenTickScheduler 테스트.
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
class DrivenTickSchedulerTest {

    private final DrivenTickScheduler scheduler = new DrivenTickScheduler();

    @Test
    void execute_소유_스레드에서는_즉시_실행() {
        List<String> order = new ArrayList<>();

        scheduler.execute(() -> order.add("a"));

        assertThat(order).containsExactly("a");
    }

    @Test
    void execute_실행_중_등록된_작업은_현재_작업_이후에_실행() {
        // given
        List<String> order = new ArrayList<>();

        // when
        scheduler.execute(() -> {
            scheduler.execute(() -> order.add("inner"));
            order.add("outer");
        });

        // then
        assertThat(order).containsExactly("outer", "inner");
    }

    @Test
    void execute_작업_예외가_이후_작업을_막지_않음() {
        List<String> order = new ArrayList<>();

        scheduler.execute(() -> {
            scheduler.execute(() -> order.add("after"));
            throw new IllegalStateException("boom");
        });

        assertThat(order).containsExactly("after");
    }

    @Test
    void execute_다른_스레드의_작업은_다음_드레인에서_실행() throws Exception {
        // given
        List<String> order = new ArrayList<>();
        Thread other = new Thread(() -> scheduler.execute(() -> order.add("remote")));
        other.start();
        other.join();
        assertThat(order).isEmpty();

        // when
        scheduler.tick(Duration.ofMillis(10));

        // then
        assertThat(order).containsExactly("remote");
    }

    @Test
    void nextTick_다음_틱에서_경과_시간으로_완료() throws Exception {
        // given
        CompletableFuture<Duration> waiter = scheduler.nextTick();
        assertThat(waiter).isNotDone();

        // when
        scheduler.tick(Duration.ofMillis(100));

        // then
        assertThat(waiter.get()).isEqualTo(Duration.ofMillis(100));
        assertThat(scheduler.getTickCount()).isEqualTo(1);
        assertThat(scheduler.getPendingTickWaiters()).isZero();
    }

    @Test
    void nextTick_틱_도중_등록한_대기자는_다음_틱을_기다림() {
        // given
        AtomicReference<CompletableFuture<Duration>> second = new AtomicReference<>();
        scheduler.nextTick().thenRun(() -> second.set(scheduler.nextTick()));

        // when
        scheduler.tick(Duration.ofMillis(16));

        // then
        assertThat(second.get()).isNotDone();
        scheduler.tick(Duration.ofMillis(16));
        assertThat(second.get()).isCompleted();
    }

    @Test
    void advance_스텝_단위로_틱() {
        scheduler.advance(Duration.ofMillis(250), Duration.ofMillis(100));

        assertThat(scheduler.getTickCount()).isEqualTo(3);
    }

    @Test
    void tick_음수_델타면_예외() {
        assertThatThrownBy(() -> scheduler.tick(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scheduler.advance(Duration.ofMillis(100), Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nextTick_소유_스레드가_아니면_예외() throws Exception {
        CompletableFuture<Throwable> failure = new CompletableFuture<>();
        Thread other = new Thread(() -> {
            try {
                scheduler.nextTick();
                failure.complete(null);
            } catch (IllegalStateException e) {
                failure.complete(e);
            }
        });
        other.start();
        other.join();

        assertThat(failure.get()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void execute_null이면_예외() {
        assertThatThrownBy(() -> scheduler.execute(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
