package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.core.model.CallFamily;
import com.ryuqq.cloudcall.core.scheduler.DrivenTickScheduler;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TransactionLock 유닛 테스트.
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
class TransactionLockTest {

    private static final CallFamily PURCHASE = CallFamily.of("PURCHASE");
    private static final Duration TICK = Duration.ofMillis(16);

    private final DrivenTickScheduler scheduler = new DrivenTickScheduler();
    private final TransactionLock lock = new TransactionLock(scheduler);

    @Test
    void acquire_잠금이_없으면_즉시_획득() {
        // when
        CompletableFuture<Void> acquired = lock.acquire(PURCHASE);

        // then
        assertThat(acquired).isCompleted();
        assertThat(lock.isHeld(PURCHASE)).isTrue();
    }

    @Test
    void acquire_잠금_중이면_해제_후_다음_틱에_획득() {
        // given
        lock.acquire(PURCHASE);
        CompletableFuture<Void> waiting = lock.acquire(PURCHASE);
        scheduler.tick(TICK);
        assertThat(waiting).isNotDone();

        // when
        lock.release(PURCHASE);
        scheduler.tick(TICK);

        // then
        assertThat(waiting).isCompleted();
        assertThat(lock.isHeld(PURCHASE)).isTrue();
    }

    @Test
    void acquire_대기자가_여럿이면_한_번에_하나만_획득() {
        // given
        lock.acquire(PURCHASE);
        CompletableFuture<Void> first = lock.acquire(PURCHASE);
        CompletableFuture<Void> second = lock.acquire(PURCHASE);

        // when
        lock.release(PURCHASE);
        scheduler.tick(TICK);

        // then
        assertThat(first).isCompleted();
        assertThat(second).isNotDone();

        lock.release(PURCHASE);
        scheduler.tick(TICK);
        assertThat(second).isCompleted();
    }

    @Test
    void acquire_다른_패밀리는_서로_막지_않음() {
        // given
        lock.acquire(PURCHASE);

        // when
        CompletableFuture<Void> other = lock.acquire(CallFamily.of("MAIL_CLAIM"));

        // then
        assertThat(other).isCompleted();
    }

    @Test
    void isHeld_한_번도_획득하지_않은_패밀리는_false() {
        assertThat(lock.isHeld(PURCHASE)).isFalse();
    }
}
