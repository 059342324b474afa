package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.core.model.CallFamily;
import com.ryuqq.cloudcall.core.scheduler.TickScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Call family 단위 트랜잭션 게이트.
 *
 * <p>같은 family의 트랜잭션 호출이 동시에 둘 이상 실행되지 않도록 막습니다.
 * 대기자는 스레드를 점유하지 않고 tick마다 한 번씩 플래그를 확인합니다.</p>
 *
 * <p><strong>공정성:</strong> 보장하지 않습니다. 락이 풀리면 다음 tick에 먼저 확인한
 * 대기자가 획득합니다. 해제되지 않는 family의 대기자는 무한히 기다리며, 이는 사용 오류로 봅니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class TransactionLock {

    private static final Logger log = LoggerFactory.getLogger(TransactionLock.class);

    private final TickScheduler scheduler;
    private final Map<CallFamily, Boolean> held = new HashMap<>();

    /**
     * 생성자.
     *
     * @param scheduler tick 공급자
     * @throws IllegalArgumentException scheduler가 null인 경우
     */
    public TransactionLock(TickScheduler scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
    }

    /**
     * 락 획득.
     *
     * @param family 대상 family
     * @return 락을 획득하면 완료되는 future
     */
    public CompletableFuture<Void> acquire(CallFamily family) {
        CompletableFuture<Void> acquired = new CompletableFuture<>();
        tryAcquire(family, acquired, 0);
        return acquired;
    }

    /**
     * 락 해제.
     *
     * @param family 대상 family
     */
    public void release(CallFamily family) {
        held.put(family, false);
        log.debug("Transaction lock released for {}", family.getValue());
    }

    public boolean isHeld(CallFamily family) {
        return held.getOrDefault(family, false);
    }

    private void tryAcquire(CallFamily family, CompletableFuture<Void> acquired, int waitedTicks) {
        if (!isHeld(family)) {
            held.put(family, true);
            log.debug("Transaction lock acquired for {} after {} ticks", family.getValue(), waitedTicks);
            acquired.complete(null);
            return;
        }
        scheduler.nextTick().thenRun(() -> tryAcquire(family, acquired, waitedTicks + 1));
    }
}
