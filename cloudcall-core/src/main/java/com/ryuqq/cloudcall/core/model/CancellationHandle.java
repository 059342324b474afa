package com.ryuqq.cloudcall.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 실행 중인 원격 호출 하나의 협조적 취소 핸들.
 *
 * <p>cancel()은 멱등하며, 취소 요청 시 등록된 콜백을 정확히 한 번씩 실행합니다.
 * 취소 이후에 등록된 콜백은 즉시 실행됩니다.</p>
 *
 * <p><strong>동시성:</strong> Transport 구현체가 다른 스레드에서 상태를 확인할 수 있으므로
 * thread-safe하게 구현되어 있습니다. 취소 플래그와 콜백 목록은 하나의 락으로 함께 갱신되며,
 * 콜백은 락 밖에서 실행됩니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class CancellationHandle {

    private final Object lock = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    /**
     * 취소 요청.
     *
     * @return 이번 호출로 처음 취소된 경우 true, 이미 취소되어 있었으면 false
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : toRun) {
            callback.run();
        }
        return true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    /**
     * 취소 콜백 등록.
     *
     * @param callback 취소 시 실행할 콜백
     * @throws IllegalArgumentException callback이 null인 경우
     */
    public void onCancel(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    @Override
    public String toString() {
        return "CancellationHandle{cancelled=" + cancelled + '}';
    }
}
