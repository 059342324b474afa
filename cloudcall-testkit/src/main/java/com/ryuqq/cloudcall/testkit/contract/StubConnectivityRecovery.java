package com.ryuqq.cloudcall.testkit.contract;

import com.ryuqq.cloudcall.core.spi.ConnectivityRecovery;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ConnectivityRecovery} whose resolutions are completed by the test.
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public class StubConnectivityRecovery implements ConnectivityRecovery {

    private final AtomicInteger resolveCount = new AtomicInteger();
    private final List<CompletableFuture<Void>> pending = new ArrayList<>();
    private volatile Boolean lastBlocking;

    @Override
    public synchronized CompletableFuture<Void> resolve(boolean blocking) {
        resolveCount.incrementAndGet();
        lastBlocking = blocking;
        CompletableFuture<Void> resolution = new CompletableFuture<>();
        pending.add(resolution);
        return resolution;
    }

    /**
     * Signals that connectivity is back for every pending resolution.
     *
     * @return the number of resolutions completed
     */
    public int recover() {
        List<CompletableFuture<Void>> due = drain();
        due.forEach(resolution -> resolution.complete(null));
        return due.size();
    }

    /**
     * Fails every pending resolution.
     *
     * @param error the failure
     * @return the number of resolutions failed
     */
    public int failRecovery(Throwable error) {
        List<CompletableFuture<Void>> due = drain();
        due.forEach(resolution -> resolution.completeExceptionally(error));
        return due.size();
    }

    public int resolveCount() {
        return resolveCount.get();
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public Boolean lastBlocking() {
        return lastBlocking;
    }

    private synchronized List<CompletableFuture<Void>> drain() {
        List<CompletableFuture<Void>> due = new ArrayList<>(pending);
        pending.clear();
        return due;
    }
}
