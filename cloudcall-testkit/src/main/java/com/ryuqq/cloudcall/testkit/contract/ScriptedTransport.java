package com.ryuqq.cloudcall.testkit.contract;

import com.ryuqq.cloudcall.core.model.CallFamily;
import com.ryuqq.cloudcall.core.model.CallRequest;
import com.ryuqq.cloudcall.core.model.CancellationHandle;
import com.ryuqq.cloudcall.core.spi.Transport;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Scripted {@link Transport} for contract tests.
 *
 * <p>Every invocation is recorded and left pending until the test resolves it with
 * {@link Invocation#succeed(Object)}, {@link Invocation#fail(Throwable)} or
 * {@link Invocation#cancel()}. An invocation that is never resolved models a backend
 * that never answers. Cancelling the invocation's handle cancels its pending response.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public class ScriptedTransport implements Transport {

    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();

    @Override
    public <T> CompletableFuture<T> invoke(CallRequest<T> request, CancellationHandle handle) {
        CompletableFuture<T> response = new CompletableFuture<>();
        handle.onCancel(() -> response.cancel(false));
        invocations.add(new Invocation(invocations.size(), request, handle, response));
        return response;
    }

    /**
     * Returns all invocations in the order they were started.
     */
    public List<Invocation> invocations() {
        return List.copyOf(invocations);
    }

    /**
     * Returns the invocations of one call family.
     *
     * @param family the call family
     * @return invocations of that family, in start order
     */
    public List<Invocation> invocationsOf(CallFamily family) {
        return invocations.stream()
            .filter(invocation -> invocation.request().family().equals(family))
            .collect(Collectors.toList());
    }

    /**
     * Returns the invocation with the given start index.
     *
     * @param index zero-based start index
     * @return the invocation
     */
    public Invocation invocation(int index) {
        return invocations.get(index);
    }

    public int invocationCount() {
        return invocations.size();
    }

    /**
     * Returns the invocations that are still pending.
     */
    public List<Invocation> pending() {
        return invocations.stream()
            .filter(Invocation::isPending)
            .collect(Collectors.toList());
    }

    /**
     * Resolves every pending invocation with the same response.
     *
     * @param response the response
     * @return the number of invocations resolved
     */
    public int succeedAllPending(Object response) {
        List<Invocation> pending = pending();
        pending.forEach(invocation -> invocation.succeed(response));
        return pending.size();
    }

    public void clear() {
        invocations.clear();
    }

    /**
     * One recorded transport invocation.
     */
    public static final class Invocation {

        private final int index;
        private final CallRequest<?> request;
        private final CancellationHandle handle;
        private final CompletableFuture<Object> response;

        @SuppressWarnings("unchecked")
        private Invocation(int index, CallRequest<?> request, CancellationHandle handle,
                           CompletableFuture<?> response) {
            this.index = index;
            this.request = request;
            this.handle = handle;
            this.response = (CompletableFuture<Object>) response;
        }

        public int index() {
            return index;
        }

        public CallRequest<?> request() {
            return request;
        }

        public CancellationHandle handle() {
            return handle;
        }

        public boolean isPending() {
            return !response.isDone();
        }

        public boolean isCancellationRequested() {
            return handle.isCancellationRequested();
        }

        /**
         * Completes the invocation with a response.
         */
        public void succeed(Object value) {
            response.complete(value);
        }

        /**
         * Completes the invocation with a fault.
         */
        public void fail(Throwable error) {
            response.completeExceptionally(error);
        }

        /**
         * Completes the invocation as cancelled by a connectivity problem.
         */
        public void cancel() {
            response.completeExceptionally(new CancellationException("Connectivity lost"));
        }

        @Override
        public String toString() {
            return "Invocation{index=" + index + ", family=" + request.family().getValue()
                + ", pending=" + isPending() + '}';
        }
    }
}
