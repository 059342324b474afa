package com.ryuqq.cloudcall.testkit.contract;

import com.ryuqq.cloudcall.core.spi.LoadingIndicator;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link LoadingIndicator} that records claims per owner.
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public class RecordingLoadingIndicator implements LoadingIndicator {

    private final Map<Object, Integer> claims = new ConcurrentHashMap<>();
    private final List<String> history = new CopyOnWriteArrayList<>();

    @Override
    public void show(Object owner) {
        claims.merge(owner, 1, Integer::sum);
        history.add("show");
    }

    @Override
    public void hide(Object owner) {
        claims.remove(owner);
        history.add("hide");
    }

    /**
     * Returns whether any owner currently holds a claim.
     */
    public boolean isShowing() {
        return !claims.isEmpty();
    }

    public boolean isShowingFor(Object owner) {
        return claims.containsKey(owner);
    }

    public int showCount() {
        return (int) history.stream().filter("show"::equals).count();
    }

    public int hideCount() {
        return (int) history.stream().filter("hide"::equals).count();
    }

    /**
     * Returns show/hide calls in order.
     */
    public List<String> history() {
        return List.copyOf(history);
    }

    public void clear() {
        claims.clear();
        history.clear();
    }
}
