package com.ryuqq.cloudcall.adapter.inmemory.bus;

import com.ryuqq.cloudcall.core.spi.ConnectivityEvents;
import com.ryuqq.cloudcall.core.spi.ConnectivityListener;
import com.ryuqq.cloudcall.core.spi.ConnectivityState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ConnectivityEvents} SPI.
 *
 * <p>The host's network monitor publishes connectivity changes here, and every
 * subscribed listener is notified synchronously on the publishing thread.</p>
 *
 * <p><strong>Dispatch Rules:</strong></p>
 * <ul>
 *   <li>Last subscriber in, first notified</li>
 *   <li>A listener returning {@code true} consumes the event: earlier subscribers do not see it</li>
 *   <li>Subscribing the same listener twice is rejected</li>
 *   <li>Unsubscribing an unknown listener only logs a warning</li>
 *   <li>A listener that throws is logged and treated as not consuming</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> the listener list is a {@link CopyOnWriteArrayList}, so
 * publishing iterates a snapshot and listeners may subscribe or unsubscribe during dispatch.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryConnectivityEventBus bus = new InMemoryConnectivityEventBus();
 * CloudCallEngine engine = new CloudCallEngine(scheduler, transport, bus, ...);
 * engine.start();
 *
 * // from the network monitor
 * bus.publish(ConnectivityState.DEGRADED);
 * </pre>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public class InMemoryConnectivityEventBus implements ConnectivityEvents {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConnectivityEventBus.class);

    private final List<ConnectivityListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public synchronized Subscription subscribe(ConnectivityListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (listeners.contains(listener)) {
            throw new IllegalStateException("Listener cannot be subscribed twice: " + listener);
        }
        listeners.add(listener);
        log.debug("Connectivity listener subscribed ({} total)", listeners.size());
        return () -> unsubscribeQuietly(listener);
    }

    /**
     * Removes a listener.
     *
     * @param listener the listener
     * @return true if the listener was subscribed
     */
    public boolean unsubscribe(ConnectivityListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (!listeners.remove(listener)) {
            log.warn("Attempt to unsubscribe a connectivity listener that was never subscribed");
            return false;
        }
        return true;
    }

    /**
     * Publishes a connectivity change.
     *
     * @param state the new connectivity state
     * @return true if a listener consumed the event
     * @throws IllegalArgumentException if state is null
     */
    public boolean publish(ConnectivityState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        List<ConnectivityListener> snapshot = new ArrayList<>(listeners);
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            if (notify(snapshot.get(i), state)) {
                log.debug("Connectivity event {} consumed", state);
                return true;
            }
        }
        return false;
    }

    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Removes every listener.
     */
    public void clear() {
        listeners.clear();
    }

    private boolean notify(ConnectivityListener listener, ConnectivityState state) {
        try {
            return listener.onConnectivityChanged(state);
        } catch (RuntimeException e) {
            log.error("Connectivity listener failed on {}", state, e);
            return false;
        }
    }

    private void unsubscribeQuietly(ConnectivityListener listener) {
        listeners.remove(listener);
    }
}
