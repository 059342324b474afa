package com.ryuqq.cloudcall.core.spi;

/**
 * Connectivity event SPI.
 *
 * <p>Delivers connectivity state changes to subscribed listeners. The engine subscribes on
 * {@code start()} and unsubscribes on {@code shutdown()}.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public interface ConnectivityEvents {

    /**
     * Subscribes a listener.
     *
     * @param listener the listener
     * @return subscription used to unsubscribe
     * @throws IllegalArgumentException if listener is null
     * @throws IllegalStateException if the listener is already subscribed
     */
    Subscription subscribe(ConnectivityListener listener);

    /**
     * Handle of one subscription.
     */
    @FunctionalInterface
    interface Subscription {

        /**
         * Removes the listener. Calling it more than once has no further effect.
         */
        void unsubscribe();
    }
}
