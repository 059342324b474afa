package com.ryuqq.cloudcall.core.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Connectivity recovery SPI.
 *
 * <p>Invoked exactly once per declared timeout. Implementations typically show a
 * "connection lost" popup and wait until the user or the network resolves the issue.
 * Completion of the returned future is the sole trigger for re-issuing aborted calls.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public interface ConnectivityRecovery {

    /**
     * Resolves the current connectivity issue.
     *
     * @param blocking whether the recovery UI should block user interaction
     * @return future completed once connectivity is confirmed; exceptional completion
     *         means recovery failed
     */
    CompletableFuture<Void> resolve(boolean blocking);
}
