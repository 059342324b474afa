package com.ryuqq.cloudcall.core.spi;

import com.ryuqq.cloudcall.core.model.CallRequest;
import com.ryuqq.cloudcall.core.model.CancellationHandle;

import java.util.concurrent.CompletableFuture;

/**
 * Remote call transport SPI.
 *
 * <p>Performs one remote call and parses its response. The engine never interprets the
 * payload beyond {@link com.ryuqq.cloudcall.core.model.BasePayload}.</p>
 *
 * <p><strong>Completion contract:</strong></p>
 * <ul>
 *   <li>Success: complete normally with the parsed response</li>
 *   <li>Connectivity issue: complete with {@link java.util.concurrent.CancellationException}
 *       (or cancel the returned future)</li>
 *   <li>Server fault: complete exceptionally with any other throwable, preferably
 *       {@link RemoteCallException} carrying the application error code</li>
 * </ul>
 *
 * <p>The engine also treats a cancelled {@code handle} as cancellation of the attempt,
 * even when the transport never completes its future.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public interface Transport {

    /**
     * Starts a remote call.
     *
     * <p>Must not block; the returned future may complete on any thread.</p>
     *
     * @param request the call request (type and parameters)
     * @param handle cancellation handle for this attempt
     * @param <T> response type
     * @return future of the parsed response
     */
    <T> CompletableFuture<T> invoke(CallRequest<T> request, CancellationHandle handle);
}
