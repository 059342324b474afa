/**
 * Engine internals behind {@link com.ryuqq.cloudcall.application.dispatcher.CallDispatcher}.
 *
 * <ul>
 *   <li>{@link com.ryuqq.cloudcall.application.engine.CloudCallEngine} - the engine instance and its lifecycle</li>
 *   <li>{@link com.ryuqq.cloudcall.application.engine.CallRegistry} - in-flight envelopes and live cancellation handles</li>
 *   <li>{@link com.ryuqq.cloudcall.application.engine.TransactionLock} - per-family gate, polled once per tick</li>
 *   <li>{@link com.ryuqq.cloudcall.application.engine.SpinnerArbiter} - effective spinner mode</li>
 *   <li>{@link com.ryuqq.cloudcall.application.engine.TimeoutEscalation} - two-phase timeout state machine</li>
 *   <li>{@link com.ryuqq.cloudcall.application.engine.ConnectivityRecoveryController} - abort, recover, replay</li>
 * </ul>
 *
 * <p>None of these classes synchronize. They are only touched from the scheduler thread.</p>
 *
 * @since 1.0.0
 * @author CloudCall Team
 */
package com.ryuqq.cloudcall.application.engine;
