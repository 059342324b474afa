/**
 * Engine state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cloudcall.core.statemachine.ManagerState} - Engine states (enum)</li>
 *   <li>{@link com.ryuqq.cloudcall.core.statemachine.StateTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * IDLE → PROCESSING (escalation cycle starts)
 * PROCESSING → IDLE (all calls finished in time)
 * PROCESSING → TIMED_OUT (both phases expired)
 * PROCESSING → ERROR (server fault)
 * TIMED_OUT → IDLE (recovered, calls re-issued)
 * TIMED_OUT → ERROR (recovery failed)
 * ERROR → IDLE (explicit reset)
 * </pre>
 *
 * @since 1.0.0
 * @author CloudCall Team
 */
package com.ryuqq.cloudcall.core.statemachine;
