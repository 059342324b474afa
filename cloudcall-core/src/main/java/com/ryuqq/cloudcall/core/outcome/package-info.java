/**
 * Resilient call outcome package.
 *
 * <p>{@link com.ryuqq.cloudcall.core.outcome.CallOutcome} is a sealed interface permitting
 * {@link com.ryuqq.cloudcall.core.outcome.Ok} and {@link com.ryuqq.cloudcall.core.outcome.Fail}.
 * Connectivity-driven cancellation never surfaces as an outcome; such calls are retried.</p>
 *
 * @since 1.0.0
 * @author CloudCall Team
 */
package com.ryuqq.cloudcall.core.outcome;
