/**
 * Scheduler abstraction: one logical thread, cooperative suspension on ticks.
 *
 * <ul>
 *   <li>{@link com.ryuqq.cloudcall.core.scheduler.TickScheduler} - the port</li>
 *   <li>{@link com.ryuqq.cloudcall.core.scheduler.DrivenTickScheduler} - ticks driven by the host loop</li>
 * </ul>
 *
 * <p>A self-ticking implementation backed by a scheduled executor lives in the
 * {@code cloudcall-adapter-runner} module.</p>
 *
 * @since 1.0.0
 * @author CloudCall Team
 */
package com.ryuqq.cloudcall.core.scheduler;
