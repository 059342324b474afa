/**
 * Runner Adapter Layer - 스스로 tick을 생성하는 스케줄러.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cloudcall.adapter.runner.ScheduledTickScheduler} - 단일 스레드 fixed-rate tick</li>
 *   <li>{@link com.ryuqq.cloudcall.adapter.runner.TickSchedulerConfig} - 설정</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ScheduledTickScheduler)
 *   ↓ implements
 * core/scheduler (TickScheduler)
 *   ↑ used by
 * application (CloudCallEngine)
 * </pre>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
package com.ryuqq.cloudcall.adapter.runner;
