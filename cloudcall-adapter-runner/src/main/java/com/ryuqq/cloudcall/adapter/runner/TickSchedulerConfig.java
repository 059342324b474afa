package com.ryuqq.cloudcall.adapter.runner;

/**
 * ScheduledTickScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>tickIntervalMs: tick 주기 (기본 16ms, 약 60 tick/초)</li>
 *   <li>threadName: 스케줄러 스레드 이름 (기본 cloudcall-scheduler)</li>
 *   <li>daemon: 데몬 스레드 여부 (기본 true)</li>
 *   <li>shutdownTimeoutMs: 종료 대기 시간 (기본 5000ms)</li>
 * </ul>
 *
 * <p>tick 주기는 타임아웃 판정의 해상도입니다. 타임아웃 단계는 최대 한 tick 늦게 만료될 수 있습니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 * @param tickIntervalMs tick 주기 (밀리초, 양수여야 함)
 * @param threadName 스레드 이름 (비어 있으면 안 됨)
 * @param daemon 데몬 스레드 여부
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record TickSchedulerConfig(
    long tickIntervalMs,
    String threadName,
    boolean daemon,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: tickIntervalMs=16ms, threadName=cloudcall-scheduler, daemon=true,
     * shutdownTimeoutMs=5000ms</p>
     */
    public TickSchedulerConfig() {
        this(16, "cloudcall-scheduler", true, 5000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TickSchedulerConfig {
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "tickIntervalMs must be positive (current: " + tickIntervalMs + ")"
            );
        }
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("threadName cannot be null or blank");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * tickIntervalMs만 변경한 새 인스턴스 생성.
     */
    public TickSchedulerConfig withTickIntervalMs(long tickIntervalMs) {
        return new TickSchedulerConfig(tickIntervalMs, threadName, daemon, shutdownTimeoutMs);
    }

    /**
     * threadName만 변경한 새 인스턴스 생성.
     */
    public TickSchedulerConfig withThreadName(String threadName) {
        return new TickSchedulerConfig(tickIntervalMs, threadName, daemon, shutdownTimeoutMs);
    }

    /**
     * daemon만 변경한 새 인스턴스 생성.
     */
    public TickSchedulerConfig withDaemon(boolean daemon) {
        return new TickSchedulerConfig(tickIntervalMs, threadName, daemon, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public TickSchedulerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new TickSchedulerConfig(tickIntervalMs, threadName, daemon, shutdownTimeoutMs);
    }
}
