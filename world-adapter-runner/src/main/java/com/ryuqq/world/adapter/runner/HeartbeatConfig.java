package com.ryuqq.world.adapter.runner;

import com.ryuqq.world.core.model.WorldTime;

/**
 * ScheduledHeartbeat 설정 (불변 record).
 *
 * <p>이 record는 heartbeat 타이머의 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>periodMs: tick 주기 (기본 500ms)</li>
 *   <li>phaseAligned: 첫 tick을 벽시계 주기 경계에 맞출지 여부 (기본 true)</li>
 *   <li>shutdownTimeoutMs: 종료 시 진행 중 tick 대기 시간 (기본 2000ms)</li>
 *   <li>threadName: 타이머 스레드 이름 (기본 "world-heartbeat")</li>
 * </ul>
 *
 * <p>phaseAligned가 false이면 첫 tick은 start 후 한 주기 뒤에 발생합니다.</p>
 *
 * @author World Team
 * @since 1.0.0
 * @param periodMs tick 주기 (밀리초, 양수여야 함)
 * @param phaseAligned 주기 경계 정렬 여부
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 * @param threadName 타이머 스레드 이름 (공백 불가)
 */
public record HeartbeatConfig(
    long periodMs,
    boolean phaseAligned,
    long shutdownTimeoutMs,
    String threadName
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: periodMs=500ms, phaseAligned=true, shutdownTimeoutMs=2000ms,
     * threadName="world-heartbeat"</p>
     */
    public HeartbeatConfig() {
        this(WorldTime.HEARTBEAT_MS, true, 2000, "world-heartbeat");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public HeartbeatConfig {
        if (periodMs <= 0) {
            throw new IllegalArgumentException(
                "periodMs must be positive (current: " + periodMs + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("threadName cannot be null or blank");
        }
    }

    /**
     * periodMs만 변경한 새 인스턴스 생성.
     */
    public HeartbeatConfig withPeriodMs(long periodMs) {
        return new HeartbeatConfig(periodMs, phaseAligned, shutdownTimeoutMs, threadName);
    }

    /**
     * phaseAligned만 변경한 새 인스턴스 생성.
     */
    public HeartbeatConfig withPhaseAligned(boolean phaseAligned) {
        return new HeartbeatConfig(periodMs, phaseAligned, shutdownTimeoutMs, threadName);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public HeartbeatConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new HeartbeatConfig(periodMs, phaseAligned, shutdownTimeoutMs, threadName);
    }

    /**
     * threadName만 변경한 새 인스턴스 생성.
     */
    public HeartbeatConfig withThreadName(String threadName) {
        return new HeartbeatConfig(periodMs, phaseAligned, shutdownTimeoutMs, threadName);
    }
}
