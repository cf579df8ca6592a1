package com.ryuqq.world.adapter.runner;

import java.time.Clock;

/**
 * 주기 경계 정렬 지연 계산기.
 *
 * <p>첫 heartbeat tick이 벽시계 기준 주기의 배수 시각에 발생하도록
 * 초기 지연 시간을 계산합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = period - (now % period)
 * </pre>
 *
 * <p><strong>예시 (period=500ms):</strong></p>
 * <ul>
 *   <li>now=...123ms: 377ms 후 첫 tick (...500ms)</li>
 *   <li>now=...499ms: 1ms 후 첫 tick</li>
 *   <li>now=...500ms: 500ms 후 첫 tick (이미 경계이면 한 주기 전체)</li>
 * </ul>
 *
 * @author World Team
 * @since 1.0.0
 */
public class PhaseAlignedDelayCalculator {

    private final long periodMs;
    private final Clock clock;

    /**
     * 시스템 UTC 시계로 생성.
     *
     * @param periodMs tick 주기 (밀리초, 양수여야 함)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PhaseAlignedDelayCalculator(long periodMs) {
        this(periodMs, Clock.systemUTC());
    }

    /**
     * 커스텀 시계로 생성.
     *
     * @param periodMs tick 주기 (밀리초, 양수여야 함)
     * @param clock 현재 시각 제공자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PhaseAlignedDelayCalculator(long periodMs, Clock clock) {
        if (periodMs <= 0) {
            throw new IllegalArgumentException(
                "periodMs must be positive (current: " + periodMs + ")"
            );
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.periodMs = periodMs;
        this.clock = clock;
    }

    /**
     * 현재 시각 기준 초기 지연 시간 계산.
     *
     * @return 다음 주기 경계까지 남은 시간 (밀리초, 1 이상 periodMs 이하)
     */
    public long calculate() {
        return calculate(clock.millis());
    }

    /**
     * 주어진 epoch 시각 기준 초기 지연 시간 계산.
     *
     * @param epochMillis 기준 시각 (epoch 밀리초)
     * @return 다음 주기 경계까지 남은 시간 (밀리초, 1 이상 periodMs 이하)
     */
    public long calculate(long epochMillis) {
        // floorMod: epoch 이전 시각에서도 0 이상
        return periodMs - Math.floorMod(epochMillis, periodMs);
    }

    /**
     * tick 주기 조회.
     *
     * @return tick 주기 (밀리초)
     */
    public long getPeriodMs() {
        return periodMs;
    }
}
