package com.ryuqq.world.core.statemachine;

/**
 * Heartbeat의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>UNINITIALIZED → SCHEDULED (start)</li>
 *   <li>SCHEDULED → TICKING (첫 번째 tick)</li>
 *   <li>UNINITIALIZED / SCHEDULED / TICKING → STOPPED (stop)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * UNINITIALIZED
 *    │
 *    ▼ (start)
 * SCHEDULED ───────┐
 *    │             │
 *    ▼ (첫 tick)    │ (stop)
 * TICKING ─────────┤
 *                  ▼
 *               STOPPED
 *
 * 금지된 전이:
 * - SCHEDULED → SCHEDULED ❌ (중복 start)
 * - TICKING → SCHEDULED ❌
 * - STOPPED → 모든 상태 ❌
 * </pre>
 *
 * @author World Team
 * @since 1.0.0
 */
public enum HeartbeatState {

    /**
     * 생성됨 (아직 스케줄되지 않음).
     */
    UNINITIALIZED,

    /**
     * 스케줄됨 (첫 tick 대기 중).
     */
    SCHEDULED,

    /**
     * 주기적으로 tick 실행 중.
     */
    TICKING,

    /**
     * 정지됨 (프로세스 종료 시).
     */
    STOPPED;

    /**
     * 종료 상태인지 확인.
     *
     * @return STOPPED인 경우 true
     */
    public boolean isTerminal() {
        return this == STOPPED;
    }

    /**
     * 타이머가 스케줄되어 있는지 확인.
     *
     * @return SCHEDULED 또는 TICKING인 경우 true
     */
    public boolean isRunning() {
        return this == SCHEDULED || this == TICKING;
    }
}
