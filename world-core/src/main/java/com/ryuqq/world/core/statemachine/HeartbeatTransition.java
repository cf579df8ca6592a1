package com.ryuqq.world.core.statemachine;

/**
 * Heartbeat 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>UNINITIALIZED → SCHEDULED</li>
 *   <li>SCHEDULED → TICKING</li>
 *   <li>UNINITIALIZED, SCHEDULED, TICKING → STOPPED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(STOPPED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>동일 상태로의 전이 불가 (예: 중복 start)</li>
 * </ul>
 *
 * @author World Team
 * @since 1.0.0
 */
public final class HeartbeatTransition {

    // Utility class - prevent instantiation
    private HeartbeatTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(HeartbeatState from, HeartbeatState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid heartbeat transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 전이가 허용되는지 확인 (예외 없음).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이인 경우 true
     */
    public static boolean isAllowed(HeartbeatState from, HeartbeatState to) {
        if (from == null || to == null) {
            return false;
        }
        return switch (from) {
            case UNINITIALIZED -> to == HeartbeatState.SCHEDULED || to == HeartbeatState.STOPPED;
            case SCHEDULED -> to == HeartbeatState.TICKING || to == HeartbeatState.STOPPED;
            case TICKING -> to == HeartbeatState.STOPPED;
            case STOPPED -> false;
        };
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static HeartbeatState transition(HeartbeatState current, HeartbeatState next) {
        validate(current, next);
        return next;
    }
}
