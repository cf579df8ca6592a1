/**
 * Heartbeat 상태 머신 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.world.core.statemachine.HeartbeatState} - UNINITIALIZED → SCHEDULED → TICKING → STOPPED</li>
 *   <li>{@link com.ryuqq.world.core.statemachine.HeartbeatTransition} - 전이 규칙 검증</li>
 * </ul>
 *
 * @author World Team
 * @since 1.0.0
 */
package com.ryuqq.world.core.statemachine;
