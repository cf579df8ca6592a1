/**
 * Runner Adapter Layer - Heartbeat 구현체.
 *
 * <p>이 패키지는 Heartbeat 인터페이스의 구체적인 구현체를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.world.adapter.runner.ScheduledHeartbeat} - 주기 경계 정렬 고정 주기 타이머</li>
 *   <li>{@link com.ryuqq.world.adapter.runner.PhaseAlignedDelayCalculator} - 첫 tick 지연 계산</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ScheduledHeartbeat)
 *   ↓ implements
 * application (Heartbeat interface)
 *   ↓ depends on
 * core (HeartbeatState, HeartbeatTransition, WorldTime)
 * </pre>
 *
 * @author World Team
 * @since 1.0.0
 */
package com.ryuqq.world.adapter.runner;
