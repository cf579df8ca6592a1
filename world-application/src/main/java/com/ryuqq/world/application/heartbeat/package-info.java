/**
 * World Application Layer - Heartbeat port.
 *
 * <ul>
 *   <li>{@link com.ryuqq.world.application.heartbeat.Heartbeat} - fixed-cadence tick scheduler</li>
 * </ul>
 *
 * <p>구현체는 world-adapter-runner 모듈에 위치합니다.</p>
 *
 * @author World Team
 * @since 1.0.0
 */
package com.ryuqq.world.application.heartbeat;
