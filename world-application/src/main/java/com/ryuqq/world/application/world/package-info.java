/**
 * World Application Layer - 월드 조정 API.
 *
 * <p>이 패키지는 레지스트리, identity 발급기, heartbeat를 조합하는
 * {@link com.ryuqq.world.application.world.WorldManager}를 포함합니다.</p>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 레지스트리와 heartbeat 구현체는 adapter 모듈에 위치</li>
 * </ul>
 *
 * @author World Team
 * @since 1.0.0
 */
package com.ryuqq.world.application.world;
