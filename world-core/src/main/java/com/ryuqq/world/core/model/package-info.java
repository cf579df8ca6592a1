/**
 * Core domain model package.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.world.core.model.MapDefinition} - external map definition (id, name, class reference)</li>
 * </ul>
 *
 * <h2>Constants</h2>
 * <ul>
 *   <li>{@link com.ryuqq.world.core.model.WorldTime} - second/minute/hour and heartbeat period</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author World Team
 */
package com.ryuqq.world.core.model;
