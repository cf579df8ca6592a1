/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces through which the world core talks to its
 * collaborators.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.world.core.spi.Partition} - map partition (implemented by the simulation layer)</li>
 *   <li>{@link com.ryuqq.world.core.spi.GameCharacter} - character returned by partition queries</li>
 *   <li>{@link com.ryuqq.world.core.spi.PartitionFactory} - builds partitions from map definitions</li>
 *   <li>{@link com.ryuqq.world.core.spi.PartitionRegistry} - dual-indexed partition registry (implemented by adapters)</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on partition content or storage</li>
 * </ul>
 *
 * @since 1.0.0
 * @author World Team
 */
package com.ryuqq.world.core.spi;
