/**
 * In-memory partition registry adapter package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.world.adapter.inmemory.registry.InMemoryPartitionRegistry}:
 *       Dual-indexed (id, name) implementation of {@link com.ryuqq.world.core.spi.PartitionRegistry}
 *       behind a single lock</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Single guard:</strong> One {@link java.util.concurrent.locks.ReentrantLock} for both indexes</li>
 *   <li><strong>Single writer path:</strong> Both indexes are updated together, never separately</li>
 *   <li><strong>Ordering:</strong> Sweeps visit partitions in registration order</li>
 *   <li><strong>No live views:</strong> Lookups return Optionals, queries return copies</li>
 * </ul>
 *
 * @see com.ryuqq.world.core.spi.PartitionRegistry
 * @author World Team
 * @since 1.0.0
 */
package com.ryuqq.world.adapter.inmemory.registry;
