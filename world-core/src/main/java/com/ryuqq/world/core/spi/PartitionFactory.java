package com.ryuqq.world.core.spi;

import com.ryuqq.world.core.model.MapDefinition;

/**
 * Builds a partition from its map definition.
 *
 * <p>The returned partition must report the definition's id and name.</p>
 *
 * @author World Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PartitionFactory {

    /**
     * Creates a partition for the given definition.
     *
     * @param definition map definition
     * @return new partition, never null
     */
    Partition create(MapDefinition definition);
}
