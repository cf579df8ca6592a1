package com.ryuqq.world.testkit.contract;

import com.ryuqq.world.core.model.MapDefinition;
import com.ryuqq.world.core.spi.PartitionFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Partition factory that builds {@link FakePartition}s and keeps them for later inspection.
 *
 * <p>A partition can be prepared up front with {@link #prepare(FakePartition)}; it is then
 * returned for the definition with the same id instead of a fresh one.</p>
 *
 * @author World Team
 * @since 1.0.0
 */
public class FakePartitionFactory implements PartitionFactory {

    private final Map<Integer, FakePartition> prepared = new ConcurrentHashMap<>();
    private final List<FakePartition> created = new CopyOnWriteArrayList<>();

    @Override
    public FakePartition create(MapDefinition definition) {
        FakePartition partition = prepared.remove(definition.id());
        if (partition == null) {
            partition = FakePartition.of(definition);
        }
        created.add(partition);
        return partition;
    }

    /**
     * Registers a partition to return for the definition with the same id.
     *
     * @param partition prepared partition
     * @return the same partition
     */
    public FakePartition prepare(FakePartition partition) {
        prepared.put(partition.getId(), partition);
        return partition;
    }

    /**
     * @return partitions created so far, in creation order
     */
    public List<FakePartition> getCreated() {
        return new ArrayList<>(created);
    }
}
