package com.ryuqq.world.adapter.inmemory.registry;

import com.ryuqq.world.core.model.MapDefinition;
import com.ryuqq.world.core.spi.GameCharacter;
import com.ryuqq.world.core.spi.Partition;
import com.ryuqq.world.core.spi.PartitionFactory;
import com.ryuqq.world.core.spi.PartitionIntegrityException;
import com.ryuqq.world.core.spi.PartitionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link PartitionRegistry} SPI.
 *
 * <p>Both indexes live behind one {@link ReentrantLock}. Every read, write and sweep takes that
 * lock, so any two registry operations (the heartbeat sweep included) are totally ordered and a
 * reader can never see a partition in one index but not the other.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>mapsById:</strong> LinkedHashMap&lt;Integer, Partition&gt; - id index, keeps registration order for sweeps</li>
 *   <li><strong>mapsByName:</strong> HashMap&lt;String, Partition&gt; - name index</li>
 * </ul>
 *
 * <p><strong>Locking:</strong></p>
 * <ul>
 *   <li>The guard is reentrant: partitions may call back into lookups during a sweep</li>
 *   <li>Sweeps hold the guard for their whole duration, not per partition</li>
 *   <li>{@link #insertAll(List)} is the only writer path and updates both indexes together</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * PartitionRegistry registry = new InMemoryPartitionRegistry();
 * registry.initialize(definitions, definition -&gt; new ZoneMap(definition));
 *
 * Optional&lt;Partition&gt; map = registry.get("Klaipeda");
 * </pre>
 *
 * @author World Team
 * @since 1.0.0
 */
public class InMemoryPartitionRegistry implements PartitionRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPartitionRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Id index. Iteration order is registration order.
     */
    private final Map<Integer, Partition> mapsById = new LinkedHashMap<>();

    /**
     * Name index. Always has the same membership as {@link #mapsById}.
     */
    private final Map<String, Partition> mapsByName = new HashMap<>();

    private boolean initialized;

    /**
     * {@inheritDoc}
     *
     * <p><strong>처리 흐름:</strong></p>
     * <pre>
     * 1. 인자 검증 (null 정의, null factory)
     * 2. 정의 목록 내 id/name 중복 검사 → PartitionIntegrityException
     * 3. factory로 Partition 생성 및 identity 검증
     * 4. lock 안에서 두 인덱스에 한꺼번에 삽입
     * </pre>
     */
    @Override
    public void initialize(Collection<MapDefinition> definitions, PartitionFactory factory) {
        if (definitions == null) {
            throw new IllegalArgumentException("definitions cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        List<MapDefinition> batch = new ArrayList<>(definitions);
        for (MapDefinition definition : batch) {
            if (definition == null) {
                throw new IllegalArgumentException("definitions cannot contain null");
            }
        }

        lock.lock();
        try {
            if (initialized) {
                throw new IllegalStateException(
                    "Registry already initialized with " + mapsById.size() + " partitions"
                );
            }

            checkDuplicates(batch);
            List<Partition> partitions = buildAll(batch, factory);
            insertAll(partitions);
            initialized = true;
        } finally {
            lock.unlock();
        }

        log.info("Partition registry initialized with {} partitions", batch.size());
    }

    @Override
    public Optional<Partition> get(int id) {
        lock.lock();
        try {
            return Optional.ofNullable(mapsById.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Partition> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(mapsByName.get(name));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int count() {
        lock.lock();
        try {
            return mapsById.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void forEach(Consumer<Partition> visitor) {
        if (visitor == null) {
            throw new IllegalArgumentException("visitor cannot be null");
        }
        lock.lock();
        try {
            for (Partition partition : mapsById.values()) {
                visitor.accept(partition);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>예외 발생 시에도 계속 진행하여 다른 Partition의 tick을 방해하지 않습니다.
     * {@link Error}를 포함한 모든 Throwable이 Partition 단위로 처리됩니다.</p>
     */
    @Override
    public int advanceAll() {
        int failed = 0;
        lock.lock();
        try {
            for (Partition partition : mapsById.values()) {
                if (!tryAdvance(partition)) {
                    failed++;
                }
            }
        } finally {
            lock.unlock();
        }
        return failed;
    }

    @Override
    public void removeScriptedEntities() {
        forEach(Partition::removeScriptedEntities);
    }

    @Override
    public Optional<GameCharacter> findCharacterByTeamName(String teamName) {
        lock.lock();
        try {
            for (Partition partition : mapsById.values()) {
                Optional<GameCharacter> character = partition.getCharacterByTeamName(teamName);
                if (character.isPresent()) {
                    return character;
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<GameCharacter> allCharacters() {
        List<GameCharacter> result = new ArrayList<>();
        forEach(partition -> result.addAll(partition.getCharacters()));
        return List.copyOf(result);
    }

    @Override
    public List<GameCharacter> allCharacters(Predicate<GameCharacter> predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        List<GameCharacter> result = new ArrayList<>();
        forEach(partition -> result.addAll(partition.getCharacters(predicate)));
        return List.copyOf(result);
    }

    @Override
    public List<Partition> snapshot() {
        lock.lock();
        try {
            return List.copyOf(mapsById.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 정의 목록 내 및 기존 등록분과의 id/name 중복 검사.
     *
     * @param batch map definitions
     * @throws PartitionIntegrityException 중복 발견 시
     */
    private void checkDuplicates(List<MapDefinition> batch) {
        Set<Integer> ids = new HashSet<>(mapsById.keySet());
        Set<String> names = new HashSet<>(mapsByName.keySet());
        for (MapDefinition definition : batch) {
            if (!ids.add(definition.id())) {
                log.error("Duplicate map id {} in map definitions", definition.id());
                throw PartitionIntegrityException.duplicateId(definition.id());
            }
            if (!names.add(definition.name())) {
                log.error("Duplicate map name '{}' in map definitions", definition.name());
                throw PartitionIntegrityException.duplicateName(definition.name());
            }
        }
    }

    /**
     * Factory로 Partition 생성 후 정의와 identity 일치 여부 검증.
     *
     * @param batch map definitions
     * @param factory partition factory
     * @return partitions in definition order
     * @throws PartitionIntegrityException factory 결과가 정의와 다른 경우
     */
    private List<Partition> buildAll(List<MapDefinition> batch, PartitionFactory factory) {
        List<Partition> partitions = new ArrayList<>(batch.size());
        for (MapDefinition definition : batch) {
            Partition partition = factory.create(definition);
            if (partition == null) {
                throw new IllegalStateException("factory returned null for map " + definition.id());
            }
            if (partition.getId() != definition.id() || !definition.name().equals(partition.getName())) {
                throw PartitionIntegrityException.identityMismatch(
                    definition.id(), definition.name(), partition.getId(), partition.getName()
                );
            }
            partitions.add(partition);
        }
        return partitions;
    }

    /**
     * 두 인덱스에 동시에 삽입. 호출자는 lock을 보유해야 합니다.
     *
     * @param partitions validated partitions
     */
    private void insertAll(List<Partition> partitions) {
        for (Partition partition : partitions) {
            mapsById.put(partition.getId(), partition);
            mapsByName.put(partition.getName(), partition);
        }
    }

    /**
     * 개별 Partition tick 시도.
     *
     * @param partition partition to advance
     * @return 성공 여부
     */
    private boolean tryAdvance(Partition partition) {
        try {
            partition.advanceTick();
            return true;
        } catch (Throwable t) {
            log.error("Failed to advance partition {} ({})", partition.getId(), partition.getName(), t);
            return false;
        }
    }
}
