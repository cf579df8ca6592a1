package com.ryuqq.world.testkit.contract;

import com.ryuqq.world.core.model.MapDefinition;
import com.ryuqq.world.core.spi.GameCharacter;
import com.ryuqq.world.core.spi.Partition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Partition fake for contract and integration tests.
 *
 * <p>Records every lifecycle call so tests can verify how the registry dispatches to its
 * partitions. All state is thread-safe because the heartbeat thread and test threads touch it
 * concurrently.</p>
 *
 * <p><strong>Recorded state:</strong></p>
 * <ul>
 *   <li>tickCount: number of {@link #advanceTick()} calls</li>
 *   <li>tickTimesNanos: {@link System#nanoTime()} of every advance</li>
 *   <li>scriptedRemovalCount: number of {@link #removeScriptedEntities()} calls</li>
 * </ul>
 *
 * @author World Team
 * @since 1.0.0
 */
public class FakePartition implements Partition {

    private final int id;
    private final String name;
    private final List<GameCharacter> characters = new CopyOnWriteArrayList<>();
    private final List<GameCharacter> scriptedEntities = new CopyOnWriteArrayList<>();
    private final AtomicInteger tickCount = new AtomicInteger();
    private final AtomicInteger scriptedRemovalCount = new AtomicInteger();
    private final ConcurrentLinkedQueue<Long> tickTimesNanos = new ConcurrentLinkedQueue<>();

    private volatile Throwable tickFailure;

    /**
     * 생성자.
     *
     * @param id map id
     * @param name map name
     */
    public FakePartition(int id, String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.id = id;
        this.name = name;
    }

    /**
     * Definition 기반 생성.
     *
     * @param definition map definition
     * @return new partition reporting the definition's identity
     */
    public static FakePartition of(MapDefinition definition) {
        return new FakePartition(definition.id(), definition.name());
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void advanceTick() {
        tickTimesNanos.add(System.nanoTime());
        tickCount.incrementAndGet();
        Throwable failure = tickFailure;
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        if (failure != null) {
            throw new IllegalStateException(failure);
        }
    }

    @Override
    public void removeScriptedEntities() {
        scriptedRemovalCount.incrementAndGet();
        characters.removeAll(scriptedEntities);
        scriptedEntities.clear();
    }

    @Override
    public Optional<GameCharacter> getCharacterByTeamName(String teamName) {
        for (GameCharacter character : characters) {
            if (Objects.equals(character.getTeamName(), teamName)) {
                return Optional.of(character);
            }
        }
        return Optional.empty();
    }

    @Override
    public List<GameCharacter> getCharacters() {
        return new ArrayList<>(characters);
    }

    @Override
    public List<GameCharacter> getCharacters(Predicate<GameCharacter> predicate) {
        List<GameCharacter> result = new ArrayList<>();
        for (GameCharacter character : characters) {
            if (predicate.test(character)) {
                result.add(character);
            }
        }
        return result;
    }

    /**
     * Adds characters to this partition.
     *
     * @param added characters in partition order
     * @return this partition
     */
    public FakePartition withCharacters(GameCharacter... added) {
        characters.addAll(List.of(added));
        return this;
    }

    /**
     * Adds a script-created entity, removed again by {@link #removeScriptedEntities()}.
     *
     * @param entity scripted entity
     * @return this partition
     */
    public FakePartition withScriptedEntity(GameCharacter entity) {
        scriptedEntities.add(entity);
        characters.add(entity);
        return this;
    }

    /**
     * Makes every following {@link #advanceTick()} throw the given exception (null to stop).
     *
     * @param failure exception to throw
     */
    public void failTicksWith(Throwable failure) {
        this.tickFailure = failure;
    }

    public int getTickCount() {
        return tickCount.get();
    }

    public int getScriptedRemovalCount() {
        return scriptedRemovalCount.get();
    }

    public List<Long> getTickTimesNanos() {
        return new ArrayList<>(tickTimesNanos);
    }

    @Override
    public String toString() {
        return "FakePartition{" + id + ", " + name + '}';
    }
}
