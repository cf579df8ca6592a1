package com.ryuqq.world.core.spi;

import com.ryuqq.world.core.model.MapDefinition;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Partition registry SPI.
 *
 * <p>Holds the world's partitions indexed both by numeric id and by name. The two indexes always
 * have identical membership.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>One-time population from map definitions, with explicit integrity checks</li>
 *   <li>Point lookups by id and by name</li>
 *   <li>Registry-wide sweeps: heartbeat advance, scripted entity removal, character queries</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods are callable from multiple threads</li>
 *   <li>Single guard: every read, write and sweep is serialized through one guard, and a sweep
 *       holds it for its whole duration so it observes one consistent membership</li>
 *   <li>Iteration order: registration order (the order of the definitions)</li>
 *   <li>No live views: collections returned are fresh copies</li>
 *   <li>A lookup miss is {@link Optional#empty()}, never an exception</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * registry.initialize(List.of(new MapDefinition(1, "Alpha")), factory);
 *
 * registry.get(1).map(Partition::getName);          // Optional[Alpha]
 * registry.get("Gamma");                            // Optional.empty
 * registry.allCharacters(c -&gt; "red".equals(c.getTeamName()));
 * </pre>
 *
 * @author World Team
 * @since 1.0.0
 */
public interface PartitionRegistry {

    /**
     * Builds one partition per definition and registers all of them atomically.
     *
     * <p>The whole batch is validated before any partition is inserted. On failure the registry
     * is left unchanged.</p>
     *
     * @param definitions map definitions
     * @param factory partition factory
     * @throws IllegalArgumentException if definitions, an element of it, or factory is null
     * @throws PartitionIntegrityException if two definitions share an id or name, or a built
     *         partition does not match its definition
     * @throws IllegalStateException if the registry was already initialized
     */
    void initialize(Collection<MapDefinition> definitions, PartitionFactory factory);

    /**
     * Looks up a partition by id.
     *
     * @param id map id
     * @return partition, or empty on miss
     */
    Optional<Partition> get(int id);

    /**
     * Looks up a partition by name.
     *
     * @param name map name
     * @return partition, or empty on miss (including a null name)
     */
    Optional<Partition> get(String name);

    /**
     * Returns the number of registered partitions.
     *
     * @return partition count
     */
    int count();

    /**
     * Visits every partition in registration order under a single guard acquisition.
     *
     * <p>The visitor must not call back into the registry from another thread and wait on it.</p>
     *
     * @param visitor partition visitor
     * @throws IllegalArgumentException if visitor is null
     */
    void forEach(Consumer<Partition> visitor);

    /**
     * Advances every partition by one heartbeat.
     *
     * <p>A failure raised by one partition is logged and does not stop the sweep.</p>
     *
     * @return number of partitions whose advance failed
     */
    int advanceAll();

    /**
     * Removes scripted entities from every partition.
     */
    void removeScriptedEntities();

    /**
     * Returns the first character with the given team name, scanning partitions in registration
     * order.
     *
     * @param teamName team name
     * @return first match, or empty
     */
    Optional<GameCharacter> findCharacterByTeamName(String teamName);

    /**
     * Returns the characters of all partitions.
     *
     * @return concatenation of per-partition characters
     */
    List<GameCharacter> allCharacters();

    /**
     * Returns the characters of all partitions matching the predicate.
     *
     * @param predicate character filter
     * @return concatenation of per-partition matches
     * @throws IllegalArgumentException if predicate is null
     */
    List<GameCharacter> allCharacters(Predicate<GameCharacter> predicate);

    /**
     * Returns a copy of the registered partitions in registration order.
     *
     * @return partition snapshot
     */
    List<Partition> snapshot();
}
