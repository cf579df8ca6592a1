package com.ryuqq.world.core.spi;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Map partition SPI.
 *
 * <p>A spatial subdivision of the world holding its own actors and scripted entities. The
 * content and simulation logic of a partition belong to the implementation; the world core only
 * registers partitions and dispatches lifecycle calls to them.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@link #getId()} and {@link #getName()} are immutable</li>
 *   <li>Character queries return fresh collections, not live views</li>
 *   <li>Methods may be called from the heartbeat thread and from caller threads, always while
 *       the registry guard is held</li>
 * </ul>
 *
 * @author World Team
 * @since 1.0.0
 */
public interface Partition {

    /**
     * Returns the numeric map id.
     *
     * @return map id
     */
    int getId();

    /**
     * Returns the unique map name.
     *
     * @return map name
     */
    String getName();

    /**
     * Advances the partition's own simulation by one heartbeat.
     */
    void advanceTick();

    /**
     * Removes every entity created by scripts (e.g. NPCs).
     */
    void removeScriptedEntities();

    /**
     * Returns the first character in this partition with the given team name.
     *
     * @param teamName team name to look for
     * @return matching character, or empty
     */
    Optional<GameCharacter> getCharacterByTeamName(String teamName);

    /**
     * Returns all characters currently in this partition.
     *
     * @return characters in partition order
     */
    List<GameCharacter> getCharacters();

    /**
     * Returns the characters in this partition matching the predicate.
     *
     * @param predicate character filter
     * @return matching characters in partition order
     */
    List<GameCharacter> getCharacters(Predicate<GameCharacter> predicate);
}
