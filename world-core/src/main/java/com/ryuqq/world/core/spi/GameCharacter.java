package com.ryuqq.world.core.spi;

/**
 * Character SPI.
 *
 * <p>Opaque to the world core beyond being the element type of partition character queries.
 * Partitions use the team name for their own lookups.</p>
 *
 * @author World Team
 * @since 1.0.0
 */
public interface GameCharacter {

    /**
     * Returns the in-memory handle assigned to this character.
     *
     * @return actor handle
     */
    long getHandle();

    /**
     * Returns the team name of this character.
     *
     * @return team name (may be null if the character has none)
     */
    String getTeamName();
}
