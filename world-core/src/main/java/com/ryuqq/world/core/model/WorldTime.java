package com.ryuqq.world.core.model;

/**
 * World time constants in milliseconds.
 *
 * @author World Team
 * @since 1.0.0
 */
public final class WorldTime {

    public static final long SECOND = 1000;
    public static final long MINUTE = SECOND * 60;
    public static final long HOUR = MINUTE * 60;

    /**
     * Default heartbeat period. Partitions advance once per heartbeat.
     */
    public static final long HEARTBEAT_MS = 500;

    // Utility class - prevent instantiation
    private WorldTime() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
