package com.ryuqq.world.core.spi;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Configuration integrity error raised while populating a partition registry.
 *
 * <p>Thrown when two map definitions share an id or a name, or when a partition built from a
 * definition does not report the definition's identity. World startup cannot proceed.</p>
 *
 * @author World Team
 * @since 1.0.0
 */
public class PartitionIntegrityException extends IllegalStateException {

    private final Integer collidingId;
    private final String collidingName;

    private PartitionIntegrityException(String message, Integer collidingId, String collidingName) {
        super(message);
        this.collidingId = collidingId;
        this.collidingName = collidingName;
    }

    /**
     * Duplicate map id.
     *
     * @param id colliding map id
     * @return exception naming the id
     */
    public static PartitionIntegrityException duplicateId(int id) {
        return new PartitionIntegrityException("Duplicate map id: " + id, id, null);
    }

    /**
     * Duplicate map name.
     *
     * @param name colliding map name
     * @return exception naming the name
     */
    public static PartitionIntegrityException duplicateName(String name) {
        return new PartitionIntegrityException("Duplicate map name: " + name, null, name);
    }

    /**
     * Partition built by the factory does not match its definition.
     *
     * @param expectedId definition id
     * @param expectedName definition name
     * @param actualId partition id
     * @param actualName partition name
     * @return exception naming the definition
     */
    public static PartitionIntegrityException identityMismatch(int expectedId, String expectedName,
                                                               int actualId, String actualName) {
        return new PartitionIntegrityException(
            String.format("Partition identity mismatch: expected (%d, %s) but factory built (%d, %s)",
                expectedId, expectedName, actualId, actualName),
            expectedId, expectedName
        );
    }

    /**
     * @return colliding map id, if the error concerns an id
     */
    public OptionalInt getCollidingId() {
        return collidingId == null ? OptionalInt.empty() : OptionalInt.of(collidingId);
    }

    /**
     * @return colliding map name, if the error concerns a name
     */
    public Optional<String> getCollidingName() {
        return Optional.ofNullable(collidingName);
    }
}
