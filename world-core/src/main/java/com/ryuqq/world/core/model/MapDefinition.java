package com.ryuqq.world.core.model;

/**
 * Map partition definition (불변 record).
 *
 * <p>A single entry of the external map data used once while the world is initialized.
 * The registry builds one partition per definition.</p>
 *
 * <p><strong>Validation:</strong></p>
 * <ul>
 *   <li>name: not null or blank, at most 100 characters</li>
 *   <li>classReference: not null or blank (opaque to the registry)</li>
 * </ul>
 *
 * @author World Team
 * @since 1.0.0
 * @param id numeric map id (unique within a world)
 * @param name map name (unique within a world)
 * @param classReference opaque reference handed to the partition factory
 */
public record MapDefinition(
    int id,
    String name,
    String classReference
) {

    private static final int MAX_NAME_LENGTH = 100;

    /**
     * Creates a definition whose class reference is the map name itself.
     *
     * @param id numeric map id
     * @param name map name
     */
    public MapDefinition(int id, String name) {
        this(id, name, name);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MapDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException(
                "name length cannot exceed " + MAX_NAME_LENGTH + " characters (current: " + name.length() + ")"
            );
        }
        if (classReference == null || classReference.isBlank()) {
            throw new IllegalArgumentException("classReference cannot be null or blank");
        }
    }
}
