package com.ryuqq.world.core.identity;

/**
 * Identity counter kinds.
 *
 * <p>Each kind is backed by its own counter in {@link IdentityAllocator}; values of different
 * kinds have no ordering relation to each other.</p>
 *
 * @author World Team
 * @since 1.0.0
 */
public enum IdentityKind {

    /**
     * In-memory handle of an actor (character or monster). Process-lifetime scoped.
     */
    HANDLE,

    /**
     * Globally unique id of a session-scoped object.
     */
    SESSION_OBJECT,

    /**
     * Globally unique id of a skill-scoped object.
     */
    SKILL_OBJECT
}
