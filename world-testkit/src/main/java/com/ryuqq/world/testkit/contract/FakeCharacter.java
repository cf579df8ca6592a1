package com.ryuqq.world.testkit.contract;

import com.ryuqq.world.core.spi.GameCharacter;

/**
 * Immutable character used by contract tests.
 *
 * @author World Team
 * @since 1.0.0
 */
public final class FakeCharacter implements GameCharacter {

    private final long handle;
    private final String name;
    private final String teamName;

    /**
     * 생성자.
     *
     * @param handle actor handle
     * @param name character name (diagnostics only)
     * @param teamName team name, may be null
     */
    public FakeCharacter(long handle, String name, String teamName) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.handle = handle;
        this.name = name;
        this.teamName = teamName;
    }

    @Override
    public long getHandle() {
        return handle;
    }

    @Override
    public String getTeamName() {
        return teamName;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "FakeCharacter{" + name + ", handle=" + handle + ", team=" + teamName + '}';
    }
}
