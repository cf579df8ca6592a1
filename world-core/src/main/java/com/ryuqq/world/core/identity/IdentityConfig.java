package com.ryuqq.world.core.identity;

/**
 * Identity counter start values (불변 record).
 *
 * <p>Each counter returns {@code start + 1} on its first allocation.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>handleStart: actor handle 시작값 (기본 0)</li>
 *   <li>sessionObjectIdStart: session object id 시작값 (기본 0x0000E1A900000000)</li>
 *   <li>skillObjectIdStart: skill object id 시작값 (기본 0x000054B600000000)</li>
 * </ul>
 *
 * <p>Session and skill objects observed on live clients were above the default bases, so the
 * two object id kinds are kept in separate ranges.</p>
 *
 * @author World Team
 * @since 1.0.0
 * @param handleStart handle counter start (0 이상)
 * @param sessionObjectIdStart session object id counter start (0 이상)
 * @param skillObjectIdStart skill object id counter start (0 이상)
 */
public record IdentityConfig(
    long handleStart,
    long sessionObjectIdStart,
    long skillObjectIdStart
) {

    public static final long DEFAULT_HANDLE_START = 0L;
    public static final long DEFAULT_SESSION_OBJECT_ID_START = 0x0000E1A900000000L;
    public static final long DEFAULT_SKILL_OBJECT_ID_START = 0x000054B600000000L;

    /**
     * 기본 설정 생성자.
     */
    public IdentityConfig() {
        this(DEFAULT_HANDLE_START, DEFAULT_SESSION_OBJECT_ID_START, DEFAULT_SKILL_OBJECT_ID_START);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public IdentityConfig {
        if (handleStart < 0) {
            throw new IllegalArgumentException(
                "handleStart must not be negative (current: " + handleStart + ")"
            );
        }
        if (sessionObjectIdStart < 0) {
            throw new IllegalArgumentException(
                "sessionObjectIdStart must not be negative (current: " + sessionObjectIdStart + ")"
            );
        }
        if (skillObjectIdStart < 0) {
            throw new IllegalArgumentException(
                "skillObjectIdStart must not be negative (current: " + skillObjectIdStart + ")"
            );
        }
    }

    /**
     * Kind에 해당하는 시작값 조회.
     *
     * @param kind identity kind
     * @return start value of the kind's counter
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public long startOf(IdentityKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return switch (kind) {
            case HANDLE -> handleStart;
            case SESSION_OBJECT -> sessionObjectIdStart;
            case SKILL_OBJECT -> skillObjectIdStart;
        };
    }

    /**
     * handleStart만 변경한 새 인스턴스 생성.
     */
    public IdentityConfig withHandleStart(long handleStart) {
        return new IdentityConfig(handleStart, sessionObjectIdStart, skillObjectIdStart);
    }

    /**
     * sessionObjectIdStart만 변경한 새 인스턴스 생성.
     */
    public IdentityConfig withSessionObjectIdStart(long sessionObjectIdStart) {
        return new IdentityConfig(handleStart, sessionObjectIdStart, skillObjectIdStart);
    }

    /**
     * skillObjectIdStart만 변경한 새 인스턴스 생성.
     */
    public IdentityConfig withSkillObjectIdStart(long skillObjectIdStart) {
        return new IdentityConfig(handleStart, sessionObjectIdStart, skillObjectIdStart);
    }
}
