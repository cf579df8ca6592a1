package com.ryuqq.world.core.identity;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic identity allocator.
 *
 * <p>Holds one {@link AtomicLong} per {@link IdentityKind}. Allocation is a single
 * {@code incrementAndGet}, so it is lock-free and linearizable per kind: no two calls ever
 * return the same value for the same kind, whatever the number of calling threads.</p>
 *
 * <p><strong>Guarantees:</strong></p>
 * <ul>
 *   <li>Every value is strictly greater than all values previously returned for its kind</li>
 *   <li>Counters are never reset and values are never reused</li>
 *   <li>No ordering relation between different kinds</li>
 * </ul>
 *
 * <p>64-bit overflow is not handled.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * IdentityAllocator allocator = new IdentityAllocator();
 * long handle = allocator.next(IdentityKind.HANDLE);            // 1
 * long sessionId = allocator.next(IdentityKind.SESSION_OBJECT); // 0xE1A900000001
 * </pre>
 *
 * @author World Team
 * @since 1.0.0
 */
public final class IdentityAllocator {

    private final IdentityConfig config;
    private final Map<IdentityKind, AtomicLong> counters;

    /**
     * Creates an allocator with the default start values.
     */
    public IdentityAllocator() {
        this(new IdentityConfig());
    }

    /**
     * Creates an allocator with the given start values.
     *
     * @param config counter start values
     * @throws IllegalArgumentException config가 null인 경우
     */
    public IdentityAllocator(IdentityConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.counters = new EnumMap<>(IdentityKind.class);
        for (IdentityKind kind : IdentityKind.values()) {
            counters.put(kind, new AtomicLong(config.startOf(kind)));
        }
    }

    /**
     * Allocates the next value of the given kind.
     *
     * @param kind counter kind
     * @return newly allocated value
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public long next(IdentityKind kind) {
        return counterOf(kind).incrementAndGet();
    }

    /**
     * Returns the last value allocated for the given kind, or its start value when nothing has
     * been allocated yet.
     *
     * @param kind counter kind
     * @return last allocated value
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public long current(IdentityKind kind) {
        return counterOf(kind).get();
    }

    /**
     * 설정 조회.
     *
     * @return counter start values
     */
    public IdentityConfig getConfig() {
        return config;
    }

    private AtomicLong counterOf(IdentityKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        // EnumMap is fully populated in the constructor and never mutated afterwards
        return counters.get(kind);
    }
}
