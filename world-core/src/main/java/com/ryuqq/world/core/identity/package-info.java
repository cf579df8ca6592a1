/**
 * Identity allocation package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.world.core.identity.IdentityAllocator} - lock-free monotonic counters</li>
 *   <li>{@link com.ryuqq.world.core.identity.IdentityKind} - handle / session object / skill object</li>
 *   <li>{@link com.ryuqq.world.core.identity.IdentityConfig} - counter start values</li>
 * </ul>
 *
 * @since 1.0.0
 * @author World Team
 */
package com.ryuqq.world.core.identity;
