package com.ryuqq.world.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.ryuqq.world.core.statemachine.HeartbeatState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * HeartbeatTransition 테스트.
 *
 * <ul>
 *   <li>정상 전이 (UNINITIALIZED → SCHEDULED → TICKING → STOPPED) 성공</li>
 *   <li>중복 start (SCHEDULED → SCHEDULED) 시 IllegalStateException</li>
 *   <li>STOPPED 에서의 모든 전이 시 IllegalStateException</li>
 * </ul>
 *
 * @author World Team
 * @since 1.0.0
 */
class HeartbeatTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_NormalLifecycle_Succeeds() {
        // Given
        HeartbeatState state = UNINITIALIZED;

        // When
        state = HeartbeatTransition.transition(state, SCHEDULED);
        state = HeartbeatTransition.transition(state, TICKING);
        state = HeartbeatTransition.transition(state, STOPPED);

        // Then
        assertEquals(STOPPED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void validate_ScheduledToStopped_Succeeds() {
        assertDoesNotThrow(() -> HeartbeatTransition.validate(SCHEDULED, STOPPED));
    }

    @Test
    void validate_UninitializedToStopped_Succeeds() {
        assertDoesNotThrow(() -> HeartbeatTransition.validate(UNINITIALIZED, STOPPED));
    }

    // ========== 금지된 전이 테스트 ==========

    @Test
    void validate_ScheduledToScheduled_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> HeartbeatTransition.validate(SCHEDULED, SCHEDULED)
        );
        assertTrue(exception.getMessage().contains("Invalid heartbeat transition"));
    }

    @Test
    void validate_TickingToScheduled_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> HeartbeatTransition.validate(TICKING, SCHEDULED));
    }

    @Test
    void validate_UninitializedToTicking_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> HeartbeatTransition.validate(UNINITIALIZED, TICKING));
    }

    @ParameterizedTest
    @EnumSource(HeartbeatState.class)
    void validate_FromStopped_AlwaysThrows(HeartbeatState target) {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> HeartbeatTransition.validate(STOPPED, target)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> HeartbeatTransition.validate(null, SCHEDULED));
        assertThrows(IllegalArgumentException.class, () -> HeartbeatTransition.validate(SCHEDULED, null));
    }

    @Test
    void isAllowed_MatchesValidate() {
        for (HeartbeatState from : HeartbeatState.values()) {
            for (HeartbeatState to : HeartbeatState.values()) {
                boolean allowed = HeartbeatTransition.isAllowed(from, to);
                if (allowed) {
                    assertDoesNotThrow(() -> HeartbeatTransition.validate(from, to));
                } else {
                    assertThrows(IllegalStateException.class, () -> HeartbeatTransition.validate(from, to));
                }
            }
        }
    }

    @Test
    void isRunning_OnlyForScheduledAndTicking() {
        assertFalse(UNINITIALIZED.isRunning());
        assertTrue(SCHEDULED.isRunning());
        assertTrue(TICKING.isRunning());
        assertFalse(STOPPED.isRunning());
    }
}
