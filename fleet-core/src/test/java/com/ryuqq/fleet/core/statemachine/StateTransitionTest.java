package com.ryuqq.fleet.core.statemachine;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static com.ryuqq.fleet.core.statemachine.OperationState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_LaunchThenComplete_Succeeds() {
        // Given
        OperationState state = PENDING;

        // When
        state = StateTransition.transition(state, RUNNING);
        state = StateTransition.transition(state, COMPLETED);

        // Then
        assertEquals(COMPLETED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void validate_RunningToStopped_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(RUNNING, STOPPED));
    }

    @Test
    void validate_RunningToFailed_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(RUNNING, FAILED));
    }

    @Test
    void validate_PendingToFailed_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, FAILED));
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, STOPPED));
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_FromTerminalState_ThrowsException() {
        for (OperationState terminal : new OperationState[] {COMPLETED, STOPPED, FAILED}) {
            IllegalStateException exception = assertThrows(
                IllegalStateException.class,
                () -> StateTransition.validate(terminal, RUNNING)
            );
            assertTrue(exception.getMessage().contains("terminal state"));
            assertTrue(exception.getMessage().contains(terminal.name()));
        }
    }

    @Test
    void validate_PendingToCompleted_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(PENDING, COMPLETED)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_RunningToPending_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(RUNNING, PENDING));
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(RUNNING, RUNNING));
    }

    @Test
    void validate_NullState_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, RUNNING));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(PENDING, null));
    }

    @Test
    void allowedTargets_MatchesTransitionTable() {
        assertEquals(EnumSet.of(RUNNING, STOPPED, FAILED), StateTransition.allowedTargets(PENDING));
        assertEquals(EnumSet.of(COMPLETED, STOPPED, FAILED), StateTransition.allowedTargets(RUNNING));
        for (OperationState terminal : new OperationState[] {COMPLETED, STOPPED, FAILED}) {
            assertTrue(StateTransition.allowedTargets(terminal).isEmpty());
        }
        assertThrows(UnsupportedOperationException.class,
            () -> StateTransition.allowedTargets(PENDING).add(COMPLETED));
    }

    @Test
    void isTerminal_OnlyForEndStates() {
        assertFalse(PENDING.isTerminal());
        assertFalse(RUNNING.isTerminal());
        assertTrue(COMPLETED.isTerminal());
        assertTrue(STOPPED.isTerminal());
        assertTrue(FAILED.isTerminal());
    }
}
