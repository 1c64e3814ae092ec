package com.ryuqq.fleet.core.error;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CoordinationErrorTest {

    @Test
    void recoverableErrors() {
        assertTrue(CoordinationError.INSUFFICIENT_SPACE.isRecoverable());
        assertTrue(CoordinationError.INSUFFICIENT_CARGO.isRecoverable());
        assertFalse(CoordinationError.INSUFFICIENT_CARGO.isTerminal());
    }

    @Test
    void terminalErrors() {
        assertTrue(CoordinationError.RESOURCE_GONE.isTerminal());
        assertTrue(CoordinationError.WAIT_CANCELLED.isTerminal());
        assertTrue(CoordinationError.OPERATION_SHUTDOWN.isTerminal());
        assertFalse(CoordinationError.RESOURCE_GONE.isRecoverable());
    }

    @Test
    void rejectedErrors_AreNeitherRecoverableNorTerminal() {
        for (CoordinationError error : new CoordinationError[] {
            CoordinationError.ALREADY_REGISTERED,
            CoordinationError.OPERATION_NOT_FOUND,
            CoordinationError.NO_FEASIBLE_CANDIDATE}) {
            assertFalse(error.isRecoverable(), error.name());
            assertFalse(error.isTerminal(), error.name());
        }
    }

    @Test
    void codes_AreUnique() {
        long distinct = java.util.Arrays.stream(CoordinationError.values())
            .map(CoordinationError::code)
            .distinct()
            .count();
        assertEquals(CoordinationError.values().length, distinct);
    }

    @Test
    void exception_CarriesErrorAndMessage() {
        // When
        CoordinationException exception = CoordinationException.insufficientSpace(10, 4);

        // Then
        assertEquals(CoordinationError.INSUFFICIENT_SPACE, exception.error());
        assertTrue(exception.getMessage().contains("10"));
        assertTrue(exception.getMessage().contains("4"));
        assertTrue(exception.toString().contains("COORD-001"));
    }

    @Test
    void exception_NullError_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new CoordinationException(null, "x"));
    }
}
