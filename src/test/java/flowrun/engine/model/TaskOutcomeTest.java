package flowrun.engine.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskOutcomeTest {

    @Test
    void success() {
        TaskOutcome outcome = TaskOutcome.success(42);

        assertTrue(outcome.isSuccess());
        assertEquals(42, outcome.value());
        assertNull(outcome.error());
        assertEquals("42", outcome.message());
    }

    @Test
    void failureUsesErrorMessage() {
        TaskOutcome outcome = TaskOutcome.failure(new RuntimeException("disk full"));

        assertFalse(outcome.isSuccess());
        assertNull(outcome.value());
        assertEquals("disk full", outcome.message());
    }

    @Test
    void failureWithoutMessageUsesErrorType() {
        TaskOutcome outcome = TaskOutcome.failure(new NullPointerException());

        assertEquals("NullPointerException", outcome.message());
    }

    @Test
    void failureRequiresError() {
        assertThrows(NullPointerException.class, () -> TaskOutcome.failure(null));
    }
}
