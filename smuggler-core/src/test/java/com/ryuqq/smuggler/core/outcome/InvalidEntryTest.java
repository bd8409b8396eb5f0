package com.ryuqq.smuggler.core.outcome;

import com.ryuqq.smuggler.core.error.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InvalidEntry 테스트.
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
class InvalidEntryTest {

    @Test
    void of_BlankReason_DefaultsToKindDescription() {
        InvalidEntry entry = InvalidEntry.badValue("elixir-app-k", "oops", " ");
        assertEquals(ErrorKind.BAD_VALUE.description(), entry.reason());
    }

    @Test
    void of_NonEntryKind_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> InvalidEntry.of("k", "v", ErrorKind.BAD_INPUT, "reason"));
        assertThrows(IllegalArgumentException.class,
            () -> InvalidEntry.of("k", "v", ErrorKind.LOAD_ERROR, "reason"));
    }

    @Test
    void isInvalid_True() {
        EntryOutcome outcome = InvalidEntry.badKey("bad key", "22", "no tag");
        assertTrue(outcome.isInvalid());
        assertFalse(outcome.isDecoded());
    }
}
