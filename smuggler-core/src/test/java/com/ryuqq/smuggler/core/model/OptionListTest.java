package com.ryuqq.smuggler.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OptionList 테스트.
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
class OptionListTest {

    private static final Symbol A = Symbol.of("a");
    private static final Symbol B = Symbol.of("b");

    @Test
    void equals_SameEntriesDifferentOrder_Equal() {
        // Given
        OptionList first = OptionList.of(Option.of(A, IntegerLiteral.of(1)), Option.of(B, IntegerLiteral.of(2)));
        OptionList second = OptionList.of(Option.of(B, IntegerLiteral.of(2)), Option.of(A, IntegerLiteral.of(1)));

        // Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void duplicateKeys_NotNestable_LastValueWins() {
        // Given
        OptionList options = OptionList.of(Option.of(A, IntegerLiteral.of(1)), Option.of(A, IntegerLiteral.of(2)));

        // Then
        assertFalse(options.hasUniqueKeys());
        assertFalse(options.isNestable());
        assertEquals(IntegerLiteral.of(2), options.get(A).orElseThrow());
        assertEquals(List.of(A), options.keys());
    }

    @Test
    void empty_NotNestable() {
        assertTrue(OptionList.empty().isEmpty());
        assertFalse(OptionList.empty().isNestable());
        assertFalse(OptionList.empty().isNestedOptions());
    }

    @Test
    void empty_EqualsEmptyListLiteral() {
        // Then
        assertEquals(ListLiteral.empty(), OptionList.empty());
        assertEquals(OptionList.empty(), ListLiteral.empty());
        assertEquals(ListLiteral.empty().hashCode(), OptionList.empty().hashCode());
        assertNotEquals(ListLiteral.of(IntegerLiteral.of(1)), OptionList.empty());
        assertNotEquals(OptionList.of(A, IntegerLiteral.of(1)), ListLiteral.empty());
        assertNotEquals(ListLiteral.empty(), OptionList.of(A, IntegerLiteral.of(1)));
    }

    @Test
    void with_ExistingKey_ReplacedInPlace() {
        // Given
        OptionList options = OptionList.of(Option.of(A, IntegerLiteral.of(1)), Option.of(B, IntegerLiteral.of(2)));

        // When
        OptionList updated = options.with(A, IntegerLiteral.of(9));

        // Then
        assertEquals(List.of(A, B), updated.keys());
        assertEquals(IntegerLiteral.of(9), updated.get(A).orElseThrow());
        assertEquals(IntegerLiteral.of(1), options.get(A).orElseThrow());
    }

    @Test
    void with_NewKey_Appended() {
        // When
        OptionList updated = OptionList.of(A, IntegerLiteral.of(1)).with(B, IntegerLiteral.of(2));

        // Then
        assertEquals(List.of(A, B), updated.keys());
    }

    @Test
    void of_NullEntry_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> OptionList.of(Option.of(A, IntegerLiteral.of(1)), null));
    }

    @Test
    void toString_KeywordListForm() {
        OptionList options = OptionList.of(Option.of(A, Symbol.of("info")));
        assertEquals("[a: :info]", options.toString());
    }
}
