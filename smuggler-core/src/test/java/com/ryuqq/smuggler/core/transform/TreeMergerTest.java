package com.ryuqq.smuggler.core.transform;

import com.ryuqq.smuggler.core.error.BadInputException;
import com.ryuqq.smuggler.core.model.ConfigTree;
import com.ryuqq.smuggler.core.model.IntegerLiteral;
import com.ryuqq.smuggler.core.model.ListLiteral;
import com.ryuqq.smuggler.core.model.Option;
import com.ryuqq.smuggler.core.model.OptionList;
import com.ryuqq.smuggler.core.model.Symbol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TreeMerger 테스트.
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
class TreeMergerTest {

    private static final Symbol APP = Symbol.of("app");
    private static final Symbol A = Symbol.of("a");
    private static final Symbol B = Symbol.of("b");
    private static final Symbol GROUP = Symbol.of("group");

    // ========== mergeOptions ==========

    @Test
    void mergeOptions_BothGroups_MergedRecursively() {
        // Given
        OptionList existing = OptionList.of(GROUP, OptionList.of(A, IntegerLiteral.of(1)));
        OptionList incoming = OptionList.of(GROUP, OptionList.of(B, IntegerLiteral.of(2)));

        // When
        OptionList merged = TreeMerger.mergeOptions(existing, incoming);

        // Then
        assertEquals(OptionList.of(GROUP, OptionList.of(
            Option.of(A, IntegerLiteral.of(1)),
            Option.of(B, IntegerLiteral.of(2))
        )), merged);
    }

    @Test
    void mergeOptions_LeafCollision_IncomingWinsAndKeepsPosition() {
        // Given
        OptionList existing = OptionList.of(Option.of(A, IntegerLiteral.of(1)), Option.of(B, IntegerLiteral.of(2)));
        OptionList incoming = OptionList.of(A, IntegerLiteral.of(9));

        // When
        OptionList merged = TreeMerger.mergeOptions(existing, incoming);

        // Then
        assertEquals(List.of(A, B), merged.keys());
        assertEquals(IntegerLiteral.of(9), merged.get(A).orElseThrow());
    }

    @Test
    void mergeOptions_ListValues_Replaced() {
        // Given
        OptionList existing = OptionList.of(A, ListLiteral.of(IntegerLiteral.of(1)));
        OptionList incoming = OptionList.of(A, ListLiteral.of(IntegerLiteral.of(2)));

        // When & Then
        assertEquals(incoming, TreeMerger.mergeOptions(existing, incoming));
    }

    // ========== merge ==========

    @Test
    void merge_InputsUntouched() {
        // Given
        ConfigTree tree = ConfigTree.of(APP, OptionList.of(A, IntegerLiteral.of(1)));

        // When
        ConfigTree merged = TreeMerger.merge(tree, APP, OptionList.of(B, IntegerLiteral.of(2)));

        // Then
        assertEquals(OptionList.of(A, IntegerLiteral.of(1)), tree.get(APP).orElseThrow());
        assertEquals(2, merged.get(APP).orElseThrow().size());
    }

    @Test
    void merge_NewApp_Added() {
        ConfigTree merged = TreeMerger.merge(ConfigTree.empty(), APP, OptionList.of(A, IntegerLiteral.of(1)));
        assertEquals(ConfigTree.of(APP, OptionList.of(A, IntegerLiteral.of(1))), merged);
    }

    // ========== nest ==========

    @Test
    void nest_Path_SingleKeyGroups() {
        // When
        OptionList nested = TreeMerger.nest(List.of(Symbol.of("url"), Symbol.of("port")), IntegerLiteral.of(4444));

        // Then
        assertEquals(OptionList.of(Symbol.of("url"), OptionList.of(Symbol.of("port"), IntegerLiteral.of(4444))), nested);
    }

    @Test
    void nest_EmptyPath_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> TreeMerger.nest(List.of(), IntegerLiteral.of(1)));
    }

    // ========== toTree ==========

    @Test
    void toTree_DuplicateApps_DeepMerged() {
        // Given
        OptionList literal = OptionList.of(
            Option.of(APP, OptionList.of(A, IntegerLiteral.of(1))),
            Option.of(APP, OptionList.of(B, IntegerLiteral.of(2)))
        );

        // When
        ConfigTree tree = TreeMerger.toTree(literal);

        // Then
        assertEquals(ConfigTree.of(APP, OptionList.of(
            Option.of(A, IntegerLiteral.of(1)),
            Option.of(B, IntegerLiteral.of(2))
        )), tree);
    }

    @Test
    void toTree_EmptyListOptions_EmptyApp() {
        ConfigTree tree = TreeMerger.toTree(OptionList.of(APP, ListLiteral.empty()));
        assertEquals(OptionList.empty(), tree.get(APP).orElseThrow());
    }

    @Test
    void toTree_NotAppKeyed_ThrowsBadInput() {
        assertThrows(BadInputException.class, () -> TreeMerger.toTree(null));
        assertThrows(BadInputException.class, () -> TreeMerger.toTree(ListLiteral.of(IntegerLiteral.of(1))));
        assertThrows(BadInputException.class, () -> TreeMerger.toTree(OptionList.of(APP, IntegerLiteral.of(1))));
    }
}
