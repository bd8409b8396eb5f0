package com.ryuqq.smuggler.testkit.contract;

import com.ryuqq.smuggler.application.smuggler.DecodeResult;
import com.ryuqq.smuggler.core.error.BadInputException;
import com.ryuqq.smuggler.core.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.ryuqq.smuggler.testkit.contract.SmugglerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: reference encode/decode scenarios with tag {@code elixir}.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Scenario 1: single leaf encodes to one entry</li>
 *   <li>Scenario 2: sibling keys merge under one nested group</li>
 *   <li>Scenario 3: malformed key is reported as BAD_KEY</li>
 *   <li>Scenario 4: malformed value is reported as BAD_VALUE</li>
 *   <li>Scenario 5: a literal that is not app-keyed is rejected as bad input</li>
 * </ul>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
class ScenarioContractTest extends AbstractContractTest {

    @Test
    void testScenario1_SingleLeaf_OneEntry() {
        // When
        Map<String, String> flat = smuggler.encode(tree("app", options("key", sym("value"))));

        // Then
        assertEquals(Map.of("elixir-app-key", ":value"), flat);
    }

    @Test
    void testScenario2_SiblingKeys_MergedUnderNestedGroup() {
        // When
        DecodeResult result = smuggler.decodeAndMerge(Map.of(
            "elixir-app-nested-x", "1",
            "elixir-app-nested-y", "2"
        ));

        // Then
        assertEquals(tree("app", options("nested", options("x", integer(1), "y", integer(2)))), result.tree());
        assertNoInvalidEntries(result);
    }

    @Test
    void testScenario3_BadKey_ReportedAndExcluded() {
        // When
        DecodeResult result = smuggler.decodeAndMerge(Map.of("bad key", "22"));

        // Then
        assertTrue(result.tree().isEmpty());
        assertSingleInvalid(result, "bad key", ErrorKind.BAD_KEY);
        assertEquals("22", result.invalidEntries().get(0).value());
    }

    @Test
    void testScenario4_BadValue_ReportedAndExcluded() {
        // When
        DecodeResult result = smuggler.decodeAndMerge(Map.of("elixir-app-k", "not(valid"));

        // Then
        assertTrue(result.tree().isEmpty());
        assertSingleInvalid(result, "elixir-app-k", ErrorKind.BAD_VALUE);
    }

    @Test
    void testScenario5_NotAppKeyed_BadInput() {
        // When & Then
        assertThrows(BadInputException.class,
            () -> smuggler.encode(list(integer(1), integer(2), integer(3))));
    }
}
