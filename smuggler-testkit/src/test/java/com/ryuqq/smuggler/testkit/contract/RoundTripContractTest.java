package com.ryuqq.smuggler.testkit.contract;

import com.ryuqq.smuggler.application.smuggler.DecodeResult;
import com.ryuqq.smuggler.core.model.ConfigTree;
import com.ryuqq.smuggler.core.model.Literal;
import com.ryuqq.smuggler.core.model.OptionList;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.ryuqq.smuggler.testkit.contract.SmugglerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: encoding then decoding reproduces the tree.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A tree with nested groups and every literal kind survives the flat form unchanged</li>
 *   <li>Every encoded key carries the namespace tag prefix</li>
 *   <li>Every literal value survives {@code decode(encode(v))}</li>
 *   <li>An empty option list value comes back as an equal empty list</li>
 * </ul>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
class RoundTripContractTest extends AbstractContractTest {

    @Test
    void testRoundTrip_SampleTree_Unchanged() {
        // Given
        ConfigTree tree = sampleTree();

        // When
        DecodeResult result = roundTrip(tree);

        // Then
        assertNoInvalidEntries(result);
        assertEquals(tree, result.tree());
    }

    @Test
    void testEncode_SampleTree_OneEntryPerLeaf() {
        // When
        Map<String, String> flat = smuggler.encode(sampleTree());

        // Then
        assertEquals(12, flat.size());
        assertEquals("\"localhost\"", flat.get("elixir-my_app-MyApp.Endpoint-url-host"));
        assertEquals("4444", flat.get("elixir-my_app-MyApp.Endpoint-url-port"));
        assertEquals("0.75", flat.get("elixir-my_app-MyApp.Repo-ratio"));
        assertEquals("[{:a, 1}, {:b, 2}]", flat.get("elixir-my_app-pairs"));
        assertEquals("Ecto.Adapters.Postgres", flat.get("elixir-my_app-adapter"));
        assertTrue(flat.keySet().stream().allMatch(key -> key.startsWith("elixir-")));
    }

    @Test
    void testRoundTrip_EveryLiteralKind_Unchanged() {
        // Given
        List<Literal> values = List.of(
            integer(0),
            integer(-42),
            decimal("3.14"),
            decimal("-0.5"),
            bool(true),
            bool(false),
            nil(),
            str(""),
            str("tab\tquote\"backslash\\"),
            str("no #{interpolation}"),
            sym("info"),
            sym("ok?"),
            mod("MyApp.Repo"),
            list(),
            list(integer(1), str("two"), sym("three")),
            tuple(),
            tuple(sym("error"), str("reason")),
            options("nested", options("deep", list(integer(1))))
        );

        for (Literal value : values) {
            // When
            Literal decoded = smuggler.valueCodec().decode(smuggler.valueCodec().encode(value));

            // Then
            assertEquals(value, decoded, "Round trip failed for " + value);
        }
    }

    @Test
    void testRoundTrip_EmptyOptionListValue_Unchanged() {
        // Given
        ConfigTree tree = tree("my_app", options("a", integer(1), "b", OptionList.empty()));

        // When
        Map<String, String> flat = smuggler.encode(tree);
        DecodeResult result = smuggler.decodeAndMerge(flat);

        // Then
        assertEquals("[]", flat.get("elixir-my_app-b"));
        assertNoInvalidEntries(result);
        assertEquals(tree, result.tree());
        assertEquals(result.tree(), tree);
    }

    @Test
    void testRoundTrip_EmptyTree_EmptyFlatMap() {
        // When
        Map<String, String> flat = smuggler.encode(ConfigTree.empty());
        DecodeResult result = smuggler.decodeAndMerge(flat);

        // Then
        assertTrue(flat.isEmpty());
        assertTrue(result.tree().isEmpty());
        assertNoInvalidEntries(result);
    }
}
