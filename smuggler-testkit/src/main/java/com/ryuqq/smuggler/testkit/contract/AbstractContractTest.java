package com.ryuqq.smuggler.testkit.contract;

import com.ryuqq.smuggler.application.smuggler.ConfigSmuggler;
import com.ryuqq.smuggler.application.smuggler.DecodeResult;
import com.ryuqq.smuggler.application.smuggler.Smuggler;
import com.ryuqq.smuggler.core.config.SmugglerConfig;
import com.ryuqq.smuggler.core.error.ErrorKind;
import com.ryuqq.smuggler.core.model.ConfigTree;
import com.ryuqq.smuggler.core.outcome.InvalidEntry;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for transform Contract Tests.
 *
 * <p>Provides a fresh {@link Smuggler} per test and assertion helpers for decode results.
 * Subclasses may override {@link #createConfig()} to run the same contracts under different
 * settings (e.g., parallel decoding).</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         DecodeResult result = smuggler.decodeAndMerge(Map.of("elixir-app-key", ":value"));
 *         assertNoInvalidEntries(result);
 *     }
 * }
 * </pre>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected SmugglerConfig config;
    protected Smuggler smuggler;

    /**
     * Creates a fresh smuggler before each test.
     */
    @BeforeEach
    protected void setUp() {
        config = createConfig();
        smuggler = new ConfigSmuggler(config);
    }

    /**
     * Settings used to build the smuggler under test.
     *
     * @return default settings (tag {@code elixir})
     */
    protected SmugglerConfig createConfig() {
        return new SmugglerConfig();
    }

    /**
     * Encodes then decodes a tree.
     *
     * @param tree tree to send through the flat form
     * @return decode result
     */
    protected DecodeResult roundTrip(ConfigTree tree) {
        Map<String, String> flat = smuggler.encode(tree);
        return smuggler.decodeAndMerge(flat);
    }

    /**
     * Asserts that every entry decoded.
     *
     * @param result decode result
     */
    protected void assertNoInvalidEntries(DecodeResult result) {
        assertTrue(result.invalidEntries().isEmpty(),
            "Expected no invalid entries but found: " + result.invalidEntries());
    }

    /**
     * Asserts that exactly one entry was rejected with the given key and kind.
     *
     * @param result decode result
     * @param key encoded key expected to be rejected
     * @param kind expected error kind
     */
    protected void assertSingleInvalid(DecodeResult result, String key, ErrorKind kind) {
        List<InvalidEntry> invalid = result.invalidEntries();
        assertEquals(1, invalid.size(), "Expected one invalid entry but found: " + invalid);
        assertEquals(key, invalid.get(0).key());
        assertEquals(kind, invalid.get(0).kind());
        assertFalse(invalid.get(0).reason().isBlank(), "Invalid entry should carry a reason");
    }
}
