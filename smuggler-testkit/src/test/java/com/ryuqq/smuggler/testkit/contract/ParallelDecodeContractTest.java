package com.ryuqq.smuggler.testkit.contract;

import com.ryuqq.smuggler.application.smuggler.ConfigSmuggler;
import com.ryuqq.smuggler.application.smuggler.DecodeResult;
import com.ryuqq.smuggler.core.config.SmugglerConfig;
import com.ryuqq.smuggler.core.model.ConfigTree;
import com.ryuqq.smuggler.core.model.Option;
import com.ryuqq.smuggler.core.model.OptionList;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.ryuqq.smuggler.testkit.contract.SmugglerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: parallel decoding yields the same result as sequential decoding.
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
class ParallelDecodeContractTest extends AbstractContractTest {

    @Override
    protected SmugglerConfig createConfig() {
        return new SmugglerConfig().withParallelDecode(true).withParallelThreshold(16);
    }

    @Test
    void testParallelDecode_LargeInput_SameAsSequential() {
        // Given
        List<Option> settings = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            settings.add(Option.of(sym("key_" + i), integer(i)));
        }
        ConfigTree tree = tree(
            "my_app", options("MyApp.Settings", OptionList.of(settings)),
            "logger", options("level", sym("debug"))
        );
        Map<String, String> encoded = new HashMap<>(smuggler.encode(tree));
        encoded.put("bad key", "1");
        encoded.put("elixir-my_app-oops", "oops(");

        // When
        DecodeResult parallel = smuggler.decodeAndMerge(encoded);
        DecodeResult sequential = new ConfigSmuggler().decodeAndMerge(encoded);

        // Then
        assertEquals(tree, parallel.tree());
        assertEquals(sequential.tree(), parallel.tree());
        assertEquals(sequential.invalidEntries(), parallel.invalidEntries());
    }
}
