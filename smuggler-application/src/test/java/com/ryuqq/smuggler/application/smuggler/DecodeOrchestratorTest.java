package com.ryuqq.smuggler.application.smuggler;

import com.ryuqq.smuggler.core.codec.PathCodec;
import com.ryuqq.smuggler.core.codec.ValueCodec;
import com.ryuqq.smuggler.core.config.SmugglerConfig;
import com.ryuqq.smuggler.core.error.BadInputException;
import com.ryuqq.smuggler.core.error.ErrorKind;
import com.ryuqq.smuggler.core.model.ConfigTree;
import com.ryuqq.smuggler.core.model.IntegerLiteral;
import com.ryuqq.smuggler.core.model.OptionList;
import com.ryuqq.smuggler.core.model.Symbol;
import com.ryuqq.smuggler.core.outcome.InvalidEntry;
import com.ryuqq.smuggler.core.transform.EntryDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * DecodeOrchestrator 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>유효한 항목은 하나의 트리로 병합</li>
 *   <li>잘못된 항목은 키 순서대로 보고되고 병합에서 제외</li>
 *   <li>null 입력과 타입이 맞지 않는 입력은 BadInput</li>
 *   <li>병렬 디코딩도 같은 결과</li>
 * </ul>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
class DecodeOrchestratorTest {

    private DecodeOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = newOrchestrator(new SmugglerConfig());
    }

    private static DecodeOrchestrator newOrchestrator(SmugglerConfig config) {
        EntryDecoder decoder = new EntryDecoder(new PathCodec(config.namespaceTag()), new ValueCodec(config.maxNestingDepth()));
        return new DecodeOrchestrator(decoder, config);
    }

    @Test
    void decodeAndMerge_유효한_항목은_하나의_트리로_병합됨() {
        // given
        Map<String, String> encoded = Map.of(
            "elixir-app-nested-x", "1",
            "elixir-app-nested-y", "2",
            "elixir-other-key", ":v"
        );

        // when
        DecodeResult result = orchestrator.decodeAndMerge(encoded);

        // then
        assertThat(result.hasInvalidEntries()).isFalse();
        assertThat(result.tree().apps()).containsExactly(Symbol.of("app"), Symbol.of("other"));
        assertThat(result.tree().get(Symbol.of("app")).orElseThrow().get(Symbol.of("nested")))
            .contains(OptionList.fromMap(Map.of(Symbol.of("x"), IntegerLiteral.of(1), Symbol.of("y"), IntegerLiteral.of(2))));
    }

    @Test
    void decodeAndMerge_잘못된_항목은_제외되고_키_순서로_보고됨() {
        // given
        Map<String, String> encoded = new HashMap<>();
        encoded.put("elixir-app-ok", "1");
        encoded.put("elixir-app-value", "not(valid");
        encoded.put("bad key", "22");

        // when
        DecodeResult result = orchestrator.decodeAndMerge(encoded);

        // then
        assertThat(result.tree()).isEqualTo(ConfigTree.of(Symbol.of("app"), OptionList.of(Symbol.of("ok"), IntegerLiteral.of(1))));
        assertThat(result.invalidEntries())
            .extracting(InvalidEntry::key, InvalidEntry::kind)
            .containsExactly(
                tuple("bad key", ErrorKind.BAD_KEY),
                tuple("elixir-app-value", ErrorKind.BAD_VALUE)
            );
    }

    @Test
    void decodeAndMerge_빈_맵이면_빈_트리() {
        DecodeResult result = orchestrator.decodeAndMerge(Map.of());

        assertThat(result.tree().isEmpty()).isTrue();
        assertThat(result.invalidEntries()).isEmpty();
    }

    @Test
    void decodeAndMerge_null_입력이면_BadInput() {
        assertThatThrownBy(() -> orchestrator.decodeAndMerge(null))
            .isInstanceOf(BadInputException.class);
    }

    @Test
    void decodeAndMerge_null_값이_있으면_BadInput() {
        // given
        Map<String, String> encoded = new HashMap<>();
        encoded.put("elixir-app-key", null);

        // when & then
        assertThatThrownBy(() -> orchestrator.decodeAndMerge(encoded))
            .isInstanceOf(BadInputException.class)
            .hasMessageContaining("null");
    }

    @Test
    void decodeUntyped_맵이_아니면_BadInput() {
        assertThatThrownBy(() -> orchestrator.decodeUntyped(List.of("elixir-app-key")))
            .isInstanceOf(BadInputException.class);
        assertThatThrownBy(() -> orchestrator.decodeUntyped(null))
            .isInstanceOf(BadInputException.class);
    }

    @Test
    void decodeUntyped_문자열이_아닌_값이면_BadInput() {
        assertThatThrownBy(() -> orchestrator.decodeUntyped(Map.of("elixir-app-key", 1)))
            .isInstanceOf(BadInputException.class);
    }

    @Test
    void decodeUntyped_문자열_맵이면_디코딩됨() {
        // given
        Object encoded = Map.of("elixir-app-key", ":value");

        // when
        DecodeResult result = orchestrator.decodeUntyped(encoded);

        // then
        assertThat(result.tree()).isEqualTo(ConfigTree.of(Symbol.of("app"), OptionList.of(Symbol.of("key"), Symbol.of("value"))));
    }

    @Test
    void decodeAndMerge_병렬_디코딩도_같은_결과() {
        // given
        DecodeOrchestrator parallel = newOrchestrator(new SmugglerConfig().withParallelDecode(true).withParallelThreshold(1));
        Map<String, String> encoded = new HashMap<>();
        for (int i = 0; i < 200; i++) {
            encoded.put("elixir-app-group-key_" + i, String.valueOf(i));
        }
        encoded.put("elixir-app-group", "[key_0: -1]");
        encoded.put("elixir-app-bad", "[");

        // when
        DecodeResult sequentialResult = orchestrator.decodeAndMerge(encoded);
        DecodeResult parallelResult = parallel.decodeAndMerge(encoded);

        // then
        assertThat(parallelResult).isEqualTo(sequentialResult);
        assertThat(parallelResult.tree().get(Symbol.of("app")).orElseThrow().get(Symbol.of("group")).orElseThrow())
            .isInstanceOfSatisfying(OptionList.class, group -> assertThat(group.size()).isEqualTo(200));
    }
}
