package com.ryuqq.smuggler.application.smuggler;

import com.ryuqq.smuggler.core.config.SmugglerConfig;
import com.ryuqq.smuggler.core.error.BadInputException;
import com.ryuqq.smuggler.core.model.ConfigTree;
import com.ryuqq.smuggler.core.outcome.DecodedEntry;
import com.ryuqq.smuggler.core.outcome.EntryOutcome;
import com.ryuqq.smuggler.core.outcome.InvalidEntry;
import com.ryuqq.smuggler.core.transform.EntryDecoder;
import com.ryuqq.smuggler.core.transform.TreeMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 평탄한 맵 디코딩 조정자.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 입력 검증 (null 맵, null 키/값 → BadInput)
 * 2. 키 오름차순 정렬
 * 3. 항목별 독립 디코딩 (설정에 따라 병렬)
 *    - 키 오류 → InvalidEntry(BAD_KEY)
 *    - 값 오류 → InvalidEntry(BAD_VALUE)
 * 4. 유효한 항목을 키 순서대로 TreeMerger로 병합
 * 5. 결과 로깅
 * </pre>
 *
 * <p>병합은 항상 키 순서대로 순차 실행되므로, 같은 말단 경로를 가리키는 두 키가 있으면
 * 입력 맵의 순회 순서와 무관하게 더 큰 키의 값이 남습니다.</p>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public final class DecodeOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DecodeOrchestrator.class);
    private final EntryDecoder entryDecoder;
    private final SmugglerConfig config;

    /**
     * 생성자.
     *
     * @param entryDecoder 항목 디코더
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DecodeOrchestrator(EntryDecoder entryDecoder, SmugglerConfig config) {
        if (entryDecoder == null) {
            throw new IllegalArgumentException("entryDecoder cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.entryDecoder = entryDecoder;
        this.config = config;
    }

    /**
     * 디코딩 및 병합.
     *
     * @param encoded 인코딩된 키 → 값 맵
     * @return 병합된 트리 + 잘못된 항목
     * @throws BadInputException encoded가 null이거나 null 키/값을 포함한 경우
     */
    public DecodeResult decodeAndMerge(Map<String, String> encoded) {
        if (encoded == null) {
            throw new BadInputException("encoded config cannot be null");
        }

        List<Map.Entry<String, String>> entries = sortedEntries(encoded);
        List<EntryOutcome> outcomes = decodeAll(entries);

        ConfigTree tree = ConfigTree.empty();
        List<InvalidEntry> invalidEntries = new ArrayList<>();
        for (EntryOutcome outcome : outcomes) {
            if (outcome instanceof DecodedEntry decoded) {
                tree = TreeMerger.merge(tree, decoded.app(), decoded.options());
            } else {
                InvalidEntry invalid = (InvalidEntry) outcome;
                log.debug("Skipping invalid entry {} ({}): {}", invalid.key(), invalid.kind(), invalid.reason());
                invalidEntries.add(invalid);
            }
        }

        log.info("Decoded {} entries: {} apps, {} invalid", entries.size(), tree.size(), invalidEntries.size());
        return new DecodeResult(tree, invalidEntries);
    }

    /**
     * 타입이 확인되지 않은 입력 디코딩.
     *
     * @param encoded String → String 맵이어야 하는 입력
     * @return 병합된 트리 + 잘못된 항목
     * @throws BadInputException 입력이 String → String 맵이 아닌 경우
     */
    public DecodeResult decodeUntyped(Object encoded) {
        if (!(encoded instanceof Map<?, ?> raw)) {
            throw new BadInputException("encoded config must be a map of strings, got: "
                + (encoded == null ? "null" : encoded.getClass().getName()));
        }
        Map<String, String> typed = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getKey() instanceof String key) || !(entry.getValue() instanceof String value)) {
                throw new BadInputException("encoded config must map strings to strings, found: "
                    + entry.getKey() + " => " + entry.getValue());
            }
            typed.put(key, value);
        }
        return decodeAndMerge(typed);
    }

    private List<Map.Entry<String, String>> sortedEntries(Map<String, String> encoded) {
        List<Map.Entry<String, String>> entries = new ArrayList<>(encoded.size());
        for (Map.Entry<String, String> entry : encoded.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new BadInputException("encoded config cannot contain null keys or values");
            }
            entries.add(Map.entry(entry.getKey(), entry.getValue()));
        }
        entries.sort(Map.Entry.comparingByKey());
        return entries;
    }

    private List<EntryOutcome> decodeAll(List<Map.Entry<String, String>> entries) {
        Stream<Map.Entry<String, String>> stream = entries.stream();
        if (config.parallelDecode() && entries.size() >= config.parallelThreshold()) {
            log.debug("Decoding {} entries in parallel", entries.size());
            stream = stream.parallel();
        }
        return stream
            .map(entry -> entryDecoder.decode(entry.getKey(), entry.getValue()))
            .collect(Collectors.toList());
    }
}
