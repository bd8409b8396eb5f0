package com.ryuqq.smuggler.application.smuggler;

import com.ryuqq.smuggler.core.codec.PathCodec;
import com.ryuqq.smuggler.core.codec.ValueCodec;
import com.ryuqq.smuggler.core.model.ConfigTree;
import com.ryuqq.smuggler.core.model.Literal;
import com.ryuqq.smuggler.core.spi.ConfigLoader;

import java.util.Map;

/**
 * 계층형 설정 ↔ 평탄한 문자열 맵 변환 진입점.
 *
 * <p>인코딩은 설정 트리를 {@code <tag>-<app>-<path...>} 키와 리터럴 텍스트 값으로 평탄화하고,
 * 디코딩은 그 역변환을 수행하되 잘못된 항목은 제외하고 보고합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Smuggler smuggler = new ConfigSmuggler();
 *
 * Map&lt;String, String&gt; flat = smuggler.encode(tree);
 * // {"elixir-logger-level" = ":info", "elixir-my_app-url-port" = "4444"}
 *
 * DecodeResult result = smuggler.decodeAndMerge(flat);
 * if (result.hasInvalidEntries()) {
 *     result.invalidEntries().forEach(entry -&gt; ...);
 * }
 * ConfigTree restored = result.tree();
 * </pre>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public interface Smuggler {

    /**
     * 설정 트리 인코딩.
     *
     * @param tree 설정 트리
     * @return 평탄한 키 → 값 맵
     * @throws com.ryuqq.smuggler.core.error.BadInputException tree가 null인 경우
     */
    Map<String, String> encode(ConfigTree tree);

    /**
     * 앱을 키로 하는 리터럴 인코딩.
     *
     * @param config {@code [app: [options...], ...]} 형태의 리터럴
     * @return 평탄한 키 → 값 맵
     * @throws com.ryuqq.smuggler.core.error.BadInputException 앱을 키로 하는 형태가 아닌 경우
     */
    Map<String, String> encode(Literal config);

    /**
     * 로더가 읽어 온 설정 인코딩.
     *
     * @param loader 설정 로더
     * @param source 로더에 전달할 소스 이름
     * @return 평탄한 키 → 값 맵
     * @throws com.ryuqq.smuggler.core.error.LoadException 로더가 실패하거나 null을 반환한 경우
     */
    Map<String, String> encode(ConfigLoader loader, String source);

    /**
     * {@code config :app, key: value} 형태의 문장 하나 인코딩.
     *
     * @param statement 설정 문장
     * @return 평탄한 키 → 값 맵
     * @throws com.ryuqq.smuggler.core.error.BadInputException 문장 형식이 잘못된 경우
     */
    Map<String, String> encodeStatement(String statement);

    /**
     * 평탄한 맵을 디코딩하여 하나의 트리로 병합.
     *
     * <p>항목 단위 오류로 중단되지 않으며, 잘못된 항목은 결과에 포함되어 반환됩니다.</p>
     *
     * @param encoded 인코딩된 키 → 값 맵
     * @return 병합된 트리 + 잘못된 항목 목록
     * @throws com.ryuqq.smuggler.core.error.BadInputException encoded가 null이거나 null 키/값을 포함한 경우
     */
    DecodeResult decodeAndMerge(Map<String, String> encoded);

    /**
     * 타입이 확인되지 않은 입력 디코딩.
     *
     * @param encoded String → String 맵이어야 하는 입력
     * @return 병합된 트리 + 잘못된 항목 목록
     * @throws com.ryuqq.smuggler.core.error.BadInputException 입력이 String → String 맵이 아닌 경우
     */
    DecodeResult decodeUntyped(Object encoded);

    PathCodec pathCodec();

    ValueCodec valueCodec();
}
