package com.ryuqq.smuggler.core.outcome;

/**
 * 인코딩된 (키, 값) 한 쌍의 디코딩 결과.
 *
 * <p>EntryOutcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link DecodedEntry}: 디코딩 성공, 병합 가능</li>
 *   <li>{@link InvalidEntry}: 키 또는 값이 잘못됨, 해당 항목만 제외</li>
 * </ul>
 *
 * <p>각 항목은 서로 독립적으로 디코딩되므로, 한 항목의 실패가 다른 항목의 결과에
 * 영향을 주지 않습니다.</p>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public sealed interface EntryOutcome permits DecodedEntry, InvalidEntry {

    /**
     * 원본 인코딩 키.
     *
     * @return 키
     */
    String key();

    /**
     * 원본 인코딩 값.
     *
     * @return 값
     */
    String value();

    default boolean isDecoded() {
        return this instanceof DecodedEntry;
    }

    default boolean isInvalid() {
        return this instanceof InvalidEntry;
    }
}
