package com.ryuqq.smuggler.core.model;

/**
 * 옵션 목록의 한 항목 (키, 값).
 *
 * @param key 옵션 키
 * @param value 옵션 값 (중첩 옵션 그룹이면 {@link OptionList})
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record Option(Identifier key, Literal value) {

    public Option {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    public static Option of(Identifier key, Literal value) {
        return new Option(key, value);
    }

    /**
     * 심볼 키로 Option 생성.
     *
     * @param key 키 텍스트 (소문자 시작)
     * @param value 값
     * @return Option 인스턴스
     */
    public static Option of(String key, Literal value) {
        return new Option(Identifier.parse(key), value);
    }

    @Override
    public String toString() {
        return key.text() + ": " + value;
    }
}
