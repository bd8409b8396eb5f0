package com.ryuqq.smuggler.core.model;

/**
 * 문자열 리터럴.
 *
 * <p>값에는 어떤 문자든 포함될 수 있으며 (제어 문자, 따옴표, 역슬래시 포함),
 * 인코딩 시 이스케이프 처리됩니다.</p>
 *
 * @param value 문자열 값 (빈 문자열 허용)
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record StringLiteral(String value) implements Literal {

    public StringLiteral {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    public static StringLiteral of(String value) {
        return new StringLiteral(value);
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
