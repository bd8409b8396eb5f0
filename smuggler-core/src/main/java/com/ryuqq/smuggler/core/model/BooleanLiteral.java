package com.ryuqq.smuggler.core.model;

/**
 * 불리언 리터럴 ({@code true} / {@code false}).
 *
 * @param value 불리언 값
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record BooleanLiteral(boolean value) implements Literal {

    public static final BooleanLiteral TRUE = new BooleanLiteral(true);
    public static final BooleanLiteral FALSE = new BooleanLiteral(false);

    public static BooleanLiteral of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
