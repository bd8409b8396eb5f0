package com.ryuqq.smuggler.core.model;

import java.math.BigInteger;

/**
 * 정수 리터럴 (크기 제한 없음).
 *
 * @param value 정수 값
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record IntegerLiteral(BigInteger value) implements Literal {

    public IntegerLiteral {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    public static IntegerLiteral of(long value) {
        return new IntegerLiteral(BigInteger.valueOf(value));
    }

    public static IntegerLiteral of(BigInteger value) {
        return new IntegerLiteral(value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
