package com.ryuqq.smuggler.core.model;

import java.math.BigDecimal;

/**
 * 실수 리터럴 (정밀도 제한 없음).
 *
 * <p>동등성은 수치 비교({@link BigDecimal#compareTo(BigDecimal)})로 판단합니다.
 * 즉 {@code 1.50}과 {@code 1.5}는 같은 값입니다.</p>
 *
 * @param value 실수 값
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record FloatLiteral(BigDecimal value) implements Literal {

    public FloatLiteral {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    public static FloatLiteral of(BigDecimal value) {
        return new FloatLiteral(value);
    }

    /**
     * 텍스트에서 FloatLiteral 생성.
     *
     * @param text 십진 또는 지수 표기 (예: "3.14", "1.0e10")
     * @return FloatLiteral 인스턴스
     * @throws NumberFormatException 숫자 형식이 아닌 경우
     */
    public static FloatLiteral of(String text) {
        return new FloatLiteral(new BigDecimal(text));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FloatLiteral that = (FloatLiteral) o;
        return value.compareTo(that.value) == 0;
    }

    @Override
    public int hashCode() {
        return value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
