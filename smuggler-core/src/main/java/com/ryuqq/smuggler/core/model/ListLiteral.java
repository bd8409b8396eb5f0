package com.ryuqq.smuggler.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 리터럴의 순서 있는 목록 ({@code [a, b, c]}).
 *
 * <p>원소가 두 원소 튜플이어도 {@link OptionList}로 취급되지 않습니다.
 * 중첩 옵션 그룹은 반드시 {@link OptionList} 타입으로 표현해야 합니다.</p>
 *
 * <p>빈 ListLiteral은 빈 {@link OptionList}와 동등합니다.</p>
 *
 * @param elements 원소 목록 (null 원소 불가)
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record ListLiteral(List<Literal> elements) implements Literal {

    private static final ListLiteral EMPTY = new ListLiteral(List.of());

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException elements가 null이거나 null 원소를 포함한 경우
     */
    public ListLiteral {
        if (elements == null) {
            throw new IllegalArgumentException("elements cannot be null");
        }
        for (Literal element : elements) {
            if (element == null) {
                throw new IllegalArgumentException("elements cannot contain null");
            }
        }
        elements = List.copyOf(elements);
    }

    public static ListLiteral empty() {
        return EMPTY;
    }

    public static ListLiteral of(Literal... elements) {
        return new ListLiteral(Arrays.asList(elements));
    }

    public static ListLiteral of(List<? extends Literal> elements) {
        return new ListLiteral(new ArrayList<>(elements));
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o instanceof ListLiteral that) {
            return elements.equals(that.elements);
        }
        return o instanceof OptionList options && elements.isEmpty() && options.isEmpty();
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
