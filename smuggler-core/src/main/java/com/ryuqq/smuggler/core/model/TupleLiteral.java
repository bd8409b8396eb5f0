package com.ryuqq.smuggler.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 튜플 리터럴 ({@code {a, b}}).
 *
 * @param elements 원소 목록 (null 원소 불가)
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record TupleLiteral(List<Literal> elements) implements Literal {

    public TupleLiteral {
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

    public static TupleLiteral of(Literal... elements) {
        return new TupleLiteral(Arrays.asList(elements));
    }

    public int arity() {
        return elements.size();
    }

    @Override
    public String toString() {
        return elements.stream().map(String::valueOf).collect(Collectors.joining(", ", "{", "}"));
    }
}
