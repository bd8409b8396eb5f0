package com.ryuqq.smuggler.core.model;

/**
 * 널 리터럴 ({@code nil}).
 *
 * <p>모든 인스턴스는 서로 같습니다. {@link #NIL}을 사용하세요.</p>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record NullLiteral() implements Literal {

    public static final NullLiteral NIL = new NullLiteral();

    @Override
    public String toString() {
        return "nil";
    }
}
