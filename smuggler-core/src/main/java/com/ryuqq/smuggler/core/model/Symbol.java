package com.ryuqq.smuggler.core.model;

import java.util.regex.Pattern;

/**
 * 소문자로 시작하는 단순 식별자.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Symbol.of("my_app") - 앱 이름</li>
 *   <li>Symbol.of("level") - 옵션 키</li>
 *   <li>Symbol.of("info") - 값으로 사용되는 심볼 ({@code :info})</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>패턴: 소문자로 시작, 영숫자와 언더스코어, 끝에 선택적 ? 또는 !</li>
 * </ul>
 *
 * @param name 심볼 이름
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record Symbol(String name) implements Identifier {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z][A-Za-z0-9_]*[?!]?$");

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null, 빈 문자열이거나 패턴에 맞지 않는 경우
     */
    public Symbol {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name cannot be null or empty");
        }
        if (!VALID_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid symbol name: " + name);
        }
    }

    /**
     * Symbol 생성.
     *
     * @param name 심볼 이름
     * @return Symbol 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 이름인 경우
     */
    public static Symbol of(String name) {
        return new Symbol(name);
    }

    @Override
    public String text() {
        return name;
    }

    @Override
    public String toString() {
        return ":" + name;
    }
}
