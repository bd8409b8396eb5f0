package com.ryuqq.smuggler.core.model;

/**
 * 앱 이름, 옵션 키, 심볼 값으로 사용되는 식별자.
 *
 * <p>식별자는 두 가지 변형 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Symbol}: 소문자로 시작하는 단순 이름 (예: {@code my_app}, {@code level})</li>
 *   <li>{@link QualifiedName}: 대문자로 시작하는 점(.) 구분 경로 (예: {@code MyApp.Endpoint})</li>
 * </ul>
 *
 * <p>분류는 {@link #parse(String)}에서 첫 글자의 대소문자로 한 번만 결정되며,
 * 이후 코드는 원문 텍스트를 다시 검사하지 않고 변형 타입을 사용합니다.</p>
 *
 * <p><strong>불변식:</strong> 식별자의 텍스트 형태는 경로 구분자({@code -})를 포함하지 않습니다.</p>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public sealed interface Identifier extends Literal permits Symbol, QualifiedName {

    /**
     * 텍스트에서 식별자 생성.
     *
     * <p>첫 글자가 {@code a-z}이면 {@link Symbol}, 그 외에는 {@link QualifiedName}으로 분류합니다.</p>
     *
     * @param text 식별자 텍스트
     * @return Symbol 또는 QualifiedName
     * @throws IllegalArgumentException text가 null, 빈 문자열이거나 유효한 식별자가 아닌 경우
     */
    static Identifier parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Identifier text cannot be null or empty");
        }
        char first = text.charAt(0);
        if (first >= 'a' && first <= 'z') {
            return Symbol.of(text);
        }
        return QualifiedName.of(text);
    }

    /**
     * 키 경로와 옵션 목록에서 사용되는 텍스트 형태.
     *
     * @return 식별자 텍스트 (Symbol은 이름, QualifiedName은 점 구분 경로)
     */
    String text();

    /**
     * Symbol인지 확인.
     *
     * @return Symbol이면 true
     */
    default boolean isSymbol() {
        return this instanceof Symbol;
    }

    /**
     * QualifiedName인지 확인.
     *
     * @return QualifiedName이면 true
     */
    default boolean isQualifiedName() {
        return this instanceof QualifiedName;
    }
}
