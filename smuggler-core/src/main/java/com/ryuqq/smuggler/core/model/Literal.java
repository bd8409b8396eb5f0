package com.ryuqq.smuggler.core.model;

/**
 * 설정 값으로 사용되는 리터럴.
 *
 * <p>Literal은 리터럴 표현 언어로 인코딩 가능한 모든 값을 나타냅니다:</p>
 * <ul>
 *   <li>{@link IntegerLiteral}: 정수 (크기 제한 없음)</li>
 *   <li>{@link FloatLiteral}: 실수 (정밀도 제한 없음)</li>
 *   <li>{@link BooleanLiteral}: true / false</li>
 *   <li>{@link NullLiteral}: nil</li>
 *   <li>{@link StringLiteral}: 문자열</li>
 *   <li>{@link Symbol}, {@link QualifiedName}: 식별자 ({@link Identifier})</li>
 *   <li>{@link ListLiteral}: 리터럴의 순서 있는 목록</li>
 *   <li>{@link OptionList}: (식별자, 리터럴) 쌍의 순서 있는 목록</li>
 *   <li>{@link TupleLiteral}: 튜플</li>
 * </ul>
 *
 * <p>모든 구현은 불변이며 구조적 동등성(structural equality)만을 가집니다.</p>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public sealed interface Literal
    permits IntegerLiteral, FloatLiteral, BooleanLiteral, NullLiteral, StringLiteral,
            Identifier, ListLiteral, OptionList, TupleLiteral {

    /**
     * 중첩 가능한 옵션 그룹인지 확인.
     *
     * <p>평탄화 시 재귀 대상이 되는 값은 비어 있지 않고 키가 고유한
     * {@link OptionList}뿐입니다. 두 원소 튜플의 목록은 항상 단말 값입니다.</p>
     *
     * @return 중첩 옵션 그룹이면 true
     */
    default boolean isNestedOptions() {
        return this instanceof OptionList options && options.isNestable();
    }
}
