package com.ryuqq.smuggler.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * (식별자, 리터럴) 쌍의 순서 있는 목록 ({@code [key: value, ...]}).
 *
 * <p>OptionList는 앱의 옵션 그룹이자 그 자체로 하나의 리터럴 값입니다.
 * 비어 있지 않고 키가 고유한 OptionList는 평탄화 시 중첩 그룹으로 취급됩니다
 * ({@link #isNestable()}).</p>
 *
 * <p><strong>순서와 동등성:</strong></p>
 * <ul>
 *   <li>삽입 순서는 보존되지만 의미를 갖지 않습니다</li>
 *   <li>빈 OptionList는 빈 {@link ListLiteral}과 동등합니다 (둘 다 {@code []})</li>
 *   <li>키가 고유한 두 목록은 순서와 무관하게 키별 값이 같으면 동등합니다</li>
 *   <li>중복 키가 있는 목록은 위치 기반으로 비교합니다</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * OptionList url = OptionList.of(
 *     Option.of("host", StringLiteral.of("localhost")),
 *     Option.of("port", IntegerLiteral.of(4444))
 * );
 * OptionList endpoint = OptionList.of(QualifiedName.of("MyApp.Endpoint"), OptionList.of(Symbol.of("url"), url));
 * </pre>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public final class OptionList implements Literal {

    private static final OptionList EMPTY = new OptionList(List.of());

    private final List<Option> options;
    private final boolean uniqueKeys;

    private OptionList(List<Option> options) {
        this.options = options;
        this.uniqueKeys = computeUniqueKeys(options);
    }

    /**
     * 빈 OptionList.
     *
     * @return 빈 OptionList
     */
    public static OptionList empty() {
        return EMPTY;
    }

    /**
     * 항목 목록으로 OptionList 생성.
     *
     * @param options 항목 목록 (중복 키 허용)
     * @return OptionList 인스턴스
     * @throws IllegalArgumentException options가 null이거나 null 항목을 포함한 경우
     */
    public static OptionList of(List<Option> options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        for (Option option : options) {
            if (option == null) {
                throw new IllegalArgumentException("options cannot contain null");
            }
        }
        return options.isEmpty() ? EMPTY : new OptionList(List.copyOf(options));
    }

    public static OptionList of(Option... options) {
        return of(Arrays.asList(options));
    }

    /**
     * 단일 항목 OptionList 생성.
     *
     * @param key 키
     * @param value 값
     * @return 항목이 하나인 OptionList
     */
    public static OptionList of(Identifier key, Literal value) {
        return new OptionList(List.of(Option.of(key, value)));
    }

    /**
     * 키 순서가 보존된 맵에서 OptionList 생성.
     *
     * @param entries 키 → 값 맵
     * @return OptionList 인스턴스
     */
    public static OptionList fromMap(Map<? extends Identifier, ? extends Literal> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        List<Option> options = new ArrayList<>(entries.size());
        entries.forEach((key, value) -> options.add(Option.of(key, value)));
        return of(options);
    }

    public List<Option> options() {
        return options;
    }

    public int size() {
        return options.size();
    }

    public boolean isEmpty() {
        return options.isEmpty();
    }

    /**
     * 모든 키가 고유한지 확인.
     *
     * @return 중복 키가 없으면 true
     */
    public boolean hasUniqueKeys() {
        return uniqueKeys;
    }

    /**
     * 평탄화 시 중첩 그룹으로 재귀할 수 있는지 확인.
     *
     * @return 비어 있지 않고 키가 고유하면 true
     */
    public boolean isNestable() {
        return !options.isEmpty() && uniqueKeys;
    }

    /**
     * 키로 값 조회 (중복 키인 경우 마지막 값).
     *
     * @param key 조회할 키
     * @return 값 (없으면 empty)
     */
    public Optional<Literal> get(Identifier key) {
        for (int i = options.size() - 1; i >= 0; i--) {
            Option option = options.get(i);
            if (option.key().equals(key)) {
                return Optional.of(option.value());
            }
        }
        return Optional.empty();
    }

    /**
     * 키 목록 (삽입 순서, 중복 제거).
     *
     * @return 키 목록
     */
    public List<Identifier> keys() {
        return new ArrayList<>(toMap().keySet());
    }

    /**
     * 키 → 값 맵으로 변환 (첫 등장 위치, 마지막 값).
     *
     * @return 수정 불가능한 순서 보존 맵
     */
    public Map<Identifier, Literal> toMap() {
        Map<Identifier, Literal> map = new LinkedHashMap<>();
        for (Option option : options) {
            map.put(option.key(), option.value());
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * 키의 값을 설정한 새 OptionList 반환.
     *
     * <p>키가 이미 있으면 그 위치의 값을 교체하고, 없으면 끝에 추가합니다.</p>
     *
     * @param key 키
     * @param value 새 값
     * @return 새 OptionList 인스턴스
     */
    public OptionList with(Identifier key, Literal value) {
        Map<Identifier, Literal> map = new LinkedHashMap<>(toMap());
        map.put(key, value);
        return fromMap(map);
    }

    private static boolean computeUniqueKeys(List<Option> options) {
        Set<Identifier> seen = new HashSet<>();
        for (Option option : options) {
            if (!seen.add(option.key())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o instanceof ListLiteral list) {
            return options.isEmpty() && list.isEmpty();
        }
        if (o == null || getClass() != o.getClass()) return false;
        OptionList that = (OptionList) o;
        if (uniqueKeys && that.uniqueKeys) {
            return toMap().equals(that.toMap());
        }
        return options.equals(that.options);
    }

    @Override
    public int hashCode() {
        if (options.isEmpty()) {
            return ListLiteral.empty().hashCode();
        }
        return uniqueKeys ? toMap().hashCode() : options.hashCode();
    }

    @Override
    public String toString() {
        return options.stream().map(Option::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
