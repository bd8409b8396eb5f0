package com.ryuqq.smuggler.core.transform;

import com.ryuqq.smuggler.core.error.BadInputException;
import com.ryuqq.smuggler.core.model.ConfigTree;
import com.ryuqq.smuggler.core.model.Identifier;
import com.ryuqq.smuggler.core.model.ListLiteral;
import com.ryuqq.smuggler.core.model.Literal;
import com.ryuqq.smuggler.core.model.Option;
import com.ryuqq.smuggler.core.model.OptionList;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 설정 트리 깊은 병합 규칙.
 *
 * <p>병합 규칙:</p>
 * <ul>
 *   <li>한쪽에만 있는 키는 그대로 유지</li>
 *   <li>양쪽 값이 모두 OptionList이면 재귀적으로 병합</li>
 *   <li>그 외에는 새 값이 기존 값을 교체 (기존 키 위치 유지)</li>
 * </ul>
 *
 * <p>모든 메서드는 입력을 변경하지 않고 새 인스턴스를 반환합니다.</p>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public final class TreeMerger {

    private TreeMerger() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 앱의 옵션을 트리에 깊은 병합.
     *
     * @param tree 기존 트리
     * @param app 앱 식별자
     * @param options 병합할 옵션
     * @return 병합된 새 트리
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static ConfigTree merge(ConfigTree tree, Identifier app, OptionList options) {
        if (tree == null) {
            throw new IllegalArgumentException("tree cannot be null");
        }
        if (app == null) {
            throw new IllegalArgumentException("app cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        OptionList existing = tree.get(app).orElse(OptionList.empty());
        return tree.with(app, mergeOptions(existing, options));
    }

    /**
     * 두 트리를 앱 단위로 깊은 병합.
     *
     * @param base 기존 트리
     * @param incoming 덮어쓸 트리
     * @return 병합된 새 트리
     */
    public static ConfigTree merge(ConfigTree base, ConfigTree incoming) {
        ConfigTree result = base;
        for (Map.Entry<Identifier, OptionList> entry : incoming.asMap().entrySet()) {
            result = merge(result, entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * 옵션 목록 키 단위 깊은 병합.
     *
     * @param existing 기존 옵션
     * @param incoming 새 옵션
     * @return 병합된 옵션
     */
    public static OptionList mergeOptions(OptionList existing, OptionList incoming) {
        if (existing == null || incoming == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (existing.isEmpty()) {
            return incoming;
        }
        if (incoming.isEmpty()) {
            return existing;
        }
        Map<Identifier, Literal> merged = new LinkedHashMap<>(existing.toMap());
        for (Option option : incoming.options()) {
            merged.merge(option.key(), option.value(), TreeMerger::mergeValues);
        }
        return OptionList.fromMap(merged);
    }

    private static Literal mergeValues(Literal existing, Literal incoming) {
        if (existing instanceof OptionList left && incoming instanceof OptionList right) {
            return mergeOptions(left, right);
        }
        return incoming;
    }

    /**
     * 경로를 따라 값을 단일 키 OptionList로 중첩.
     *
     * <p>{@code nest([url, port], 4444)} → {@code [url: [port: 4444]]}</p>
     *
     * @param path 옵션 경로 (1개 이상)
     * @param value 말단 값
     * @return 중첩된 OptionList
     * @throws IllegalArgumentException path가 비어 있거나 value가 null인 경우
     */
    public static OptionList nest(List<? extends Identifier> path, Literal value) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path cannot be null or empty");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        OptionList nested = OptionList.of(path.get(path.size() - 1), value);
        for (int i = path.size() - 2; i >= 0; i--) {
            nested = OptionList.of(path.get(i), nested);
        }
        return nested;
    }

    /**
     * 앱을 키로 하는 리터럴을 ConfigTree로 변환.
     *
     * <p>허용하는 형태는 빈 리스트, 또는 값이 모두 OptionList(빈 리스트 포함)인 OptionList입니다.
     * 같은 앱이 여러 번 나오면 순서대로 깊은 병합됩니다.</p>
     *
     * @param literal 변환할 리터럴
     * @return ConfigTree
     * @throws BadInputException 앱을 키로 하는 형태가 아닌 경우
     */
    public static ConfigTree toTree(Literal literal) {
        ConfigTree tree = ConfigTree.empty();
        for (Option option : appEntries(literal)) {
            tree = merge(tree, option.key(), appOptions(option));
        }
        return tree;
    }

    static List<Option> appEntries(Literal literal) {
        if (literal == null) {
            throw new BadInputException("config cannot be null");
        }
        if (literal instanceof ListLiteral list && list.isEmpty()) {
            return List.of();
        }
        if (!(literal instanceof OptionList apps)) {
            throw new BadInputException("config must be a list of app options, got: " + literal);
        }
        return apps.options();
    }

    static OptionList appOptions(Option option) {
        Literal value = option.value();
        if (value instanceof OptionList options) {
            return options;
        }
        if (value instanceof ListLiteral list && list.isEmpty()) {
            return OptionList.empty();
        }
        throw new BadInputException("options of app " + option.key().text() + " must be a keyword list, got: " + value);
    }
}
