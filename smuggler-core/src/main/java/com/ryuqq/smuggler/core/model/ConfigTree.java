package com.ryuqq.smuggler.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 앱 식별자 → 옵션 목록 매핑 (계층형 설정 트리).
 *
 * <p>ConfigTree는 불변이며, 변경 메서드는 항상 새 인스턴스를 반환합니다.
 * 앱 순서는 보존되지만 동등성 비교에는 영향을 주지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ConfigTree tree = ConfigTree.empty()
 *     .with(Symbol.of("logger"), OptionList.of(Symbol.of("level"), Symbol.of("info")))
 *     .with(Symbol.of("my_app"), OptionList.of(Symbol.of("key"), StringLiteral.of("value")));
 * </pre>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public final class ConfigTree {

    private static final ConfigTree EMPTY = new ConfigTree(Map.of());

    private final Map<Identifier, OptionList> apps;

    private ConfigTree(Map<Identifier, OptionList> apps) {
        this.apps = apps;
    }

    public static ConfigTree empty() {
        return EMPTY;
    }

    /**
     * 단일 앱 ConfigTree 생성.
     *
     * @param app 앱 식별자
     * @param options 옵션 목록
     * @return ConfigTree 인스턴스
     */
    public static ConfigTree of(Identifier app, OptionList options) {
        return EMPTY.with(app, options);
    }

    /**
     * 순서 보존 맵에서 ConfigTree 생성.
     *
     * @param apps 앱 → 옵션 목록 맵
     * @return ConfigTree 인스턴스
     * @throws IllegalArgumentException apps가 null이거나 null 키/값을 포함한 경우
     */
    public static ConfigTree of(Map<? extends Identifier, OptionList> apps) {
        if (apps == null) {
            throw new IllegalArgumentException("apps cannot be null");
        }
        Map<Identifier, OptionList> copy = new LinkedHashMap<>();
        apps.forEach((app, options) -> {
            if (app == null || options == null) {
                throw new IllegalArgumentException("apps cannot contain null app or options");
            }
            copy.put(app, options);
        });
        return copy.isEmpty() ? EMPTY : new ConfigTree(Collections.unmodifiableMap(copy));
    }

    /**
     * 앱의 옵션 목록을 설정한 새 ConfigTree 반환 (기존 값은 교체).
     *
     * @param app 앱 식별자
     * @param options 옵션 목록
     * @return 새 ConfigTree 인스턴스
     */
    public ConfigTree with(Identifier app, OptionList options) {
        if (app == null) {
            throw new IllegalArgumentException("app cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        Map<Identifier, OptionList> copy = new LinkedHashMap<>(apps);
        copy.put(app, options);
        return new ConfigTree(Collections.unmodifiableMap(copy));
    }

    public Optional<OptionList> get(Identifier app) {
        return Optional.ofNullable(apps.get(app));
    }

    public boolean contains(Identifier app) {
        return apps.containsKey(app);
    }

    public List<Identifier> apps() {
        return List.copyOf(apps.keySet());
    }

    /**
     * 앱 → 옵션 목록 맵.
     *
     * @return 수정 불가능한 순서 보존 맵
     */
    public Map<Identifier, OptionList> asMap() {
        return apps;
    }

    public int size() {
        return apps.size();
    }

    public boolean isEmpty() {
        return apps.isEmpty();
    }

    /**
     * 앱을 키로 하는 OptionList 리터럴로 변환.
     *
     * @return {@code [app: [options...], ...]} 형태의 OptionList
     */
    public OptionList toLiteral() {
        return OptionList.fromMap(apps);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConfigTree that = (ConfigTree) o;
        return apps.equals(that.apps);
    }

    @Override
    public int hashCode() {
        return apps.hashCode();
    }

    @Override
    public String toString() {
        return "ConfigTree" + apps;
    }
}
