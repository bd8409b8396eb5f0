package com.ryuqq.smuggler.core.transform;

import com.ryuqq.smuggler.core.codec.PathCodec;
import com.ryuqq.smuggler.core.codec.ValueCodec;
import com.ryuqq.smuggler.core.error.BadInputException;
import com.ryuqq.smuggler.core.model.ConfigTree;
import com.ryuqq.smuggler.core.model.Identifier;
import com.ryuqq.smuggler.core.model.Literal;
import com.ryuqq.smuggler.core.model.Option;
import com.ryuqq.smuggler.core.model.OptionList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 설정 트리를 평탄한 문자열 맵으로 변환.
 *
 * <p>중첩 가능한 OptionList 값({@link OptionList#isNestable()})은 경로를 늘려 재귀하고,
 * 그 외의 값은 말단으로 인코딩됩니다.</p>
 *
 * <pre>
 * [my_app: [url: [host: "localhost", port: 4444]]]
 *   → elixir-my_app-url-host => "\"localhost\""
 *   → elixir-my_app-url-port => "4444"
 * </pre>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public final class TreeFlattener {

    private final PathCodec pathCodec;
    private final ValueCodec valueCodec;

    public TreeFlattener(PathCodec pathCodec, ValueCodec valueCodec) {
        if (pathCodec == null) {
            throw new IllegalArgumentException("pathCodec cannot be null");
        }
        if (valueCodec == null) {
            throw new IllegalArgumentException("valueCodec cannot be null");
        }
        this.pathCodec = pathCodec;
        this.valueCodec = valueCodec;
    }

    /**
     * 트리 전체 평탄화.
     *
     * @param tree 설정 트리
     * @return 삽입 순서가 보존된 수정 불가능한 맵
     * @throws BadInputException tree가 null인 경우
     */
    public Map<String, String> flatten(ConfigTree tree) {
        if (tree == null) {
            throw new BadInputException("config tree cannot be null");
        }
        Map<String, String> flat = new LinkedHashMap<>();
        tree.asMap().forEach((app, options) -> collect(flat, List.of(app), options));
        return Collections.unmodifiableMap(flat);
    }

    /**
     * 앱을 키로 하는 리터럴 평탄화.
     *
     * <p>같은 앱이 여러 번 나오면 병합하지 않고 순서대로 평탄화합니다.
     * 평탄화된 키가 겹치면 나중 값이 남습니다.</p>
     *
     * @param config {@code [app: [options...], ...]} 형태의 리터럴
     * @return 평탄화된 맵
     * @throws BadInputException 앱을 키로 하는 형태가 아닌 경우
     */
    public Map<String, String> flatten(Literal config) {
        Map<String, String> flat = new LinkedHashMap<>();
        for (Option app : TreeMerger.appEntries(config)) {
            collect(flat, List.of(app.key()), TreeMerger.appOptions(app));
        }
        return Collections.unmodifiableMap(flat);
    }

    /**
     * 단일 앱의 옵션 평탄화.
     *
     * @param app 앱 식별자
     * @param options 옵션 목록
     * @return 평탄화된 맵
     */
    public Map<String, String> flatten(Identifier app, OptionList options) {
        if (app == null || options == null) {
            throw new BadInputException("app and options cannot be null");
        }
        Map<String, String> flat = new LinkedHashMap<>();
        collect(flat, List.of(app), options);
        return Collections.unmodifiableMap(flat);
    }

    private void collect(Map<String, String> flat, List<Identifier> path, OptionList options) {
        for (Option option : options.options()) {
            List<Identifier> keyPath = new ArrayList<>(path.size() + 1);
            keyPath.addAll(path);
            keyPath.add(option.key());
            Literal value = option.value();
            if (value.isNestedOptions()) {
                collect(flat, keyPath, (OptionList) value);
            } else {
                flat.put(pathCodec.encode(keyPath), valueCodec.encode(value));
            }
        }
    }
}
