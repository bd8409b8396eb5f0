package com.ryuqq.smuggler.application.environment;

import com.ryuqq.smuggler.application.smuggler.DecodeResult;
import com.ryuqq.smuggler.application.smuggler.Smuggler;
import com.ryuqq.smuggler.core.error.BadInputException;
import com.ryuqq.smuggler.core.model.ConfigTree;
import com.ryuqq.smuggler.core.model.Identifier;
import com.ryuqq.smuggler.core.model.Literal;
import com.ryuqq.smuggler.core.model.OptionList;
import com.ryuqq.smuggler.core.outcome.InvalidEntry;
import com.ryuqq.smuggler.core.spi.Environment;
import com.ryuqq.smuggler.core.transform.TreeMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 디코딩된 설정을 {@link Environment}에 적용.
 *
 * <p>각 앱의 최상위 키마다 현재 값을 읽어 깊은 병합한 뒤 기록합니다.
 * 현재 값과 새 값이 모두 OptionList이면 {@link TreeMerger#mergeOptions}로 병합하고,
 * 그 외에는 새 값으로 교체합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * EnvironmentApplier applier = new EnvironmentApplier(environment, smuggler);
 * ApplyReport report = applier.applyEncoded(System.getenv());
 * </pre>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public final class EnvironmentApplier {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentApplier.class);
    private final Environment environment;
    private final Smuggler smuggler;

    /**
     * 생성자.
     *
     * @param environment 적용 대상 환경
     * @param smuggler 디코딩에 사용할 Smuggler
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EnvironmentApplier(Environment environment, Smuggler smuggler) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (smuggler == null) {
            throw new IllegalArgumentException("smuggler cannot be null");
        }
        this.environment = environment;
        this.smuggler = smuggler;
    }

    /**
     * 설정 트리 적용.
     *
     * @param tree 적용할 트리
     * @return 적용 결과
     * @throws BadInputException tree가 null인 경우
     */
    public ApplyReport applyDecoded(ConfigTree tree) {
        if (tree == null) {
            throw new BadInputException("config tree cannot be null");
        }
        int applied = 0;
        for (Map.Entry<Identifier, OptionList> app : tree.asMap().entrySet()) {
            for (Map.Entry<Identifier, Literal> option : app.getValue().toMap().entrySet()) {
                Literal merged = mergeWithCurrent(app.getKey(), option.getKey(), option.getValue());
                environment.set(app.getKey(), option.getKey(), merged);
                applied++;
            }
        }
        log.debug("Applied {} options across {} apps", applied, tree.size());
        return new ApplyReport(applied, List.of());
    }

    /**
     * 평탄한 맵을 디코딩하여 적용.
     *
     * <p>잘못된 항목은 건너뛰고 경고 로그와 함께 결과에 포함됩니다.</p>
     *
     * @param encoded 인코딩된 키 → 값 맵
     * @return 적용 결과
     * @throws BadInputException encoded가 null이거나 null 키/값을 포함한 경우
     */
    public ApplyReport applyEncoded(Map<String, String> encoded) {
        return applyResult(smuggler.decodeAndMerge(encoded));
    }

    /**
     * 입력 타입에 따라 적용.
     *
     * <ul>
     *   <li>{@link ConfigTree}: 그대로 적용</li>
     *   <li>{@link Literal}: 앱을 키로 하는 리터럴을 트리로 변환하여 적용</li>
     *   <li>{@link Map}: 인코딩된 맵으로 디코딩하여 적용</li>
     * </ul>
     *
     * @param config 적용할 설정
     * @return 적용 결과
     * @throws BadInputException 지원하지 않는 입력인 경우
     */
    public ApplyReport apply(Object config) {
        if (config instanceof ConfigTree tree) {
            return applyDecoded(tree);
        }
        if (config instanceof Literal literal) {
            return applyDecoded(TreeMerger.toTree(literal));
        }
        if (config instanceof Map<?, ?>) {
            return applyResult(smuggler.decodeUntyped(config));
        }
        throw new BadInputException("cannot apply config of type "
            + (config == null ? "null" : config.getClass().getName()));
    }

    private ApplyReport applyResult(DecodeResult result) {
        for (InvalidEntry entry : result.invalidEntries()) {
            log.warn("Skipping {} for {}: {}", entry.kind().description(), entry.key(), entry.reason());
        }
        ApplyReport applied = applyDecoded(result.tree());
        return new ApplyReport(applied.appliedOptions(), result.invalidEntries());
    }

    private Literal mergeWithCurrent(Identifier app, Identifier key, Literal incoming) {
        Optional<Literal> current = environment.get(app, key);
        if (current.isPresent() && current.get() instanceof OptionList existing && incoming instanceof OptionList options) {
            return TreeMerger.mergeOptions(existing, options);
        }
        return incoming;
    }
}
