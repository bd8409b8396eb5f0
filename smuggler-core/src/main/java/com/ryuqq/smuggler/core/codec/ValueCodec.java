package com.ryuqq.smuggler.core.codec;

import com.ryuqq.smuggler.core.config.SmugglerConfig;
import com.ryuqq.smuggler.core.error.BadValueException;
import com.ryuqq.smuggler.core.model.Literal;

/**
 * 단일 리터럴 값 코덱.
 *
 * <p>값을 리터럴 표현 언어 텍스트로 인코딩하고, 닫힌 문법으로만 디코딩합니다.
 * 디코딩은 전용 재귀 하강 파서로 수행되며 입력을 평가하거나 실행하는 경로가 없습니다.</p>
 *
 * <p><strong>인코딩 예시:</strong></p>
 * <pre>
 * :info                       → ":info"
 * "hi\"there"                 → "\"hi\\\"there\""
 * MyApp.Endpoint              → "MyApp.Endpoint"
 * [x: 1, y: "two"]            → "[x: 1, y: \"two\"]"
 * {:a, 1}                     → "{:a, 1}"
 * </pre>
 *
 * <p>이 클래스는 상태가 없으며 thread-safe 합니다.</p>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public final class ValueCodec {

    private final int maxNestingDepth;

    /**
     * 기본 최대 중첩 깊이(256)로 생성.
     */
    public ValueCodec() {
        this(SmugglerConfig.DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * 생성자.
     *
     * @param maxNestingDepth 인코딩/디코딩 시 허용하는 최대 컨테이너 중첩 깊이
     * @throws IllegalArgumentException maxNestingDepth가 양수가 아닌 경우
     */
    public ValueCodec(int maxNestingDepth) {
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException(
                "maxNestingDepth must be positive (current: " + maxNestingDepth + ")"
            );
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * 값을 정규 텍스트로 인코딩 (길이/정밀도 손실 없음).
     *
     * <p>디코딩과 같은 최대 중첩 깊이를 적용하므로 인코딩된 값은 항상 다시 디코딩됩니다.</p>
     *
     * @param value 인코딩할 값
     * @return 인코딩된 텍스트
     * @throws IllegalArgumentException value가 null인 경우
     * @throws BadValueException 중첩 깊이가 maxNestingDepth를 넘는 경우
     */
    public String encode(Literal value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return LiteralWriter.write(value, maxNestingDepth);
    }

    /**
     * 텍스트를 하나의 리터럴로 디코딩.
     *
     * @param text 인코딩된 텍스트
     * @return 디코딩된 값
     * @throws BadValueException 텍스트가 닫힌 리터럴 문법에 맞지 않는 경우
     */
    public Literal decode(String text) {
        if (text == null) {
            throw new BadValueException("value cannot be null");
        }
        return new LiteralParser(text, maxNestingDepth).parseValue();
    }

    /**
     * 쉼표로 구분된 인자 목록 디코딩.
     *
     * @param text 인자 텍스트 (예: {@code :my_app, key: :value})
     * @return 위치 인자 + 옵션 쌍
     * @throws BadValueException 텍스트가 문법에 맞지 않는 경우
     */
    public ArgumentList decodeArguments(String text) {
        if (text == null) {
            throw new BadValueException("arguments cannot be null");
        }
        return new LiteralParser(text, maxNestingDepth).parseArguments();
    }
}
