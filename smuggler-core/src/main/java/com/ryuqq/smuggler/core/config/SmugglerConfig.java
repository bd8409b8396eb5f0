package com.ryuqq.smuggler.core.config;

/**
 * Smuggler 설정 (불변 record).
 *
 * <p>이 record는 키 인코딩, 값 파싱, 디코딩 병렬화를 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>namespaceTag: 모든 인코딩 키의 접두 태그 (기본 "elixir")</li>
 *   <li>maxNestingDepth: 값 파싱 시 허용하는 최대 중첩 깊이 (기본 256)</li>
 *   <li>parallelDecode: 항목별 디코딩 단계의 병렬 실행 여부 (기본 false)</li>
 *   <li>parallelThreshold: 병렬 디코딩을 시작하는 최소 항목 수 (기본 1024)</li>
 * </ul>
 *
 * <p>병렬 디코딩을 켜더라도 병합 단계는 항상 키 순서대로 순차 실행되므로
 * 결과는 동일합니다.</p>
 *
 * @author Smuggler Team
 * @since 1.0.0
 * @param namespaceTag 키 접두 태그 (비어 있지 않고 '-'를 포함하지 않아야 함)
 * @param maxNestingDepth 최대 중첩 깊이 (1 이상)
 * @param parallelDecode 병렬 디코딩 여부
 * @param parallelThreshold 병렬 디코딩 최소 항목 수 (1 이상)
 */
public record SmugglerConfig(
    String namespaceTag,
    int maxNestingDepth,
    boolean parallelDecode,
    int parallelThreshold
) {

    public static final String DEFAULT_NAMESPACE_TAG = "elixir";
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;
    public static final int DEFAULT_PARALLEL_THRESHOLD = 1024;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: namespaceTag="elixir", maxNestingDepth=256, parallelDecode=false, parallelThreshold=1024</p>
     */
    public SmugglerConfig() {
        this(DEFAULT_NAMESPACE_TAG, DEFAULT_MAX_NESTING_DEPTH, false, DEFAULT_PARALLEL_THRESHOLD);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SmugglerConfig {
        if (namespaceTag == null || namespaceTag.isBlank()) {
            throw new IllegalArgumentException("namespaceTag cannot be null or blank");
        }
        if (namespaceTag.indexOf('-') >= 0) {
            throw new IllegalArgumentException(
                "namespaceTag cannot contain the path separator '-' (current: " + namespaceTag + ")"
            );
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException(
                "maxNestingDepth must be positive (current: " + maxNestingDepth + ")"
            );
        }
        if (parallelThreshold <= 0) {
            throw new IllegalArgumentException(
                "parallelThreshold must be positive (current: " + parallelThreshold + ")"
            );
        }
    }

    public SmugglerConfig withNamespaceTag(String namespaceTag) {
        return new SmugglerConfig(namespaceTag, this.maxNestingDepth, this.parallelDecode, this.parallelThreshold);
    }

    public SmugglerConfig withMaxNestingDepth(int maxNestingDepth) {
        return new SmugglerConfig(this.namespaceTag, maxNestingDepth, this.parallelDecode, this.parallelThreshold);
    }

    public SmugglerConfig withParallelDecode(boolean parallelDecode) {
        return new SmugglerConfig(this.namespaceTag, this.maxNestingDepth, parallelDecode, this.parallelThreshold);
    }

    public SmugglerConfig withParallelThreshold(int parallelThreshold) {
        return new SmugglerConfig(this.namespaceTag, this.maxNestingDepth, this.parallelDecode, parallelThreshold);
    }
}
