package com.ryuqq.smuggler.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 대문자로 시작하는 세그먼트들을 점(.)으로 연결한 이름 (예: 네임스페이스가 있는 타입 이름).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>QualifiedName.of("MyApp.Endpoint")</li>
 *   <li>QualifiedName.of("Elixir.MyApp.Repo") - 생태계 접두사 {@code Elixir.}는 제거됨</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>세그먼트 1개 이상</li>
 *   <li>각 세그먼트: 대문자로 시작, 영숫자와 언더스코어만 허용</li>
 * </ul>
 *
 * @param segments 점으로 구분된 세그먼트 목록
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record QualifiedName(List<String> segments) implements Identifier {

    private static final Pattern SEGMENT_PATTERN = Pattern.compile("^[A-Z][A-Za-z0-9_]*$");
    private static final String ECOSYSTEM_PREFIX = "Elixir.";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException segments가 비어 있거나 유효하지 않은 세그먼트가 있는 경우
     */
    public QualifiedName {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("QualifiedName segments cannot be null or empty");
        }
        for (String segment : segments) {
            if (segment == null || !SEGMENT_PATTERN.matcher(segment).matches()) {
                throw new IllegalArgumentException("Invalid qualified name segment: " + segment);
            }
        }
        segments = List.copyOf(segments);
    }

    /**
     * 점 구분 텍스트에서 QualifiedName 생성.
     *
     * @param dotted 점 구분 이름 (예: "MyApp.Endpoint")
     * @return QualifiedName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 이름인 경우
     */
    public static QualifiedName of(String dotted) {
        if (dotted == null || dotted.isEmpty()) {
            throw new IllegalArgumentException("QualifiedName cannot be null or empty");
        }
        String name = dotted.startsWith(ECOSYSTEM_PREFIX) ? dotted.substring(ECOSYSTEM_PREFIX.length()) : dotted;
        return new QualifiedName(Arrays.asList(name.split("\\.", -1)));
    }

    @Override
    public String text() {
        return String.join(".", segments);
    }

    @Override
    public String toString() {
        return text();
    }
}
