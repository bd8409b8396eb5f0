package com.ryuqq.smuggler.core.codec;

import com.ryuqq.smuggler.core.config.SmugglerConfig;
import com.ryuqq.smuggler.core.error.BadKeyException;
import com.ryuqq.smuggler.core.model.Identifier;

import java.util.ArrayList;
import java.util.List;

/**
 * 인코딩 키에 포함된 네임스페이스 경로 코덱.
 *
 * <p>키 형식: {@code <tag>-<segment>(-<segment>)*}</p>
 *
 * <p><strong>예시 (tag = "elixir"):</strong></p>
 * <pre>
 * encode([:api, Api.Repo, :priv])  → "elixir-api-Api.Repo-priv"
 * decode("elixir-api-Api.Repo-priv") → [:api, Api.Repo, :priv]
 * </pre>
 *
 * <p>세그먼트의 분류(Symbol / QualifiedName)는 {@link Identifier#parse(String)}가
 * 첫 글자의 대소문자로 결정합니다.</p>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public final class PathCodec {

    public static final char SEPARATOR = '-';

    private final String tag;
    private final String prefix;

    /**
     * 기본 태그("elixir")로 생성.
     */
    public PathCodec() {
        this(SmugglerConfig.DEFAULT_NAMESPACE_TAG);
    }

    /**
     * 생성자.
     *
     * @param tag 네임스페이스 태그
     * @throws IllegalArgumentException tag가 비어 있거나 구분자를 포함한 경우
     */
    public PathCodec(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("tag cannot be null or blank");
        }
        if (tag.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("tag cannot contain separator '" + SEPARATOR + "': " + tag);
        }
        this.tag = tag;
        this.prefix = tag + SEPARATOR;
    }

    public String tag() {
        return tag;
    }

    /**
     * 세그먼트 목록을 키로 인코딩.
     *
     * @param segments 경로 세그먼트 (1개 이상)
     * @return 인코딩된 키
     * @throws IllegalArgumentException segments가 null이거나 비어 있는 경우
     */
    public String encode(List<? extends Identifier> segments) {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("segments cannot be null or empty");
        }
        StringBuilder key = new StringBuilder(prefix);
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) {
                key.append(SEPARATOR);
            }
            key.append(segments.get(i).text());
        }
        return key.toString();
    }

    /**
     * 키를 세그먼트 목록으로 디코딩.
     *
     * @param text 인코딩된 키
     * @return 경로 세그먼트 (1개 이상)
     * @throws BadKeyException 태그로 시작하지 않거나, 빈 세그먼트가 있거나, 유효한 식별자가 아닌 세그먼트가 있는 경우
     */
    public List<Identifier> decode(String text) {
        if (text == null) {
            throw new BadKeyException("key cannot be null");
        }
        if (!text.startsWith(prefix)) {
            throw new BadKeyException("key does not start with '" + prefix + "': " + text);
        }
        String[] pieces = text.substring(prefix.length()).split(String.valueOf(SEPARATOR), -1);
        List<Identifier> segments = new ArrayList<>(pieces.length);
        for (String piece : pieces) {
            if (piece.isEmpty()) {
                throw new BadKeyException("key contains an empty path segment: " + text);
            }
            try {
                segments.add(Identifier.parse(piece));
            } catch (IllegalArgumentException e) {
                throw new BadKeyException("key contains an invalid segment '" + piece + "': " + text, e);
            }
        }
        return segments;
    }

    /**
     * 키를 앱과 옵션 경로로 디코딩.
     *
     * @param text 인코딩된 키
     * @return 앱 + 옵션 경로 (경로는 1개 이상)
     * @throws BadKeyException {@link #decode(String)} 실패 또는 옵션 경로가 없는 경우
     */
    public EntryPath decodeEntryPath(String text) {
        List<Identifier> segments = decode(text);
        if (segments.size() < 2) {
            throw new BadKeyException("key names an app but no option path: " + text);
        }
        return new EntryPath(segments.get(0), segments.subList(1, segments.size()));
    }
}
