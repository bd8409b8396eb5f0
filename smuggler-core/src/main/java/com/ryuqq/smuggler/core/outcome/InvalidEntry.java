package com.ryuqq.smuggler.core.outcome;

import com.ryuqq.smuggler.core.error.ErrorKind;

/**
 * 디코딩할 수 없는 항목.
 *
 * @param key 원본 인코딩 키
 * @param value 원본 인코딩 값
 * @param kind 오류 종류 (BAD_KEY 또는 BAD_VALUE)
 * @param reason 사람이 읽을 수 있는 원인
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record InvalidEntry(
    String key,
    String value,
    ErrorKind kind,
    String reason
) implements EntryOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 항목 단위 오류가 아닌 경우
     */
    public InvalidEntry {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (!kind.isEntryScoped()) {
            throw new IllegalArgumentException("kind must be BAD_KEY or BAD_VALUE (current: " + kind + ")");
        }
        if (reason == null || reason.isBlank()) {
            reason = kind.description();
        }
    }

    public static InvalidEntry of(String key, String value, ErrorKind kind, String reason) {
        return new InvalidEntry(key, value, kind, reason);
    }

    public static InvalidEntry badKey(String key, String value, String reason) {
        return new InvalidEntry(key, value, ErrorKind.BAD_KEY, reason);
    }

    public static InvalidEntry badValue(String key, String value, String reason) {
        return new InvalidEntry(key, value, ErrorKind.BAD_VALUE, reason);
    }
}
