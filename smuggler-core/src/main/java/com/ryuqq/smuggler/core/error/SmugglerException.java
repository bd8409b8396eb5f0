package com.ryuqq.smuggler.core.error;

/**
 * 모든 Smuggler 오류의 상위 예외.
 *
 * <p>각 예외는 {@link ErrorKind}를 가지며, 호출자는 예외 타입 또는 {@link #kind()}로
 * 오류를 구분할 수 있습니다.</p>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public class SmugglerException extends RuntimeException {

    private final ErrorKind kind;

    public SmugglerException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public SmugglerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
