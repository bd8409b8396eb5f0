package com.ryuqq.smuggler.core.error;

/**
 * 인코딩된 키를 경로로 디코딩할 수 없는 경우.
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public class BadKeyException extends SmugglerException {

    public BadKeyException(String message) {
        super(ErrorKind.BAD_KEY, message);
    }

    public BadKeyException(String message, Throwable cause) {
        super(ErrorKind.BAD_KEY, message, cause);
    }
}
