package com.ryuqq.smuggler.core.error;

/**
 * 설정 소스를 읽거나 평가할 수 없는 경우.
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public class LoadException extends SmugglerException {

    public LoadException(String message) {
        super(ErrorKind.LOAD_ERROR, message);
    }

    public LoadException(String message, Throwable cause) {
        super(ErrorKind.LOAD_ERROR, message, cause);
    }
}
