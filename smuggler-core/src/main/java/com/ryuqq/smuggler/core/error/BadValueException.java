package com.ryuqq.smuggler.core.error;

/**
 * 값 텍스트가 닫힌 리터럴 문법에 맞지 않는 경우.
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public class BadValueException extends SmugglerException {

    public BadValueException(String message) {
        super(ErrorKind.BAD_VALUE, message);
    }

    public BadValueException(String message, Throwable cause) {
        super(ErrorKind.BAD_VALUE, message, cause);
    }
}
