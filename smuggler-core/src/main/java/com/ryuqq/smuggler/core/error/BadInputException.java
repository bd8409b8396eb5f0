package com.ryuqq.smuggler.core.error;

/**
 * 인코딩/디코딩 인자의 형태가 잘못된 경우 (호출 전체 실패).
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public class BadInputException extends SmugglerException {

    public BadInputException(String message) {
        super(ErrorKind.BAD_INPUT, message);
    }

    public BadInputException(String message, Throwable cause) {
        super(ErrorKind.BAD_INPUT, message, cause);
    }
}
