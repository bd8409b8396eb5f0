package com.ryuqq.smuggler.core.codec;

/**
 * 렉서가 생성한 토큰.
 *
 * @param type 토큰 종류
 * @param text 토큰 내용 (STRING은 이스케이프 해제된 값, SYMBOL/KEY는 이름)
 * @param position 입력 내 시작 위치 (0부터)
 */
record Token(TokenType type, String text, int position) {

    String describe() {
        return switch (type) {
            case INTEGER, FLOAT, QUALIFIED_NAME, BARE_WORD -> type.display() + " '" + text + "'";
            case SYMBOL -> "symbol ':" + text + "'";
            case KEY -> "option key '" + text + ":'";
            default -> type.display();
        };
    }
}
