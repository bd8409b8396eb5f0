package com.ryuqq.smuggler.core.codec;

/**
 * 리터럴 표현 언어의 토큰 종류.
 */
enum TokenType {
    LBRACKET("'['"),
    RBRACKET("']'"),
    LBRACE("'{'"),
    RBRACE("'}'"),
    COMMA("','"),
    INTEGER("integer"),
    FLOAT("float"),
    STRING("string"),
    SYMBOL("symbol"),
    QUALIFIED_NAME("qualified name"),
    KEY("option key"),
    TRUE("true"),
    FALSE("false"),
    NIL("nil"),
    BARE_WORD("bare word"),
    EOF("end of input");

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    String display() {
        return display;
    }
}
