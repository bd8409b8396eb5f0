package com.ryuqq.smuggler.core.codec;

import com.ryuqq.smuggler.core.error.BadValueException;

/**
 * 리터럴 표현 언어 렉서.
 *
 * <p>입력을 한 번만 앞으로 읽으며 토큰을 생성합니다. 문자열 보간({@code #{...}})처럼
 * 실행 가능한 구문은 토큰화 단계에서 거부합니다.</p>
 */
final class LiteralLexer {

    private final String input;
    private int pos;

    LiteralLexer(String input) {
        this.input = input;
    }

    Token next() {
        skipWhitespace();
        if (pos >= input.length()) {
            return new Token(TokenType.EOF, "", pos);
        }
        int start = pos;
        char c = input.charAt(pos);
        if (c == '[') {
            return single(TokenType.LBRACKET, start);
        }
        if (c == ']') {
            return single(TokenType.RBRACKET, start);
        }
        if (c == '{') {
            return single(TokenType.LBRACE, start);
        }
        if (c == '}') {
            return single(TokenType.RBRACE, start);
        }
        if (c == ',') {
            return single(TokenType.COMMA, start);
        }
        if (c == '"') {
            return string(start);
        }
        if (c == ':') {
            return symbol(start);
        }
        if (c == '-' || isDigit(c)) {
            return number(start);
        }
        if (isLower(c)) {
            return word(start);
        }
        if (isUpper(c)) {
            return qualifiedName(start);
        }
        throw error(start, "unexpected character '" + c + "'");
    }

    private Token single(TokenType type, int start) {
        pos++;
        return new Token(type, input.substring(start, pos), start);
    }

    private Token symbol(int start) {
        pos++;
        if (pos >= input.length() || !isLower(input.charAt(pos))) {
            throw error(start, "expected a lowercase symbol name after ':'");
        }
        int nameStart = pos;
        readIdentifier();
        return new Token(TokenType.SYMBOL, input.substring(nameStart, pos), start);
    }

    private Token word(int start) {
        readIdentifier();
        String text = input.substring(start, pos);
        if (atKeyColon()) {
            pos++;
            return new Token(TokenType.KEY, text, start);
        }
        switch (text) {
            case "true":
                return new Token(TokenType.TRUE, text, start);
            case "false":
                return new Token(TokenType.FALSE, text, start);
            case "nil":
                return new Token(TokenType.NIL, text, start);
            default:
                return new Token(TokenType.BARE_WORD, text, start);
        }
    }

    private Token qualifiedName(int start) {
        readSegment();
        while (pos + 1 < input.length() && input.charAt(pos) == '.' && isUpper(input.charAt(pos + 1))) {
            pos++;
            readSegment();
        }
        String text = input.substring(start, pos);
        if (atKeyColon()) {
            pos++;
            return new Token(TokenType.KEY, text, start);
        }
        return new Token(TokenType.QUALIFIED_NAME, text, start);
    }

    private Token number(int start) {
        if (input.charAt(pos) == '-') {
            pos++;
            if (pos >= input.length() || !isDigit(input.charAt(pos))) {
                throw error(start, "expected a digit after '-'");
            }
        }
        readDigits();
        boolean isFloat = false;
        if (pos + 1 < input.length() && input.charAt(pos) == '.' && isDigit(input.charAt(pos + 1))) {
            isFloat = true;
            pos++;
            readDigits();
            if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
                int exponentStart = pos;
                pos++;
                if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos >= input.length() || !isDigit(input.charAt(pos))) {
                    throw error(exponentStart, "malformed exponent");
                }
                readDigits();
            }
        }
        String text = input.substring(start, pos).replace("_", "");
        return new Token(isFloat ? TokenType.FLOAT : TokenType.INTEGER, text, start);
    }

    private Token string(int start) {
        pos++;
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= input.length()) {
                throw error(start, "unterminated string");
            }
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return new Token(TokenType.STRING, value.toString(), start);
            }
            if (c == '\\') {
                escape(value);
            } else if (c == '#' && pos + 1 < input.length() && input.charAt(pos + 1) == '{') {
                throw error(pos, "string interpolation is not allowed");
            } else {
                value.append(c);
                pos++;
            }
        }
    }

    private void escape(StringBuilder value) {
        int escapeStart = pos;
        pos++;
        if (pos >= input.length()) {
            throw error(escapeStart, "unterminated escape sequence");
        }
        char e = input.charAt(pos++);
        switch (e) {
            case '"' -> value.append('"');
            case '\\' -> value.append('\\');
            case 'n' -> value.append('\n');
            case 'r' -> value.append('\r');
            case 't' -> value.append('\t');
            case 'f' -> value.append('\f');
            case 'b' -> value.append('\b');
            case 'v' -> value.append('\u000B');
            case 'a' -> value.append('\u0007');
            case 'e' -> value.append('\u001B');
            case '0' -> value.append('\0');
            case 's' -> value.append(' ');
            case '#' -> value.append('#');
            case 'u' -> value.appendCodePoint(unicodeEscape(escapeStart));
            default -> throw error(escapeStart, "unknown escape sequence '\\" + e + "'");
        }
    }

    private int unicodeEscape(int escapeStart) {
        if (pos < input.length() && input.charAt(pos) == '{') {
            int close = input.indexOf('}', pos);
            if (close < 0 || close - pos - 1 < 1 || close - pos - 1 > 6) {
                throw error(escapeStart, "malformed unicode escape");
            }
            int codePoint = parseHex(input.substring(pos + 1, close), escapeStart);
            if (!Character.isValidCodePoint(codePoint)) {
                throw error(escapeStart, "invalid code point in unicode escape");
            }
            pos = close + 1;
            return codePoint;
        }
        if (pos + 4 > input.length()) {
            throw error(escapeStart, "malformed unicode escape");
        }
        int codeUnit = parseHex(input.substring(pos, pos + 4), escapeStart);
        pos += 4;
        return codeUnit;
    }

    private int parseHex(String digits, int escapeStart) {
        int value = 0;
        for (int i = 0; i < digits.length(); i++) {
            int digit = hexDigit(digits.charAt(i));
            if (digit < 0) {
                throw error(escapeStart, "malformed unicode escape");
            }
            value = value * 16 + digit;
        }
        return value;
    }

    // ASCII only; Character.digit also accepts non-Latin digits
    private static int hexDigit(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    private void readIdentifier() {
        while (pos < input.length() && isIdentifierChar(input.charAt(pos))) {
            pos++;
        }
        if (pos < input.length() && (input.charAt(pos) == '?' || input.charAt(pos) == '!')) {
            pos++;
        }
    }

    private void readSegment() {
        pos++;
        while (pos < input.length() && isIdentifierChar(input.charAt(pos))) {
            pos++;
        }
    }

    // caller guarantees a digit at pos
    private void readDigits() {
        pos++;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (isDigit(c)) {
                pos++;
            } else if (c == '_' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
                pos += 2;
            } else {
                break;
            }
        }
    }

    private boolean atKeyColon() {
        return pos < input.length()
            && input.charAt(pos) == ':'
            && !(pos + 1 < input.length() && input.charAt(pos + 1) == ':');
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLower(char c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isIdentifierChar(char c) {
        return isDigit(c) || isLower(c) || isUpper(c) || c == '_';
    }

    BadValueException error(int position, String message) {
        return new BadValueException(message + " at position " + position);
    }
}
