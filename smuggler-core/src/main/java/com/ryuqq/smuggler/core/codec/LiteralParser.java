package com.ryuqq.smuggler.core.codec;

import com.ryuqq.smuggler.core.error.BadValueException;
import com.ryuqq.smuggler.core.model.BooleanLiteral;
import com.ryuqq.smuggler.core.model.FloatLiteral;
import com.ryuqq.smuggler.core.model.Identifier;
import com.ryuqq.smuggler.core.model.IntegerLiteral;
import com.ryuqq.smuggler.core.model.ListLiteral;
import com.ryuqq.smuggler.core.model.Literal;
import com.ryuqq.smuggler.core.model.NullLiteral;
import com.ryuqq.smuggler.core.model.Option;
import com.ryuqq.smuggler.core.model.OptionList;
import com.ryuqq.smuggler.core.model.QualifiedName;
import com.ryuqq.smuggler.core.model.StringLiteral;
import com.ryuqq.smuggler.core.model.Symbol;
import com.ryuqq.smuggler.core.model.TupleLiteral;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 닫힌 리터럴 문법에 대한 재귀 하강 파서.
 *
 * <pre>
 * value          := integer | float | "true" | "false" | "nil" | string | symbol
 *                 | qualified_name | list | option_list | tuple
 * list           := "[" (value ("," value)*)? "]"
 * option_list    := "[" pair ("," pair)* "]"
 * pair           := identifier ":" value
 * tuple          := "{" (value ("," value)*)? "}"
 * </pre>
 *
 * <p>문법 밖의 입력(단어, 호출, 연산자 등)은 모두 {@link BadValueException}으로 거부됩니다.
 * 컨테이너 중첩 깊이는 {@code maxDepth}로 제한됩니다.</p>
 */
final class LiteralParser {

    private final LiteralLexer lexer;
    private final int maxDepth;
    private Token current;

    LiteralParser(String input, int maxDepth) {
        this.lexer = new LiteralLexer(input);
        this.maxDepth = maxDepth;
        this.current = lexer.next();
    }

    /**
     * 입력 전체를 하나의 값으로 파싱.
     */
    Literal parseValue() {
        Literal value = value(0);
        expect(TokenType.EOF);
        return value;
    }

    /**
     * 쉼표로 구분된 인자 목록 파싱 (위치 인자 뒤에 선택적 옵션 쌍).
     */
    ArgumentList parseArguments() {
        List<Literal> positional = new ArrayList<>();
        List<Option> options = new ArrayList<>();
        if (current.type() == TokenType.EOF) {
            return new ArgumentList(positional, OptionList.empty());
        }
        do {
            if (current.type() == TokenType.KEY) {
                options.add(pair(0));
            } else if (!options.isEmpty()) {
                throw error("positional argument cannot follow option pairs");
            } else {
                positional.add(value(0));
            }
        } while (accept(TokenType.COMMA));
        expect(TokenType.EOF);
        return new ArgumentList(positional, OptionList.of(options));
    }

    private Literal value(int depth) {
        Token token = current;
        switch (token.type()) {
            case INTEGER -> {
                advance();
                return IntegerLiteral.of(new BigInteger(token.text()));
            }
            case FLOAT -> {
                advance();
                return FloatLiteral.of(decimal(token));
            }
            case TRUE -> {
                advance();
                return BooleanLiteral.TRUE;
            }
            case FALSE -> {
                advance();
                return BooleanLiteral.FALSE;
            }
            case NIL -> {
                advance();
                return NullLiteral.NIL;
            }
            case STRING -> {
                advance();
                return StringLiteral.of(token.text());
            }
            case SYMBOL -> {
                advance();
                return Symbol.of(token.text());
            }
            case QUALIFIED_NAME -> {
                advance();
                return QualifiedName.of(token.text());
            }
            case LBRACKET -> {
                return list(depth + 1);
            }
            case LBRACE -> {
                return tuple(depth + 1);
            }
            case BARE_WORD -> throw error("unexpected " + token.describe() + ", only literal values are allowed");
            default -> throw error("unexpected " + token.describe());
        }
    }

    private Literal list(int depth) {
        checkDepth(depth);
        advance();
        if (accept(TokenType.RBRACKET)) {
            return ListLiteral.empty();
        }
        if (current.type() == TokenType.KEY) {
            List<Option> options = new ArrayList<>();
            do {
                if (current.type() != TokenType.KEY) {
                    throw error("expected option key but found " + current.describe());
                }
                options.add(pair(depth));
            } while (accept(TokenType.COMMA));
            expect(TokenType.RBRACKET);
            return OptionList.of(options);
        }
        List<Literal> elements = new ArrayList<>();
        do {
            if (current.type() == TokenType.KEY) {
                throw error("option pairs cannot be mixed with plain values in a list");
            }
            elements.add(value(depth));
        } while (accept(TokenType.COMMA));
        expect(TokenType.RBRACKET);
        return ListLiteral.of(elements);
    }

    private Literal tuple(int depth) {
        checkDepth(depth);
        advance();
        List<Literal> elements = new ArrayList<>();
        if (!accept(TokenType.RBRACE)) {
            do {
                elements.add(value(depth));
            } while (accept(TokenType.COMMA));
            expect(TokenType.RBRACE);
        }
        return new TupleLiteral(elements);
    }

    private Option pair(int depth) {
        Token key = current;
        advance();
        Identifier identifier;
        try {
            identifier = Identifier.parse(key.text());
        } catch (IllegalArgumentException e) {
            throw new BadValueException("invalid option key '" + key.text() + "' at position " + key.position(), e);
        }
        return Option.of(identifier, value(depth));
    }

    private BigDecimal decimal(Token token) {
        try {
            return new BigDecimal(token.text());
        } catch (NumberFormatException e) {
            throw new BadValueException("float out of range '" + token.text() + "' at position " + token.position(), e);
        }
    }

    private void checkDepth(int depth) {
        if (depth > maxDepth) {
            throw error("nesting exceeds maximum depth " + maxDepth);
        }
    }

    private void advance() {
        current = lexer.next();
    }

    private boolean accept(TokenType type) {
        if (current.type() == type) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(TokenType type) {
        if (current.type() != type) {
            throw error("expected " + type.display() + " but found " + current.describe());
        }
        advance();
    }

    private BadValueException error(String message) {
        return lexer.error(current.position(), message);
    }
}
