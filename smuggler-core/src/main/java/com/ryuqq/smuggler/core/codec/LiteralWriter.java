package com.ryuqq.smuggler.core.codec;

import com.ryuqq.smuggler.core.error.BadValueException;
import com.ryuqq.smuggler.core.model.BooleanLiteral;
import com.ryuqq.smuggler.core.model.FloatLiteral;
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
import java.util.List;

/**
 * 리터럴을 정규 텍스트 형태로 출력.
 *
 * <p>출력은 항상 {@link LiteralParser}가 같은 값으로 다시 읽을 수 있습니다.</p>
 */
final class LiteralWriter {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private LiteralWriter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static String write(Literal literal, int maxDepth) {
        StringBuilder out = new StringBuilder();
        append(out, literal, 0, maxDepth);
        return out.toString();
    }

    private static void append(StringBuilder out, Literal literal, int depth, int maxDepth) {
        if (literal instanceof IntegerLiteral integer) {
            out.append(integer.value());
        } else if (literal instanceof FloatLiteral decimal) {
            out.append(formatFloat(decimal.value()));
        } else if (literal instanceof BooleanLiteral bool) {
            out.append(bool.value());
        } else if (literal instanceof NullLiteral) {
            out.append("nil");
        } else if (literal instanceof StringLiteral string) {
            quote(out, string.value());
        } else if (literal instanceof Symbol symbol) {
            out.append(':').append(symbol.name());
        } else if (literal instanceof QualifiedName name) {
            out.append(name.text());
        } else if (literal instanceof ListLiteral list) {
            appendAll(out, '[', list.elements(), ']', checkDepth(depth + 1, maxDepth), maxDepth);
        } else if (literal instanceof OptionList options) {
            appendOptions(out, options, checkDepth(depth + 1, maxDepth), maxDepth);
        } else if (literal instanceof TupleLiteral tuple) {
            appendAll(out, '{', tuple.elements(), '}', checkDepth(depth + 1, maxDepth), maxDepth);
        } else {
            throw new IllegalStateException("Unsupported literal type: " + literal.getClass().getName());
        }
    }

    private static int checkDepth(int depth, int maxDepth) {
        if (depth > maxDepth) {
            throw new BadValueException("nesting exceeds maximum depth " + maxDepth);
        }
        return depth;
    }

    private static void appendAll(StringBuilder out, char open, List<Literal> elements, char close,
                                  int depth, int maxDepth) {
        out.append(open);
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            append(out, elements.get(i), depth, maxDepth);
        }
        out.append(close);
    }

    private static void appendOptions(StringBuilder out, OptionList options, int depth, int maxDepth) {
        out.append('[');
        List<Option> entries = options.options();
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            out.append(entries.get(i).key().text()).append(": ");
            append(out, entries.get(i).value(), depth, maxDepth);
        }
        out.append(']');
    }

    /**
     * 실수는 항상 소수점을 포함하며, 필요하면 {@code e} 지수를 붙입니다 (예: 3.14, 1.0e10).
     */
    static String formatFloat(BigDecimal value) {
        String text = value.toString();
        int e = text.indexOf('E');
        String mantissa = e < 0 ? text : text.substring(0, e);
        String exponent = e < 0 ? "" : text.substring(e + 1);
        if (mantissa.indexOf('.') < 0) {
            mantissa = mantissa + ".0";
        }
        if (exponent.isEmpty()) {
            return mantissa;
        }
        if (exponent.startsWith("+")) {
            exponent = exponent.substring(1);
        }
        return mantissa + "e" + exponent;
    }

    private static void quote(StringBuilder out, String value) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\f' -> out.append("\\f");
                case '\b' -> out.append("\\b");
                case '\u000B' -> out.append("\\v");
                case '\u0007' -> out.append("\\a");
                case '\u001B' -> out.append("\\e");
                case '\0' -> out.append("\\0");
                case '#' -> out.append(i + 1 < value.length() && value.charAt(i + 1) == '{' ? "\\#" : "#");
                default -> {
                    if (c < 0x20 || c == 0x7F) {
                        out.append("\\u00").append(HEX[(c >> 4) & 0xF]).append(HEX[c & 0xF]);
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }
}
