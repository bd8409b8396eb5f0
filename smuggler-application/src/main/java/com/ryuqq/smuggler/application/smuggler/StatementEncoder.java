package com.ryuqq.smuggler.application.smuggler;

import com.ryuqq.smuggler.core.codec.ArgumentList;
import com.ryuqq.smuggler.core.codec.ValueCodec;
import com.ryuqq.smuggler.core.error.BadInputException;
import com.ryuqq.smuggler.core.error.BadValueException;
import com.ryuqq.smuggler.core.model.Identifier;
import com.ryuqq.smuggler.core.model.Literal;
import com.ryuqq.smuggler.core.model.OptionList;
import com.ryuqq.smuggler.core.transform.TreeFlattener;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 설정 문장 하나를 평탄한 맵으로 인코딩.
 *
 * <p>지원 형식:</p>
 * <pre>
 * config :my_app, key: :value, other: 1
 * config :my_app, MyApp.Endpoint, url: [port: 4444]
 * config :my_app, [key: :value]
 * </pre>
 *
 * <p>두 번째 형식은 {@code config :my_app, [{MyApp.Endpoint, [url: [port: 4444]]}]}와 같으며,
 * 인자는 {@link ValueCodec}와 같은 닫힌 문법으로만 파싱됩니다.</p>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public final class StatementEncoder {

    private static final String KEYWORD = "config";

    private final ValueCodec valueCodec;
    private final TreeFlattener flattener;

    public StatementEncoder(ValueCodec valueCodec, TreeFlattener flattener) {
        if (valueCodec == null) {
            throw new IllegalArgumentException("valueCodec cannot be null");
        }
        if (flattener == null) {
            throw new IllegalArgumentException("flattener cannot be null");
        }
        this.valueCodec = valueCodec;
        this.flattener = flattener;
    }

    /**
     * 문장 인코딩.
     *
     * @param statement 설정 문장
     * @return 평탄한 키 → 값 맵
     * @throws BadInputException 문장 형식이 잘못된 경우
     */
    public Map<String, String> encode(String statement) {
        if (statement == null) {
            throw new BadInputException("statement cannot be null");
        }
        String text = statement.strip();
        if (!text.startsWith(KEYWORD)
            || text.length() == KEYWORD.length()
            || !Character.isWhitespace(text.charAt(KEYWORD.length()))) {
            throw new BadInputException("statement must start with '" + KEYWORD + " ': " + statement);
        }

        ArgumentList arguments;
        try {
            arguments = valueCodec.decodeArguments(text.substring(KEYWORD.length()));
        } catch (BadValueException e) {
            throw new BadInputException("malformed statement: " + e.getMessage(), e);
        }

        List<Literal> positional = new ArrayList<>(arguments.positional());
        OptionList options = arguments.options();
        if (options.isEmpty() && !positional.isEmpty() && positional.get(positional.size() - 1) instanceof OptionList trailing) {
            positional.remove(positional.size() - 1);
            options = trailing;
        }
        if (options.isEmpty()) {
            throw new BadInputException("statement has no options: " + statement);
        }

        if (positional.size() == 1 && positional.get(0) instanceof Identifier app) {
            return flattener.flatten(app, options);
        }
        if (positional.size() == 2
            && positional.get(0) instanceof Identifier app
            && positional.get(1) instanceof Identifier group) {
            return flattener.flatten(app, OptionList.of(group, options));
        }
        throw new BadInputException("statement must name an app and optionally one group: " + statement);
    }
}
