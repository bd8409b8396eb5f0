package com.ryuqq.smuggler.testkit.contract;

import com.ryuqq.smuggler.core.model.BooleanLiteral;
import com.ryuqq.smuggler.core.model.ConfigTree;
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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Short builders for configuration trees used across contract tests.
 *
 * <pre>
 * ConfigTree tree = tree(
 *     "logger", options("level", sym("info")),
 *     "my_app", options("MyApp.Endpoint", options("url", options("port", integer(4444))))
 * );
 * </pre>
 *
 * <p>String keys are classified like encoded key segments: a lowercase first letter makes a
 * {@link Symbol}, an uppercase one a {@link QualifiedName}.</p>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public final class SmugglerFixtures {

    private SmugglerFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Symbol sym(String name) {
        return Symbol.of(name);
    }

    public static QualifiedName mod(String dotted) {
        return QualifiedName.of(dotted);
    }

    public static IntegerLiteral integer(long value) {
        return IntegerLiteral.of(value);
    }

    public static FloatLiteral decimal(String value) {
        return FloatLiteral.of(value);
    }

    public static StringLiteral str(String value) {
        return StringLiteral.of(value);
    }

    public static BooleanLiteral bool(boolean value) {
        return BooleanLiteral.of(value);
    }

    public static NullLiteral nil() {
        return NullLiteral.NIL;
    }

    public static ListLiteral list(Literal... elements) {
        return ListLiteral.of(elements);
    }

    public static TupleLiteral tuple(Literal... elements) {
        return TupleLiteral.of(elements);
    }

    public static Identifier id(String text) {
        return Identifier.parse(text);
    }

    /**
     * Builds an option list from alternating keys and values.
     *
     * @param keysAndValues {@code key1, value1, key2, value2, ...}; keys are {@link String} or {@link Identifier}
     * @return option list in the given order
     */
    public static OptionList options(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("keysAndValues must alternate keys and values");
        }
        List<Option> options = new ArrayList<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            options.add(Option.of(key(keysAndValues[i]), (Literal) keysAndValues[i + 1]));
        }
        return OptionList.of(options);
    }

    /**
     * Builds a tree from alternating apps and option lists.
     *
     * @param appsAndOptions {@code app1, options1, app2, options2, ...}
     * @return configuration tree
     */
    public static ConfigTree tree(Object... appsAndOptions) {
        if (appsAndOptions.length % 2 != 0) {
            throw new IllegalArgumentException("appsAndOptions must alternate apps and option lists");
        }
        Map<Identifier, OptionList> apps = new LinkedHashMap<>();
        for (int i = 0; i < appsAndOptions.length; i += 2) {
            apps.put(key(appsAndOptions[i]), (OptionList) appsAndOptions[i + 1]);
        }
        return ConfigTree.of(apps);
    }

    /**
     * A tree touching every literal kind, nested groups, and two apps.
     *
     * @return sample tree that survives an encode/decode round trip unchanged
     */
    public static ConfigTree sampleTree() {
        return tree(
            "logger", options(
                "level", sym("info"),
                "backends", list(sym("console"))
            ),
            "my_app", options(
                "MyApp.Endpoint", options(
                    "url", options("host", str("localhost"), "port", integer(4444)),
                    "secret_key_base", str("s3cr3t \"quoted\"\nline"),
                    "debug_errors", bool(true)
                ),
                "MyApp.Repo", options(
                    "pool_size", integer(10),
                    "ratio", decimal("0.75"),
                    "password", nil()
                ),
                "hosts", list(str("a.example.com"), str("b.example.com")),
                "pairs", list(tuple(sym("a"), integer(1)), tuple(sym("b"), integer(2))),
                "adapter", mod("Ecto.Adapters.Postgres")
            )
        );
    }

    private static Identifier key(Object key) {
        if (key instanceof Identifier identifier) {
            return identifier;
        }
        if (key instanceof String text) {
            return Identifier.parse(text);
        }
        throw new IllegalArgumentException("key must be a String or Identifier: " + key);
    }
}
