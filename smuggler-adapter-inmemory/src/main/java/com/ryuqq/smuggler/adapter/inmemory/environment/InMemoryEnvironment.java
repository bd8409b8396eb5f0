package com.ryuqq.smuggler.adapter.inmemory.environment;

import com.ryuqq.smuggler.core.model.Identifier;
import com.ryuqq.smuggler.core.model.Literal;
import com.ryuqq.smuggler.core.model.OptionList;
import com.ryuqq.smuggler.core.spi.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link Environment} SPI for testing and reference purposes.
 *
 * <p>Each app's options are held as one immutable {@link OptionList}; {@link #set} replaces the
 * list atomically through {@link ConcurrentHashMap#compute}, so concurrent writers to the same app
 * never lose each other's keys.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not shared across JVMs</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryEnvironment environment = new InMemoryEnvironment();
 * EnvironmentApplier applier = new EnvironmentApplier(environment, new ConfigSmuggler());
 * applier.applyEncoded(Map.of("elixir-logger-level", ":info"));
 *
 * environment.get(Symbol.of("logger"), Symbol.of("level")); // Optional[:info]
 * </pre>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public class InMemoryEnvironment implements Environment {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEnvironment.class);

    /**
     * Key: app, Value: that app's options.
     */
    private final ConcurrentHashMap<Identifier, OptionList> apps = new ConcurrentHashMap<>();

    @Override
    public Optional<Literal> get(Identifier app, Identifier key) {
        if (app == null) {
            throw new IllegalArgumentException("app cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        OptionList options = apps.get(app);
        return options == null ? Optional.empty() : options.get(key);
    }

    @Override
    public void set(Identifier app, Identifier key, Literal value) {
        if (app == null) {
            throw new IllegalArgumentException("app cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        apps.compute(app, (ignored, current) ->
            (current == null ? OptionList.empty() : current).with(key, value));
        log.debug("Set {} {} = {}", app.text(), key.text(), value);
    }

    @Override
    public OptionList getAll(Identifier app) {
        if (app == null) {
            throw new IllegalArgumentException("app cannot be null");
        }
        return apps.getOrDefault(app, OptionList.empty());
    }

    /**
     * Apps that hold at least one option.
     *
     * @return snapshot of app identifiers
     */
    public List<Identifier> apps() {
        return List.copyOf(apps.keySet());
    }

    /**
     * Removes every app. For test cleanup.
     */
    public void clear() {
        apps.clear();
    }
}
