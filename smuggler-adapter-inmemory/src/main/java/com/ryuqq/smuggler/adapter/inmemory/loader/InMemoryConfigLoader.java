package com.ryuqq.smuggler.adapter.inmemory.loader;

import com.ryuqq.smuggler.core.error.LoadException;
import com.ryuqq.smuggler.core.model.ConfigTree;
import com.ryuqq.smuggler.core.spi.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ConfigLoader} SPI.
 *
 * <p>Sources are registered up front by name; loading an unknown source fails with
 * {@link LoadException}.</p>
 *
 * <pre>
 * InMemoryConfigLoader loader = new InMemoryConfigLoader()
 *     .register("config/prod", tree);
 * Map&lt;String, String&gt; flat = smuggler.encode(loader, "config/prod");
 * </pre>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public class InMemoryConfigLoader implements ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConfigLoader.class);

    private final ConcurrentHashMap<String, ConfigTree> sources = new ConcurrentHashMap<>();

    /**
     * Registers (or replaces) a source.
     *
     * @param source source name
     * @param tree tree returned for that source
     * @return this loader
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryConfigLoader register(String source, ConfigTree tree) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (tree == null) {
            throw new IllegalArgumentException("tree cannot be null");
        }
        sources.put(source, tree);
        return this;
    }

    @Override
    public ConfigTree load(String source) {
        if (source == null) {
            throw new LoadException("source cannot be null");
        }
        ConfigTree tree = sources.get(source);
        if (tree == null) {
            throw new LoadException("no config registered for source: " + source);
        }
        log.debug("Loaded source {} ({} apps)", source, tree.size());
        return tree;
    }

    public void clear() {
        sources.clear();
    }
}
