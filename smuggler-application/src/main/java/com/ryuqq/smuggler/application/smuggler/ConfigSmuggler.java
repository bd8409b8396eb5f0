package com.ryuqq.smuggler.application.smuggler;

import com.ryuqq.smuggler.core.codec.PathCodec;
import com.ryuqq.smuggler.core.codec.ValueCodec;
import com.ryuqq.smuggler.core.config.SmugglerConfig;
import com.ryuqq.smuggler.core.error.BadInputException;
import com.ryuqq.smuggler.core.error.LoadException;
import com.ryuqq.smuggler.core.model.ConfigTree;
import com.ryuqq.smuggler.core.model.Literal;
import com.ryuqq.smuggler.core.spi.ConfigLoader;
import com.ryuqq.smuggler.core.transform.EntryDecoder;
import com.ryuqq.smuggler.core.transform.TreeFlattener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * {@link Smuggler} 기본 구현.
 *
 * <p>설정에서 코덱을 구성하고 인코딩은 {@link TreeFlattener}, 디코딩은
 * {@link DecodeOrchestrator}, 문장 인코딩은 {@link StatementEncoder}에 위임합니다.
 * 상태가 없으므로 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public final class ConfigSmuggler implements Smuggler {

    private static final Logger log = LoggerFactory.getLogger(ConfigSmuggler.class);
    private final SmugglerConfig config;
    private final PathCodec pathCodec;
    private final ValueCodec valueCodec;
    private final TreeFlattener flattener;
    private final DecodeOrchestrator decodeOrchestrator;
    private final StatementEncoder statementEncoder;

    /**
     * 기본 설정으로 생성.
     */
    public ConfigSmuggler() {
        this(new SmugglerConfig());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ConfigSmuggler(SmugglerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.pathCodec = new PathCodec(config.namespaceTag());
        this.valueCodec = new ValueCodec(config.maxNestingDepth());
        this.flattener = new TreeFlattener(pathCodec, valueCodec);
        this.decodeOrchestrator = new DecodeOrchestrator(new EntryDecoder(pathCodec, valueCodec), config);
        this.statementEncoder = new StatementEncoder(valueCodec, flattener);
    }

    @Override
    public Map<String, String> encode(ConfigTree tree) {
        Map<String, String> flat = flattener.flatten(tree);
        log.debug("Encoded {} apps into {} entries", tree.size(), flat.size());
        return flat;
    }

    @Override
    public Map<String, String> encode(Literal config) {
        return flattener.flatten(config);
    }

    @Override
    public Map<String, String> encode(ConfigLoader loader, String source) {
        if (loader == null) {
            throw new BadInputException("loader cannot be null");
        }
        ConfigTree tree;
        try {
            tree = loader.load(source);
        } catch (LoadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LoadException("failed to load config from " + source + ": " + e.getMessage(), e);
        }
        if (tree == null) {
            throw new LoadException("loader returned no config for " + source);
        }
        log.debug("Loaded {} apps from {}", tree.size(), source);
        return encode(tree);
    }

    @Override
    public Map<String, String> encodeStatement(String statement) {
        return statementEncoder.encode(statement);
    }

    @Override
    public DecodeResult decodeAndMerge(Map<String, String> encoded) {
        return decodeOrchestrator.decodeAndMerge(encoded);
    }

    @Override
    public DecodeResult decodeUntyped(Object encoded) {
        return decodeOrchestrator.decodeUntyped(encoded);
    }

    @Override
    public PathCodec pathCodec() {
        return pathCodec;
    }

    @Override
    public ValueCodec valueCodec() {
        return valueCodec;
    }

    public SmugglerConfig config() {
        return config;
    }
}
