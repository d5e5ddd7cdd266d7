package br.edu.ifba.graphmemory.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Builds {@link GraphMemoryConfig} without a container.
 *
 * <p>Sources, highest priority first: caller overrides, system properties, environment
 * variables, {@code META-INF/microprofile-config.properties}, then the mapping defaults.</p>
 */
public final class GraphMemoryConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(GraphMemoryConfigLoader.class);

    private static final int OVERRIDES_ORDINAL = 500;

    private GraphMemoryConfigLoader() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static GraphMemoryConfig load() {
        return load(Map.of());
    }

    /**
     * Loads and validates the configuration.
     *
     * @param overrides properties such as {@code graph-memory.search.rrf-k}, taking precedence over every other source
     * @return validated configuration
     * @throws IllegalArgumentException if a value is out of range
     */
    @NotNull
    public static GraphMemoryConfig load(@NotNull Map<String, String> overrides) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
            .addDefaultSources()
            .addDiscoveredConverters()
            .withSources(new PropertiesConfigSource(overrides, "graph-memory-overrides", OVERRIDES_ORDINAL))
            .withMapping(GraphMemoryConfig.class)
            .build();

        GraphMemoryConfig mapping = config.getConfigMapping(GraphMemoryConfig.class);
        mapping.validate();
        logger.debug("Loaded graph memory configuration ({} override(s))", overrides.size());
        return mapping;
    }
}
