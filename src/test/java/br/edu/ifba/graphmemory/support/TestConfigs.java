package br.edu.ifba.graphmemory.support;

import br.edu.ifba.graphmemory.config.GraphMemoryConfig;
import br.edu.ifba.graphmemory.config.GraphMemoryConfigLoader;

import java.util.HashMap;
import java.util.Map;

/**
 * Configurations with millisecond backoff so retry paths run fast.
 */
public final class TestConfigs {

    private TestConfigs() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static GraphMemoryConfig fast() {
        return fast(Map.of());
    }

    public static GraphMemoryConfig fast(Map<String, String> overrides) {
        Map<String, String> properties = new HashMap<>();
        properties.put("graph-memory.capability.initial-delay-ms", "1");
        properties.put("graph-memory.capability.max-delay-ms", "5");
        properties.put("graph-memory.capability.max-retries", "2");
        properties.putAll(overrides);
        return GraphMemoryConfigLoader.load(properties);
    }
}
