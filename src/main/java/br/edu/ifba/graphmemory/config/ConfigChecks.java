package br.edu.ifba.graphmemory.config;

/**
 * Range checks shared by {@link GraphMemoryConfig#validate()}.
 */
final class ConfigChecks {

    private ConfigChecks() {
        throw new UnsupportedOperationException("Utility class");
    }

    static void requireUnit(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(String.format("%s must be in [0.0, 1.0], got %.3f", name, value));
        }
    }

    static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(String.format("%s must be > 0, got %d", name, value));
        }
    }
}
