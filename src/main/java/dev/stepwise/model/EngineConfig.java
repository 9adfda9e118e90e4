package dev.stepwise.model;

/**
 * Engine limits. {@code maxIterations} is the hard cap on rule applications per run; it stops
 * rule sets that would otherwise keep firing forever.
 */
public record EngineConfig(
    int maxIterations
) {
    public static final int DEFAULT_MAX_ITERATIONS = 64;

    public EngineConfig {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_MAX_ITERATIONS);
    }

    public EngineConfig withMaxIterations(int newMaxIterations) {
        return new EngineConfig(newMaxIterations);
    }
}
