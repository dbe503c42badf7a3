package com.challenges.tslgen.generator;

/**
 * Tunables for a {@link FrameGenerator} run.
 *
 * @param maxSteps upper bound on recursive search visits while enumerating normal
 *                 frames; {@code 0} disables the bound
 */
public record GeneratorOptions(long maxSteps) {
    public static final long DEFAULT_MAX_STEPS = 10_000_000L;

    public GeneratorOptions {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must be >= 0, was " + maxSteps);
        }
    }

    public static GeneratorOptions defaults() {
        return new GeneratorOptions(DEFAULT_MAX_STEPS);
    }

    public static GeneratorOptions unbounded() {
        return new GeneratorOptions(0);
    }

    public boolean isBounded() {
        return maxSteps > 0;
    }
}
