package com.challenges.tslgen.generator;

/**
 * Thrown when normal-frame enumeration visits more search states than
 * {@link GeneratorOptions#maxSteps()} allows. No frames are returned in that case.
 */
public class GenerationLimitExceededException extends RuntimeException {
    private final long maxSteps;

    public GenerationLimitExceededException(long maxSteps) {
        super("Frame generation exceeded the step budget of " + maxSteps
                + " search steps; raise --max-steps or add constraints to the specification");
        this.maxSteps = maxSteps;
    }

    public long maxSteps() {
        return maxSteps;
    }
}
