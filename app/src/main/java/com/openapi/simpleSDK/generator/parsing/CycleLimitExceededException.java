package com.openapi.simpleSDK.generator.parsing;

/**
 * Thrown when the configured {@link ParsingOptions#maxCycles()} limit is exceeded.
 */
public class CycleLimitExceededException extends RuntimeException {
    private final int cycleCount;

    public CycleLimitExceededException(int cycleCount, int limit, String lastCyclePath) {
        super(String.format("Detected %d schema cycles, limit is %d (last cycle: %s)",
            cycleCount, limit, lastCyclePath));
        this.cycleCount = cycleCount;
    }

    public int getCycleCount() {
        return cycleCount;
    }
}
