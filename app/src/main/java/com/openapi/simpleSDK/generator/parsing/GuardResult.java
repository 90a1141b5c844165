package com.openapi.simpleSDK.generator.parsing;

import com.openapi.simpleSDK.generator.ir.IRSchema;

/**
 * Outcome of entering a schema node: either the resolver may proceed, or it must return the
 * supplied placeholder instead of recursing.
 */
public record GuardResult(Outcome outcome, IRSchema placeholder, String path) {

    public enum Outcome {
        ENTERED,
        CYCLE_HIT,
        DEPTH_EXCEEDED
    }

    public static GuardResult entered() {
        return new GuardResult(Outcome.ENTERED, null, null);
    }

    public static GuardResult cycleHit(IRSchema placeholder, String path) {
        return new GuardResult(Outcome.CYCLE_HIT, placeholder, path);
    }

    public static GuardResult depthExceeded(IRSchema placeholder, String path) {
        return new GuardResult(Outcome.DEPTH_EXCEEDED, placeholder, path);
    }
}
