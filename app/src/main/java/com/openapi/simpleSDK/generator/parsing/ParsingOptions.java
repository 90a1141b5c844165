package com.openapi.simpleSDK.generator.parsing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tuning knobs for one parsing run.
 *
 * None of these change resolution results, with one exception: a positive {@code maxCycles}
 * aborts the run with {@link CycleLimitExceededException} once more cycles than that have been
 * detected. It exists to stop early while debugging pathological documents.
 *
 * @param maxDepth maximum schema nesting depth before a placeholder is substituted
 * @param debugCycles report every cycle hit at INFO with the full parsing path
 * @param maxCycles abort after this many detected cycles, 0 disables the limit
 */
public record ParsingOptions(int maxDepth, boolean debugCycles, int maxCycles) {
    private static final Logger logger = LoggerFactory.getLogger(ParsingOptions.class);

    public static final int DEFAULT_MAX_DEPTH = 100;
    public static final String ENV_MAX_DEPTH = "SIMPLESDK_MAX_DEPTH";
    public static final String ENV_DEBUG_CYCLES = "SIMPLESDK_DEBUG_CYCLES";
    public static final String ENV_MAX_CYCLES = "SIMPLESDK_MAX_CYCLES";

    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes");

    public ParsingOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, was " + maxDepth);
        }
        if (maxCycles < 0) {
            throw new IllegalArgumentException("maxCycles must not be negative, was " + maxCycles);
        }
    }

    public static ParsingOptions defaults() {
        return new ParsingOptions(DEFAULT_MAX_DEPTH, false, 0);
    }

    public static ParsingOptions fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads the options from environment style variables. Malformed values fall back to the
     * defaults.
     */
    public static ParsingOptions fromEnvironment(Map<String, String> env) {
        int maxDepth = readInt(env, ENV_MAX_DEPTH, DEFAULT_MAX_DEPTH, 1);
        int maxCycles = readInt(env, ENV_MAX_CYCLES, 0, 0);
        String debug = env.get(ENV_DEBUG_CYCLES);
        boolean debugCycles = debug != null && TRUE_VALUES.contains(debug.trim().toLowerCase(Locale.ROOT));
        return new ParsingOptions(maxDepth, debugCycles, maxCycles);
    }

    public ParsingOptions withMaxDepth(int newMaxDepth) {
        return new ParsingOptions(newMaxDepth, debugCycles, maxCycles);
    }

    public ParsingOptions withDebugCycles(boolean newDebugCycles) {
        return new ParsingOptions(maxDepth, newDebugCycles, maxCycles);
    }

    public ParsingOptions withMaxCycles(int newMaxCycles) {
        return new ParsingOptions(maxDepth, debugCycles, newMaxCycles);
    }

    private static int readInt(Map<String, String> env, String key, int defaultValue, int minimum) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < minimum) {
                logger.warn("Ignoring {}={}: must be at least {}, using {}", key, raw, minimum, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}: not an integer, using {}", key, raw, defaultValue);
            return defaultValue;
        }
    }
}
