package io.symdiff.core.engine;

/**
 * Tunables of the engine.
 *
 * <p>Immutable and thread-safe.
 *
 * @param simplifyOnParse build parsed trees through the {@link Simplifier} instead of verbatim
 *     (default: off)
 * @param maxNestingDepth maximum parenthesis nesting accepted by the parser (default: 256)
 */
public record EngineOptions(boolean simplifyOnParse, int maxNestingDepth) {

    /** Default options: raw parse trees, nesting up to 256. */
    public static final EngineOptions DEFAULT = new EngineOptions(false, 256);

    public EngineOptions {
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }
}
