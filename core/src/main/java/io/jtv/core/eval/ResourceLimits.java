package io.jtv.core.eval;

/**
 * Ceilings that turn potential non-termination into a reported failure.
 *
 * <p>Immutable and thread-safe.
 *
 * @param maxSteps     loop iterations plus function calls a single run may perform
 *                     (default: 1,000,000)
 * @param maxCallDepth maximum nesting of function calls (default: 256, at most
 *                     {@value #MAX_CALL_DEPTH})
 */
public record ResourceLimits(long maxSteps, int maxCallDepth) {

    /**
     * Largest accepted call-depth ceiling. The engine sizes the interpreter's thread stack so that
     * this depth is always reached before the host stack runs out.
     */
    public static final int MAX_CALL_DEPTH = 10_000;

    /** Default limits: one million steps, call depth 256. */
    public static final ResourceLimits DEFAULT = new ResourceLimits(1_000_000L, 256);

    public ResourceLimits {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got: " + maxSteps);
        }
        if (maxCallDepth <= 0 || maxCallDepth > MAX_CALL_DEPTH) {
            throw new IllegalArgumentException(
                    "maxCallDepth must be between 1 and " + MAX_CALL_DEPTH + ", got: " + maxCallDepth);
        }
    }

    public ResourceLimits withMaxSteps(long steps) {
        return new ResourceLimits(steps, maxCallDepth);
    }

    public ResourceLimits withMaxCallDepth(int depth) {
        return new ResourceLimits(maxSteps, depth);
    }
}
