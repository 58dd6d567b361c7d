package io.jtv.core.engine;

import io.jtv.core.eval.ResourceLimits;
import io.jtv.core.number.NumericPolicy;
import java.util.Objects;

/**
 * Engine-wide settings applied to every run.
 *
 * <p>Immutable and thread-safe.
 *
 * @param limits        step and call-depth ceilings
 * @param numericPolicy integer width policy
 */
public record EngineOptions(ResourceLimits limits, NumericPolicy numericPolicy) {

    /** Default options: {@link ResourceLimits#DEFAULT}, unbounded integers. */
    public static final EngineOptions DEFAULT = new EngineOptions(ResourceLimits.DEFAULT, NumericPolicy.UNBOUNDED);

    public EngineOptions {
        Objects.requireNonNull(limits, "limits must not be null");
        Objects.requireNonNull(numericPolicy, "numericPolicy must not be null");
    }

    public EngineOptions withLimits(ResourceLimits newLimits) {
        return new EngineOptions(newLimits, numericPolicy);
    }

    public EngineOptions withNumericPolicy(NumericPolicy policy) {
        return new EngineOptions(limits, policy);
    }
}
