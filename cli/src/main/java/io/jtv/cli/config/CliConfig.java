package io.jtv.cli.config;

import io.jtv.core.engine.EngineOptions;
import io.jtv.core.eval.ResourceLimits;
import io.jtv.core.number.NumericPolicy;

/**
 * Configuration of the command-line runner.
 *
 * <p>Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param maxSteps      loop iterations plus calls allowed per run
 * @param maxCallDepth  maximum function call nesting
 * @param integerBits   integer width, {@code 0} for unbounded
 * @param loggingFormat json or text
 * @param loggingLevel  root log level
 * @param trace         log the trace of every reverse block
 */
public record CliConfig(
        long maxSteps, int maxCallDepth, int integerBits, String loggingFormat, String loggingLevel, boolean trace) {

    public CliConfig {
        if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
            throw new IllegalArgumentException("loggingFormat must be 'json' or 'text', got: " + loggingFormat);
        }
    }

    /** Creates a new builder with the defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Engine options for these settings.
     *
     * @throws IllegalArgumentException if a limit or the integer width is out of range
     */
    public EngineOptions toEngineOptions() {
        return new EngineOptions(new ResourceLimits(maxSteps, maxCallDepth), NumericPolicy.ofBits(integerBits));
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {
        private long maxSteps = ResourceLimits.DEFAULT.maxSteps();
        private int maxCallDepth = ResourceLimits.DEFAULT.maxCallDepth();
        private int integerBits = 0;
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";
        private boolean trace = false;

        Builder() {}

        public Builder maxSteps(long maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder maxCallDepth(int maxCallDepth) {
            this.maxCallDepth = maxCallDepth;
            return this;
        }

        public Builder integerBits(int integerBits) {
            this.integerBits = integerBits;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder trace(boolean trace) {
            this.trace = trace;
            return this;
        }

        public CliConfig build() {
            return new CliConfig(maxSteps, maxCallDepth, integerBits, loggingFormat, loggingLevel, trace);
        }
    }
}
