package io.jtv.core.number;

/**
 * Numeric limits applied by {@link Arithmetic}.
 *
 * <p>Immutable and thread-safe.
 *
 * @param integerBits two's-complement width integers must fit in, or {@code 0} for unbounded
 *                    precision. Results outside the range raise an overflow error; they never wrap.
 */
public record NumericPolicy(int integerBits) {

    /** Default policy: unbounded integers. */
    public static final NumericPolicy UNBOUNDED = new NumericPolicy(0);

    public NumericPolicy {
        if (integerBits < 0 || integerBits == 1) {
            throw new IllegalArgumentException("integerBits must be 0 (unbounded) or at least 2, got: " + integerBits);
        }
    }

    public static NumericPolicy ofBits(int integerBits) {
        return new NumericPolicy(integerBits);
    }

    public boolean isBounded() {
        return integerBits > 0;
    }
}
