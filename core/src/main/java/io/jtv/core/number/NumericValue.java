package io.jtv.core.number;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Runtime value domain: a closed set of five tagged kinds. Arithmetic lives in {@link Arithmetic}
 * and dispatches on {@link #kind()}; the variants carry data only.
 *
 * <p>{@link #toString()} is the textual form used by {@code print}.
 */
public sealed interface NumericValue {

    NumericKind kind();

    /** Arbitrary-precision integer. */
    record IntegerValue(BigInteger value) implements NumericValue {
        public IntegerValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        public static IntegerValue of(long value) {
            return new IntegerValue(BigInteger.valueOf(value));
        }

        @Override
        public NumericKind kind() {
            return NumericKind.INTEGER;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    /** IEEE-754 double. Record equality is bitwise ({@link Double#compare}). */
    record FloatValue(double value) implements NumericValue {
        @Override
        public NumericKind kind() {
            return NumericKind.FLOAT;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /** Exact fraction, always in lowest terms with a positive denominator. */
    record RationalValue(BigInteger numerator, BigInteger denominator) implements NumericValue {
        public RationalValue {
            Objects.requireNonNull(numerator, "numerator must not be null");
            Objects.requireNonNull(denominator, "denominator must not be null");
            if (denominator.signum() == 0) {
                throw new IllegalArgumentException("Rational denominator must not be zero");
            }
            if (denominator.signum() < 0) {
                numerator = numerator.negate();
                denominator = denominator.negate();
            }
            BigInteger gcd = numerator.gcd(denominator);
            if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
                numerator = numerator.divide(gcd);
                denominator = denominator.divide(gcd);
            }
        }

        public static RationalValue of(long numerator, long denominator) {
            return new RationalValue(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
        }

        @Override
        public NumericKind kind() {
            return NumericKind.RATIONAL;
        }

        @Override
        public String toString() {
            return numerator + "/" + denominator;
        }
    }

    /** Complex number with double components. */
    record ComplexValue(double real, double imaginary) implements NumericValue {
        @Override
        public NumericKind kind() {
            return NumericKind.COMPLEX;
        }

        @Override
        public String toString() {
            String sign = imaginary < 0 || (imaginary == 0.0 && 1 / imaginary < 0) ? "" : "+";
            return real + sign + imaginary + "i";
        }
    }

    record SymbolicValue(SymbolicTerm term) implements NumericValue {
        public SymbolicValue {
            Objects.requireNonNull(term, "term must not be null");
        }

        public static SymbolicValue atom(String name) {
            return new SymbolicValue(new SymbolicTerm.Atom(name));
        }

        @Override
        public NumericKind kind() {
            return NumericKind.SYMBOLIC;
        }

        @Override
        public String toString() {
            return term.toString();
        }
    }
}
