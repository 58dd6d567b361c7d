package io.jtv.core.number;

import io.jtv.core.error.ArithmeticOverflowException;
import io.jtv.core.error.TypeCheckException;
import io.jtv.core.number.NumericValue.ComplexValue;
import io.jtv.core.number.NumericValue.FloatValue;
import io.jtv.core.number.NumericValue.IntegerValue;
import io.jtv.core.number.NumericValue.RationalValue;
import io.jtv.core.number.NumericValue.SymbolicValue;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Addition, negation, comparison and coercion over {@link NumericValue}s.
 *
 * <p>Mixed-kind operations first promote both operands to their {@link CoercionLattice#join join},
 * then apply the common kind's rule. Kinds without a join are a type error, never a crash.
 *
 * <p>Immutable and thread-safe.
 */
public final class Arithmetic {

    private static final int SIGNIFICAND_BITS = 53;
    private static final int MIN_NORMAL_EXPONENT = Double.MIN_EXPONENT;
    /** Significand plus guard bits computed before rounding a Rational to Float. */
    static final int QUOTIENT_BITS = SIGNIFICAND_BITS + 2;

    private final NumericPolicy policy;
    private final BigInteger maxInteger;
    private final BigInteger minInteger;

    public Arithmetic(NumericPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        if (policy.isBounded()) {
            this.maxInteger = BigInteger.ONE.shiftLeft(policy.integerBits() - 1).subtract(BigInteger.ONE);
            this.minInteger = BigInteger.ONE.shiftLeft(policy.integerBits() - 1).negate();
        } else {
            this.maxInteger = null;
            this.minInteger = null;
        }
    }

    /** Arithmetic with unbounded integers. */
    public static Arithmetic unbounded() {
        return new Arithmetic(NumericPolicy.UNBOUNDED);
    }

    public NumericPolicy policy() {
        return policy;
    }

    // ── Addition / negation ──

    public NumericValue add(NumericValue left, NumericValue right) {
        NumericKind common = joinOrFail(left.kind(), right.kind(), "+");
        NumericValue a = coerce(left, common);
        NumericValue b = coerce(right, common);
        return switch (common) {
            case INTEGER -> checked(((IntegerValue) a).value().add(((IntegerValue) b).value()));
            case FLOAT -> new FloatValue(((FloatValue) a).value() + ((FloatValue) b).value());
            case RATIONAL -> addRational((RationalValue) a, (RationalValue) b);
            case COMPLEX -> {
                ComplexValue x = (ComplexValue) a;
                ComplexValue y = (ComplexValue) b;
                yield new ComplexValue(x.real() + y.real(), x.imaginary() + y.imaginary());
            }
            case SYMBOLIC -> new SymbolicValue(
                    new SymbolicTerm.Sum(((SymbolicValue) a).term(), ((SymbolicValue) b).term()));
        };
    }

    private static RationalValue addRational(RationalValue a, RationalValue b) {
        BigInteger numerator =
                a.numerator().multiply(b.denominator()).add(b.numerator().multiply(a.denominator()));
        return new RationalValue(numerator, a.denominator().multiply(b.denominator()));
    }

    public NumericValue negate(NumericValue value) {
        if (value instanceof IntegerValue i) {
            return checked(i.value().negate());
        } else if (value instanceof FloatValue f) {
            return new FloatValue(-f.value());
        } else if (value instanceof RationalValue r) {
            return new RationalValue(r.numerator().negate(), r.denominator());
        } else if (value instanceof ComplexValue c) {
            return new ComplexValue(-c.real(), -c.imaginary());
        }
        return new SymbolicValue(new SymbolicTerm.Neg(((SymbolicValue) value).term()));
    }

    /** {@code left + (-right)}. */
    public NumericValue subtract(NumericValue left, NumericValue right) {
        return add(left, negate(right));
    }

    /** Range-checks an integer result against the configured width. */
    public IntegerValue checked(BigInteger value) {
        if (policy.isBounded() && (value.compareTo(maxInteger) > 0 || value.compareTo(minInteger) < 0)) {
            throw new ArithmeticOverflowException(
                    "Integer " + value + " does not fit in " + policy.integerBits() + " bits");
        }
        return new IntegerValue(value);
    }

    // ── Coercion ──

    /**
     * Promotes {@code value} to {@code target} along the lattice.
     *
     * @throws TypeCheckException if {@code target} is not an upper bound of the value's kind
     */
    public NumericValue coerce(NumericValue value, NumericKind target) {
        NumericKind from = value.kind();
        if (from == target) {
            return value;
        }
        if (!CoercionLattice.leq(from, target)) {
            throw TypeCheckException.mismatch(target.name(), from.name());
        }
        if (value instanceof IntegerValue i) {
            return switch (target) {
                case FLOAT -> new FloatValue(i.value().doubleValue());
                case RATIONAL -> new RationalValue(i.value(), BigInteger.ONE);
                case COMPLEX -> new ComplexValue(i.value().doubleValue(), 0.0);
                default -> throw TypeCheckException.mismatch(target.name(), from.name());
            };
        } else if (value instanceof FloatValue f) {
            return new ComplexValue(f.value(), 0.0);
        } else if (value instanceof RationalValue r) {
            return new ComplexValue(rationalToDouble(r), 0.0);
        }
        throw TypeCheckException.mismatch(target.name(), from.name());
    }

    /**
     * Explicit, possibly lossy conversion to Float. A Rational is rounded to the nearest double, ties
     * to even.
     */
    public FloatValue toFloat(NumericValue value) {
        if (value instanceof FloatValue f) {
            return f;
        } else if (value instanceof IntegerValue i) {
            return new FloatValue(i.value().doubleValue());
        } else if (value instanceof RationalValue r) {
            return new FloatValue(rationalToDouble(r));
        }
        throw TypeCheckException.mismatch("INTEGER, FLOAT or RATIONAL", value.kind().name());
    }

    /** Explicit conversion to Rational. Exact for every finite double. */
    public RationalValue toRational(NumericValue value) {
        if (value instanceof RationalValue r) {
            return r;
        } else if (value instanceof IntegerValue i) {
            return new RationalValue(i.value(), BigInteger.ONE);
        } else if (value instanceof FloatValue f) {
            if (!Double.isFinite(f.value())) {
                throw new ArithmeticOverflowException("Cannot convert " + f.value() + " to a rational");
            }
            BigDecimal exact = new BigDecimal(f.value());
            if (exact.scale() <= 0) {
                return new RationalValue(exact.toBigIntegerExact(), BigInteger.ONE);
            }
            return new RationalValue(exact.unscaledValue(), BigInteger.TEN.pow(exact.scale()));
        }
        throw TypeCheckException.mismatch("INTEGER, FLOAT or RATIONAL", value.kind().name());
    }

    /**
     * Nearest double to {@code r}, ties to even, rounded once. The quotient is computed with at least
     * {@value #QUOTIENT_BITS} significant bits; any nonzero remainder is kept as a sticky bit.
     */
    static double rationalToDouble(RationalValue r) {
        BigInteger numerator = r.numerator().abs();
        if (numerator.signum() == 0) {
            return 0.0;
        }
        BigInteger denominator = r.denominator();
        int shift = QUOTIENT_BITS - (numerator.bitLength() - denominator.bitLength());
        BigInteger[] qr = shift >= 0
                ? numerator.shiftLeft(shift).divideAndRemainder(denominator)
                : numerator.divideAndRemainder(denominator.shiftLeft(-shift));
        BigInteger quotient = qr[0];
        boolean sticky = qr[1].signum() != 0;

        // |r| lies in [2^exponent, 2^(exponent + 1)); subnormals keep fewer significand bits.
        int bits = quotient.bitLength();
        int exponent = bits - 1 - shift;
        int keep = exponent >= MIN_NORMAL_EXPONENT
                ? SIGNIFICAND_BITS
                : SIGNIFICAND_BITS - (MIN_NORMAL_EXPONENT - exponent);
        double magnitude;
        if (keep < 0) {
            magnitude = 0.0;
        } else {
            int drop = bits - keep;
            BigInteger significand = quotient.shiftRight(drop);
            boolean half = quotient.testBit(drop - 1);
            boolean belowHalf = sticky || quotient.getLowestSetBit() < drop - 1;
            if (half && (belowHalf || significand.testBit(0))) {
                significand = significand.add(BigInteger.ONE);
            }
            magnitude = Math.scalb(significand.doubleValue(), drop - shift);
        }
        return r.numerator().signum() < 0 ? -magnitude : magnitude;
    }

    // ── Ordering / equality / truthiness ──

    /**
     * Compares two ordered values after promotion to their join.
     *
     * @throws TypeCheckException if either kind is unordered or the join is unordered
     */
    public int compare(NumericValue left, NumericValue right) {
        NumericKind common = joinOrFail(left.kind(), right.kind(), "<");
        if (!common.isOrdered()) {
            throw TypeCheckException.mismatch("ordered kind", left.kind() + " and " + right.kind());
        }
        NumericValue a = coerce(left, common);
        NumericValue b = coerce(right, common);
        return switch (common) {
            case INTEGER -> ((IntegerValue) a).value().compareTo(((IntegerValue) b).value());
            case FLOAT -> Double.compare(((FloatValue) a).value(), ((FloatValue) b).value());
            case RATIONAL -> {
                RationalValue x = (RationalValue) a;
                RationalValue y = (RationalValue) b;
                yield x.numerator().multiply(y.denominator()).compareTo(y.numerator().multiply(x.denominator()));
            }
            default -> throw TypeCheckException.mismatch("ordered kind", common.name());
        };
    }

    /** Numeric equality after promotion; Float follows IEEE {@code ==}. */
    public boolean numericEquals(NumericValue left, NumericValue right) {
        NumericKind common = joinOrFail(left.kind(), right.kind(), "==");
        NumericValue a = coerce(left, common);
        NumericValue b = coerce(right, common);
        if (a instanceof FloatValue x) {
            return x.value() == ((FloatValue) b).value();
        } else if (a instanceof ComplexValue x) {
            ComplexValue y = (ComplexValue) b;
            return x.real() == y.real() && x.imaginary() == y.imaginary();
        }
        return a.equals(b);
    }

    /** Nonzero is true. Symbolic values have no zero test. */
    public boolean isTruthy(NumericValue value) {
        if (value instanceof IntegerValue i) {
            return i.value().signum() != 0;
        } else if (value instanceof FloatValue f) {
            return f.value() != 0.0;
        } else if (value instanceof RationalValue r) {
            return r.numerator().signum() != 0;
        } else if (value instanceof ComplexValue c) {
            return c.real() != 0.0 || c.imaginary() != 0.0;
        }
        throw TypeCheckException.mismatch("non-symbolic numeric condition", value.kind().name());
    }

    private static NumericKind joinOrFail(NumericKind a, NumericKind b, String operator) {
        return CoercionLattice.join(a, b)
                .orElseThrow(() -> TypeCheckException.mismatch(
                        "operands with a common kind for '" + operator + "'", a + " and " + b));
    }
}
