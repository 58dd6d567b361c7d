package io.jtv.core.ast;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Expression of the Data language: literals, variables, addition, negation and calls to total or
 * pure functions.
 *
 * <p>The hierarchy is sealed and no variant holds a {@link ControlStmt} or {@link Condition}, so a
 * Data expression cannot contain executable statements. Nodes are immutable and compared by
 * identity where annotations are attached (see {@code TypeReport#typeOf}).
 */
public sealed interface DataExpr {

    /** Integer literal. Hex and binary spellings are decoded to this form before they reach the engine. */
    record IntegerLiteral(BigInteger value) implements DataExpr {
        public IntegerLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record FloatLiteral(double value) implements DataExpr {}

    /** Rational literal {@code numerator/denominator}; normalized when evaluated. */
    record RationalLiteral(BigInteger numerator, BigInteger denominator) implements DataExpr {
        public RationalLiteral {
            Objects.requireNonNull(numerator, "numerator must not be null");
            Objects.requireNonNull(denominator, "denominator must not be null");
            if (denominator.signum() == 0) {
                throw new IllegalArgumentException("Rational literal with zero denominator");
            }
        }
    }

    record ComplexLiteral(double real, double imaginary) implements DataExpr {}

    /** Opaque symbol such as {@code pi}. */
    record SymbolicLiteral(String name) implements DataExpr {
        public SymbolicLiteral {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record VariableRef(String name) implements DataExpr {
        public VariableRef {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record Addition(DataExpr left, DataExpr right) implements DataExpr {
        public Addition {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record Negation(DataExpr operand) implements DataExpr {
        public Negation {
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    /** Call of a total or pure function from Data context. */
    record PureCall(String name, List<DataExpr> args) implements DataExpr {
        public PureCall {
            Objects.requireNonNull(name, "name must not be null");
            args = List.copyOf(args);
        }
    }

    // ── Construction helpers ──

    static IntegerLiteral integer(long value) {
        return new IntegerLiteral(BigInteger.valueOf(value));
    }

    static FloatLiteral floating(double value) {
        return new FloatLiteral(value);
    }

    static RationalLiteral rational(long numerator, long denominator) {
        return new RationalLiteral(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    static ComplexLiteral complex(double real, double imaginary) {
        return new ComplexLiteral(real, imaginary);
    }

    static SymbolicLiteral symbol(String name) {
        return new SymbolicLiteral(name);
    }

    static VariableRef var(String name) {
        return new VariableRef(name);
    }

    static Addition add(DataExpr left, DataExpr right) {
        return new Addition(left, right);
    }

    static Negation negate(DataExpr operand) {
        return new Negation(operand);
    }

    static PureCall call(String name, DataExpr... args) {
        return new PureCall(name, List.of(args));
    }
}
