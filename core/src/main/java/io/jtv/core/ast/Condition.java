package io.jtv.core.ast;

import java.util.Objects;

/**
 * Branch condition of {@code if} and {@code while}. Conditions belong to the Control language: they
 * may compare Data values but can never appear inside a {@link DataExpr}.
 */
public sealed interface Condition {

    /** A Data expression used as a condition; nonzero is true. */
    record Truthy(DataExpr expr) implements Condition {
        public Truthy {
            Objects.requireNonNull(expr, "expr must not be null");
        }
    }

    record Comparison(DataExpr left, Comparator op, DataExpr right) implements Condition {
        public Comparison {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    /** Short-circuiting conjunction or disjunction. */
    record Logical(Condition left, LogicalOp op, Condition right) implements Condition {
        public Logical {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record Not(Condition operand) implements Condition {
        public Not {
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    enum Comparator {
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">=");

        private final String symbol;

        Comparator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /** EQ and NE are defined for every kind; the rest need a total order. */
        public boolean isOrdering() {
            return this != EQ && this != NE;
        }
    }

    enum LogicalOp {
        AND,
        OR
    }

    static Truthy of(DataExpr expr) {
        return new Truthy(expr);
    }

    static Comparison compare(DataExpr left, Comparator op, DataExpr right) {
        return new Comparison(left, op, right);
    }
}
