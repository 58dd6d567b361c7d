package io.jtv.core.number;

import java.util.Objects;

/** Unevaluated symbolic expression. No simplification is ever performed. */
public sealed interface SymbolicTerm {

    record Atom(String name) implements SymbolicTerm {
        public Atom {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Sum(SymbolicTerm left, SymbolicTerm right) implements SymbolicTerm {
        public Sum {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public String toString() {
            return left + " + " + right;
        }
    }

    record Neg(SymbolicTerm operand) implements SymbolicTerm {
        public Neg {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public String toString() {
            return "-(" + operand + ")";
        }
    }
}
