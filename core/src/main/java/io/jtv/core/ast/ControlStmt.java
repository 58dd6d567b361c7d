package io.jtv.core.ast;

import io.jtv.core.types.Type;
import java.util.List;
import java.util.Objects;

/** Statement of the Control language. Control may mutate state, loop and perform output. */
public sealed interface ControlStmt {

    record Skip() implements ControlStmt {}

    record Assign(String target, DataExpr value) implements ControlStmt {
        public Assign {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Sequence(ControlStmt first, ControlStmt second) implements ControlStmt {
        public Sequence {
            Objects.requireNonNull(first, "first must not be null");
            Objects.requireNonNull(second, "second must not be null");
        }
    }

    record If(Condition condition, ControlStmt thenBranch, ControlStmt elseBranch) implements ControlStmt {
        public If {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(thenBranch, "thenBranch must not be null");
            Objects.requireNonNull(elseBranch, "elseBranch must not be null");
        }
    }

    record While(Condition condition, ControlStmt body) implements ControlStmt {
        public While {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    /** {@code for variable in start..end}; the range is half-open. */
    record ForRange(String variable, DataExpr start, DataExpr end, ControlStmt body) implements ControlStmt {
        public ForRange {
            Objects.requireNonNull(variable, "variable must not be null");
            Objects.requireNonNull(start, "start must not be null");
            Objects.requireNonNull(end, "end must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    record Return(DataExpr value) implements ControlStmt {
        public Return {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Print(DataExpr value) implements ControlStmt {
        public Print {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record ReverseBlock(List<ReversibleOp> ops) implements ControlStmt {
        public ReverseBlock {
            ops = List.copyOf(ops);
        }
    }

    /**
     * Function declaration. Declarations are hoisted program-wide, so executing one is a no-op.
     *
     * @param returnType {@link Type#UNIT} when the function returns nothing
     */
    record FunctionDecl(String name, List<Param> params, Type returnType, Purity purity, ControlStmt body)
            implements ControlStmt {
        public FunctionDecl {
            Objects.requireNonNull(name, "name must not be null");
            params = List.copyOf(params);
            Objects.requireNonNull(returnType, "returnType must not be null");
            Objects.requireNonNull(purity, "purity must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    /** Calls a function for its effects, discarding the result. The only way to run an impure function. */
    record CallStmt(String name, List<DataExpr> args) implements ControlStmt {
        public CallStmt {
            Objects.requireNonNull(name, "name must not be null");
            args = List.copyOf(args);
        }
    }

    // ── Construction helpers ──

    static Skip skip() {
        return new Skip();
    }

    static Assign assign(String target, DataExpr value) {
        return new Assign(target, value);
    }

    static Print print(DataExpr value) {
        return new Print(value);
    }

    /** Folds statements into right-nested {@link Sequence}s; an empty list is {@link Skip}. */
    static ControlStmt sequence(List<? extends ControlStmt> statements) {
        if (statements.isEmpty()) {
            return new Skip();
        }
        ControlStmt result = statements.get(statements.size() - 1);
        for (int i = statements.size() - 2; i >= 0; i--) {
            result = new Sequence(statements.get(i), result);
        }
        return result;
    }

    static ControlStmt sequence(ControlStmt... statements) {
        return sequence(List.of(statements));
    }
}
