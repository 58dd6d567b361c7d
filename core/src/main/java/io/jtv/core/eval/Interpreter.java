package io.jtv.core.eval;

import io.jtv.core.ast.Condition;
import io.jtv.core.ast.ControlStmt;
import io.jtv.core.ast.DataExpr;
import io.jtv.core.ast.Param;
import io.jtv.core.error.StackDepthExceededException;
import io.jtv.core.error.TypeCheckException;
import io.jtv.core.number.Arithmetic;
import io.jtv.core.number.Intrinsic;
import io.jtv.core.number.NumericKind;
import io.jtv.core.number.NumericValue;
import io.jtv.core.reversible.ReversalTrace;
import io.jtv.core.reversible.ReversibleExecutor;
import io.jtv.core.types.Type;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Big-step evaluator for both sublanguages.
 *
 * <p>{@link #evalData} is side-effect free: it never writes to the state or the output sink.
 * {@link #execControl} mutates the given state in place and appends to the context's output. A
 * {@code return} unwinds to the innermost function call; at top level it ends the program.
 *
 * <p>When the context carries the checker's {@link io.jtv.core.types.TypeReport}, the operands of
 * every addition and negation are first coerced to the type inferred for that node, so the value
 * computed always has the kind the checker reported.
 *
 * <p>Expects a program that passed the static checks. Runtime failures are thrown as
 * {@link io.jtv.core.error.ExecutionException}s and leave the state as it was at the failure point.
 */
public final class Interpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    private final ExecutionContext context;
    private final Arithmetic arithmetic;
    private final ReversibleExecutor reversible;

    /** Result of executing a statement: normal completion, or a value being returned. */
    private static final class Completion {
        static final Completion NORMAL = new Completion(null);

        final NumericValue returned;

        private Completion(NumericValue returned) {
            this.returned = returned;
        }

        static Completion returned(NumericValue value) {
            return new Completion(value);
        }

        boolean isReturn() {
            return this != NORMAL;
        }
    }

    public Interpreter(ExecutionContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.arithmetic = context.arithmetic();
        this.reversible = new ReversibleExecutor(arithmetic);
    }

    public ExecutionContext context() {
        return context;
    }

    // ── Data ──

    /** Evaluates a Data expression. Total for well-typed expressions; never mutates {@code state}. */
    public NumericValue evalData(DataExpr expr, State state) {
        if (expr instanceof DataExpr.IntegerLiteral i) {
            return arithmetic.checked(i.value());
        } else if (expr instanceof DataExpr.FloatLiteral f) {
            return new NumericValue.FloatValue(f.value());
        } else if (expr instanceof DataExpr.RationalLiteral r) {
            return new NumericValue.RationalValue(r.numerator(), r.denominator());
        } else if (expr instanceof DataExpr.ComplexLiteral c) {
            return new NumericValue.ComplexValue(c.real(), c.imaginary());
        } else if (expr instanceof DataExpr.SymbolicLiteral s) {
            return NumericValue.SymbolicValue.atom(s.name());
        } else if (expr instanceof DataExpr.VariableRef v) {
            return state.lookup(v.name());
        } else if (expr instanceof DataExpr.Addition a) {
            NumericValue left = evalData(a.left(), state);
            NumericValue right = evalData(a.right(), state);
            Optional<Type> type = context.staticType(a);
            if (type.isPresent()) {
                left = coerce(left, type.get());
                right = coerce(right, type.get());
            }
            return arithmetic.add(left, right);
        } else if (expr instanceof DataExpr.Negation n) {
            NumericValue operand = evalData(n.operand(), state);
            Optional<Type> type = context.staticType(n);
            return arithmetic.negate(type.isPresent() ? coerce(operand, type.get()) : operand);
        } else if (expr instanceof DataExpr.PureCall c) {
            return call(c.name(), c.args(), state)
                    .orElseThrow(() -> TypeCheckException.mismatch("numeric value", "UNIT", c.name()));
        }
        throw new IllegalStateException("Unhandled expression: " + expr.getClass().getSimpleName());
    }

    /** Evaluates a condition; any nonzero value is true. */
    public boolean evalCondition(Condition condition, State state) {
        if (condition instanceof Condition.Truthy t) {
            return arithmetic.isTruthy(evalData(t.expr(), state));
        } else if (condition instanceof Condition.Comparison c) {
            NumericValue left = evalData(c.left(), state);
            NumericValue right = evalData(c.right(), state);
            return switch (c.op()) {
                case EQ -> arithmetic.numericEquals(left, right);
                case NE -> !arithmetic.numericEquals(left, right);
                case LT -> arithmetic.compare(left, right) < 0;
                case LE -> arithmetic.compare(left, right) <= 0;
                case GT -> arithmetic.compare(left, right) > 0;
                case GE -> arithmetic.compare(left, right) >= 0;
            };
        } else if (condition instanceof Condition.Logical l) {
            boolean left = evalCondition(l.left(), state);
            return switch (l.op()) {
                case AND -> left && evalCondition(l.right(), state);
                case OR -> left || evalCondition(l.right(), state);
            };
        } else if (condition instanceof Condition.Not n) {
            return !evalCondition(n.operand(), state);
        }
        throw new IllegalStateException("Unhandled condition: " + condition.getClass().getSimpleName());
    }

    // ── Control ──

    /**
     * Executes a top-level statement against {@code state}.
     *
     * @return the value of a top-level {@code return}, which ends the program early
     */
    public Optional<NumericValue> execControl(ControlStmt stmt, State state) {
        Completion completion = exec(stmt, state);
        return completion.isReturn() ? Optional.of(completion.returned) : Optional.empty();
    }

    private Completion exec(ControlStmt stmt, State state) {
        if (stmt instanceof ControlStmt.Skip || stmt instanceof ControlStmt.FunctionDecl) {
            return Completion.NORMAL;
        } else if (stmt instanceof ControlStmt.Assign a) {
            state.set(a.target(), evalData(a.value(), state));
            return Completion.NORMAL;
        } else if (stmt instanceof ControlStmt.Sequence s) {
            return execSequence(s, state);
        } else if (stmt instanceof ControlStmt.If i) {
            return evalCondition(i.condition(), state) ? exec(i.thenBranch(), state) : exec(i.elseBranch(), state);
        } else if (stmt instanceof ControlStmt.While w) {
            while (evalCondition(w.condition(), state)) {
                context.consumeStep();
                Completion body = exec(w.body(), state);
                if (body.isReturn()) {
                    return body;
                }
            }
            return Completion.NORMAL;
        } else if (stmt instanceof ControlStmt.ForRange f) {
            return execForRange(f, state);
        } else if (stmt instanceof ControlStmt.Return r) {
            return Completion.returned(evalData(r.value(), state));
        } else if (stmt instanceof ControlStmt.Print p) {
            context.output().emit(evalData(p.value(), state).toString());
            return Completion.NORMAL;
        } else if (stmt instanceof ControlStmt.ReverseBlock b) {
            ReversalTrace trace = reversible.forward(b, state, expr -> evalData(expr, state));
            context.reverseBlockExecuted(trace);
            return Completion.NORMAL;
        } else if (stmt instanceof ControlStmt.CallStmt c) {
            call(c.name(), c.args(), state);
            return Completion.NORMAL;
        }
        throw new IllegalStateException("Unhandled statement: " + stmt.getClass().getSimpleName());
    }

    private Completion execSequence(ControlStmt.Sequence sequence, State state) {
        ControlStmt next = sequence;
        while (next instanceof ControlStmt.Sequence s) {
            Completion first = exec(s.first(), state);
            if (first.isReturn()) {
                return first;
            }
            next = s.second();
        }
        return exec(next, state);
    }

    private Completion execForRange(ControlStmt.ForRange f, State state) {
        BigInteger start = integerBound(evalData(f.start(), state));
        BigInteger end = integerBound(evalData(f.end(), state));
        Optional<NumericValue> shadowed = state.get(f.variable());
        try {
            for (BigInteger i = start; i.compareTo(end) < 0; i = i.add(BigInteger.ONE)) {
                context.consumeStep();
                state.set(f.variable(), arithmetic.checked(i));
                Completion body = exec(f.body(), state);
                if (body.isReturn()) {
                    return body;
                }
            }
            return Completion.NORMAL;
        } finally {
            state.restore(f.variable(), shadowed);
        }
    }

    private static BigInteger integerBound(NumericValue value) {
        if (value instanceof NumericValue.IntegerValue i) {
            return i.value();
        }
        throw TypeCheckException.mismatch("INTEGER range bound", value.kind().name());
    }

    // ── Calls ──

    /** Runs a function; empty when it completed without returning a value. */
    private Optional<NumericValue> call(String name, List<DataExpr> argExprs, State callerState) {
        List<NumericValue> args = new ArrayList<>(argExprs.size());
        for (DataExpr arg : argExprs) {
            args.add(evalData(arg, callerState));
        }

        Optional<Intrinsic> intrinsic = Intrinsic.byName(name);
        if (intrinsic.isPresent()) {
            if (args.size() != 1) {
                throw TypeCheckException.arity(name, 1, args.size());
            }
            return Optional.of(intrinsic.get().apply(arithmetic, args.get(0)));
        }

        ControlStmt.FunctionDecl decl =
                context.function(name).orElseThrow(() -> TypeCheckException.unboundFunction(name));
        if (decl.params().size() != args.size()) {
            throw TypeCheckException.arity(name, decl.params().size(), args.size());
        }

        State frame = State.empty();
        for (int i = 0; i < args.size(); i++) {
            Param param = decl.params().get(i);
            frame.set(param.name(), coerce(args.get(i), param.type()));
        }

        context.consumeStep();
        context.enterCall(name);
        try {
            LOG.trace("Calling {} at depth {}", name, context.depth());
            Completion completion = exec(decl.body(), frame);
            if (!completion.isReturn() || decl.returnType() == Type.UNIT) {
                return Optional.empty();
            }
            return Optional.of(coerce(completion.returned, decl.returnType()));
        } catch (StackOverflowError e) {
            // Host stack exhausted below the configured ceiling; reported like the ceiling itself.
            throw new StackDepthExceededException(name, context.depth());
        } finally {
            context.exitCall();
        }
    }

    private NumericValue coerce(NumericValue value, Type declared) {
        Optional<NumericKind> kind = declared.kind();
        return kind.isPresent() ? arithmetic.coerce(value, kind.get()) : value;
    }
}
