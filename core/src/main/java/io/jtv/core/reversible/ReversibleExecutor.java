package io.jtv.core.reversible;

import io.jtv.core.ast.ControlStmt;
import io.jtv.core.ast.DataExpr;
import io.jtv.core.ast.ReversibleOp;
import io.jtv.core.eval.State;
import io.jtv.core.number.Arithmetic;
import io.jtv.core.number.NumericValue;
import io.jtv.core.number.NumericValue.SymbolicValue;
import io.jtv.core.number.SymbolicTerm;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs reverse blocks with an explicit trace.
 *
 * <p>{@link #forward} evaluates each right-hand side in the current state, records it, then applies
 * the update. {@link #backward} replays a trace last-to-first with the opposite operator and the
 * recorded amounts. For Integer, Rational and Symbolic values {@code backward(forward(σ))} restores
 * σ exactly; Float and Complex round trips are subject to rounding. Symbolic terms are never
 * simplified, so a symbolic update is undone by peeling off the summand it appended.
 */
public final class ReversibleExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(ReversibleExecutor.class);

    private final Arithmetic arithmetic;

    public ReversibleExecutor(Arithmetic arithmetic) {
        this.arithmetic = Objects.requireNonNull(arithmetic, "arithmetic must not be null");
    }

    /**
     * Applies {@code block} to {@code state} and returns the trace of what was applied. Nothing is
     * applied when the block fails the reversibility precondition.
     *
     * @param evaluator evaluates a right-hand side against {@code state}
     */
    public ReversalTrace forward(
            ControlStmt.ReverseBlock block, State state, Function<DataExpr, NumericValue> evaluator) {
        ReversibilityChecker.requireReversible(block);
        List<TraceEntry> entries = new ArrayList<>(block.ops().size());
        for (ReversibleOp op : block.ops()) {
            NumericValue amount = evaluator.apply(op.value());
            OpKind kind = op instanceof ReversibleOp.AddAssign ? OpKind.ADD : OpKind.SUB;
            apply(kind, op.target(), amount, state);
            entries.add(new TraceEntry(kind, op.target(), amount));
        }
        ReversalTrace trace = new ReversalTrace(entries);
        LOG.debug("Reverse block applied: {}", trace.entries());
        return trace;
    }

    /** Undoes {@code trace} on {@code state}. */
    public void backward(ReversalTrace trace, State state) {
        List<TraceEntry> entries = trace.entries();
        for (int i = entries.size() - 1; i >= 0; i--) {
            TraceEntry entry = entries.get(i);
            if (!peelSymbolic(entry, state)) {
                apply(entry.op().inverse(), entry.variable(), entry.amount(), state);
            }
        }
        LOG.debug("Reverse trace replayed backwards: {} update(s)", entries.size());
    }

    private static boolean peelSymbolic(TraceEntry entry, State state) {
        if (!(state.lookup(entry.variable()) instanceof SymbolicValue current)
                || !(current.term() instanceof SymbolicTerm.Sum sum)
                || !(entry.amount() instanceof SymbolicValue amount)) {
            return false;
        }
        SymbolicTerm appended = entry.op() == OpKind.ADD ? amount.term() : new SymbolicTerm.Neg(amount.term());
        if (!sum.right().equals(appended)) {
            return false;
        }
        state.set(entry.variable(), new SymbolicValue(sum.left()));
        return true;
    }

    private void apply(OpKind kind, String variable, NumericValue amount, State state) {
        NumericValue current = state.lookup(variable);
        NumericValue next = kind == OpKind.ADD
                ? arithmetic.add(current, amount)
                : arithmetic.subtract(current, amount);
        state.set(variable, next);
    }
}
