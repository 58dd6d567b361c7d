package io.jtv.core.reversible;

import io.jtv.core.number.NumericValue;
import java.util.Objects;

/**
 * One applied update: {@code variable op amount}, with {@code amount} the value the right-hand side
 * had when the update ran.
 */
public record TraceEntry(OpKind op, String variable, NumericValue amount) {

    public TraceEntry {
        Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(amount, "amount must not be null");
    }

    @Override
    public String toString() {
        return variable + " " + op.symbol() + " " + amount;
    }
}
