package io.jtv.core.ast;

import java.util.Objects;

/** An invertible update allowed inside a {@code reverse { … }} block. */
public sealed interface ReversibleOp {

    /** The updated variable. */
    String target();

    /** The amount added or subtracted. Must not mention {@link #target()}. */
    DataExpr value();

    /** {@code target += value} */
    record AddAssign(String target, DataExpr value) implements ReversibleOp {
        public AddAssign {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** {@code target -= value} */
    record SubAssign(String target, DataExpr value) implements ReversibleOp {
        public SubAssign {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }
}
