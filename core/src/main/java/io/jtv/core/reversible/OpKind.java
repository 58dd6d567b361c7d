package io.jtv.core.reversible;

/** Primitive invertible updates recorded in a {@link ReversalTrace}. */
public enum OpKind {
    ADD("+="),
    SUB("-=");

    private final String symbol;

    OpKind(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public OpKind inverse() {
        return this == ADD ? SUB : ADD;
    }
}
