package io.jtv.core.number;

/** Runtime tags of {@link NumericValue}. Hex and binary are lexical spellings of {@link #INTEGER}. */
public enum NumericKind {
    INTEGER,
    FLOAT,
    RATIONAL,
    COMPLEX,
    SYMBOLIC;

    /** Only these kinds carry a total order. */
    public boolean isOrdered() {
        return this == INTEGER || this == FLOAT || this == RATIONAL;
    }

    /** Kinds whose addition is exact (no rounding). */
    public boolean isExact() {
        return this == INTEGER || this == RATIONAL;
    }
}
