package io.jtv.core.number;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The automatic-promotion partial order over numeric kinds, kept as a plain data table.
 *
 * <pre>
 * INTEGER ≤ FLOAT ≤ COMPLEX
 * INTEGER ≤ RATIONAL ≤ COMPLEX
 * SYMBOLIC (related only to itself)
 * </pre>
 *
 * <p>There is no edge between RATIONAL and FLOAT in either direction: that conversion is lossy and
 * only available explicitly ({@link Arithmetic#toFloat}, {@link Arithmetic#toRational}). Their only
 * common upper bound is COMPLEX.
 */
public final class CoercionLattice {

    /** For each kind, the set of kinds it may be promoted to (reflexive). */
    private static final Map<NumericKind, Set<NumericKind>> UPPER_BOUNDS;

    static {
        Map<NumericKind, Set<NumericKind>> table = new EnumMap<>(NumericKind.class);
        table.put(
                NumericKind.INTEGER,
                EnumSet.of(NumericKind.INTEGER, NumericKind.FLOAT, NumericKind.RATIONAL, NumericKind.COMPLEX));
        table.put(NumericKind.FLOAT, EnumSet.of(NumericKind.FLOAT, NumericKind.COMPLEX));
        table.put(NumericKind.RATIONAL, EnumSet.of(NumericKind.RATIONAL, NumericKind.COMPLEX));
        table.put(NumericKind.COMPLEX, EnumSet.of(NumericKind.COMPLEX));
        table.put(NumericKind.SYMBOLIC, EnumSet.of(NumericKind.SYMBOLIC));
        for (Map.Entry<NumericKind, Set<NumericKind>> e : table.entrySet()) {
            e.setValue(Collections.unmodifiableSet(e.getValue()));
        }
        UPPER_BOUNDS = Collections.unmodifiableMap(table);
    }

    private CoercionLattice() {
        // utility class
    }

    /** Returns {@code true} if {@code from} is automatically promotable to {@code to}. */
    public static boolean leq(NumericKind from, NumericKind to) {
        return UPPER_BOUNDS.get(from).contains(to);
    }

    /** The kinds {@code kind} may be promoted to, itself included. */
    public static Set<NumericKind> upperBounds(NumericKind kind) {
        return UPPER_BOUNDS.get(kind);
    }

    /**
     * Least upper bound of two kinds: the common kind addition is performed in.
     *
     * @return the join, or empty if the kinds share no upper bound
     */
    public static Optional<NumericKind> join(NumericKind a, NumericKind b) {
        EnumSet<NumericKind> common = EnumSet.copyOf(UPPER_BOUNDS.get(a));
        common.retainAll(UPPER_BOUNDS.get(b));
        for (NumericKind candidate : common) {
            if (UPPER_BOUNDS.get(candidate).containsAll(common)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
