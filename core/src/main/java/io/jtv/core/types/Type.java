package io.jtv.core.types;

import io.jtv.core.number.CoercionLattice;
import io.jtv.core.number.NumericKind;
import java.util.Locale;
import java.util.Optional;

/**
 * Static types: one per numeric kind, plus {@link #UNIT} for functions that return nothing. The
 * ordering between numeric types is {@link CoercionLattice}; UNIT is related only to itself.
 */
public enum Type {
    INTEGER(NumericKind.INTEGER),
    FLOAT(NumericKind.FLOAT),
    RATIONAL(NumericKind.RATIONAL),
    COMPLEX(NumericKind.COMPLEX),
    SYMBOLIC(NumericKind.SYMBOLIC),
    UNIT(null);

    private final NumericKind kind;

    Type(NumericKind kind) {
        this.kind = kind;
    }

    public static Type of(NumericKind kind) {
        return switch (kind) {
            case INTEGER -> INTEGER;
            case FLOAT -> FLOAT;
            case RATIONAL -> RATIONAL;
            case COMPLEX -> COMPLEX;
            case SYMBOLIC -> SYMBOLIC;
        };
    }

    /** The runtime kind of values of this type; empty for UNIT. */
    public Optional<NumericKind> kind() {
        return Optional.ofNullable(kind);
    }

    public boolean isNumeric() {
        return kind != null;
    }

    /** Returns {@code true} if a value of this type may be used where {@code target} is expected. */
    public boolean coercesTo(Type target) {
        if (this == target) {
            return true;
        }
        return isNumeric() && target.isNumeric() && CoercionLattice.leq(kind, target.kind);
    }

    /** Least upper bound; empty when none exists. */
    public static Optional<Type> join(Type a, Type b) {
        if (a == b) {
            return Optional.of(a);
        }
        if (!a.isNumeric() || !b.isNumeric()) {
            return Optional.empty();
        }
        return CoercionLattice.join(a.kind, b.kind).map(Type::of);
    }

    /**
     * Resolves a surface type name. {@code hex} and {@code binary} are integer spellings and resolve
     * to {@link #INTEGER}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Type fromName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "int", "integer", "hex", "binary" -> INTEGER;
            case "float" -> FLOAT;
            case "rational" -> RATIONAL;
            case "complex" -> COMPLEX;
            case "symbolic" -> SYMBOLIC;
            case "unit" -> UNIT;
            default -> throw new IllegalArgumentException("Unknown type name: '" + name + "'");
        };
    }
}
