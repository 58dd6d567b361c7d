package io.jtv.core.number;

import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Built-in total functions callable from Data context. They are the only way to cross the lossy
 * Rational/Float boundary.
 */
public enum Intrinsic {
    TO_FLOAT("to_float", NumericKind.FLOAT),
    TO_RATIONAL("to_rational", NumericKind.RATIONAL);

    private static final Map<String, Intrinsic> BY_NAME =
            Stream.of(values()).collect(Collectors.toUnmodifiableMap(Intrinsic::functionName, Function.identity()));

    private static final Set<NumericKind> ACCEPTED =
            EnumSet.of(NumericKind.INTEGER, NumericKind.FLOAT, NumericKind.RATIONAL);

    private final String functionName;
    private final NumericKind result;

    Intrinsic(String functionName, NumericKind result) {
        this.functionName = functionName;
        this.result = result;
    }

    public String functionName() {
        return functionName;
    }

    public NumericKind result() {
        return result;
    }

    /** Both conversions take exactly one ordered argument. */
    public boolean accepts(NumericKind argument) {
        return ACCEPTED.contains(argument);
    }

    public NumericValue apply(Arithmetic arithmetic, NumericValue argument) {
        return switch (this) {
            case TO_FLOAT -> arithmetic.toFloat(argument);
            case TO_RATIONAL -> arithmetic.toRational(argument);
        };
    }

    public static Optional<Intrinsic> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
