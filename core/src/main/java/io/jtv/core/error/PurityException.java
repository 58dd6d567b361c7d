package io.jtv.core.error;

import io.jtv.core.ast.Purity;
import java.util.Locale;

/**
 * A purity violation: a function body does more than its annotation allows, or a Data expression
 * calls an impure function. URN: {@code urn:jtv:error:purity:<kind>}
 */
public final class PurityException extends StaticCheckException {

    private static final long serialVersionUID = 1L;

    /** The purity rule that was violated. */
    public enum Kind {
        LOOP_IN_TOTAL,
        IO_IN_PURE,
        IMPURE_CALL_IN_DATA_CONTEXT,
        ANNOTATION_TOO_OPTIMISTIC
    }

    private final Kind kind;
    private final Purity required;
    private final Purity declared;

    private PurityException(Kind kind, String message, String function, Purity required, Purity declared) {
        super(message, function);
        this.kind = kind;
        this.required = required;
        this.declared = declared;
    }

    public static PurityException loopInTotal(String function) {
        return new PurityException(
                Kind.LOOP_IN_TOTAL,
                "Function '" + function + "' is declared total but contains a loop",
                function,
                Purity.PURE,
                Purity.TOTAL);
    }

    public static PurityException ioInPure(String function, Purity declared) {
        return new PurityException(
                Kind.IO_IN_PURE,
                "Function '" + function + "' is declared " + declared.keyword() + " but performs I/O",
                function,
                Purity.IMPURE,
                declared);
    }

    public static PurityException impureCallInDataContext(String function) {
        return new PurityException(
                Kind.IMPURE_CALL_IN_DATA_CONTEXT,
                "Impure function '" + function + "' cannot be called from a Data expression",
                function,
                Purity.IMPURE,
                null);
    }

    public static PurityException annotationTooOptimistic(String function, Purity required, Purity declared) {
        return new PurityException(
                Kind.ANNOTATION_TOO_OPTIMISTIC,
                "Function '" + function + "' is declared " + declared.keyword() + " but its body requires "
                        + required.keyword(),
                function,
                required,
                declared);
    }

    public Kind kind() {
        return kind;
    }

    /** The level the offending function actually needs. */
    public Purity required() {
        return required;
    }

    /** The declared level, or {@code null} for Data-context call errors. */
    public Purity declared() {
        return declared;
    }

    @Override
    public String urn() {
        return "urn:jtv:error:purity:" + kind.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
