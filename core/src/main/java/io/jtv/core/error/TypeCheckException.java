package io.jtv.core.error;

import java.util.Locale;

/** A static typing error. URN: {@code urn:jtv:error:type:<kind>} */
public final class TypeCheckException extends StaticCheckException {

    private static final long serialVersionUID = 1L;

    /** The typing rule that was violated. */
    public enum Kind {
        UNBOUND_VARIABLE,
        TYPE_MISMATCH,
        ARITY_MISMATCH,
        UNBOUND_FUNCTION,
        DUPLICATE_FUNCTION
    }

    private final Kind kind;

    public TypeCheckException(Kind kind, String message, String subject) {
        super(message, subject);
        this.kind = kind;
    }

    public static TypeCheckException unboundVariable(String name) {
        return new TypeCheckException(Kind.UNBOUND_VARIABLE, "Unbound variable: '" + name + "'", name);
    }

    public static TypeCheckException mismatch(String expected, String found) {
        return new TypeCheckException(
                Kind.TYPE_MISMATCH, "Type mismatch: expected " + expected + ", found " + found, null);
    }

    public static TypeCheckException mismatch(String expected, String found, String subject) {
        return new TypeCheckException(
                Kind.TYPE_MISMATCH,
                "Type mismatch for '" + subject + "': expected " + expected + ", found " + found,
                subject);
    }

    public static TypeCheckException arity(String function, int expected, int got) {
        return new TypeCheckException(
                Kind.ARITY_MISMATCH,
                "Function '" + function + "' expects " + expected + " argument(s), got " + got,
                function);
    }

    public static TypeCheckException unboundFunction(String name) {
        return new TypeCheckException(Kind.UNBOUND_FUNCTION, "Unknown function: '" + name + "'", name);
    }

    public static TypeCheckException duplicateFunction(String name) {
        return new TypeCheckException(
                Kind.DUPLICATE_FUNCTION, "Function '" + name + "' is declared more than once", name);
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public String urn() {
        return "urn:jtv:error:type:" + kind.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
