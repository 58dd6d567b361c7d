package io.jtv.core.error;

/**
 * Thrown when a reverse block cannot be inverted exactly, i.e. the target of a {@code +=} or
 * {@code -=} occurs in its own right-hand side. Raised before any operation of the block runs. URN:
 * {@code urn:jtv:error:reversibility:target-in-expression}
 */
public final class ReversibilityException extends StaticCheckException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:jtv:error:reversibility:target-in-expression";

    /** The reversibility rule that was violated. */
    public enum Kind {
        TARGET_IN_EXPRESSION
    }

    public ReversibilityException(String variable) {
        super("Variable '" + variable + "' occurs in its own reversible update", variable);
    }

    public Kind kind() {
        return Kind.TARGET_IN_EXPRESSION;
    }

    /** The offending target variable. */
    public String variable() {
        return subject();
    }

    @Override
    public String urn() {
        return URN;
    }
}
