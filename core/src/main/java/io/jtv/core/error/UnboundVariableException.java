package io.jtv.core.error;

/**
 * Thrown when evaluation reads a variable that is not bound in the current state. Checked programs
 * never reach this; it guards direct evaluator use. URN: {@code urn:jtv:error:runtime:unbound-variable}
 */
public final class UnboundVariableException extends ExecutionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:jtv:error:runtime:unbound-variable";

    private final String variable;

    public UnboundVariableException(String variable) {
        super("Unbound variable: '" + variable + "'");
        this.variable = variable;
    }

    public String variable() {
        return variable;
    }

    @Override
    public String urn() {
        return URN;
    }
}
