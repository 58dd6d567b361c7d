package io.jtv.core.error;

/**
 * Thrown when an integer result does not fit the configured bit width. Never wraps. URN:
 * {@code urn:jtv:error:runtime:arithmetic-overflow}
 */
public final class ArithmeticOverflowException extends ExecutionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:jtv:error:runtime:arithmetic-overflow";

    public ArithmeticOverflowException(String message) {
        super(message);
    }

    @Override
    public String urn() {
        return URN;
    }
}
