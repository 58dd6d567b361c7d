package io.jtv.core.error;

/**
 * Thrown when nested function calls exceed {@code maxCallDepth}. URN:
 * {@code urn:jtv:error:runtime:stack-depth-exceeded}
 */
public final class StackDepthExceededException extends ExecutionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:jtv:error:runtime:stack-depth-exceeded";

    private final int limit;

    public StackDepthExceededException(String function, int limit) {
        super("Call depth limit of " + limit + " exceeded calling '" + function + "'");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }

    @Override
    public String urn() {
        return URN;
    }
}
