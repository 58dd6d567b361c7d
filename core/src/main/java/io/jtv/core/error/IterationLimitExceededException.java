package io.jtv.core.error;

/**
 * Thrown when a run consumes more than {@code maxSteps} loop iterations and calls. A deliberate,
 * reported abort rather than a hang. URN: {@code urn:jtv:error:runtime:iteration-limit-exceeded}
 */
public final class IterationLimitExceededException extends ExecutionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:jtv:error:runtime:iteration-limit-exceeded";

    private final long stepsTaken;

    public IterationLimitExceededException(long stepsTaken) {
        super("Step limit exceeded after " + stepsTaken + " steps");
        this.stepsTaken = stepsTaken;
    }

    /** Number of steps completed before the abort; equal to the configured ceiling. */
    public long stepsTaken() {
        return stepsTaken;
    }

    @Override
    public String urn() {
        return URN;
    }
}
